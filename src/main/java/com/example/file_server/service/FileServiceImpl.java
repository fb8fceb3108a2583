package com.example.file_server.service;

import com.example.file_server.config.FileServerProperties;
import com.example.file_server.controller.dto.FileResponse;
import com.example.file_server.controller.dto.UploadResponse;
import com.example.file_server.exception.UnauthorizedOperationException;
import com.example.file_server.model.StoredFile;
import com.example.file_server.model.StoredFileContent;
import com.example.file_server.storage.StorageEngine;
import com.example.file_server.util.FileMapper;
import com.example.file_server.util.FileSizes;
import com.example.file_server.util.NameGenerator;
import com.example.file_server.util.PathSanitizer;
import java.io.InputStream;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class FileServiceImpl implements FileService {
  private static final Logger log = LoggerFactory.getLogger(FileServiceImpl.class);

  private final Authenticator authenticator;
  private final PathSanitizer pathSanitizer;
  private final NameGenerator nameGenerator;
  private final StorageEngine storageEngine;
  private final FileMapper fileMapper;
  private final boolean publicRead;

  public FileServiceImpl(
      Authenticator authenticator,
      PathSanitizer pathSanitizer,
      NameGenerator nameGenerator,
      StorageEngine storageEngine,
      FileMapper fileMapper,
      FileServerProperties properties) {
    this.authenticator = authenticator;
    this.pathSanitizer = pathSanitizer;
    this.nameGenerator = nameGenerator;
    this.storageEngine = storageEngine;
    this.fileMapper = fileMapper;
    this.publicRead = properties.publicRead();
  }

  @Override
  public UploadResponse upload(
      String secret, String originalName, InputStream content, long declaredSize) {
    authenticate(secret, "upload");

    String cleanName = pathSanitizer.cleanOriginalName(originalName);
    String storedName = nameGenerator.generate(cleanName);

    StoredFile stored = storageEngine.write(storedName, content, declaredSize, cleanName);
    log.info(
        "File uploaded: {} ({}, {})",
        stored.getStoredName(),
        FileSizes.format(stored.getSizeBytes()),
        stored.getContentType());
    return fileMapper.toUploadResponse(stored);
  }

  @Override
  public List<FileResponse> list(String secret) {
    authenticate(secret, "list");
    return storageEngine.list().stream().map(fileMapper::toResponse).toList();
  }

  @Override
  public void delete(String secret, String targetName) {
    authenticate(secret, "delete");
    String storedName = pathSanitizer.sanitize(targetName);
    storageEngine.delete(storedName);
    log.info("File deleted: {}", storedName);
  }

  @Override
  public StoredFileContent read(String secret, String targetName) {
    if (!publicRead) {
      authenticate(secret, "read");
    }
    return storageEngine.read(pathSanitizer.sanitize(targetName));
  }

  private void authenticate(String secret, String operation) {
    if (!authenticator.verify(secret)) {
      log.warn("Rejected {} request: invalid password", operation);
      throw new UnauthorizedOperationException();
    }
  }
}

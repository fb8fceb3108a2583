package com.example.file_server.util;

import com.example.file_server.config.FileServerProperties;
import com.example.file_server.controller.dto.FileResponse;
import com.example.file_server.controller.dto.UploadResponse;
import com.example.file_server.model.StoredFile;
import org.springframework.stereotype.Component;

@Component
public class FileMapper {
  static final String FILES_PATH = "/files/";
  static final String UPLOAD_SUCCESS = "Upload successful";

  private final String baseUrl;

  public FileMapper(FileServerProperties properties) {
    this.baseUrl = properties.baseUrl();
  }

  public String publicUrl(String storedName) {
    return baseUrl + FILES_PATH + storedName;
  }

  public UploadResponse toUploadResponse(StoredFile file) {
    return new UploadResponse(
        file.getStoredName(),
        publicUrl(file.getStoredName()),
        file.getSizeBytes(),
        file.getOriginalName(),
        file.getContentType(),
        UPLOAD_SUCCESS);
  }

  public FileResponse toResponse(StoredFile file) {
    if (file == null) return null;
    return new FileResponse(
        file.getStoredName(),
        publicUrl(file.getStoredName()),
        file.getSizeBytes(),
        FileSizes.format(file.getSizeBytes()),
        FileIcons.forName(file.getStoredName()),
        file.getContentType(),
        file.getCreatedAt());
  }
}

package com.example.file_server.service;

import com.example.file_server.controller.dto.FileResponse;
import com.example.file_server.controller.dto.UploadResponse;
import com.example.file_server.model.StoredFileContent;
import java.io.InputStream;
import java.util.List;

public interface FileService {

  UploadResponse upload(String secret, String originalName, InputStream content, long declaredSize);

  List<FileResponse> list(String secret);

  void delete(String secret, String targetName);

  /** Opens a stored file. {@code secret} is only checked when public read access is disabled. */
  StoredFileContent read(String secret, String targetName);
}

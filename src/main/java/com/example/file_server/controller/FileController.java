package com.example.file_server.controller;

import com.example.file_server.controller.dto.FileListResponse;
import com.example.file_server.controller.dto.FileResponse;
import com.example.file_server.controller.dto.MessageResponse;
import com.example.file_server.controller.dto.UploadResponse;
import com.example.file_server.model.StoredFile;
import com.example.file_server.model.StoredFileContent;
import com.example.file_server.service.FileService;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Set;
import org.springframework.core.io.InputStreamResource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
public class FileController {
  // types a browser would run as script from this origin
  private static final Set<String> ACTIVE_CONTENT_TYPES =
      Set.of(
          "text/html",
          "application/xhtml+xml",
          "image/svg+xml",
          "text/xml",
          "application/xml",
          "text/javascript",
          "application/javascript");

  private final FileService fileService;

  public FileController(FileService fileService) {
    this.fileService = fileService;
  }

  @PostMapping(path = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<UploadResponse> uploadFile(
      @RequestParam(name = "password", required = false) String password,
      @RequestPart("file") MultipartFile file)
      throws IOException {
    try (InputStream content = file.getInputStream()) {
      UploadResponse response =
          fileService.upload(password, file.getOriginalFilename(), content, file.getSize());
      return ResponseEntity.ok(response);
    }
  }

  @GetMapping("/list")
  public ResponseEntity<FileListResponse> listFiles(
      @RequestParam(name = "password", required = false) String password) {
    List<FileResponse> files = fileService.list(password);
    return ResponseEntity.ok(new FileListResponse(files, files.size()));
  }

  @DeleteMapping("/delete/{filename}")
  public ResponseEntity<MessageResponse> deleteFile(
      @PathVariable String filename,
      @RequestParam(name = "password", required = false) String password) {
    fileService.delete(password, filename);
    return ResponseEntity.ok(new MessageResponse("Deleted: " + filename));
  }

  @GetMapping("/files/{filename}")
  public ResponseEntity<InputStreamResource> readFile(
      @PathVariable String filename,
      @RequestParam(name = "password", required = false) String password) {
    StoredFileContent content = fileService.read(password, filename);
    StoredFile file = content.file();

    MediaType contentType;
    try {
      contentType = MediaType.parseMediaType(file.getContentType());
    } catch (InvalidMediaTypeException e) {
      contentType = MediaType.APPLICATION_OCTET_STREAM;
    }
    ContentDisposition.Builder disposition =
        ACTIVE_CONTENT_TYPES.contains(contentType.getType() + "/" + contentType.getSubtype())
            ? ContentDisposition.attachment()
            : ContentDisposition.inline();

    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(contentType);
    headers.setContentDisposition(disposition.filename(file.getStoredName()).build());
    headers.setContentLength(file.getSizeBytes());
    headers.set("Content-Security-Policy", "sandbox");
    // the message converter closes the stream once the body is written
    return ResponseEntity.ok().headers(headers).body(new InputStreamResource(content.stream()));
  }
}

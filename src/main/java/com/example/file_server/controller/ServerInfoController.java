package com.example.file_server.controller;

import com.example.file_server.config.FileServerProperties;
import com.example.file_server.util.FileSizes;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** Unauthenticated health and API description endpoints. */
@RestController
public class ServerInfoController {

  private final FileServerProperties properties;

  public ServerInfoController(FileServerProperties properties) {
    this.properties = properties;
  }

  @GetMapping("/health")
  public Map<String, Object> health() {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", "healthy");
    body.put("version", properties.version());
    body.put("timestamp", Instant.now().toString());
    return body;
  }

  @GetMapping("/api")
  public Map<String, Object> apiInfo() {
    String readAuth = properties.publicRead() ? "none" : "password";
    Map<String, Object> endpoints = new LinkedHashMap<>();
    endpoints.put("upload", endpoint("POST", "/upload", "password"));
    endpoints.put("list", endpoint("GET", "/list", "password"));
    endpoints.put("delete", endpoint("DELETE", "/delete/{filename}", "password"));
    endpoints.put("read", endpoint("GET", "/files/{filename}", readAuth));
    endpoints.put("health", endpoint("GET", "/health", "none"));

    Map<String, Object> limits = new LinkedHashMap<>();
    limits.put("maxFileSize", properties.maxFileSize());
    limits.put("maxFileSizeFormatted", FileSizes.format(properties.maxFileSize()));

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("name", "File Server API");
    body.put("version", properties.version());
    body.put("endpoints", endpoints);
    body.put("limits", limits);
    return body;
  }

  private static Map<String, String> endpoint(String method, String path, String auth) {
    Map<String, String> endpoint = new LinkedHashMap<>();
    endpoint.put("method", method);
    endpoint.put("path", path);
    endpoint.put("auth", auth);
    return endpoint;
  }
}

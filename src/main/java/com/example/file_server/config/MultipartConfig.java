package com.example.file_server.config;

import jakarta.servlet.MultipartConfigElement;
import org.springframework.boot.web.servlet.MultipartConfigFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.unit.DataSize;

/**
 * Servlet multipart limits derived from {@code file-server.max-file-size}, so an oversized body is
 * cut off by the container before it is spooled to disk or reaches the password check.
 */
@Configuration
public class MultipartConfig {
  // boundary lines, part headers and the password field
  static final long FORM_OVERHEAD_BYTES = 64 * 1024;

  @Bean
  MultipartConfigElement multipartConfigElement(FileServerProperties properties) {
    MultipartConfigFactory factory = new MultipartConfigFactory();
    factory.setMaxFileSize(DataSize.ofBytes(properties.maxFileSize()));
    factory.setMaxRequestSize(DataSize.ofBytes(properties.maxFileSize() + FORM_OVERHEAD_BYTES));
    factory.setFileSizeThreshold(DataSize.ofMegabytes(1));
    return factory.createMultipartConfig();
  }
}

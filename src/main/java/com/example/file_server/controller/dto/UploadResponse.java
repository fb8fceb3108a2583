package com.example.file_server.controller.dto;

public record UploadResponse(
    String storedName,
    String url,
    long sizeBytes,
    String originalName,
    String contentType,
    String message) {}

package com.example.file_server.controller.dto;

import java.time.Instant;

public record FileResponse(
    String storedName,
    String url,
    long sizeBytes,
    String sizeFormatted,
    String icon,
    String contentType,
    Instant createdAt) {}

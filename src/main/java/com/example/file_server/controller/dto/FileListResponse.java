package com.example.file_server.controller.dto;

import java.util.List;

public record FileListResponse(List<FileResponse> files, int total) {}

package com.example.file_server.controller.dto;

public record MessageResponse(String message) {}

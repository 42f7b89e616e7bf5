package com.example.datalake.dsdust.response;

public record DownloadResponse(String message, int count) {}

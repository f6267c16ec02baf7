package net.unishelf.controller.dto;

public record DownloadResponse(String redirectUrl) {
}

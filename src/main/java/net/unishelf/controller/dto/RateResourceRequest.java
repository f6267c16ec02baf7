package net.unishelf.controller.dto;

public record RateResourceRequest(Integer rating, String review) {
}

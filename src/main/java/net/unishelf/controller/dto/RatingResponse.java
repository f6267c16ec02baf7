package net.unishelf.controller.dto;

public record RatingResponse(int rating, double averageRating, int ratingsCount) {
}

package com.hemovita.dto.response;

/**
 * Response DTO for one suggested food.
 */
public record FoodItemDto(
    String name,
    Double servingG,
    String category
) {}

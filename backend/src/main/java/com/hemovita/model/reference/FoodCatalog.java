package com.hemovita.model.reference;

import java.util.List;

/**
 * Curated food rows in file order.
 */
public record FoodCatalog(List<FoodSource> foods) {

    public FoodCatalog {
        foods = List.copyOf(foods);
    }

    public boolean isEmpty() {
        return foods.isEmpty();
    }
}

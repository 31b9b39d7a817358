package com.example.recipematch.model;

import java.util.List;

public class IngredientMatchResult {
    public final Ingredient ingredient;
    public final List<ProductMatch> matches;
    public final boolean available;
    public final ProductMatch bestMatch; // nullable

    public IngredientMatchResult(Ingredient ingredient, List<ProductMatch> matches) {
        this.ingredient = ingredient;
        this.matches = List.copyOf(matches);
        this.available = this.matches.stream().anyMatch(m -> m.offer.availability);
        this.bestMatch = this.matches.isEmpty() ? null : this.matches.get(0);
    }

    public static IngredientMatchResult unmatched(Ingredient ingredient) {
        return new IngredientMatchResult(ingredient, List.of());
    }
}

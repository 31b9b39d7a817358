package com.example.recipematch.model;

import java.util.List;

public class RecipeMatchResponse {
    public final Recipe recipe;
    public final List<IngredientMatchResult> ingredientMatches;
    public final int totalAvailableIngredients;
    public final int totalIngredients;
    public final int availabilityPercentage;
    public final double estimatedTotalCost;
    public final Integer scaledServings; // null when the recipe was not rescaled

    public RecipeMatchResponse(Recipe recipe, List<IngredientMatchResult> ingredientMatches, int totalAvailableIngredients,
                               int totalIngredients, int availabilityPercentage, double estimatedTotalCost, Integer scaledServings) {
        this.recipe = recipe;
        this.ingredientMatches = List.copyOf(ingredientMatches);
        this.totalAvailableIngredients = totalAvailableIngredients;
        this.totalIngredients = totalIngredients;
        this.availabilityPercentage = availabilityPercentage;
        this.estimatedTotalCost = estimatedTotalCost;
        this.scaledServings = scaledServings;
    }
}

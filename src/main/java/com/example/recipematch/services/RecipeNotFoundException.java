package com.example.recipematch.services;

public class RecipeNotFoundException extends RecipeMatchException {
    private final String recipeId;
    public RecipeNotFoundException(String recipeId) {
        super("Recipe not found: " + recipeId);
        this.recipeId = recipeId;
    }
    public String recipeId() { return recipeId; }
}

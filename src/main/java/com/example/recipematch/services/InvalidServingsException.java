package com.example.recipematch.services;

public class InvalidServingsException extends RecipeMatchException {
    private final int servings;
    public InvalidServingsException(int servings) {
        super("Servings must be greater than 0, got " + servings);
        this.servings = servings;
    }
    public int servings() { return servings; }
}

package com.example.recipematch.services;

import com.example.recipematch.model.Ingredient;

import java.util.ArrayList;
import java.util.List;

public class RecipeScaler {
    static final double MIN_QUANTITY = 0.01;

    /**
     * Returns new ingredients with quantities multiplied by target/original servings,
     * rounded to 2 decimals but never below 0.01. The input list is not modified.
     */
    public List<Ingredient> scale(List<Ingredient> ingredients, int originalServings, int targetServings) {
        if (targetServings <= 0) throw new InvalidServingsException(targetServings);
        if (originalServings <= 0) throw new InvalidServingsException(originalServings);
        double factor = (double) targetServings / originalServings;
        List<Ingredient> out = new ArrayList<>();
        if (ingredients == null) return out;
        for (Ingredient ing : ingredients) {
            double q = Math.round(ing.quantity * factor * 100.0) / 100.0;
            out.add(ing.withQuantity(Math.max(MIN_QUANTITY, q)));
        }
        return out;
    }
}

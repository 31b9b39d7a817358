package com.example.recipematch.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

public class Recipe {
    public String id;
    public String title;
    public int servings;
    public List<Ingredient> ingredients = new ArrayList<>();
    public Set<String> tags = Set.of();
    public int cookCount;   // times shoppers tried to buy this recipe
    public int viewCount;
    public Recipe() {}
    public Recipe(String id, String title, int servings, List<Ingredient> ingredients) {
        this.id=id; this.title=title; this.servings=servings; this.ingredients=ingredients;
    }
}

package com.example.recipematch.storage;

import com.example.recipematch.model.Recipe;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

public class InMemoryRecipeRepository implements RecipeRepository {
    private final Map<String, Recipe> recipes = new LinkedHashMap<>();
    private final Map<String, AtomicInteger> shopAttempts = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> views = new ConcurrentHashMap<>();

    public InMemoryRecipeRepository(Collection<Recipe> all) {
        for (Recipe r : all) if (r != null && r.id != null) recipes.put(r.id, r);
    }

    @Override public Optional<Recipe> getById(String recipeId) {
        return Optional.ofNullable(recipeId == null ? null : recipes.get(recipeId));
    }

    @Override public void notifyShopAttempt(String recipeId) {
        if (recipes.containsKey(recipeId)) shopAttempts.computeIfAbsent(recipeId, k -> new AtomicInteger()).incrementAndGet();
    }

    @Override public void recordView(String recipeId) {
        if (recipes.containsKey(recipeId)) views.computeIfAbsent(recipeId, k -> new AtomicInteger()).incrementAndGet();
    }

    /** Stored cook count plus attempts recorded since loading. */
    public int shopAttempts(String recipeId) {
        Recipe r = recipes.get(recipeId);
        if (r == null) return 0;
        AtomicInteger n = shopAttempts.get(recipeId);
        return r.cookCount + (n == null ? 0 : n.get());
    }

    public int views(String recipeId) {
        Recipe r = recipes.get(recipeId);
        if (r == null) return 0;
        AtomicInteger n = views.get(recipeId);
        return r.viewCount + (n == null ? 0 : n.get());
    }
}

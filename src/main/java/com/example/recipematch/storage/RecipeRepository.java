package com.example.recipematch.storage;

import com.example.recipematch.model.Recipe;

import java.util.Optional;

/** Read access to stored recipes plus the engagement counters the matcher is allowed to bump. */
public interface RecipeRepository {
    Optional<Recipe> getById(String recipeId);

    /** Records that a shopper tried to buy this recipe's ingredients. */
    void notifyShopAttempt(String recipeId);

    void recordView(String recipeId);
}

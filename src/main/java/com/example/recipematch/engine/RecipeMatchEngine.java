package com.example.recipematch.engine;

import com.example.recipematch.model.RecipeMatchResponse;
import com.example.recipematch.services.*;
import com.example.recipematch.storage.CatalogRepository;
import com.example.recipematch.storage.RecipeRepository;
import com.example.recipematch.storage.Settings;

import java.time.Clock;
import java.util.Map;

/** Wires the matching services together behind the single call callers need. */
public class RecipeMatchEngine implements AutoCloseable {
    private final RecipeMatcher matcher;

    public RecipeMatchEngine(RecipeRepository recipes, CatalogRepository catalog, Settings settings) {
        this(recipes, catalog, settings, UnitConverter.defaultFactors(), Clock.systemDefaultZone());
    }

    public RecipeMatchEngine(RecipeRepository recipes, CatalogRepository catalog, Settings settings,
                             Map<String, Map<String, Double>> conversions, Clock clock) {
        Settings s = settings != null ? settings : new Settings();
        StringSimilarity similarity = new StringSimilarity(s.containmentScore);
        CandidateRetriever retriever = new CandidateRetriever(catalog, similarity, s);
        MatchRanker ranker = new MatchRanker(new UnitConverter(conversions), s.minimumScore);
        this.matcher = new RecipeMatcher(recipes, retriever, ranker, new RecipeScaler(), s, clock);
    }

    /**
     * Matches the recipe's ingredients, optionally rescaled to {@code servings}.
     *
     * @throws RecipeNotFoundException when the recipe id is unknown
     * @throws InvalidServingsException when servings is zero or negative
     */
    public RecipeMatchResponse matchRecipeIngredients(String recipeId, Integer servings) {
        return matcher.matchRecipe(recipeId, servings);
    }

    @Override public void close() { matcher.close(); }
}

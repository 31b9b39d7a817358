package com.example.recipematch.services;

import com.example.recipematch.model.*;
import com.example.recipematch.storage.RecipeRepository;
import com.example.recipematch.storage.Settings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Matches every ingredient of a recipe against the catalog and sums up availability
 * and cost. Ingredients are retrieved in parallel; one failing or slow ingredient is
 * reported as unmatched instead of failing the whole recipe.
 */
public class RecipeMatcher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RecipeMatcher.class);

    private final RecipeRepository recipes;
    private final CandidateRetriever retriever;
    private final MatchRanker ranker;
    private final RecipeScaler scaler;
    private final Settings settings;
    private final Clock clock;
    private final ExecutorService pool;

    public RecipeMatcher(RecipeRepository recipes, CandidateRetriever retriever, MatchRanker ranker,
                         RecipeScaler scaler, Settings settings, Clock clock) {
        this.recipes = Objects.requireNonNull(recipes, "recipes");
        this.retriever = retriever;
        this.ranker = ranker;
        this.scaler = scaler;
        this.settings = settings;
        this.clock = clock;
        this.pool = Executors.newFixedThreadPool(Math.max(1, settings.parallelism), workerThreads());
    }

    public RecipeMatchResponse matchRecipe(String recipeId) {
        return matchRecipe(recipeId, null);
    }

    public RecipeMatchResponse matchRecipe(String recipeId, Integer targetServings) {
        Objects.requireNonNull(recipeId, "recipeId");
        Recipe recipe = recipes.getById(recipeId).orElseThrow(() -> new RecipeNotFoundException(recipeId));

        List<Ingredient> ingredients = targetServings != null
                ? scaler.scale(recipe.ingredients, recipe.servings, targetServings)
                : (recipe.ingredients == null ? List.of() : recipe.ingredients);

        List<IngredientMatchResult> results = matchAll(ingredients);

        LocalDate today = LocalDate.now(clock);
        int available = 0;
        double total = 0;
        for (IngredientMatchResult r : results) {
            if (r.available) available++;
            if (r.bestMatch != null) total += lineCost(r.bestMatch, today);
        }
        int pct = results.isEmpty() ? 0 : (int) Math.round(available * 100.0 / results.size());
        double cost = Math.round(total * 100.0) / 100.0;

        RecipeMatchResponse response = new RecipeMatchResponse(recipe, results, available, results.size(), pct, cost, targetServings);
        log.info("Matched recipe {}: {}/{} ingredients available ({}%), estimated cost {}",
                recipeId, available, results.size(), pct, cost);

        try {
            recipes.notifyShopAttempt(recipeId);
        } catch (RuntimeException ex) {
            log.warn("Could not record shop attempt for recipe {}", recipeId, ex);
        }
        return response;
    }

    /** Best-match price for the suggested quantity, less any discount running today. */
    static double lineCost(ProductMatch best, LocalDate today) {
        double price = best.offer.sellingPrice * best.suggestedQuantity;
        Double discount = best.offer.activeDiscountPercent(today);
        if (discount != null) price -= price * (discount / 100.0);
        return price;
    }

    private List<IngredientMatchResult> matchAll(List<Ingredient> ingredients) {
        List<Future<List<ProductMatch>>> pending = new ArrayList<>();
        for (Ingredient ing : ingredients) {
            pending.add(pool.submit(() -> ranker.rank(retriever.findCandidates(ing, settings.maxResults), ing, settings.maxResults)));
        }

        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(settings.retrievalTimeoutMillis);
        List<IngredientMatchResult> out = new ArrayList<>(ingredients.size());
        for (int i = 0; i < ingredients.size(); i++) {
            Ingredient ing = ingredients.get(i);
            Future<List<ProductMatch>> f = pending.get(i);
            try {
                long left = Math.max(0, deadline - System.nanoTime());
                out.add(new IngredientMatchResult(ing, f.get(left, TimeUnit.NANOSECONDS)));
            } catch (TimeoutException ex) {
                f.cancel(true);
                log.warn("Catalog lookup for '{}' timed out after {} ms; treating it as unavailable", ing.name, settings.retrievalTimeoutMillis);
                out.add(IngredientMatchResult.unmatched(ing));
            } catch (ExecutionException ex) {
                log.warn("Catalog lookup for '{}' failed; treating it as unavailable", ing.name, ex.getCause());
                out.add(IngredientMatchResult.unmatched(ing));
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                for (Future<List<ProductMatch>> p : pending) p.cancel(true);
                throw new RecipeMatchException("Interrupted while matching ingredients", ex);
            }
        }
        return out;
    }

    @Override public void close() {
        pool.shutdownNow();
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "ingredient-matcher-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}

package com.example.recipematch.services;

import com.example.recipematch.model.*;

import java.util.*;

/**
 * Turns raw candidates into unit-converted, best-first product matches. A catalog offer
 * found by several tiers or search terms is kept once, with its highest score.
 */
public class MatchRanker {
    public static final int DEFAULT_MAX_RESULTS = 5;

    private final UnitConverter units;
    private final int minimumScore;

    public MatchRanker(UnitConverter units, int minimumScore) {
        this.units = units; this.minimumScore = minimumScore;
    }

    public List<ProductMatch> rank(List<Candidate> candidates, Ingredient ingredient) {
        return rank(candidates, ingredient, DEFAULT_MAX_RESULTS);
    }

    public List<ProductMatch> rank(List<Candidate> candidates, Ingredient ingredient, int maxResults) {
        if (candidates == null || candidates.isEmpty() || maxResults <= 0) return List.of();

        // List.sort is stable, so equal scores keep retrieval order
        List<Candidate> sorted = new ArrayList<>(candidates);
        sorted.sort((a, b) -> Integer.compare(b.score, a.score));

        Set<String> seen = new HashSet<>();
        List<ProductMatch> out = new ArrayList<>();
        for (Candidate c : sorted) {
            if (out.size() >= maxResults) break;
            if (c.score < minimumScore) continue;
            if (!seen.add(c.offerKey())) continue;
            CatalogListing l = c.listing;
            UnitConverter.Conversion conv = units.convert(ingredient.quantity, ingredient.unit, l.product.unit);
            out.add(new ProductMatch(l.product, l.offer, l.seller, c.score, c.reason, conv.quantity, conv.note));
        }
        return out;
    }
}

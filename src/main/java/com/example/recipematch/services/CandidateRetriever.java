package com.example.recipematch.services;

import com.example.recipematch.model.*;
import com.example.recipematch.storage.CatalogRepository;
import com.example.recipematch.storage.Settings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Looks up catalog candidates for one ingredient: first the pre-mapped product,
 * then a fuzzy search over the ingredient name and its search terms.
 * Catalog failures are not caught here.
 */
public class CandidateRetriever {
    private static final Logger log = LoggerFactory.getLogger(CandidateRetriever.class);

    private final CatalogRepository catalog;
    private final StringSimilarity similarity;
    private final Settings settings;

    public CandidateRetriever(CatalogRepository catalog, StringSimilarity similarity, Settings settings) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.similarity = similarity;
        this.settings = settings;
    }

    public List<Candidate> findCandidates(Ingredient ingredient, int maxResults) {
        Objects.requireNonNull(ingredient, "ingredient");
        List<Candidate> out = new ArrayList<>();

        if (ingredient.productId != null && !ingredient.productId.isBlank()) {
            Optional<CatalogProduct> mapped = catalog.getProductById(ingredient.productId);
            if (mapped.isPresent() && mapped.get().active) {
                for (CatalogListing l : catalog.findAvailableListings(ingredient.productId)) {
                    out.add(new Candidate(l, 100, MatchReason.PRE_MAPPED));
                }
            } else {
                log.debug("Pre-mapped product {} for '{}' is missing or inactive", ingredient.productId, ingredient.name);
            }
        }

        if (out.size() < maxResults) {
            int limit = Math.max(1, maxResults * Math.max(1, settings.searchOverfetch));
            for (String term : searchTerms(ingredient)) {
                for (CatalogListing l : catalog.searchActiveProducts(term, limit)) {
                    int score = scoreListing(ingredient, l.product);
                    if (score < settings.minimumScore) continue;
                    out.add(new Candidate(l, score, score == 100 ? MatchReason.EXACT_NAME : MatchReason.NAME_SIMILARITY));
                }
                if (!settings.searchAllTerms && out.size() >= maxResults) break;
            }
        }
        log.debug("'{}': {} candidate(s)", ingredient.name, out.size());
        return out;
    }

    /** Name similarity, boosted when the ingredient's category agrees with the product's. */
    int scoreListing(Ingredient ingredient, CatalogProduct product) {
        int score = similarity.score(ingredient.name, product.name);
        if (ingredient.category != null && !ingredient.category.isBlank()
                && product.category != null && product.category.name != null
                && similarity.score(ingredient.category, product.category.name) >= settings.categoryMatchThreshold) {
            score = Math.min(100, score + settings.categoryBoost);
        }
        return score;
    }

    /** Ingredient name followed by its search terms, blanks and repeats removed. */
    static List<String> searchTerms(Ingredient ingredient) {
        Map<String, String> terms = new LinkedHashMap<>();
        List<String> raw = new ArrayList<>();
        raw.add(ingredient.name);
        if (ingredient.searchTerms != null) raw.addAll(ingredient.searchTerms);
        for (String t : raw) {
            if (t == null || t.isBlank()) continue;
            terms.putIfAbsent(t.trim().toLowerCase(), t.trim());
        }
        return new ArrayList<>(terms.values());
    }
}

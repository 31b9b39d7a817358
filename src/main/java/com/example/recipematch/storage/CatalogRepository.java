package com.example.recipematch.storage;

import com.example.recipematch.model.CatalogListing;
import com.example.recipematch.model.CatalogProduct;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the marketplace catalog. Listings returned by this interface are
 * always available and in stock; implementations must tolerate concurrent callers.
 */
public interface CatalogRepository {
    Optional<CatalogProduct> getProductById(String productId);

    /** Every available, in-stock offer of the product. The seller is null when its account is unknown. */
    List<CatalogListing> findAvailableListings(String productId);

    /**
     * Active products whose name or any tag contains {@code term} (case-insensitive),
     * one row per available, in-stock offer, at most {@code limit} rows.
     */
    List<CatalogListing> searchActiveProducts(String term, int limit);
}

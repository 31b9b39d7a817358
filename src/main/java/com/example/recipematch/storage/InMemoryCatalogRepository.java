package com.example.recipematch.storage;

import com.example.recipematch.model.*;

import java.util.*;

/** Catalog held in memory; a linear scan stands in for the marketplace's search index. */
public class InMemoryCatalogRepository implements CatalogRepository {
    private final Map<String, CatalogProduct> products = new LinkedHashMap<>();
    private final Map<String, List<StockOffer>> offersByProduct = new HashMap<>();
    private final Map<String, Seller> sellers = new HashMap<>();

    public InMemoryCatalogRepository(Collection<CatalogProduct> products, Collection<StockOffer> offers, Collection<Seller> sellers) {
        for (CatalogProduct p : products) if (p != null && p.id != null) this.products.put(p.id, p);
        for (Seller s : sellers) if (s != null && s.id != null) this.sellers.put(s.id, s);
        for (StockOffer o : offers) {
            if (o == null || o.productId == null) continue;
            offersByProduct.computeIfAbsent(o.productId, k -> new ArrayList<>()).add(o);
        }
    }

    public InMemoryCatalogRepository(JsonStorage.Catalog catalog) {
        this(catalog.products, catalog.offers, catalog.sellers);
    }

    @Override public Optional<CatalogProduct> getProductById(String productId) {
        return Optional.ofNullable(productId == null ? null : products.get(productId));
    }

    @Override public List<CatalogListing> findAvailableListings(String productId) {
        CatalogProduct p = products.get(productId);
        if (p == null) return List.of();
        return listingsOf(p, Integer.MAX_VALUE, false);
    }

    @Override public List<CatalogListing> searchActiveProducts(String term, int limit) {
        if (term == null || term.isBlank() || limit <= 0) return List.of();
        String needle = term.trim().toLowerCase();
        List<CatalogListing> out = new ArrayList<>();
        for (CatalogProduct p : products.values()) {
            if (!p.active || !mentions(p, needle)) continue;
            out.addAll(listingsOf(p, limit - out.size(), true));
            if (out.size() >= limit) break;
        }
        return out;
    }

    private static boolean mentions(CatalogProduct p, String needle) {
        if (p.name != null && p.name.toLowerCase().contains(needle)) return true;
        if (p.tags != null) for (String t : p.tags) if (t != null && t.toLowerCase().contains(needle)) return true;
        return false;
    }

    private List<CatalogListing> listingsOf(CatalogProduct p, int limit, boolean requireSeller) {
        List<CatalogListing> out = new ArrayList<>();
        for (StockOffer o : offersByProduct.getOrDefault(p.id, List.of())) {
            if (out.size() >= limit) break;
            if (!o.inStock()) continue;
            Seller seller = sellers.get(o.sellerId);
            // search joins on the seller account; direct product lookups keep orphaned offers
            if (seller == null && requireSeller) continue;
            out.add(new CatalogListing(p, o, seller));
        }
        return out;
    }
}

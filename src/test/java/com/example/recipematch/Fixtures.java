package com.example.recipematch;

import com.example.recipematch.model.*;
import com.example.recipematch.storage.*;

import java.util.*;

/** Small catalog builder shared by the tests. */
class Fixtures {
    final List<CatalogProduct> products = new ArrayList<>();
    final List<StockOffer> offers = new ArrayList<>();
    final List<Seller> sellers = new ArrayList<>(List.of(new Seller("S1", "FreshMart"), new Seller("S2", "Daily Needs")));
    private int offerSeq = 0;

    CatalogProduct product(String id, String name, String category, String unit, String... tags) {
        CatalogProduct p = new CatalogProduct(id, name, category == null ? null : new Category(category), unit);
        p.tags = List.of(tags);
        products.add(p);
        return p;
    }

    StockOffer offer(String productId, String sellerId, double price) {
        StockOffer o = new StockOffer("INV-" + (++offerSeq), productId, sellerId, price, 10, true);
        offers.add(o);
        return o;
    }

    InMemoryCatalogRepository catalog() { return new InMemoryCatalogRepository(products, offers, sellers); }

    static Ingredient ingredient(String name, double quantity, String unit) { return new Ingredient(name, quantity, unit); }

    static Recipe recipe(String id, int servings, Ingredient... ingredients) {
        return new Recipe(id, id, servings, new ArrayList<>(List.of(ingredients)));
    }

    static Settings settings() {
        Settings s = new Settings();
        s.retrievalTimeoutMillis = 5000;
        return s;
    }
}

package com.example.recipematch.model;

import java.util.List;

/** A sellable catalog item. Owned by the catalog; the matcher only reads it. */
public class CatalogProduct {
    public String id;
    public String name;
    public Category category;
    public String unit;
    public List<String> tags = List.of();
    public List<String> images = List.of();
    public boolean active = true;

    public CatalogProduct() {}
    public CatalogProduct(String id, String name, Category category, String unit) {
        this.id = id; this.name = name; this.category = category; this.unit = unit;
    }
}

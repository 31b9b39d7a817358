package com.example.recipematch.model;

import java.util.ArrayList;
import java.util.List;

public class Ingredient {
    public String name;
    public double quantity;
    public String unit;
    public String productId;          // nullable, pre-mapped catalog product
    public String category;           // nullable
    public List<String> searchTerms = new ArrayList<>();
    public List<String> substitutes = new ArrayList<>();
    public boolean optional;
    public String notes;              // nullable

    public Ingredient() {}
    public Ingredient(String name, double quantity, String unit) {
        this.name = name; this.quantity = quantity; this.unit = unit;
    }

    /** Copy of this ingredient with a different quantity; the receiver is left untouched. */
    public Ingredient withQuantity(double newQuantity) {
        Ingredient copy = new Ingredient(name, newQuantity, unit);
        copy.productId = productId;
        copy.category = category;
        copy.searchTerms = searchTerms == null ? new ArrayList<>() : new ArrayList<>(searchTerms);
        copy.substitutes = substitutes == null ? new ArrayList<>() : new ArrayList<>(substitutes);
        copy.optional = optional;
        copy.notes = notes;
        return copy;
    }

    @Override public String toString() { return name + " (" + quantity + " " + unit + ")"; }
}

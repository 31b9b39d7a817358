package com.example.recipematch.model;

import java.time.LocalDate;

/** One seller's stock of a product. */
public class StockOffer {
    public String id;
    public String productId;
    public String sellerId;
    public double sellingPrice;
    public int currentStock;
    public boolean availability;
    public ProductDiscount discount; // nullable

    public StockOffer() {}
    public StockOffer(String id, String productId, String sellerId, double sellingPrice, int currentStock, boolean availability) {
        this.id = id; this.productId = productId; this.sellerId = sellerId;
        this.sellingPrice = sellingPrice; this.currentStock = currentStock; this.availability = availability;
    }

    public boolean inStock() { return availability && currentStock > 0; }

    /** Discount percentage in force on the given day, or null when there is none. */
    public Double activeDiscountPercent(LocalDate day) {
        if (discount == null || !discount.isActiveOn(day)) return null;
        return Math.max(0.0, Math.min(100.0, discount.percentage));
    }
}

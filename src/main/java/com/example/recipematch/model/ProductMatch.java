package com.example.recipematch.model;

public class ProductMatch {
    public final CatalogProduct product;
    public final StockOffer offer;
    public final Seller seller;
    public final int matchScore;             // 0..100
    public final MatchReason matchReason;
    public final double suggestedQuantity;   // in the product's unit
    public final String unitConversionNote;  // nullable

    public ProductMatch(CatalogProduct product, StockOffer offer, Seller seller, int matchScore,
                        MatchReason matchReason, double suggestedQuantity, String unitConversionNote) {
        this.product = product; this.offer = offer; this.seller = seller;
        this.matchScore = matchScore; this.matchReason = matchReason;
        this.suggestedQuantity = suggestedQuantity; this.unitConversionNote = unitConversionNote;
    }

    @Override public String toString() {
        return product.name + " @" + offer.sellingPrice + " score=" + matchScore + " (" + matchReason.label() + ")";
    }
}

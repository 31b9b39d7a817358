package com.example.recipematch.model;

/** A catalog row: a product joined to one of its offers and, when known, the offering seller. */
public class CatalogListing {
    public final CatalogProduct product;
    public final StockOffer offer;
    public final Seller seller; // null only for direct product lookups
    public CatalogListing(CatalogProduct product, StockOffer offer, Seller seller) {
        this.product = product; this.offer = offer; this.seller = seller;
    }
}

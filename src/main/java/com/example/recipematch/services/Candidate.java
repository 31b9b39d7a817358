package com.example.recipematch.services;

import com.example.recipematch.model.*;

/** A retrieved (product, offer, seller) row with its score, before unit conversion and ranking. */
public class Candidate {
    public final CatalogListing listing;
    public final int score;
    public final MatchReason reason;
    public Candidate(CatalogListing listing, int score, MatchReason reason) {
        this.listing = listing; this.score = score; this.reason = reason;
    }
    /** Identity of the sellable item: the same product from two sellers counts twice. */
    public String offerKey() { return listing.product.id + "/" + listing.offer.id; }
}

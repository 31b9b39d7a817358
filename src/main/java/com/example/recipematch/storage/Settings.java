package com.example.recipematch.storage;

/** Matching policy values. Every field has a default; JSON files only need to list overrides. */
public class Settings {
    public int containmentScore = 85;
    public int categoryBoost = 15;
    public int categoryMatchThreshold = 70;
    public int minimumScore = 50;
    public int maxResults = 5;
    // catalog rows fetched per search term, as a multiple of maxResults
    public int searchOverfetch = 2;
    // false stops querying further search terms once maxResults candidates exist
    public boolean searchAllTerms = true;
    public int parallelism = 4;
    public long retrievalTimeoutMillis = 2000;
}

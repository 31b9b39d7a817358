package com.example.recipematch.storage;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.example.recipematch.model.*;

import java.io.*;
import java.util.*;

public class JsonStorage {
    private final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .registerModule(new JavaTimeModule());

    /** Catalog snapshot as stored on disk: products, offers and the sellers owning them. */
    public static class Catalog {
        public List<CatalogProduct> products = new ArrayList<>();
        public List<StockOffer> offers = new ArrayList<>();
        public List<Seller> sellers = new ArrayList<>();
    }

    public List<Recipe> loadRecipes(InputStream in) throws IOException {
        if (in == null) throw new IOException("Recipes JSON not found.");
        try {
            return mapper.readValue(in, new TypeReference<List<Recipe>>() {});
        } catch (IOException ex) {
            throw new IOException("Failed to parse recipes JSON. Ensure it is an array of Recipe objects.", ex);
        }
    }

    public Catalog loadCatalog(InputStream in) throws IOException {
        if (in == null) throw new IOException("Catalog JSON not found.");
        try {
            Catalog c = mapper.readValue(in, Catalog.class);
            if (c == null) throw new IOException("Catalog JSON is empty.");
            if (c.products == null) c.products = new ArrayList<>();
            if (c.offers == null) c.offers = new ArrayList<>();
            if (c.sellers == null) c.sellers = new ArrayList<>();
            return c;
        } catch (IOException ex) {
            throw new IOException("Failed to parse catalog JSON. Expect { products: [..], offers: [..], sellers: [..] }", ex);
        }
    }

    public Map<String, Map<String, Double>> loadConversions(InputStream in) throws IOException {
        if (in == null) throw new IOException("Unit conversion JSON not found.");
        try {
            return mapper.readValue(in, new TypeReference<Map<String, Map<String, Double>>>(){});
        } catch (IOException ex) {
            throw new IOException("Failed to parse unit conversion JSON. Expect a nested map: fromUnit -> { toUnit: factor }", ex);
        }
    }

    public void writeResponse(RecipeMatchResponse response, OutputStream out) throws IOException {
        mapper.writeValue(out, response);
    }

    public String toJson(RecipeMatchResponse response) throws IOException {
        return mapper.writeValueAsString(response);
    }
}

package com.example.recipematch;

import com.example.recipematch.engine.RecipeMatchEngine;
import com.example.recipematch.model.*;
import com.example.recipematch.services.*;
import com.example.recipematch.storage.*;

import java.io.*;
import java.nio.file.*;
import java.time.Clock;
import java.util.*;

/**
 * Matches one recipe against a catalog and prints the JSON report.
 * Usage: CliDemo [--catalog file] [--recipes file] [--settings file] recipeId [servings]
 */
public class CliDemo {
    public static void main(String[] args) throws IOException {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) throws IOException {
        Map<String, String> opts = new HashMap<>();
        List<String> positional = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            if (args[i].startsWith("--") && i + 1 < args.length) opts.put(args[i].substring(2), args[++i]);
            else positional.add(args[i]);
        }
        if (positional.isEmpty()) {
            err.println("usage: CliDemo [--catalog file] [--recipes file] [--settings file] recipeId [servings]");
            return 2;
        }
        Integer servings = null;
        if (positional.size() > 1) {
            try {
                servings = Integer.valueOf(positional.get(1));
            } catch (NumberFormatException ex) {
                err.println("servings must be a whole number: " + positional.get(1));
                return 2;
            }
        }

        JsonStorage storage = new JsonStorage();
        List<Recipe> recipes;
        JsonStorage.Catalog catalog;
        try (InputStream r = open(opts.get("recipes"), "/sample-data/recipes.json");
             InputStream c = open(opts.get("catalog"), "/sample-data/catalog.json")) {
            recipes = storage.loadRecipes(r);
            catalog = storage.loadCatalog(c);
        }
        Settings settings = opts.containsKey("settings")
                ? new SettingsStorage().load(Path.of(opts.get("settings")))
                : new SettingsStorage().load();

        try (RecipeMatchEngine engine = new RecipeMatchEngine(new InMemoryRecipeRepository(recipes),
                new InMemoryCatalogRepository(catalog), settings, UnitConverter.defaultFactors(), Clock.systemDefaultZone())) {
            RecipeMatchResponse response = engine.matchRecipeIngredients(positional.get(0), servings);
            out.println(storage.toJson(response));
            return 0;
        } catch (RecipeNotFoundException | InvalidServingsException ex) {
            err.println(ex.getMessage());
            return 1;
        }
    }

    private static InputStream open(String file, String resource) throws IOException {
        if (file != null) return Files.newInputStream(Path.of(file));
        return CliDemo.class.getResourceAsStream(resource);
    }
}

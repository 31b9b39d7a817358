package com.example.recipematch.services;

/** Base type for failures a caller of the matcher is expected to handle. */
public class RecipeMatchException extends RuntimeException {
    public RecipeMatchException(String message) { super(message); }
    public RecipeMatchException(String message, Throwable cause) { super(message, cause); }
}

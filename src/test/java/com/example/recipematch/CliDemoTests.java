package com.example.recipematch;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.io.*;
import java.nio.charset.StandardCharsets;

public class CliDemoTests {
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String... args) throws IOException {
        return CliDemo.run(args, new PrintStream(out, true, StandardCharsets.UTF_8), new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @Test
    void printsReportForSampleRecipe() throws Exception {
        assertEquals(0, run("RCP-TOMATO-SOUP"));
        String json = out.toString(StandardCharsets.UTF_8);
        assertTrue(json.contains("\"availabilityPercentage\" : 75"), json);
        assertTrue(json.contains("\"estimatedTotalCost\" : 89.4"), json);
    }

    @Test
    void scaledRun() throws Exception {
        assertEquals(0, run("RCP-TOMATO-SOUP", "8"));
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("\"scaledServings\" : 8"));
    }

    @Test
    void reportsCallerErrors() throws Exception {
        assertEquals(1, run("RCP-NOPE"));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Recipe not found: RCP-NOPE"));
        assertEquals(1, run("RCP-TOMATO-SOUP", "0"));
        assertEquals(2, run("RCP-TOMATO-SOUP", "two"));
        assertEquals(2, run());
    }
}

package com.example.recipematch.services;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;

/**
 * Converts recipe quantities into catalog product units using a small table of
 * approximate factors. Unknown pairs pass the quantity through with a warning note.
 */
public class UnitConverter {

    /** Result of a conversion. {@code note} is null when no conversion took place. */
    public static class Conversion {
        public final double quantity;
        public final String note;
        public Conversion(double quantity, String note) { this.quantity = quantity; this.note = note; }
        @Override public String toString() { return note == null ? fmt(quantity) : fmt(quantity) + " (" + note + ")"; }
    }

    private final Map<String, Map<String, Double>> factors;

    public UnitConverter() { this(defaultFactors()); }

    public UnitConverter(Map<String, Map<String, Double>> factorTable) {
        // lower-case both levels so lookups stay case-insensitive whatever the source
        this.factors = new HashMap<>();
        if (factorTable == null) return;
        for (var e : factorTable.entrySet()) {
            Map<String, Double> row = new HashMap<>();
            if (e.getValue() != null) for (var t : e.getValue().entrySet()) row.put(normalizeUnit(t.getKey()), t.getValue());
            factors.put(normalizeUnit(e.getKey()), row);
        }
    }

    public static Map<String, Map<String, Double>> defaultFactors() {
        Map<String, Map<String, Double>> m = new HashMap<>();
        // volume to weight is only a rough guess for typical ingredients
        m.put("cup",    Map.of("kg", 0.24, "g", 240.0, "ml", 240.0, "liter", 0.24));
        m.put("tbsp",   Map.of("g", 15.0, "ml", 15.0, "kg", 0.015));
        m.put("tsp",    Map.of("g", 5.0, "ml", 5.0, "kg", 0.005));
        m.put("liter",  Map.of("ml", 1000.0, "cup", 4.22, "kg", 1.0));
        m.put("ml",     Map.of("liter", 0.001, "cup", 0.00422, "g", 1.0));
        m.put("kg",     Map.of("g", 1000.0, "lb", 2.20462));
        m.put("g",      Map.of("kg", 0.001, "lb", 0.00220462));
        m.put("lb",     Map.of("kg", 0.453592, "g", 453.592));
        m.put("piece",  Map.of("pieces", 1.0, "pc", 1.0));
        m.put("pieces", Map.of("piece", 1.0, "pc", 1.0));
        m.put("pc",     Map.of("piece", 1.0, "pieces", 1.0));
        return m;
    }

    public Conversion convert(double quantity, String fromUnit, String toUnit) {
        String nf = normalizeUnit(fromUnit);
        String nt = normalizeUnit(toUnit);
        if (nf != null && !nf.isEmpty() && nf.equals(nt)) return new Conversion(quantity, null);

        Map<String, Double> row = nf == null ? null : factors.get(nf);
        Double factor = (row == null || nt == null) ? null : row.get(nt);
        if (factor == null) {
            return new Conversion(quantity, "Unit conversion (" + fromUnit + " → " + toUnit + ") may be approximate");
        }
        double converted = round2(quantity * factor);
        return new Conversion(converted, fmt(quantity) + " " + fromUnit + " ≈ " + fmt(converted) + " " + toUnit);
    }

    /** True when the unit has a row in the conversion table. */
    public boolean isKnownUnit(String unit) {
        String u = normalizeUnit(unit);
        return u != null && factors.containsKey(u);
    }

    /**
     * Maps spelling variants onto the short forms used by the table
     * ("cups"->"cup", "litre"->"liter", "grams"->"g", "tablespoons"->"tbsp").
     * Piece-style units are left alone; the table relates them itself.
     */
    public static String normalizeUnit(String unit) {
        if (unit == null) return null;
        String u = unit.trim().toLowerCase();
        switch (u) {
            case "cups": return "cup";
            case "tablespoon": case "tablespoons": return "tbsp";
            case "teaspoon": case "teaspoons": return "tsp";
            case "l": case "litre": case "litres": case "liters": return "liter";
            case "milliliter": case "millilitre": case "milliliters": case "millilitres": return "ml";
            case "gram": case "grams": case "gm": case "gms": return "g";
            case "kilogram": case "kilograms": case "kgs": return "kg";
            case "lbs": case "pound": case "pounds": return "lb";
            default: return u;
        }
    }

    static double round2(double v) { return Math.round(v * 100.0) / 100.0; }

    static String fmt(double v) { return BigDecimal.valueOf(v).stripTrailingZeros().toPlainString(); }
}

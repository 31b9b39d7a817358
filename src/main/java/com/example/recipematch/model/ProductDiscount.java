package com.example.recipematch.model;

import java.time.LocalDate;

public class ProductDiscount {
    public double percentage;   // 0..100
    public boolean active;
    public LocalDate validUntil; // nullable = open ended

    public ProductDiscount() {}
    public ProductDiscount(double percentage, boolean active, LocalDate validUntil) {
        this.percentage = percentage; this.active = active; this.validUntil = validUntil;
    }

    public boolean isActiveOn(LocalDate day) {
        return active && (validUntil == null || !validUntil.isBefore(day));
    }
}

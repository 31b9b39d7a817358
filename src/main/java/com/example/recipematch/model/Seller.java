package com.example.recipematch.model;

public class Seller {
    public String id;
    public String businessName; // nullable
    public String name;         // nullable, owner profile name
    public Seller() {}
    public Seller(String id, String businessName) { this.id = id; this.businessName = businessName; }

    public String displayName() {
        if (businessName != null && !businessName.isBlank()) return businessName;
        return name != null ? name : id;
    }
}

package com.example.recipematch.model;

public class Category {
    public String name;
    public String parentCategory; // nullable
    public Category() {}
    public Category(String name) { this.name = name; }
    public Category(String name, String parentCategory) { this.name = name; this.parentCategory = parentCategory; }
}

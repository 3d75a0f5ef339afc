package io.b2mash.remodel.engine;

public record TotalsSummary(
    int totalItems, int validItems, int invalidItems, int totalCategories) {}

package io.b2mash.remodel.engine;

public record BreakdownSummary(
    int totalCategories, int validCategories, int totalItems, int validItems) {}

package io.b2mash.remodel.engine;

import java.math.BigDecimal;

/**
 * Per-category subtotal. Labor is before the estimate-level discount, which only applies to the
 * estimate total.
 */
public record CategoryBreakdown(
    String key,
    String name,
    int itemCount,
    int validItemCount,
    BigDecimal materialCost,
    BigDecimal laborCost,
    BigDecimal subtotal,
    BigDecimal totalUnits,
    boolean hasErrors) {}

package io.b2mash.remodel.estimate;

import java.math.BigDecimal;

/**
 * Estimate-level waste allowance: {@code surfaceCost × wasteFactor} is added as waste cost.
 *
 * @param surfaceName label of the surface the allowance was derived from
 * @param surfaceCost material cost the factor applies to
 * @param wasteFactor waste fraction, e.g. 0.10 for 10%
 */
public record WasteEntry(String surfaceName, BigDecimal surfaceCost, BigDecimal wasteFactor) {}

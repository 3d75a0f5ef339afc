package io.b2mash.remodel.estimate;

import java.math.BigDecimal;

/** A flat fee added to the estimate total, e.g. a permit fee. */
public record MiscFee(String name, BigDecimal amount) {}

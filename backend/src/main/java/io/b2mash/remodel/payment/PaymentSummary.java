package io.b2mash.remodel.payment;

/** Record counts behind a {@link PaymentDetails}. */
public record PaymentSummary(int paidPayments, int totalPayments, int overduePayments) {}

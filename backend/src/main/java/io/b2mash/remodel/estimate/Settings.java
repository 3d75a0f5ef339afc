package io.b2mash.remodel.estimate;

import io.b2mash.remodel.payment.PaymentRecord;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Estimate-wide pricing settings and the payments recorded against the estimate. Rates are
 * fractions: 0.08 means 8%. Null rates and fees read as zero, null lists as empty.
 *
 * <p>{@code wasteFactor} is the older estimate-wide waste rate on material cost. It only applies
 * when {@code wasteEntries} is empty.
 */
public record Settings(
    BigDecimal taxRate,
    BigDecimal markup,
    BigDecimal laborDiscount,
    BigDecimal transportationFee,
    List<MiscFee> miscFees,
    List<WasteEntry> wasteEntries,
    BigDecimal wasteFactor,
    List<PaymentRecord> payments) {

  public Settings {
    taxRate = taxRate == null ? BigDecimal.ZERO : taxRate;
    markup = markup == null ? BigDecimal.ZERO : markup;
    laborDiscount = laborDiscount == null ? BigDecimal.ZERO : laborDiscount;
    transportationFee = transportationFee == null ? BigDecimal.ZERO : transportationFee;
    miscFees = copy(miscFees);
    wasteEntries = copy(wasteEntries);
    wasteFactor = wasteFactor == null ? BigDecimal.ZERO : wasteFactor;
    payments = copy(payments);
  }

  public static Settings empty() {
    return new Settings(null, null, null, null, null, null, null, null);
  }

  public static Settings of(BigDecimal taxRate, BigDecimal markup) {
    return new Settings(taxRate, markup, null, null, null, null, null, null);
  }

  public Settings withPayments(List<PaymentRecord> payments) {
    return new Settings(
        taxRate,
        markup,
        laborDiscount,
        transportationFee,
        miscFees,
        wasteEntries,
        wasteFactor,
        payments);
  }

  public Settings withLaborDiscount(BigDecimal laborDiscount) {
    return new Settings(
        taxRate,
        markup,
        laborDiscount,
        transportationFee,
        miscFees,
        wasteEntries,
        wasteFactor,
        payments);
  }

  public Settings withFees(BigDecimal transportationFee, List<MiscFee> miscFees) {
    return new Settings(
        taxRate,
        markup,
        laborDiscount,
        transportationFee,
        miscFees,
        wasteEntries,
        wasteFactor,
        payments);
  }

  public Settings withWasteEntries(List<WasteEntry> wasteEntries) {
    return new Settings(
        taxRate,
        markup,
        laborDiscount,
        transportationFee,
        miscFees,
        wasteEntries,
        wasteFactor,
        payments);
  }

  public Settings withWasteFactor(BigDecimal wasteFactor) {
    return new Settings(
        taxRate,
        markup,
        laborDiscount,
        transportationFee,
        miscFees,
        wasteEntries,
        wasteFactor,
        payments);
  }

  private static <T> List<T> copy(List<T> values) {
    return values == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(values));
  }
}

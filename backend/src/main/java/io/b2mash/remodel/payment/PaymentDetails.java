package io.b2mash.remodel.payment;

import io.b2mash.remodel.calculation.CalculationIssue;
import io.b2mash.remodel.calculation.Money;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Payment position of an estimate against a grand total.
 *
 * @param totalDue grand total minus total paid, never below zero
 * @param overduePayments sum of unpaid payments dated before today
 * @param deposit amount of the paid deposit, or zero
 */
public record PaymentDetails(
    BigDecimal totalPaid,
    BigDecimal totalDue,
    BigDecimal overduePayments,
    BigDecimal deposit,
    BigDecimal grandTotal,
    PaymentSummary summary,
    List<CalculationIssue> errors,
    List<CalculationIssue> warnings) {

  public PaymentDetails {
    errors = List.copyOf(errors);
    warnings = List.copyOf(warnings);
  }

  public PaymentBreakdown breakdown() {
    BigDecimal otherPayments = Money.nonNegative(totalPaid.subtract(deposit));
    BigDecimal overpayment = Money.nonNegative(totalPaid.subtract(grandTotal));
    BigDecimal balanceAfterDeposit = Money.round(grandTotal.subtract(deposit));
    return new PaymentBreakdown(
        grandTotal,
        deposit,
        otherPayments,
        totalPaid,
        totalDue,
        overpayment,
        balanceAfterDeposit);
  }

  public Map<String, String> formatted() {
    var values = new LinkedHashMap<String, String>();
    values.put("totalPaid", Money.format(totalPaid));
    values.put("totalDue", Money.format(totalDue));
    values.put("overduePayments", Money.format(overduePayments));
    values.put("deposit", Money.format(deposit));
    values.put("grandTotal", Money.format(grandTotal));
    return values;
  }
}

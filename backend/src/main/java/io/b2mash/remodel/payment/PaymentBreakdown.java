package io.b2mash.remodel.payment;

import java.math.BigDecimal;

/**
 * How the grand total splits between the deposit, other payments and what is still due.
 *
 * @param otherPayments paid amounts other than the deposit
 * @param balanceAfterDeposit grand total minus the deposit
 * @param overpayment amount paid beyond the grand total, or zero
 */
public record PaymentBreakdown(
    BigDecimal grandTotal,
    BigDecimal deposit,
    BigDecimal otherPayments,
    BigDecimal totalPaid,
    BigDecimal totalDue,
    BigDecimal overpayment,
    BigDecimal balanceAfterDeposit) {}

package io.b2mash.remodel.installment;

import io.b2mash.remodel.calculation.CalculationLimits;
import io.b2mash.remodel.calculation.Money;
import io.b2mash.remodel.exception.CalculationException;
import io.b2mash.remodel.exception.ValidationException;
import io.b2mash.remodel.payment.PaymentLedger;
import io.b2mash.remodel.payment.PaymentRecord;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generates monthly installment plans and keeps their unpaid amounts in line with the remaining
 * balance.
 *
 * <p>Splits are exact: every period but the last takes the half-even rounded share and the last
 * takes the residual, so a plan always sums to the amount it covers.
 *
 * <p>{@link #autoRecalculate} writes to the ledger, and a ledger write can make the caller
 * recompute the balance and call it again. The in-progress flag turns such nested calls into
 * no-ops, and the last processed balance turns repeated calls with the same balance into no-ops.
 */
public class InstallmentReconciler {

  private static final Logger log = LoggerFactory.getLogger(InstallmentReconciler.class);

  private static final Comparator<PaymentRecord> BY_INSTALLMENT_NUMBER =
      Comparator.comparing(
          PaymentRecord::installmentNumber, Comparator.nullsLast(Comparator.naturalOrder()));

  private final PaymentLedger ledger;
  private final CalculationLimits limits;

  private boolean recalculating;
  private BigDecimal lastProcessedBalance;

  public InstallmentReconciler(PaymentLedger ledger, CalculationLimits limits) {
    this.ledger = ledger;
    this.limits = limits;
  }

  /**
   * Builds, without applying it, a plan of {@code durationPeriods} monthly installments starting on
   * {@code startDate}.
   *
   * @throws ValidationException for a duration outside 1..maxInstallmentPeriods, a missing start
   *     date, or a balance that is not positive or has fractions of a cent
   */
  public List<PaymentRecord> generate(
      int durationPeriods, LocalDate startDate, BigDecimal remainingBalance) {
    if (durationPeriods < 1 || durationPeriods > limits.maxInstallmentPeriods()) {
      throw new ValidationException(
          "Invalid installment duration",
          "Duration must be between 1 and " + limits.maxInstallmentPeriods() + " months");
    }
    if (remainingBalance == null || remainingBalance.signum() <= 0) {
      throw new ValidationException(
          "Invalid remaining balance", "There is no remaining balance to split into installments");
    }
    if (startDate == null) {
      throw new ValidationException("Invalid start date", "Installment start date is required");
    }
    if (remainingBalance.stripTrailingZeros().scale() > Money.SCALE) {
      throw new ValidationException(
          "Invalid remaining balance",
          "Remaining balance " + remainingBalance.toPlainString() + " is not a whole cent amount");
    }

    List<BigDecimal> amounts = splitExact(remainingBalance, durationPeriods);
    var plan = new ArrayList<PaymentRecord>(durationPeriods);
    for (int i = 0; i < durationPeriods; i++) {
      LocalDate dueDate = startDate.plusMonths(i);
      plan.add(PaymentRecord.installment(dueDate, amounts.get(i), i + 1, durationPeriods));
    }
    log.info(
        "Generated {} installments covering {} starting {}",
        durationPeriods,
        Money.format(remainingBalance),
        startDate);
    return plan;
  }

  /** Replaces the active plan with {@code plan} in a single ledger commit. */
  public void apply(List<PaymentRecord> plan) {
    if (plan == null || plan.isEmpty()) {
      throw new ValidationException("Invalid installment plan", "Plan has no installments");
    }
    for (PaymentRecord record : plan) {
      if (record == null || !record.isInstallment()) {
        throw new ValidationException(
            "Invalid installment plan", "Plan may only contain installment records");
      }
    }
    // the plan already matches this balance, so the commit's own refresh must not redistribute it
    lastProcessedBalance = Money.sum(plan.stream().map(PaymentRecord::amount).toList());
    ledger.replaceInstallments(plan);
  }

  /**
   * Spreads {@code newRemainingBalance}, less what pinned unpaid installments already cover, evenly
   * across the unpaid installments that are not pinned. Paid and pinned installments are never
   * touched. An unpaid installment without an amount counts as free and receives its share.
   */
  public RecalculationOutcome autoRecalculate(BigDecimal newRemainingBalance) {
    if (recalculating) {
      log.debug("Installment recalculation already in progress, skipping");
      return RecalculationOutcome.SKIPPED_IN_PROGRESS;
    }
    BigDecimal balance = Money.nonNegative(newRemainingBalance);
    if (lastProcessedBalance != null && lastProcessedBalance.compareTo(balance) == 0) {
      return RecalculationOutcome.UNCHANGED;
    }

    var free = new ArrayList<PaymentRecord>();
    BigDecimal pinned = Money.ZERO;
    for (PaymentRecord installment : ledger.getInstallments()) {
      if (installment.paid()) {
        continue;
      }
      if (installment.manuallyAdjusted()) {
        pinned = pinned.add(Money.round(installment.amount()));
      } else {
        free.add(installment);
      }
    }
    if (free.isEmpty()) {
      lastProcessedBalance = balance;
      return RecalculationOutcome.NO_ELIGIBLE_INSTALLMENTS;
    }
    free.sort(BY_INSTALLMENT_NUMBER);

    BigDecimal pool = Money.nonNegative(balance.subtract(pinned));
    List<BigDecimal> amounts = splitExact(pool, free.size());
    Map<UUID, BigDecimal> updates = new LinkedHashMap<>();
    for (int i = 0; i < free.size(); i++) {
      updates.put(free.get(i).id(), amounts.get(i));
    }

    recalculating = true;
    try {
      boolean changed = ledger.updateInstallmentAmounts(updates);
      lastProcessedBalance = balance;
      if (!changed) {
        return RecalculationOutcome.UNCHANGED;
      }
      log.info(
          "Redistributed {} across {} installments ({} pinned)",
          Money.format(pool),
          free.size(),
          Money.format(pinned));
      return RecalculationOutcome.APPLIED;
    } finally {
      recalculating = false;
    }
  }

  /** Unpins every installment so the next recalculation includes them. Returns how many. */
  public int resetManualAdjustments() {
    lastProcessedBalance = null;
    int cleared = ledger.clearManualAdjustments();
    log.info("Cleared manual adjustment on {} installments", cleared);
    return cleared;
  }

  public boolean isRecalculating() {
    return recalculating;
  }

  /**
   * Splits {@code total} into {@code parts} cent amounts summing exactly to {@code total}. The
   * share is rounded half-even; if that would leave the last part negative it is rounded down.
   */
  public static List<BigDecimal> splitExact(BigDecimal total, int parts) {
    if (parts < 1) {
      throw new CalculationException(
          "Invalid installment split", "Cannot split an amount into " + parts + " parts");
    }
    BigDecimal amount = Money.round(total);
    BigDecimal others = BigDecimal.valueOf(parts - 1L);
    BigDecimal count = BigDecimal.valueOf(parts);
    BigDecimal share = amount.divide(count, Money.SCALE, RoundingMode.HALF_EVEN);
    BigDecimal last = amount.subtract(share.multiply(others));
    if (last.signum() < 0) {
      share = amount.divide(count, Money.SCALE, RoundingMode.DOWN);
      last = amount.subtract(share.multiply(others));
    }

    var amounts = new ArrayList<BigDecimal>(parts);
    for (int i = 0; i < parts - 1; i++) {
      amounts.add(share);
    }
    amounts.add(last);
    return amounts;
  }
}

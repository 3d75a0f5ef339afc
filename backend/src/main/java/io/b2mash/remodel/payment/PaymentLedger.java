package io.b2mash.remodel.payment;

import io.b2mash.remodel.calculation.CalculationIssue;
import io.b2mash.remodel.calculation.CalculationLimits;
import io.b2mash.remodel.calculation.Money;
import io.b2mash.remodel.exception.ConsistencyException;
import io.b2mash.remodel.exception.ValidationException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered payments of one estimate.
 *
 * <p>Every mutation builds a new list and swaps it in whole, so {@link #getPayments()} always
 * returns a complete snapshot. A rejected mutation throws before anything is swapped and leaves
 * the ledger unchanged. Listeners run after the swap.
 *
 * <p>At most one deposit-like record exists at any time. Deposits are always paid and are only
 * changed through {@link #setDeposit}.
 */
public class PaymentLedger {

  private static final Logger log = LoggerFactory.getLogger(PaymentLedger.class);

  static final String PREVIOUS_PLAN_SUFFIX = " (previous plan)";

  private final CalculationLimits limits;
  private final Clock clock;
  private final List<PaymentLedgerListener> listeners = new CopyOnWriteArrayList<>();

  private List<PaymentRecord> payments;
  private long revision;

  public PaymentLedger(List<PaymentRecord> initialPayments, CalculationLimits limits, Clock clock) {
    List<PaymentRecord> initial =
        initialPayments == null
            ? List.of()
            : initialPayments.stream().filter(Objects::nonNull).toList();
    long deposits = initial.stream().filter(PaymentRecord::isDepositLike).count();
    if (deposits > 1) {
      throw new ConsistencyException(
          "Duplicate deposit",
          "Payments contain " + deposits + " deposit records; at most one is allowed");
    }
    this.payments = initial;
    this.limits = limits;
    this.clock = clock;
  }

  public List<PaymentRecord> getPayments() {
    return payments;
  }

  /** Incremented once per committed mutation. */
  public long getRevision() {
    return revision;
  }

  public Optional<PaymentRecord> findDeposit() {
    return payments.stream().filter(PaymentRecord::isDepositLike).findFirst();
  }

  public List<PaymentRecord> getInstallments() {
    return payments.stream().filter(PaymentRecord::isInstallment).toList();
  }

  public void addListener(PaymentLedgerListener listener) {
    listeners.add(listener);
  }

  public void removeListener(PaymentLedgerListener listener) {
    listeners.remove(listener);
  }

  /**
   * Creates, replaces or removes the deposit. A positive amount replaces an existing deposit in
   * place (same id and position) or inserts a new one at the front; zero removes it.
   *
   * @return the deposit after the change, or empty when it was removed
   */
  public Optional<PaymentRecord> setDeposit(BigDecimal amount, LocalDate date, String method) {
    if (amount == null || amount.signum() < 0) {
      throw new ValidationException(
          "Invalid deposit amount", "Deposit amount must be zero or a positive number");
    }
    requireWithinLimit(amount);
    Optional<PaymentRecord> existing = findDeposit();

    if (amount.signum() == 0) {
      existing.ifPresent(
          deposit ->
              commit(
                  payments.stream().filter(p -> !p.id().equals(deposit.id())).toList(),
                  "deposit removed"));
      return Optional.empty();
    }

    if (date == null) {
      throw new ValidationException("Invalid deposit date", "Deposit date is required");
    }
    var next = new ArrayList<>(payments);
    PaymentRecord deposit;
    if (existing.isPresent()) {
      PaymentRecord current = existing.get();
      deposit =
          new PaymentRecord(
              current.id(),
              date,
              Money.round(amount),
              method == null || method.isBlank() ? PaymentRecord.DEPOSIT_METHOD : method,
              PaymentRecord.DEPOSIT_NOTE,
              true,
              PaymentType.DEPOSIT,
              null,
              null,
              false);
      next.set(indexOf(current.id()), deposit);
    } else {
      deposit = PaymentRecord.deposit(date, Money.round(amount), method);
      next.add(0, deposit);
    }
    commit(next, existing.isPresent() ? "deposit replaced" : "deposit set");
    return Optional.of(deposit);
  }

  /**
   * Records an ad-hoc payment. A payment labelled as a deposit becomes the deposit when none
   * exists yet.
   *
   * @throws ConsistencyException when the payment is labelled as a deposit and one already exists
   */
  public PaymentRecord addPayment(
      LocalDate date, BigDecimal amount, String method, String note, boolean paid) {
    requireDate(date);
    requireAmount(amount);

    PaymentRecord record;
    var next = new ArrayList<>(payments);
    if (PaymentRecord.isDepositLabel(method, note)) {
      requireNoDeposit();
      record =
          new PaymentRecord(
              UUID.randomUUID(),
              date,
              Money.round(amount),
              method,
              note,
              true,
              PaymentType.DEPOSIT,
              null,
              null,
              false);
      next.add(0, record);
    } else {
      record = PaymentRecord.oneTime(date, Money.round(amount), method, note, paid);
      next.add(record);
    }
    commit(next, "payment added");
    return record;
  }

  public PaymentRecord togglePaid(UUID id) {
    PaymentRecord current = requireEditable(id, "toggled");
    return replace(current.withPaid(!current.paid()), "paid toggled");
  }

  /**
   * Edits a payment's details. Changing an installment's amount pins it against automatic
   * redistribution.
   */
  public PaymentRecord editPayment(
      UUID id, LocalDate date, BigDecimal amount, String method, String note) {
    PaymentRecord current = requireEditable(id, "edited");
    requireDate(date);
    requireAmount(amount);
    if (PaymentRecord.isDepositLabel(method, note)) {
      requireNoDeposit();
      throw new ValidationException(
          "Invalid payment label", "Record a deposit with the deposit setting instead");
    }

    BigDecimal rounded = Money.round(amount);
    PaymentRecord updated = current.withDetails(date, rounded, method, note);
    if (current.isInstallment() && differs(rounded, current.amount())) {
      updated = updated.withManuallyAdjusted(true);
    }
    return replace(updated, "payment edited");
  }

  /** Overrides an amount. Installments edited this way are pinned. */
  public PaymentRecord editAmount(UUID id, BigDecimal amount) {
    PaymentRecord current = requireEditable(id, "edited");
    requireAmount(amount);
    PaymentRecord updated = current.withAmount(Money.round(amount));
    if (current.isInstallment()) {
      updated = updated.withManuallyAdjusted(true);
    }
    return replace(updated, "amount edited");
  }

  public PaymentRecord markAdjusted(UUID id, boolean manuallyAdjusted) {
    PaymentRecord current = require(id);
    if (!current.isInstallment()) {
      throw new ValidationException(
          "Not an installment", "Only installments can be marked as manually adjusted");
    }
    if (current.manuallyAdjusted() == manuallyAdjusted) {
      return current;
    }
    return replace(current.withManuallyAdjusted(manuallyAdjusted), "adjustment flag changed");
  }

  /** Removes a payment. Deleting an installment renumbers the rest of its plan. */
  public void delete(UUID id) {
    PaymentRecord current = requireEditable(id, "deleted");
    List<PaymentRecord> remaining =
        payments.stream().filter(p -> !p.id().equals(current.id())).toList();
    if (current.isInstallment()) {
      remaining = renumberInstallments(remaining);
    }
    commit(remaining, "payment deleted");
  }

  private static List<PaymentRecord> renumberInstallments(List<PaymentRecord> records) {
    int total = (int) records.stream().filter(PaymentRecord::isInstallment).count();
    var next = new ArrayList<PaymentRecord>(records.size());
    int position = 0;
    for (PaymentRecord record : records) {
      next.add(record.isInstallment() ? record.withPlanPosition(++position, total) : record);
    }
    return next;
  }

  /**
   * Swaps the active installment plan in one commit. Unpaid installments of the old plan are
   * removed; paid ones are kept as one-time payments so the money already received is not lost.
   */
  public void replaceInstallments(List<PaymentRecord> plan) {
    var next = new ArrayList<PaymentRecord>();
    for (PaymentRecord payment : payments) {
      if (!payment.isInstallment()) {
        next.add(payment);
      } else if (payment.paid()) {
        next.add(
            payment
                .withType(PaymentType.ONE_TIME)
                .withDetails(
                    payment.date(),
                    payment.amount(),
                    payment.method(),
                    payment.note() + PREVIOUS_PLAN_SUFFIX));
      }
    }
    next.addAll(plan);
    commit(next, "installment plan replaced");
  }

  /**
   * Sets new amounts on the given installments in one commit.
   *
   * @return false when every amount already matched and nothing was written
   */
  public boolean updateInstallmentAmounts(Map<UUID, BigDecimal> amounts) {
    boolean changed = false;
    var next = new ArrayList<PaymentRecord>(payments.size());
    for (PaymentRecord payment : payments) {
      BigDecimal amount = amounts.get(payment.id());
      if (amount != null && payment.isInstallment() && differs(amount, payment.amount())) {
        next.add(payment.withAmount(amount));
        changed = true;
      } else {
        next.add(payment);
      }
    }
    if (changed) {
      commit(next, "installments recalculated");
    }
    return changed;
  }

  private static boolean differs(BigDecimal amount, BigDecimal current) {
    return current == null || amount.compareTo(current) != 0;
  }

  /** Unpins every installment. Returns how many were pinned. */
  public int clearManualAdjustments() {
    int pinned = 0;
    var next = new ArrayList<PaymentRecord>(payments.size());
    for (PaymentRecord payment : payments) {
      if (payment.isInstallment() && payment.manuallyAdjusted()) {
        next.add(payment.withManuallyAdjusted(false));
        pinned++;
      } else {
        next.add(payment);
      }
    }
    if (pinned > 0) {
      commit(next, "manual adjustments cleared");
    }
    return pinned;
  }

  /** The amount that settles the estimate in one payment. */
  public BigDecimal quickPaymentAmount(BigDecimal grandTotal) {
    BigDecimal due = calculatePaymentDetails(grandTotal).totalDue();
    if (due.signum() == 0) {
      throw new ValidationException("Nothing due", "The estimate is already fully paid");
    }
    return due;
  }

  public PaymentDetails calculatePaymentDetails(BigDecimal grandTotal) {
    return calculatePaymentDetails(payments, grandTotal, LocalDate.now(clock));
  }

  /**
   * Computes paid, due and overdue amounts. Never throws: malformed records are skipped with a
   * warning.
   *
   * @param today payments dated strictly before this day and still unpaid are overdue
   */
  public static PaymentDetails calculatePaymentDetails(
      List<PaymentRecord> payments, BigDecimal grandTotal, LocalDate today) {
    var errors = new ArrayList<CalculationIssue>();
    var warnings = new ArrayList<CalculationIssue>();

    BigDecimal grand = Money.round(grandTotal);
    if (grandTotal == null || grand.signum() < 0) {
      warnings.add(
          CalculationIssue.of(
              "INVALID_GRAND_TOTAL", "Grand total is missing or negative, using 0.00"));
      grand = Money.ZERO;
    }

    BigDecimal totalPaid = Money.ZERO;
    BigDecimal overdue = Money.ZERO;
    BigDecimal deposit = Money.ZERO;
    int paidCount = 0;
    int overdueCount = 0;
    int counted = 0;
    int deposits = 0;

    for (int i = 0; i < payments.size(); i++) {
      PaymentRecord payment = payments.get(i);
      if (payment == null || payment.amount() == null) {
        warnings.add(
            CalculationIssue.of(
                "INVALID_PAYMENT", "Payment " + (i + 1) + " has no amount", Map.of("index", i)));
        continue;
      }
      BigDecimal amount = Money.round(payment.amount());
      if (amount.signum() < 0) {
        warnings.add(
            CalculationIssue.of(
                "NEGATIVE_PAYMENT",
                "Payment " + (i + 1) + " has a negative amount and was ignored",
                Map.of("index", i, "amount", amount)));
        continue;
      }
      counted++;

      if (payment.paid()) {
        totalPaid = totalPaid.add(amount);
        paidCount++;
        if (payment.isDepositLike()) {
          deposits++;
          deposit = deposit.add(amount);
          if (deposits > 1) {
            warnings.add(
                CalculationIssue.of(
                    "DUPLICATE_DEPOSIT",
                    "More than one deposit is recorded",
                    Map.of("index", i, "paymentId", payment.id())));
          }
        }
      } else if (payment.date() == null) {
        warnings.add(
            CalculationIssue.of(
                "MISSING_PAYMENT_DATE",
                "Unpaid payment " + (i + 1) + " has no date",
                Map.of("index", i, "paymentId", payment.id())));
      } else if (payment.date().isBefore(today)) {
        overdue = overdue.add(amount);
        overdueCount++;
      }
    }

    BigDecimal totalDue = Money.nonNegative(grand.subtract(totalPaid));
    return new PaymentDetails(
        totalPaid,
        totalDue,
        overdue,
        deposit,
        grand,
        new PaymentSummary(paidCount, counted, overdueCount),
        errors,
        warnings);
  }

  private PaymentRecord replace(PaymentRecord updated, String reason) {
    var next = new ArrayList<>(payments);
    next.set(indexOf(updated.id()), updated);
    commit(next, reason);
    return updated;
  }

  private void commit(List<PaymentRecord> next, String reason) {
    payments = List.copyOf(next);
    revision++;
    log.info("Payments {}: {} records, revision {}", reason, payments.size(), revision);
    for (PaymentLedgerListener listener : listeners) {
      listener.onPaymentsChanged(payments);
    }
  }

  private PaymentRecord require(UUID id) {
    return payments.stream()
        .filter(p -> p.id().equals(id))
        .findFirst()
        .orElseThrow(
            () -> new ValidationException("Payment not found", "No payment with id " + id));
  }

  private PaymentRecord requireEditable(UUID id, String action) {
    PaymentRecord current = require(id);
    if (current.isDepositLike()) {
      throw new ValidationException(
          "Deposit cannot be " + action, "Change the deposit through the deposit setting");
    }
    return current;
  }

  private void requireNoDeposit() {
    if (findDeposit().isPresent()) {
      throw new ConsistencyException(
          "Duplicate deposit", "A deposit already exists; update it instead of adding another");
    }
  }

  private void requireAmount(BigDecimal amount) {
    if (amount == null || amount.signum() <= 0) {
      throw new ValidationException(
          "Invalid payment amount", "Amount must be a number greater than zero");
    }
    requireWithinLimit(amount);
  }

  private void requireWithinLimit(BigDecimal amount) {
    if (amount.compareTo(limits.maxPaymentAmount()) > 0) {
      throw new ValidationException(
          "Invalid payment amount",
          "Amount must not exceed " + limits.maxPaymentAmount().toPlainString());
    }
  }

  private static void requireDate(LocalDate date) {
    if (date == null) {
      throw new ValidationException("Invalid payment date", "Payment date is required");
    }
  }

  private int indexOf(UUID id) {
    for (int i = 0; i < payments.size(); i++) {
      if (payments.get(i).id().equals(id)) {
        return i;
      }
    }
    throw new ValidationException("Payment not found", "No payment with id " + id);
  }
}

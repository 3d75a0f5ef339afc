package io.b2mash.remodel.payment;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

/**
 * A payment recorded against an estimate. This shape is the durable contract a persistence layer
 * must keep verbatim. Records are immutable; the ledger replaces them through the {@code with*}
 * copies.
 *
 * @param installmentNumber 1-based position within the plan, INSTALLMENT only
 * @param totalInstallments plan length, INSTALLMENT only
 * @param manuallyAdjusted true when the amount was overridden and must not be redistributed
 */
public record PaymentRecord(
    UUID id,
    LocalDate date,
    BigDecimal amount,
    String method,
    String note,
    boolean paid,
    PaymentType type,
    Integer installmentNumber,
    Integer totalInstallments,
    boolean manuallyAdjusted) {

  public static final String DEPOSIT_METHOD = "Deposit";
  public static final String DEPOSIT_NOTE = "Initial Deposit";
  public static final String INSTALLMENT_METHOD = "Installment";

  public PaymentRecord {
    Objects.requireNonNull(id, "id must not be null");
    type = type == null ? PaymentType.ONE_TIME : type;
    method = method == null ? "" : method;
    note = note == null ? "" : note;
  }

  public static PaymentRecord deposit(LocalDate date, BigDecimal amount, String method) {
    return new PaymentRecord(
        UUID.randomUUID(),
        date,
        amount,
        method == null || method.isBlank() ? DEPOSIT_METHOD : method,
        DEPOSIT_NOTE,
        true,
        PaymentType.DEPOSIT,
        null,
        null,
        false);
  }

  public static PaymentRecord oneTime(
      LocalDate date, BigDecimal amount, String method, String note, boolean paid) {
    return new PaymentRecord(
        UUID.randomUUID(),
        date,
        amount,
        method,
        note,
        paid,
        PaymentType.ONE_TIME,
        null,
        null,
        false);
  }

  public static PaymentRecord installment(
      LocalDate date, BigDecimal amount, int installmentNumber, int totalInstallments) {
    return new PaymentRecord(
        UUID.randomUUID(),
        date,
        amount,
        INSTALLMENT_METHOD,
        generatedNote(installmentNumber, totalInstallments),
        false,
        PaymentType.INSTALLMENT,
        installmentNumber,
        totalInstallments,
        false);
  }

  /**
   * True for DEPOSIT records and for legacy records whose method is "deposit" or whose note
   * mentions a deposit. Matching is case-insensitive.
   */
  public boolean isDepositLike() {
    if (type == PaymentType.DEPOSIT) {
      return true;
    }
    return isDepositLabel(method, note);
  }

  public static boolean isDepositLabel(String method, String note) {
    if (method != null && method.trim().equalsIgnoreCase("deposit")) {
      return true;
    }
    return note != null && note.toLowerCase(Locale.ROOT).contains("deposit");
  }

  public boolean isInstallment() {
    return type == PaymentType.INSTALLMENT;
  }

  public PaymentRecord withPaid(boolean paid) {
    return new PaymentRecord(
        id,
        date,
        amount,
        method,
        note,
        paid,
        type,
        installmentNumber,
        totalInstallments,
        manuallyAdjusted);
  }

  public PaymentRecord withAmount(BigDecimal amount) {
    return new PaymentRecord(
        id,
        date,
        amount,
        method,
        note,
        paid,
        type,
        installmentNumber,
        totalInstallments,
        manuallyAdjusted);
  }

  public PaymentRecord withManuallyAdjusted(boolean manuallyAdjusted) {
    return new PaymentRecord(
        id,
        date,
        amount,
        method,
        note,
        paid,
        type,
        installmentNumber,
        totalInstallments,
        manuallyAdjusted);
  }

  public PaymentRecord withDetails(LocalDate date, BigDecimal amount, String method, String note) {
    return new PaymentRecord(
        id,
        date,
        amount,
        method,
        note,
        paid,
        type,
        installmentNumber,
        totalInstallments,
        manuallyAdjusted);
  }

  /**
   * Moves this installment to another position in its plan. A note still in the generated
   * "Installment N of M" form follows the new position.
   */
  public PaymentRecord withPlanPosition(int installmentNumber, int totalInstallments) {
    String renumbered =
        generatedNote(this.installmentNumber, this.totalInstallments).equals(note)
            ? generatedNote(installmentNumber, totalInstallments)
            : note;
    return new PaymentRecord(
        id,
        date,
        amount,
        method,
        renumbered,
        paid,
        type,
        installmentNumber,
        totalInstallments,
        manuallyAdjusted);
  }

  private static String generatedNote(Integer installmentNumber, Integer totalInstallments) {
    return "Installment " + installmentNumber + " of " + totalInstallments;
  }

  /** Re-types this record, dropping plan membership when it is no longer an installment. */
  public PaymentRecord withType(PaymentType type) {
    boolean installment = type == PaymentType.INSTALLMENT;
    return new PaymentRecord(
        id,
        date,
        amount,
        method,
        note,
        paid,
        type,
        installment ? installmentNumber : null,
        installment ? totalInstallments : null,
        installment && manuallyAdjusted);
  }
}

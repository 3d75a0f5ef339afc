package io.b2mash.remodel.installment;

/** Result of one {@link InstallmentReconciler#autoRecalculate} call. */
public enum RecalculationOutcome {
  /** Installment amounts were rewritten. */
  APPLIED,
  /** The balance was already processed, or the redistribution matched the current amounts. */
  UNCHANGED,
  /** Another recalculation was still committing; the call was ignored. */
  SKIPPED_IN_PROGRESS,
  /** Every installment is paid or pinned. */
  NO_ELIGIBLE_INSTALLMENTS
}

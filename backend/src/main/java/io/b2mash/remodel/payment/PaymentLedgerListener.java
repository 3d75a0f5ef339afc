package io.b2mash.remodel.payment;

import java.util.List;

/** Notified after a ledger mutation has been committed. */
@FunctionalInterface
public interface PaymentLedgerListener {

  void onPaymentsChanged(List<PaymentRecord> payments);
}

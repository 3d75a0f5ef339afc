package io.b2mash.remodel.payment;

/**
 * Kind of payment record.
 *
 * <ul>
 *   <li>DEPOSIT: the single up-front payment, always paid. At most one per estimate.
 *   <li>INSTALLMENT: a member of the generated monthly plan.
 *   <li>ONE_TIME: any ad-hoc payment.
 * </ul>
 */
public enum PaymentType {
  DEPOSIT,
  INSTALLMENT,
  ONE_TIME
}

package io.b2mash.remodel.session;

import io.b2mash.remodel.catalog.WorkTypeCapability;
import io.b2mash.remodel.engine.CalculatorEngine;
import io.b2mash.remodel.engine.CalculatorEngineFactory;
import io.b2mash.remodel.engine.CategoryBreakdowns;
import io.b2mash.remodel.engine.EngineOptions;
import io.b2mash.remodel.engine.Totals;
import io.b2mash.remodel.estimate.Category;
import io.b2mash.remodel.estimate.Settings;
import io.b2mash.remodel.installment.InstallmentReconciler;
import io.b2mash.remodel.installment.RecalculationOutcome;
import io.b2mash.remodel.payment.PaymentDetails;
import io.b2mash.remodel.payment.PaymentLedger;
import io.b2mash.remodel.payment.PaymentLedgerListener;
import io.b2mash.remodel.payment.PaymentRecord;
import java.time.LocalDate;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One open estimate: its current snapshot, its payment ledger and its installment plan.
 *
 * <p>After every ledger commit and every estimate update the session builds a new engine, computes
 * the totals, hands the grand total to the payment details and feeds the remaining balance to the
 * reconciler. The reconciler's own writes come back here as ledger commits; they refresh the
 * snapshot while its in-progress flag makes the nested recalculation a no-op.
 */
public class EstimateSession implements PaymentLedgerListener {

  private static final Logger log = LoggerFactory.getLogger(EstimateSession.class);

  private final CalculatorEngineFactory engineFactory;
  private final WorkTypeCapability catalog;
  private final EngineOptions options;
  private final PaymentLedger ledger;
  private final InstallmentReconciler reconciler;

  private List<Category> categories;
  private Settings settings;
  private CalculatorEngine engine;
  private Totals totals;
  private PaymentDetails paymentDetails;
  private RecalculationOutcome lastOutcome;

  public EstimateSession(
      CalculatorEngineFactory engineFactory,
      List<Category> categories,
      Settings settings,
      WorkTypeCapability catalog,
      EngineOptions options) {
    this.engineFactory = engineFactory;
    this.catalog = catalog;
    this.options = options;
    this.categories = categories;
    this.settings = settings != null ? settings : Settings.empty();
    this.ledger =
        new PaymentLedger(
            this.settings.payments(), engineFactory.getLimits(), engineFactory.getClock());
    this.reconciler = new InstallmentReconciler(ledger, engineFactory.getLimits());
    ledger.addListener(this);
    refresh();
  }

  @Override
  public void onPaymentsChanged(List<PaymentRecord> payments) {
    refresh();
  }

  /** Replaces categories and pricing settings. Payments in {@code settings} are ignored. */
  public void updateEstimate(List<Category> categories, Settings settings) {
    this.categories = categories;
    this.settings = settings != null ? settings : Settings.empty();
    log.info("Estimate updated, recomputing totals");
    refresh();
  }

  /** Generates a plan over the current remaining balance and makes it the active plan. */
  public List<PaymentRecord> generateInstallmentPlan(int durationPeriods, LocalDate startDate) {
    List<PaymentRecord> plan =
        reconciler.generate(durationPeriods, startDate, paymentDetails.totalDue());
    reconciler.apply(plan);
    return plan;
  }

  public int resetManualAdjustments() {
    return reconciler.resetManualAdjustments();
  }

  public Totals getTotals() {
    return totals;
  }

  public PaymentDetails getPaymentDetails() {
    return paymentDetails;
  }

  public CategoryBreakdowns getCategoryBreakdowns() {
    return engine.calculateCategoryBreakdowns();
  }

  public PaymentLedger getLedger() {
    return ledger;
  }

  public InstallmentReconciler getReconciler() {
    return reconciler;
  }

  public CalculatorEngine getEngine() {
    return engine;
  }

  /** Outcome of the latest recalculation, or null before any installment plan existed. */
  public RecalculationOutcome getLastOutcome() {
    return lastOutcome;
  }

  private void refresh() {
    engine =
        engineFactory.create(
            categories, settings.withPayments(ledger.getPayments()), catalog, options);
    totals = engine.calculateTotals();
    paymentDetails = engine.calculatePaymentDetails(totals.total());
    if (!ledger.getInstallments().isEmpty()) {
      lastOutcome = reconciler.autoRecalculate(paymentDetails.totalDue());
    }
  }
}

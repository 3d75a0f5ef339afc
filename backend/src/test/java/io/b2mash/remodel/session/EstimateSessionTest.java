package io.b2mash.remodel.session;

import static io.b2mash.remodel.testutil.EstimateFixtures.kitchen;
import static io.b2mash.remodel.testutil.EstimateFixtures.money;
import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.remodel.calculation.Money;
import io.b2mash.remodel.catalog.WorkTypeCapability;
import io.b2mash.remodel.engine.CalculatorEngineFactory;
import io.b2mash.remodel.engine.EngineOptions;
import io.b2mash.remodel.estimate.EstimateDocumentReader;
import io.b2mash.remodel.estimate.Settings;
import io.b2mash.remodel.installment.RecalculationOutcome;
import io.b2mash.remodel.payment.PaymentRecord;
import io.b2mash.remodel.testutil.EstimateFixtures;
import io.b2mash.remodel.testutil.MutableClock;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.ObjectMapper;

class EstimateSessionTest {

  private static final LocalDate TODAY = LocalDate.parse("2025-03-15");

  private final CalculatorEngineFactory factory =
      EstimateFixtures.engineFactory(MutableClock.at(EstimateFixtures.TODAY));
  private EstimateSession session;

  @BeforeEach
  void setUp() {
    session =
        new EstimateSession(
            factory,
            kitchen(),
            Settings.of(money("0.08"), money("0.10")),
            WorkTypeCapability.permissive(),
            EngineOptions.defaults());
  }

  @Test
  void open_computesTotalsAndPaymentDetails() {
    assertThat(session.getTotals().total()).isEqualByComparingTo("944.00");
    assertThat(session.getPaymentDetails().totalDue()).isEqualByComparingTo("944.00");
    assertThat(session.getCategoryBreakdowns().breakdowns()).hasSize(1);
    assertThat(session.getLastOutcome()).isNull();
  }

  @Test
  void open_withAmountlessInstallmentRebalancesIt() {
    var settings =
        Settings.of(money("0.08"), money("0.10"))
            .withPayments(
                List.of(
                    PaymentRecord.installment(TODAY.plusMonths(1), null, 1, 2),
                    PaymentRecord.installment(TODAY.plusMonths(2), money("400"), 2, 2)));

    var opened =
        new EstimateSession(
            factory,
            kitchen(),
            settings,
            WorkTypeCapability.permissive(),
            EngineOptions.defaults());

    assertThat(opened.getLedger().getInstallments())
        .extracting(PaymentRecord::amount)
        .containsExactly(money("472.00"), money("472.00"));
    assertThat(opened.getLastOutcome()).isEqualTo(RecalculationOutcome.APPLIED);
    assertThat(opened.getPaymentDetails().totalDue()).isEqualByComparingTo("944.00");
  }

  @Test
  void openDocument_toleratesBlankInstallmentAmount() {
    var service =
        new EstimateSessionService(
            factory,
            new EstimateDocumentReader(
                new ObjectMapper(), MutableClock.at(EstimateFixtures.TODAY)));

    var opened =
        service.openDocument(
            """
            {"categories": [{"key": "kitchen", "name": "Kitchen", "workItems": [{
              "type": "tile", "measurementType": "area",
              "materialCostPerUnit": 5, "laborCostPerUnit": 3,
              "surfaces": [{"sqft": 100}]
            }]}],
             "settings": {"taxRate": 0.08, "markup": 0.10, "payments": [
               {"type": "installment", "date": "2025-04-15", "amount": "",
                "installmentNumber": 1, "totalInstallments": 2},
               {"type": "installment", "date": "2025-05-15", "amount": "n/a",
                "installmentNumber": 2, "totalInstallments": 2}
             ]}}
            """,
            WorkTypeCapability.permissive());

    assertThat(opened.getTotals().total()).isEqualByComparingTo("944.00");
    assertThat(opened.getLedger().getInstallments())
        .extracting(PaymentRecord::amount)
        .containsExactly(money("472.00"), money("472.00"));
  }

  @Test
  void ledgerChangeRefreshesPaymentDetails() {
    session.getLedger().setDeposit(money("200"), TODAY, null);

    var details = session.getPaymentDetails();
    assertThat(details.totalPaid()).isEqualByComparingTo("200.00");
    assertThat(details.totalDue()).isEqualByComparingTo("744.00");
    assertThat(details.deposit()).isEqualByComparingTo("200.00");
  }

  @Test
  void generateInstallmentPlan_coversRemainingBalance() {
    session.getLedger().setDeposit(money("200"), TODAY, null);

    var plan = session.generateInstallmentPlan(3, TODAY.plusMonths(1));

    assertThat(plan)
        .extracting(PaymentRecord::amount)
        .containsExactly(money("248.00"), money("248.00"), money("248.00"));
    assertThat(session.getLedger().getInstallments()).containsExactlyElementsOf(plan);
    assertThat(session.getLastOutcome()).isEqualTo(RecalculationOutcome.UNCHANGED);
  }

  @Test
  void estimateChangeRebalancesUnpaidInstallments() {
    session.getLedger().setDeposit(money("200"), TODAY, null);
    session.generateInstallmentPlan(3, TODAY.plusMonths(1));

    // markup 20% instead of 10%: total 1024.00, due 824.00
    session.updateEstimate(kitchen(), Settings.of(money("0.08"), money("0.20")));

    assertThat(session.getTotals().total()).isEqualByComparingTo("1024.00");
    assertThat(session.getLastOutcome()).isEqualTo(RecalculationOutcome.APPLIED);
    var amounts =
        session.getLedger().getInstallments().stream().map(PaymentRecord::amount).toList();
    assertThat(amounts).containsExactly(money("274.67"), money("274.67"), money("274.66"));
    assertThat(Money.sum(amounts)).isEqualByComparingTo(session.getPaymentDetails().totalDue());
  }

  @Test
  void payingAnInstallmentLeavesTheOthersAlone() {
    var plan = session.generateInstallmentPlan(4, TODAY.plusMonths(1));
    long revision = session.getLedger().getRevision();

    session.getLedger().togglePaid(plan.get(0).id());

    assertThat(session.getPaymentDetails().totalDue()).isEqualByComparingTo("708.00");
    assertThat(session.getLastOutcome()).isEqualTo(RecalculationOutcome.UNCHANGED);
    assertThat(session.getLedger().getRevision()).isEqualTo(revision + 1);
  }

  @Test
  void updateEstimate_keepsLedgerPayments() {
    session.getLedger().setDeposit(money("200"), TODAY, null);

    var settings = Settings.of(money("0.08"), money("0.10")).withPayments(List.of());
    session.updateEstimate(kitchen(), settings);

    assertThat(session.getLedger().findDeposit()).isPresent();
    assertThat(session.getPaymentDetails().deposit()).isEqualByComparingTo("200.00");
  }
}

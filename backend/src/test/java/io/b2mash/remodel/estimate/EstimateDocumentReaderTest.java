package io.b2mash.remodel.estimate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.remodel.calculation.CalculationIssue;
import io.b2mash.remodel.catalog.WorkTypeCapability;
import io.b2mash.remodel.exception.ConsistencyException;
import io.b2mash.remodel.exception.ValidationException;
import io.b2mash.remodel.measurement.MeasurementType;
import io.b2mash.remodel.payment.PaymentRecord;
import io.b2mash.remodel.payment.PaymentType;
import io.b2mash.remodel.testutil.EstimateFixtures;
import io.b2mash.remodel.testutil.MutableClock;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.ObjectMapper;

class EstimateDocumentReaderTest {

  private final EstimateDocumentReader reader =
      new EstimateDocumentReader(new ObjectMapper(), MutableClock.at(EstimateFixtures.TODAY));

  @Test
  void read_canonicalDocument() {
    var document =
        reader.read(
            """
            {
              "categories": [{
                "key": "kitchen",
                "name": "Kitchen",
                "workItems": [{
                  "type": "tile",
                  "subtype": "ceramic",
                  "measurementType": "square-foot",
                  "materialCostPerUnit": 5,
                  "laborCostPerUnit": "3.00",
                  "surfaces": [{"name": "Floor", "sqft": 100, "wasteFactor": 0.1}]
                }]
              }],
              "settings": {
                "taxRate": 0.08,
                "markup": 0.1,
                "transportationFee": 40,
                "miscFees": [{"name": "Permit", "amount": 50}],
                "wasteEntries": [{"surfaceName": "Floor", "surfaceCost": 500, "wasteFactor": 0.1}]
              }
            }
            """);

    var item = document.categories().get(0).workItems().get(0);
    assertThat(item.measurementType()).isEqualTo(MeasurementType.SQUARE_FOOT);
    assertThat(item.materialCostPerUnit()).isEqualByComparingTo("5");
    assertThat(item.laborCostPerUnit()).isEqualByComparingTo("3");
    assertThat(item.surfaces()).hasSize(1);
    assertThat(item.surfaces().get(0).sqft()).isEqualByComparingTo("100");
    assertThat(document.settings().taxRate()).isEqualByComparingTo("0.08");
    assertThat(document.settings().miscFees().get(0).name()).isEqualTo("Permit");
    assertThat(document.settings().miscFees().get(0).amount()).isEqualByComparingTo("50");
    assertThat(document.settings().wasteEntries()).hasSize(1);
    assertThat(document.warnings()).isEmpty();
  }

  @Test
  void read_legacyFlatMeasurementsBecomeASurface() {
    var document =
        reader.read(
            """
            {"categories": [{"key": "trim", "name": "Trim", "items": [{
              "type": "custom-work-type",
              "name": "Crown molding",
              "measurementType": "Linear Ft",
              "materialCost": "$2.50",
              "laborCost": 1.75,
              "linearFt": 48
            }]}]}
            """);

    var item = document.categories().get(0).workItems().get(0);
    assertThat(item.customName()).isEqualTo("Crown molding");
    assertThat(item.measurementType()).isEqualTo(MeasurementType.LINEAR_FOOT);
    assertThat(item.materialCostPerUnit()).isEqualByComparingTo("2.50");
    assertThat(item.laborCostPerUnit()).isEqualByComparingTo("1.75");
    assertThat(item.surfaces()).hasSize(1);
    assertThat(item.surfaces().get(0).linearFt()).isEqualByComparingTo("48");
    assertThat(document.warnings())
        .extracting(CalculationIssue::code)
        .containsExactly("LEGACY_MEASUREMENTS_MIGRATED");
  }

  @Test
  void read_flatFieldsIgnoredWhenSurfacesPresent() {
    var document =
        reader.read(
            """
            {"categories": [{"name": "Bath", "workItems": [{
              "type": "paint",
              "sqft": 999,
              "surfaces": [{"width": 10, "height": "eight"}]
            }]}]}
            """);

    var surface = document.categories().get(0).workItems().get(0).surfaces().get(0);
    assertThat(surface.sqft()).isNull();
    assertThat(surface.width()).isEqualByComparingTo("10");
    assertThat(surface.height()).isNull();
    assertThat(document.warnings())
        .extracting(CalculationIssue::code)
        .containsExactly("LEGACY_MEASUREMENTS_DISCARDED");
  }

  @Test
  void read_infersPaymentTypes() {
    var document =
        reader.read(
            """
            {"settings": {"payments": [
              {"date": "2025-01-10T12:00:00.000Z", "amount": 300, "method": "Deposit",
               "isPaid": true},
              {"id": "not-a-uuid", "date": "2025-02-10", "amount": 100, "method": "Cash",
               "isPaid": false},
              {"date": "2025-03-10", "amount": 50, "type": "installment", "installmentNumber": 1,
               "totalInstallments": 2, "manuallyAdjusted": true}
            ]}}
            """);

    var payments = document.settings().payments();
    assertThat(payments)
        .extracting(PaymentRecord::type)
        .containsExactly(PaymentType.DEPOSIT, PaymentType.ONE_TIME, PaymentType.INSTALLMENT);
    assertThat(payments.get(0).date()).isEqualTo(LocalDate.parse("2025-01-10"));
    assertThat(payments.get(1).id()).isNotNull();
    assertThat(payments.get(1).paid()).isFalse();
    assertThat(payments.get(2).installmentNumber()).isEqualTo(1);
    assertThat(payments.get(2).manuallyAdjusted()).isTrue();
  }

  @Test
  void read_migratesDepositAmount() {
    var document =
        reader.read(
            """
            {
              "settings": {"payments": [{"date": "2025-02-01", "amount": 100, "method": "Cash"}]},
              "paymentDetails": {"depositAmount": 250, "depositDate": "2025-01-20T00:00:00Z"}
            }
            """);

    var deposit = document.settings().payments().get(0);
    assertThat(deposit.type()).isEqualTo(PaymentType.DEPOSIT);
    assertThat(deposit.paid()).isTrue();
    assertThat(deposit.amount()).isEqualByComparingTo("250");
    assertThat(deposit.date()).isEqualTo(LocalDate.parse("2025-01-20"));
    assertThat(document.settings().payments()).hasSize(2);
    assertThat(document.warnings())
        .extracting(CalculationIssue::code)
        .containsExactly("DEPOSIT_MIGRATED");
  }

  @Test
  void read_migratedDepositFallsBackToCreationDateThenToday() {
    var withCreation =
        reader.read(
            """
            {"createdAt": "2024-11-05T09:30:00Z", "paymentDetails": {"depositAmount": 100}}
            """);
    var withoutDates = reader.read("{\"paymentDetails\": {\"depositAmount\": 100}}");

    assertThat(withCreation.settings().payments().get(0).date())
        .isEqualTo(LocalDate.parse("2024-11-05"));
    assertThat(withoutDates.settings().payments().get(0).date())
        .isEqualTo(LocalDate.parse("2025-03-15"));
  }

  @Test
  void read_existingDepositIsNotDuplicated() {
    var document =
        reader.read(
            """
            {
              "settings": {"payments": [{"amount": 250, "method": "Deposit", "isPaid": true}]},
              "paymentDetails": {"depositAmount": 250, "depositDate": "2025-01-20"}
            }
            """);

    assertThat(document.settings().payments()).hasSize(1);
    assertThat(document.settings().payments().get(0).date())
        .isEqualTo(LocalDate.parse("2025-01-20"));
  }

  @Test
  void read_twoDepositsIsAConsistencyError() {
    assertThatThrownBy(
            () ->
                reader.read(
                    """
                    {"settings": {"payments": [
                      {"amount": 100, "method": "Deposit", "isPaid": true},
                      {"amount": 50, "method": "Cash", "note": "extra deposit", "isPaid": true}
                    ]}}
                    """))
        .isInstanceOf(ConsistencyException.class);
  }

  @Test
  void read_legacyWasteFactorStillCostsWaste() {
    var document =
        reader.read(
            """
            {"categories": [{"key": "kitchen", "name": "Kitchen", "workItems": [{
              "type": "tile",
              "measurementType": "area",
              "materialCostPerUnit": 5,
              "laborCostPerUnit": 3,
              "surfaces": [{"sqft": 100}]
            }]}],
             "settings": {"wasteFactor": 0.10}}
            """);

    assertThat(document.settings().wasteFactor()).isEqualByComparingTo("0.10");
    var totals =
        EstimateFixtures.engineFactory(MutableClock.at(EstimateFixtures.TODAY))
            .create(document.categories(), document.settings(), WorkTypeCapability.permissive())
            .calculateTotals();
    assertThat(totals.wasteCost()).isEqualByComparingTo("50.00");
    assertThat(totals.total()).isEqualByComparingTo("850.00");
  }

  @Test
  void read_rejectsMalformedJson() {
    assertThatThrownBy(() -> reader.read("{not json")).isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> reader.read("[1, 2]")).isInstanceOf(ValidationException.class);
  }
}

package io.b2mash.remodel;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.remodel.calculation.CalculationLimits;
import io.b2mash.remodel.catalog.WorkTypeCapability;
import io.b2mash.remodel.engine.EngineOptions;
import io.b2mash.remodel.session.EstimateSessionService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class EstimatorApplicationTest {

  @Autowired private EngineOptions engineOptions;
  @Autowired private CalculationLimits limits;
  @Autowired private EstimateSessionService sessionService;

  @Test
  void bindsConfiguration() {
    assertThat(engineOptions).isEqualTo(EngineOptions.defaults());
    assertThat(limits.maxInstallmentPeriods()).isEqualTo(60);
    assertThat(limits.maxTaxRate()).isEqualByComparingTo("0.25");
    assertThat(limits.maxPaymentAmount()).isEqualByComparingTo("100000");
  }

  @Test
  void opensStoredEstimate() {
    var session =
        sessionService.openDocument(
            """
            {
              "categories": [{"key": "kitchen", "name": "Kitchen", "workItems": [{
                "type": "tile", "measurementType": "area",
                "materialCostPerUnit": 5, "laborCostPerUnit": 3,
                "surfaces": [{"sqft": 100}]
              }]}],
              "settings": {"taxRate": 0.08, "markup": 0.10},
              "paymentDetails": {"depositAmount": 200, "depositDate": "2025-01-15"}
            }
            """,
            WorkTypeCapability.permissive());

    assertThat(session.getTotals().total()).isEqualByComparingTo("944.00");
    assertThat(session.getPaymentDetails().deposit()).isEqualByComparingTo("200.00");
    assertThat(session.getPaymentDetails().totalDue()).isEqualByComparingTo("744.00");
  }
}

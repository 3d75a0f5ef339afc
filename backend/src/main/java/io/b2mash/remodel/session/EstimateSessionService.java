package io.b2mash.remodel.session;

import io.b2mash.remodel.calculation.CalculationIssue;
import io.b2mash.remodel.catalog.WorkTypeCapability;
import io.b2mash.remodel.engine.CalculatorEngineFactory;
import io.b2mash.remodel.engine.EngineOptions;
import io.b2mash.remodel.estimate.Category;
import io.b2mash.remodel.estimate.EstimateDocument;
import io.b2mash.remodel.estimate.EstimateDocumentReader;
import io.b2mash.remodel.estimate.Settings;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class EstimateSessionService {

  private static final Logger log = LoggerFactory.getLogger(EstimateSessionService.class);

  private final CalculatorEngineFactory engineFactory;
  private final EstimateDocumentReader documentReader;

  public EstimateSessionService(
      CalculatorEngineFactory engineFactory, EstimateDocumentReader documentReader) {
    this.engineFactory = engineFactory;
    this.documentReader = documentReader;
  }

  public EstimateSession open(
      List<Category> categories, Settings settings, WorkTypeCapability catalog) {
    return open(categories, settings, catalog, engineFactory.getDefaultOptions());
  }

  public EstimateSession open(
      List<Category> categories,
      Settings settings,
      WorkTypeCapability catalog,
      EngineOptions options) {
    return new EstimateSession(engineFactory, categories, settings, catalog, options);
  }

  /** Opens a stored estimate document, migrating legacy shapes on the way in. */
  public EstimateSession openDocument(String json, WorkTypeCapability catalog) {
    EstimateDocument document = documentReader.read(json);
    if (!document.warnings().isEmpty()) {
      log.info(
          "Estimate document needed {} repairs: {}",
          document.warnings().size(),
          document.warnings().stream().map(CalculationIssue::code).toList());
    }
    return open(document.categories(), document.settings(), catalog);
  }
}

package io.b2mash.remodel.engine;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.b2mash.remodel.calculation.CalculationIssue;
import io.b2mash.remodel.calculation.CalculationLimits;
import io.b2mash.remodel.calculation.Money;
import io.b2mash.remodel.catalog.WorkTypeCapability;
import io.b2mash.remodel.estimate.Category;
import io.b2mash.remodel.estimate.Settings;
import io.b2mash.remodel.measurement.MeasurementResolver;
import io.b2mash.remodel.payment.PaymentDetails;
import io.b2mash.remodel.payment.PaymentLedger;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.databind.ObjectMapper;

/**
 * Computes totals, category breakdowns and payment details for one immutable estimate snapshot.
 *
 * <p>All three results come from a single aggregation pass over the work items, run lazily on
 * first use. With caching enabled, results are additionally memoized against a content fingerprint
 * of the inputs. A changed estimate needs a new engine; instances are cheap and not thread-safe.
 */
public class CalculatorEngine {

  private static final Logger log = LoggerFactory.getLogger(CalculatorEngine.class);

  private static final String TOTALS_KEY = "totals";
  private static final String BREAKDOWNS_KEY = "breakdowns";
  private static final String PAYMENTS_KEY = "payments";

  private final List<Category> categories;
  private final Settings settings;
  private final EngineOptions options;
  private final Clock clock;
  private final CostAggregator aggregator;
  private final CategoryBreakdownBuilder breakdownBuilder = new CategoryBreakdownBuilder();
  private final List<CalculationIssue> inputErrors = new ArrayList<>();
  private final Cache<String, Object> cache;
  private final InputFingerprint inputFingerprint;

  private CalculationPass pass;
  private Totals lastTotals;
  private String fingerprint;
  private boolean fingerprinted;
  private long hits;
  private long misses;

  public CalculatorEngine(
      List<Category> categories,
      Settings settings,
      WorkTypeCapability catalog,
      EngineOptions options,
      CalculationLimits limits,
      MeasurementResolver measurementResolver,
      ObjectMapper objectMapper,
      Clock clock) {
    if (categories == null) {
      inputErrors.add(CalculationIssue.of("INVALID_CATEGORIES", "Categories must be a list"));
      categories = List.of();
    }
    if (settings == null) {
      inputErrors.add(CalculationIssue.of("INVALID_SETTINGS", "Settings must be provided"));
      settings = Settings.empty();
    }
    if (catalog == null) {
      catalog = WorkTypeCapability.permissive();
    }
    this.categories = categories;
    this.settings = settings;
    this.options = options;
    this.clock = clock;
    this.aggregator = new CostAggregator(measurementResolver, catalog, options, limits, clock);

    if (options.enableCaching()) {
      this.cache =
          Caffeine.newBuilder()
              .maximumSize(Math.max(1, options.maxCacheSize()))
              .executor(Runnable::run)
              .build();
      this.inputFingerprint = new InputFingerprint(objectMapper);
    } else {
      this.cache = null;
      this.inputFingerprint = null;
    }
  }

  public Totals calculateTotals() {
    Totals totals = memoize(TOTALS_KEY, Totals.class, () -> aggregator.summarize(pass(), settings));
    lastTotals = totals;
    return totals;
  }

  public CategoryBreakdowns calculateCategoryBreakdowns() {
    return memoize(
        BREAKDOWNS_KEY, CategoryBreakdowns.class, () -> breakdownBuilder.build(pass()));
  }

  /** Payment details against this engine's own grand total. */
  public PaymentDetails calculatePaymentDetails() {
    return calculatePaymentDetails(null);
  }

  /**
   * Payment details against a grand total the caller already has. Passing null computes the totals
   * first.
   */
  public PaymentDetails calculatePaymentDetails(BigDecimal precomputedGrandTotal) {
    BigDecimal grandTotal =
        precomputedGrandTotal != null ? precomputedGrandTotal : calculateTotals().total();
    LocalDate today = LocalDate.now(clock);
    String key = PAYMENTS_KEY + "::" + Money.format(grandTotal) + "::" + today;
    return memoize(
        key,
        PaymentDetails.class,
        () -> PaymentLedger.calculatePaymentDetails(settings.payments(), grandTotal, today));
  }

  public CacheStats getCacheStats() {
    long lookups = hits + misses;
    String hitRate =
        lookups == 0
            ? "0.00%"
            : BigDecimal.valueOf(hits * 100)
                    .divide(BigDecimal.valueOf(lookups), 2, RoundingMode.HALF_UP)
                    .toPlainString()
                + "%";
    return new CacheStats(hits, misses, hitRate, cache == null ? 0 : cache.estimatedSize());
  }

  /** Drops memoized results and resets the hit and miss counters. */
  public void clearCache() {
    if (cache != null) {
      cache.invalidateAll();
    }
    hits = 0;
    misses = 0;
  }

  public EngineStatus getEngineStatus() {
    Totals totals = lastTotals != null ? lastTotals : calculateTotals();
    return new EngineStatus(
        totals.errors().isEmpty(),
        totals.errors().size(),
        totals.warnings().size(),
        categories.size());
  }

  public List<Category> getCategories() {
    return categories;
  }

  public Settings getSettings() {
    return settings;
  }

  public EngineOptions getOptions() {
    return options;
  }

  private CalculationPass pass() {
    if (pass == null) {
      CalculationPass traversed = aggregator.traverse(categories);
      if (inputErrors.isEmpty()) {
        pass = traversed;
      } else {
        var errors = new ArrayList<>(inputErrors);
        errors.addAll(traversed.errors());
        pass =
            new CalculationPass(
                traversed.categories(),
                traversed.items(),
                errors,
                traversed.warnings(),
                traversed.timedOut());
      }
    }
    return pass;
  }

  private <T> T memoize(String key, Class<T> type, Supplier<T> compute) {
    if (cache == null || fingerprint() == null) {
      return compute.get();
    }
    String cacheKey = key + "::" + fingerprint;
    Object cached = cache.getIfPresent(cacheKey);
    if (cached != null) {
      hits++;
      log.debug("Cache hit for {}", key);
      return type.cast(cached);
    }
    misses++;
    T value = compute.get();
    cache.put(cacheKey, value);
    return value;
  }

  /** Hashes the inputs on first use; null when they cannot be serialized. */
  private String fingerprint() {
    if (!fingerprinted) {
      fingerprint = inputFingerprint.of(categories, settings).orElse(null);
      fingerprinted = true;
    }
    return fingerprint;
  }
}

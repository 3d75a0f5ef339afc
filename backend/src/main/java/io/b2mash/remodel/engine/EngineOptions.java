package io.b2mash.remodel.engine;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Per-engine options. The bound {@code estimator.engine} values are the defaults the factory uses
 * when a caller does not pass its own.
 *
 * @param enableCaching memoize results against the content fingerprint of the inputs
 * @param strictValidation treat catalog inconsistencies (unknown work type, invalid subtype) as
 *     errors that zero the item instead of warnings
 * @param timeoutMs wall-clock ceiling for one aggregation pass; zero or negative disables it
 * @param maxCacheSize most results kept per engine
 */
@ConfigurationProperties(prefix = "estimator.engine")
public record EngineOptions(
    boolean enableCaching, boolean strictValidation, long timeoutMs, int maxCacheSize) {

  public static EngineOptions defaults() {
    return new EngineOptions(true, false, 30_000L, 1_000);
  }

  public EngineOptions withCaching(boolean enableCaching) {
    return new EngineOptions(enableCaching, strictValidation, timeoutMs, maxCacheSize);
  }

  public EngineOptions withStrictValidation(boolean strictValidation) {
    return new EngineOptions(enableCaching, strictValidation, timeoutMs, maxCacheSize);
  }

  public EngineOptions withTimeoutMs(long timeoutMs) {
    return new EngineOptions(enableCaching, strictValidation, timeoutMs, maxCacheSize);
  }
}

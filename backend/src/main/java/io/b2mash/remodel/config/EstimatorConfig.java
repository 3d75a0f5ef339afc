package io.b2mash.remodel.config;

import io.b2mash.remodel.calculation.CalculationLimits;
import io.b2mash.remodel.engine.EngineOptions;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tools.jackson.databind.json.JsonMapper;

@Configuration
@EnableConfigurationProperties({EngineOptions.class, CalculationLimits.class})
public class EstimatorConfig {

  /** Source of "today" for overdue detection and of wall time for the aggregation timeout. */
  @Bean
  public Clock clock() {
    return Clock.systemDefaultZone();
  }

  @Bean
  public JsonMapper objectMapper() {
    return JsonMapper.builder().build();
  }
}

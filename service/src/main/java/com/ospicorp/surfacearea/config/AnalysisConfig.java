package com.ospicorp.surfacearea.config;

import com.ospicorp.surfacearea.bet.service.IntervalRegressionEngine;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AnalysisConfig {

  @Bean
  IntervalRegressionEngine intervalRegressionEngine(
      @Value("${analysis.max-points:400}") int maxPoints,
      @Value("${analysis.parallel-threshold:64}") int parallelThreshold) {
    return new IntervalRegressionEngine(maxPoints, parallelThreshold);
  }
}

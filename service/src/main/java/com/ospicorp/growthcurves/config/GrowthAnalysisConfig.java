package com.ospicorp.growthcurves.config;

import com.ospicorp.growthcurves.growth.service.DeathPhaseDetector;
import com.ospicorp.growthcurves.growth.service.LogisticFitter;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class GrowthAnalysisConfig {

  private static final Logger log = LoggerFactory.getLogger(GrowthAnalysisConfig.class);

  @Bean
  DeathPhaseDetector deathPhaseDetector(
      @Value("${growth.death-phase.tolerance:0.0}") double tolerance) {
    return new DeathPhaseDetector(tolerance);
  }

  @Bean
  LogisticFitter logisticFitter(
      @Value("${growth.fit.max-iterations:1000}") int maxIterations,
      @Value("${growth.fit.max-evaluations:3000}") int maxEvaluations,
      @Value("${growth.fit.cost-tolerance:1e-10}") double costTolerance,
      @Value("${growth.fit.parameter-tolerance:1e-10}") double parameterTolerance,
      @Value("${growth.fit.time-budget:5s}") Duration timeBudget) {
    log.info("Logistic fitter budget: {} iterations, {} evaluations, {} ms per group",
        maxIterations, maxEvaluations, timeBudget.toMillis());
    return new LogisticFitter(maxIterations, maxEvaluations, costTolerance, parameterTolerance,
        timeBudget);
  }

  // 0 means one worker per available processor
  @Bean
  ThreadPoolTaskExecutor growthFitExecutor(
      @Value("${growth.fit.parallelism:0}") int parallelism) {
    int workers = parallelism > 0 ? parallelism : Runtime.getRuntime().availableProcessors();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(workers);
    executor.setMaxPoolSize(workers);
    executor.setThreadNamePrefix("growth-fit-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.initialize();
    return executor;
  }
}

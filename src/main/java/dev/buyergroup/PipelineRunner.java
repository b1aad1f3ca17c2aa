package dev.buyergroup;

import dev.buyergroup.config.PipelineConfig;
import dev.buyergroup.model.EarlyStopMode;
import dev.buyergroup.model.PipelineState;
import dev.buyergroup.model.Report;
import dev.buyergroup.model.RunConfig;
import dev.buyergroup.publish.ReportPublisher;
import dev.buyergroup.service.InvalidSellerProfileException;
import dev.buyergroup.service.PipelineOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Runs one buyer group pipeline from command line options and publishes the report.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PipelineRunner {

  private static final String SEPARATOR = "========================================";

  static final String USAGE = "Usage: --company=<name> [--profile=<seller profile>] [--aliases=a,b]"
      + " [--search-budget=N] [--collect-budget=N] [--max-group-size=N] [--max-queries=N]"
      + " [--early-stop=accuracy-first|balanced|cost-first] [--deadline-seconds=N] [--dry-run]";

  private final PipelineOrchestrator orchestrator;
  private final ReportPublisher reportPublisher;
  private final PipelineConfig pipelineConfig;
  private final Clock clock;

  @Value("${engine.default-profile:revenue-technology}")
  private String defaultProfile;

  @Value("${engine.metrics-wait-seconds:0}")
  private int metricsWaitSeconds;

  /**
   * Executes the pipeline and handles the post-execution wait.
   *
   * @param args Command line options
   * @return process exit status: 0 when the run finished, 1 when it failed
   * @throws IllegalArgumentException if the options are missing or malformed
   * @throws IllegalStateException if the pipeline could not produce a report
   */
  public int execute(String... args) {
    ApplicationArguments arguments = new DefaultApplicationArguments(args);
    String company = option(arguments, "company");
    if (company == null || company.isBlank()) {
      throw new IllegalArgumentException("--company is required");
    }
    String profile = option(arguments, "profile");
    RunConfig runConfig = toRunConfig(arguments);

    log.info(SEPARATOR);
    log.info("Buyer Group Engine Starting");
    log.info(SEPARATOR);

    Report report;
    try {
      report = orchestrator.runPipeline(company, profile != null ? profile : defaultProfile, runConfig).block();
    } catch (IllegalArgumentException | InvalidSellerProfileException e) {
      throw e;
    } catch (RuntimeException e) {
      log.error("Buyer group pipeline failed: {}", e.getMessage(), e);
      throw new IllegalStateException("Pipeline execution failed", e);
    }
    if (report == null) {
      throw new IllegalStateException("Pipeline produced no report");
    }

    reportPublisher.publish(report).block();

    log.info(SEPARATOR);
    log.info("Buyer Group Engine Completed: {}", report.getState());
    log.info("Members: {}, credits: {} (~${})", report.getBuyerGroup().getTotalMembers(),
        report.getCreditsUsed().total(), String.format(Locale.ROOT, "%.2f", report.getCreditsUsed().estimatedCostUsd()));
    report.getWarnings().forEach(warning -> log.info("  {}", warning));
    log.info(SEPARATOR);

    handleMetricsWait();

    return report.getState() == PipelineState.DONE ? BuyerGroupApplication.EXIT_OK : BuyerGroupApplication.EXIT_FAILED;
  }

  RunConfig toRunConfig(ApplicationArguments arguments) {
    RunConfig.RunConfigBuilder builder = RunConfig.builder()
        .searchBudget(intOption(arguments, "search-budget", pipelineConfig.getDefaultSearchBudget()))
        .collectBudget(intOption(arguments, "collect-budget", pipelineConfig.getDefaultCollectBudget()))
        .maxGroupSize(intOption(arguments, "max-group-size", 0))
        .maxQueries(intOption(arguments, "max-queries", 0))
        .dryRun(arguments.containsOption("dry-run"));

    String earlyStop = option(arguments, "early-stop");
    if (earlyStop != null) {
      builder.earlyStopMode(EarlyStopMode.fromKey(earlyStop));
    }

    String aliases = option(arguments, "aliases");
    if (aliases != null) {
      List<String> parsed = Arrays.stream(aliases.split(","))
          .map(String::trim)
          .filter(alias -> !alias.isEmpty())
          .toList();
      builder.companyAliases(parsed);
    }

    int deadlineSeconds = intOption(arguments, "deadline-seconds", 0);
    if (deadlineSeconds > 0) {
      builder.deadline(clock.instant().plus(Duration.ofSeconds(deadlineSeconds)));
    }
    return builder.build();
  }

  private String option(ApplicationArguments arguments, String name) {
    List<String> values = arguments.getOptionValues(name);
    return values == null || values.isEmpty() ? null : values.get(values.size() - 1);
  }

  private int intOption(ApplicationArguments arguments, String name, int defaultValue) {
    String value = option(arguments, name);
    if (value == null) {
      return defaultValue;
    }
    try {
      int parsed = Integer.parseInt(value.trim());
      if (parsed < 0) {
        throw new IllegalArgumentException("--" + name + " must not be negative: " + value);
      }
      return parsed;
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("--" + name + " must be a number: " + value, e);
    }
  }

  private void handleMetricsWait() {
    if (metricsWaitSeconds > 0) {
      log.info("Keeping alive for {} seconds (metrics scrape)...", metricsWaitSeconds);
      try {
        Thread.sleep(metricsWaitSeconds * 1000L);
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
        log.warn("Metrics wait interrupted");
      }
    }
  }
}

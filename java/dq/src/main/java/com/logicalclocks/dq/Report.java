/*
 *  Copyright (c) 2023. Hopsworks AB
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *  http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *
 *  See the License for the specific language governing permissions and limitations under the License.
 *
 */

package com.logicalclocks.dq;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.logicalclocks.dq.util.Constants;
import com.logicalclocks.dq.util.LedgerFormatter;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

/**
 * Data quality report built from a checklist of metrics with limits.
 *
 * <pre>
 * {@code
 *        Report report = Report.builder()
 *            .check(Check.of("sales", Metric.countZeros("qty"), Limits.of("delta", 0.0, 0.1)))
 *            .check(Check.of("sales", Metric.countDuplicates(Arrays.asList("id")), Limits.of("count", 0, 0)))
 *            .build();
 *        Map<String, Table> tables = new HashMap<>();
 *        tables.put("sales", salesTable);
 *        System.out.println(report.fit(tables).toStr());
 * }
 * </pre>
 *
 * <p>Every checklist entry produces exactly one ledger row. Missing tables and metrics that fail to compute are
 * recorded with status {@code E} and never stop the remaining entries. A report can be fitted again, the new run
 * replaces the previous ledger and counters.
 */
public class Report {

  private static final Logger LOGGER = LoggerFactory.getLogger(Report.class);

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Getter
  private final List<Check> checklist;
  @Getter
  private final String engine;
  @Getter
  private final int parallelism;

  private String title;
  private List<CheckResult> rows;
  private int passed;
  private int failed;
  private int errors;
  private int total;
  private double passedPct;
  private double failedPct;
  private double errorsPct;
  private boolean fitted = false;

  /**
   * Create a report.
   *
   * @param checklist checks, evaluated and reported in this order
   * @param engine optional engine selector, {@code local} or {@code spark}; when set every table must be of the
   *               matching kind
   * @param parallelism number of checks evaluated concurrently, defaults to 1
   */
  @Builder
  public Report(@Singular("check") List<Check> checklist, String engine, Integer parallelism) {
    Preconditions.checkArgument(parallelism == null || parallelism > 0, "Parallelism must be positive");
    this.checklist = Collections.unmodifiableList(new ArrayList<>(checklist));
    this.engine = engine;
    this.parallelism = parallelism != null ? parallelism : 1;
  }

  /**
   * Compute every check of the checklist on the given tables and store the results in this report.
   *
   * @param tables tables by name
   * @return this report, fitted
   * @throws EmptyChecklistException if the checklist has no entries
   * @throws DataQualityException if the evaluation is interrupted
   * @throws UnsupportedOperationException if the engine selector is unknown
   * @throws UnsupportedTableKindException if a table is neither local nor distributed
   */
  public Report fit(Map<String, ? extends Table> tables) throws DataQualityException {
    Preconditions.checkNotNull(tables, "tables");
    TableKind expectedKind = Strings.isNullOrEmpty(engine) ? null : EngineType.fromString(engine).getTableKind();
    if (checklist.isEmpty()) {
      throw new EmptyChecklistException();
    }

    LOGGER.info("Running {} data quality checks on tables {}", checklist.size(), tables.keySet());
    List<CheckResult> results = parallelism > 1
        ? runParallel(tables, expectedKind)
        : runSequential(tables, expectedKind);

    int passedCount = 0;
    int failedCount = 0;
    int errorsCount = 0;
    for (CheckResult result : results) {
      switch (result.getStatus()) {
        case PASSED:
          passedCount++;
          break;
        case FAILED:
          failedCount++;
          break;
        default:
          errorsCount++;
          break;
      }
    }

    // a null name cannot be referenced by a check, it is left out of the title
    this.title = Constants.REPORT_TITLE_PREFIX + tables.keySet().stream()
        .filter(Objects::nonNull)
        .collect(Collectors.toCollection(TreeSet::new));
    this.rows = Collections.unmodifiableList(results);
    this.passed = passedCount;
    this.failed = failedCount;
    this.errors = errorsCount;
    this.total = results.size();
    this.passedPct = percentage(passedCount, total);
    this.failedPct = percentage(failedCount, total);
    this.errorsPct = percentage(errorsCount, total);
    this.fitted = true;

    LOGGER.info("Data quality checks finished: {} passed, {} failed, {} errors out of {}",
        passed, failed, errors, total);
    return this;
  }

  private List<CheckResult> runSequential(Map<String, ? extends Table> tables, TableKind expectedKind) {
    List<CheckResult> results = new ArrayList<>(checklist.size());
    for (Check check : checklist) {
      results.add(runCheck(check, tables, expectedKind));
    }
    return results;
  }

  private List<CheckResult> runParallel(Map<String, ? extends Table> tables, TableKind expectedKind)
      throws DataQualityException {
    ExecutorService executor = Executors.newFixedThreadPool(parallelism);
    try {
      List<Future<CheckResult>> futures = new ArrayList<>(checklist.size());
      for (Check check : checklist) {
        futures.add(executor.submit(() -> runCheck(check, tables, expectedKind)));
      }
      // futures are read in checklist order, the ledger keeps that order
      List<CheckResult> results = new ArrayList<>(futures.size());
      for (Future<CheckResult> future : futures) {
        results.add(future.get());
      }
      return results;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new DataQualityException("Interrupted while running data quality checks", e);
    } catch (ExecutionException e) {
      if (e.getCause() instanceof RuntimeException) {
        throw (RuntimeException) e.getCause();
      }
      throw new DataQualityException("Data quality check failed", e.getCause());
    } finally {
      executor.shutdownNow();
    }
  }

  private CheckResult runCheck(Check check, Map<String, ? extends Table> tables, TableKind expectedKind) {
    CheckResult.CheckResultBuilder row = CheckResult.builder()
        .tableName(check.getTableName())
        .metric(check.getMetric().getDescription())
        .limits(check.getLimits().toString());
    try {
      Table table = tables.get(check.getTableName());
      if (table == null) {
        throw new TableNotFoundException(check.getTableName());
      }
      if (expectedKind != null && table.getKind() != null && table.getKind() != expectedKind) {
        throw new MetricEvaluationException("Table '" + check.getTableName() + "' is a " + table.getKind()
            + " table but the report runs on the " + engine + " engine");
      }
      MetricResult result = check.getMetric().evaluate(table);
      Optional<String> failedKey = check.getLimits().check(result);
      if (failedKey.isPresent()) {
        LOGGER.debug("Check {} on '{}' failed on '{}': {}", check.getMetric(), check.getTableName(),
            failedKey.get(), result);
      } else {
        LOGGER.debug("Check {} on '{}' passed: {}", check.getMetric(), check.getTableName(), result);
      }
      return row.values(result)
          .status(failedKey.isPresent() ? CheckStatus.FAILED : CheckStatus.PASSED)
          .error("")
          .build();
    } catch (UnsupportedTableKindException e) {
      throw e;
    } catch (Exception e) {
      String message = e.getMessage() != null ? e.getMessage() : e.toString();
      LOGGER.warn("Check {} on table '{}' errored: {}", check.getMetric(), check.getTableName(), message);
      return row.values(null)
          .status(CheckStatus.ERROR)
          .error(message)
          .build();
    }
  }

  private static double percentage(int count, int total) {
    return BigDecimal.valueOf(count * 100.0 / total).setScale(2, RoundingMode.HALF_UP).doubleValue();
  }

  private void requireFitted() {
    if (!fitted) {
      throw new NotFittedException();
    }
  }

  public boolean isFitted() {
    return fitted;
  }

  public String getTitle() {
    requireFitted();
    return title;
  }

  public List<CheckResult> getRows() {
    requireFitted();
    return rows;
  }

  public int getPassed() {
    requireFitted();
    return passed;
  }

  public int getFailed() {
    requireFitted();
    return failed;
  }

  public int getErrors() {
    requireFitted();
    return errors;
  }

  public int getTotal() {
    requireFitted();
    return total;
  }

  public double getPassedPct() {
    requireFitted();
    return passedPct;
  }

  public double getFailedPct() {
    requireFitted();
    return failedPct;
  }

  public double getErrorsPct() {
    requireFitted();
    return errorsPct;
  }

  /**
   * Render the fitted report as text: title, ledger table, counters and total.
   *
   * @return report text
   * @throws NotFittedException if {@link #fit(Map)} has not been called
   */
  public String toStr() {
    requireFitted();
    return title + "\n\n"
        + LedgerFormatter.fromSystemProperties().format(rows) + "\n\n"
        + "Passed: " + passed + " (" + passedPct + "%)\n"
        + "Failed: " + failed + " (" + failedPct + "%)\n"
        + "Errors: " + errors + " (" + errorsPct + "%)\n"
        + "\n"
        + "Total: " + total;
  }

  /**
   * Render the fitted report as JSON with the title, the counters and every ledger row.
   *
   * @return report as JSON document
   * @throws JsonProcessingException if a metric value cannot be serialized
   * @throws NotFittedException if {@link #fit(Map)} has not been called
   */
  public String toJson() throws JsonProcessingException {
    requireFitted();
    Map<String, Object> document = new LinkedHashMap<>();
    document.put("title", title);
    document.put("passed", passed);
    document.put("failed", failed);
    document.put("errors", errors);
    document.put("total", total);
    document.put("passed_pct", passedPct);
    document.put("failed_pct", failedPct);
    document.put("errors_pct", errorsPct);
    document.put("result", rows);
    return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(document);
  }

  @Override
  public String toString() {
    return fitted ? toStr() : "Report{checklist=" + checklist.size() + " checks, not fitted}";
  }
}

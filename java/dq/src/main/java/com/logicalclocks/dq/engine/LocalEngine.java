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

package com.logicalclocks.dq.engine;

import com.logicalclocks.dq.LocalTable;
import com.logicalclocks.dq.Metric;
import com.logicalclocks.dq.MetricEvaluationException;
import com.logicalclocks.dq.MetricResult;
import com.logicalclocks.dq.NullAggregation;

import java.sql.Timestamp;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class LocalEngine extends EngineBase<LocalTable> {

  private static LocalEngine INSTANCE = null;

  public static synchronized LocalEngine getInstance() {
    if (INSTANCE == null) {
      INSTANCE = new LocalEngine();
    }
    return INSTANCE;
  }

  private LocalEngine() {
  }

  @Override
  public long count(LocalTable table) {
    return table.size();
  }

  @Override
  protected MetricResult countZeros(Metric.CountZeros metric, LocalTable table) throws MetricEvaluationException {
    long count = 0;
    for (Object value : table.column(metric.getColumn())) {
      if (!LocalTable.isNull(value) && value instanceof Number && ((Number) value).doubleValue() == 0) {
        count++;
      }
    }
    return MetricResult.counts(table.size(), count);
  }

  @Override
  protected MetricResult countNull(Metric.CountNull metric, LocalTable table) throws MetricEvaluationException {
    int[] indices = indices(table, metric.getColumns());
    boolean any = metric.getAggregation() == NullAggregation.ANY;
    long count = 0;
    for (List<Object> row : table.getRows()) {
      // any: stop on the first null, all: stop on the first non null
      boolean flagged = !any;
      for (int index : indices) {
        if (LocalTable.isNull(row.get(index)) == any) {
          flagged = any;
          break;
        }
      }
      if (flagged) {
        count++;
      }
    }
    return MetricResult.counts(table.size(), count);
  }

  @Override
  protected MetricResult countDuplicates(Metric.CountDuplicates metric, LocalTable table)
      throws MetricEvaluationException {
    int[] indices = indices(table, metric.getColumns());
    Map<List<Object>, Long> groups = new HashMap<>();
    for (List<Object> row : table.getRows()) {
      List<Object> key = new ArrayList<>(indices.length);
      for (int index : indices) {
        key.add(groupingKey(row.get(index)));
      }
      groups.merge(key, 1L, Long::sum);
    }
    long count = groups.values().stream().filter(size -> size > 1).mapToLong(Long::longValue).sum();
    return MetricResult.counts(table.size(), count);
  }

  @Override
  protected MetricResult countValue(Metric.CountValue metric, LocalTable table) throws MetricEvaluationException {
    long count = 0;
    for (Object value : table.column(metric.getColumn())) {
      if (!LocalTable.isNull(value) && sameValue(value, metric.getValue())) {
        count++;
      }
    }
    return MetricResult.counts(table.size(), count);
  }

  @Override
  protected MetricResult countBelowValue(Metric.CountBelowValue metric, LocalTable table)
      throws MetricEvaluationException {
    long count = 0;
    for (Object value : table.column(metric.getColumn())) {
      if (!LocalTable.isNull(value) && below(number(metric.getColumn(), value), metric.getValue(), metric.isStrict())) {
        count++;
      }
    }
    return MetricResult.counts(table.size(), count);
  }

  @Override
  protected MetricResult countBelowColumn(Metric.CountBelowColumn metric, LocalTable table)
      throws MetricEvaluationException {
    int x = table.columnIndex(metric.getColumnX());
    int y = table.columnIndex(metric.getColumnY());
    long total = 0;
    long count = 0;
    for (List<Object> row : table.getRows()) {
      if (LocalTable.isNull(row.get(x)) || LocalTable.isNull(row.get(y))) {
        continue;
      }
      total++;
      int order = compare(metric.getColumnX(), row.get(x), metric.getColumnY(), row.get(y));
      if (metric.isStrict() ? order < 0 : order <= 0) {
        count++;
      }
    }
    return MetricResult.counts(total, count);
  }

  @Override
  protected MetricResult countRatioBelow(Metric.CountRatioBelow metric, LocalTable table)
      throws MetricEvaluationException {
    int x = table.columnIndex(metric.getColumnX());
    int y = table.columnIndex(metric.getColumnY());
    int z = table.columnIndex(metric.getColumnZ());
    long total = 0;
    long count = 0;
    for (List<Object> row : table.getRows()) {
      if (LocalTable.isNull(row.get(x)) || LocalTable.isNull(row.get(y)) || LocalTable.isNull(row.get(z))) {
        continue;
      }
      total++;
      double numerator = number(metric.getColumnX(), row.get(x));
      double denominator = number(metric.getColumnY(), row.get(y));
      double threshold = number(metric.getColumnZ(), row.get(z));
      // a zero denominator has no ratio and never matches
      if (denominator != 0 && below(numerator / denominator, threshold, metric.isStrict())) {
        count++;
      }
    }
    return MetricResult.counts(total, count);
  }

  @Override
  protected MetricResult countCb(Metric.CountCb metric, LocalTable table) throws MetricEvaluationException {
    List<Double> sorted = new ArrayList<>();
    for (Object value : table.column(metric.getColumn())) {
      if (!LocalTable.isNull(value)) {
        sorted.add(number(metric.getColumn(), value));
      }
    }
    Collections.sort(sorted);
    return MetricResult.bounds(quantile(sorted, metric.getLowerQuantile()),
        quantile(sorted, metric.getUpperQuantile()));
  }

  @Override
  protected MetricResult countLag(Metric.CountLag metric, LocalTable table) throws MetricEvaluationException {
    DateTimeFormatter formatter = metric.getFormatter();
    LocalDate lastDay = null;
    for (Object value : table.column(metric.getColumn())) {
      LocalDate date = toDate(value, formatter);
      if (date != null && (lastDay == null || date.isAfter(lastDay))) {
        lastDay = date;
      }
    }
    return lag(metric, lastDay);
  }

  /**
   * Build the date lag result from the latest date found, shared with the distributed engine so both format dates
   * and count days the same way.
   *
   * @param metric date lag metric
   * @param lastDay latest date in the column, null when the column holds no date
   * @return {@code {today, last_day, lag}}
   * @throws MetricEvaluationException if the metric format cannot render a date
   */
  public static MetricResult lag(Metric.CountLag metric, LocalDate lastDay) throws MetricEvaluationException {
    LocalDateTime now = LocalDateTime.now(metric.getClock());
    try {
      String today = metric.getFormatter().format(now);
      if (lastDay == null) {
        return MetricResult.lag(today, null, null);
      }
      return MetricResult.lag(today, metric.getFormatter().format(lastDay.atStartOfDay()),
          ChronoUnit.DAYS.between(lastDay, now.toLocalDate()));
    } catch (DateTimeException e) {
      throw new MetricEvaluationException("Cannot format dates with pattern '" + metric.getFormat() + "'", e);
    }
  }

  /**
   * Linear interpolation between the two closest ranks, the same definition as the exact percentile aggregate of
   * the distributed engine.
   */
  static Double quantile(List<Double> sorted, double quantile) {
    if (sorted.isEmpty()) {
      return null;
    }
    double position = quantile * (sorted.size() - 1);
    int lower = (int) Math.floor(position);
    int upper = (int) Math.ceil(position);
    double fraction = position - lower;
    return sorted.get(lower) + (sorted.get(upper) - sorted.get(lower)) * fraction;
  }

  private static int[] indices(LocalTable table, List<String> columns) throws MetricEvaluationException {
    int[] indices = new int[columns.size()];
    for (int i = 0; i < columns.size(); i++) {
      indices[i] = table.columnIndex(columns.get(i));
    }
    return indices;
  }

  private static boolean below(double value, double threshold, boolean strict) {
    return strict ? value < threshold : value <= threshold;
  }

  private static double number(String column, Object value) throws MetricEvaluationException {
    if (!(value instanceof Number)) {
      throw new MetricEvaluationException("Column '" + column + "' holds a non numeric value: '" + value + "'");
    }
    return ((Number) value).doubleValue();
  }

  // numbers compare by value, other values only with a value of the same type
  @SuppressWarnings("unchecked")
  private static int compare(String columnX, Object x, String columnY, Object y) throws MetricEvaluationException {
    if (x instanceof Number && y instanceof Number) {
      double left = ((Number) x).doubleValue();
      double right = ((Number) y).doubleValue();
      return left < right ? -1 : left > right ? 1 : 0;
    }
    Object left = temporal(x);
    Object right = temporal(y);
    if (left.getClass().equals(right.getClass()) && (left instanceof String || left instanceof Boolean
        || left instanceof LocalDate || left instanceof LocalDateTime)) {
      return ((Comparable<Object>) left).compareTo(right);
    }
    throw new MetricEvaluationException("Columns '" + columnX + "' and '" + columnY + "' hold values that cannot be"
        + " compared: '" + x + "' (" + x.getClass().getSimpleName() + ") and '" + y + "' ("
        + y.getClass().getSimpleName() + ")");
  }

  private static Object temporal(Object value) {
    if (value instanceof java.sql.Date) {
      return ((java.sql.Date) value).toLocalDate();
    }
    if (value instanceof Timestamp) {
      return ((Timestamp) value).toLocalDateTime();
    }
    return value;
  }

  private static boolean isIntegral(Object value) {
    return value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte;
  }

  private static boolean sameValue(Object value, Object literal) {
    if (value instanceof Number && literal instanceof Number) {
      if (isIntegral(value) && isIntegral(literal)) {
        return ((Number) value).longValue() == ((Number) literal).longValue();
      }
      return ((Number) value).doubleValue() == ((Number) literal).doubleValue();
    }
    return value.equals(literal);
  }

  // numbers with the same value share one key: whole values, -0.0 included, become long and others stay double
  private static Object groupingKey(Object value) {
    if (isIntegral(value)) {
      return ((Number) value).longValue();
    }
    if (value instanceof Number) {
      double number = ((Number) value).doubleValue();
      if (number == Math.rint(number) && Math.abs(number) < 0x1p63) {
        return (long) number;
      }
      return number;
    }
    return value;
  }

  private static LocalDate toDate(Object value, DateTimeFormatter formatter) {
    if (value instanceof LocalDate) {
      return (LocalDate) value;
    }
    if (value instanceof LocalDateTime) {
      return ((LocalDateTime) value).toLocalDate();
    }
    if (value instanceof java.sql.Date) {
      return ((java.sql.Date) value).toLocalDate();
    }
    if (value instanceof Timestamp) {
      return ((Timestamp) value).toLocalDateTime().toLocalDate();
    }
    if (value instanceof String) {
      try {
        return LocalDate.parse((String) value, formatter);
      } catch (DateTimeParseException e) {
        // unparseable values are ignored, the column may hold no date at all
        return null;
      }
    }
    return null;
  }
}

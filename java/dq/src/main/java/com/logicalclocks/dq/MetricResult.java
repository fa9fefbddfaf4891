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

import com.fasterxml.jackson.annotation.JsonValue;
import com.logicalclocks.dq.util.Constants;
import lombok.EqualsAndHashCode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Named scalar values produced by one metric evaluation. Values are {@link Long}, {@link Double}, {@link String} or
 * null.
 */
@EqualsAndHashCode
public class MetricResult {

  private final Map<String, Object> values;

  private MetricResult(Map<String, Object> values) {
    this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  public static MetricResult of(Map<String, Object> values) {
    return new MetricResult(values);
  }

  public static MetricResult total(long total) {
    return new MetricResult(Collections.singletonMap(Constants.TOTAL, total));
  }

  /**
   * Result of a counting metric, {@code delta} is the share of matching rows.
   *
   * @param total number of rows considered
   * @param count number of matching rows
   * @return {@code {total, count, delta}}
   * @throws MetricEvaluationException if no row was considered
   */
  public static MetricResult counts(long total, long count) throws MetricEvaluationException {
    if (total == 0) {
      throw new MetricEvaluationException("Division by zero: no rows to compute delta = count / total on");
    }
    Map<String, Object> values = new LinkedHashMap<>();
    values.put(Constants.TOTAL, total);
    values.put(Constants.COUNT, count);
    values.put(Constants.DELTA, (double) count / total);
    return new MetricResult(values);
  }

  public static MetricResult bounds(Double lcb, Double ucb) {
    Map<String, Object> values = new LinkedHashMap<>();
    values.put(Constants.LCB, lcb);
    values.put(Constants.UCB, ucb);
    return new MetricResult(values);
  }

  public static MetricResult lag(String today, String lastDay, Long lag) {
    Map<String, Object> values = new LinkedHashMap<>();
    values.put(Constants.TODAY, today);
    values.put(Constants.LAST_DAY, lastDay);
    values.put(Constants.LAG, lag);
    return new MetricResult(values);
  }

  public boolean containsKey(String key) {
    return values.containsKey(key);
  }

  public Object get(String key) {
    return values.get(key);
  }

  /**
   * Numeric view of a value.
   *
   * @param key result key
   * @return the value as double, or null when the key is absent, null or not a number
   */
  public Double getNumber(String key) {
    Object value = values.get(key);
    return value instanceof Number ? ((Number) value).doubleValue() : null;
  }

  public Set<String> keySet() {
    return values.keySet();
  }

  @JsonValue
  public Map<String, Object> asMap() {
    return values;
  }

  @Override
  public String toString() {
    return values.toString();
  }
}

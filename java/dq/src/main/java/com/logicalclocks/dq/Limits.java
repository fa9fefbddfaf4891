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

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Inclusive ranges that metric result values must fall into for a check to pass.
 *
 * <pre>
 * {@code
 *        Limits limits = Limits.builder()
 *            .limit("delta", 0.0, 0.05)
 *            .limit("total", 1000, Double.MAX_VALUE)
 *            .build();
 * }
 * </pre>
 */
@EqualsAndHashCode
public class Limits {

  private final Map<String, Range> ranges;

  private Limits(Map<String, Range> ranges) {
    this.ranges = Collections.unmodifiableMap(new LinkedHashMap<>(ranges));
  }

  public static Limits none() {
    return new Limits(Collections.emptyMap());
  }

  public static Limits of(String key, double lower, double upper) {
    return builder().limit(key, lower, upper).build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public Map<String, Range> getRanges() {
    return ranges;
  }

  /**
   * Compare a metric result against the limits, in declaration order.
   *
   * @param result metric result
   * @return the first key whose value is absent, not a number or out of range; empty if every limit holds
   */
  public Optional<String> check(MetricResult result) {
    for (Map.Entry<String, Range> entry : ranges.entrySet()) {
      Double value = result.getNumber(entry.getKey());
      if (value == null || !entry.getValue().contains(value)) {
        return Optional.of(entry.getKey());
      }
    }
    return Optional.empty();
  }

  @Override
  public String toString() {
    return ranges.toString();
  }

  @Getter
  @EqualsAndHashCode
  public static class Range {
    private final double lower;
    private final double upper;

    public Range(double lower, double upper) {
      Preconditions.checkArgument(lower <= upper, "Lower limit %s is greater than upper limit %s", lower, upper);
      this.lower = lower;
      this.upper = upper;
    }

    public boolean contains(double value) {
      return lower <= value && value <= upper;
    }

    @Override
    public String toString() {
      return "[" + lower + ", " + upper + "]";
    }
  }

  public static class Builder {
    private final Map<String, Range> ranges = new LinkedHashMap<>();

    public Builder limit(String key, double lower, double upper) {
      Preconditions.checkArgument(!Strings.isNullOrEmpty(key), "Limit key must not be empty");
      ranges.put(key, new Range(lower, upper));
      return this;
    }

    public Limits build() {
      return new Limits(ranges);
    }
  }
}

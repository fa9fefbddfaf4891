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

public enum MetricKind {
  TOTAL_COUNT("CountTotal"),
  ZERO_COUNT("CountZeros"),
  NULL_COUNT("CountNull"),
  DUPLICATE_COUNT("CountDuplicates"),
  EXACT_VALUE_COUNT("CountValue"),
  BELOW_THRESHOLD_COUNT("CountBelowValue"),
  COLUMN_BELOW_COLUMN_COUNT("CountBelowColumn"),
  RATIO_BELOW_THRESHOLD_COUNT("CountRatioBelow"),
  CONFIDENCE_BOUND("CountCB"),
  DATE_LAG("CountLag");

  private final String label;

  MetricKind(String label) {
    this.label = label;
  }

  public String getLabel() {
    return label;
  }

  /**
   * Kinds whose result is {@code {total, count, delta}}.
   */
  public boolean isCounting() {
    return this != TOTAL_COUNT && this != CONFIDENCE_BOUND && this != DATE_LAG;
  }
}

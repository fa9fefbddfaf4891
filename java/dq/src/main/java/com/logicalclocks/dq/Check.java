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

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;

/**
 * One checklist entry: the metric to compute on a named table and the limits its result must respect.
 */
@Getter
@EqualsAndHashCode
public class Check {

  private final String tableName;
  private final Metric metric;
  private final Limits limits;

  @Builder
  public Check(@NonNull String tableName, @NonNull Metric metric, Limits limits) {
    this.tableName = tableName;
    this.metric = metric;
    this.limits = limits != null ? limits : Limits.none();
  }

  public static Check of(String tableName, Metric metric, Limits limits) {
    return new Check(tableName, metric, limits);
  }

  @Override
  public String toString() {
    return "Check{tableName='" + tableName + "', metric=" + metric + ", limits=" + limits + "}";
  }
}

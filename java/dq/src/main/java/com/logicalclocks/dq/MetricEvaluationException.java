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

/**
 * Raised when a metric cannot be computed on a table, e.g. a missing column, a value of the wrong type or an empty
 * table for a metric that divides by the row count.
 */
public class MetricEvaluationException extends DataQualityException {

  public MetricEvaluationException(String msg) {
    super(msg);
  }

  public MetricEvaluationException(String msg, Throwable cause) {
    super(msg, cause);
  }
}

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
 * A partitioned table with deferred computation. Every call blocks until the backing engine has materialized the
 * result in the local process.
 */
public interface DistributedTable extends Table {

  @Override
  default TableKind getKind() {
    return TableKind.DISTRIBUTED;
  }

  /**
   * Number of rows, computed by the backing engine.
   *
   * @return row count
   */
  long count();

  /**
   * Run the distributed strategy of a metric on this table.
   *
   * @param metric metric to compute
   * @return metric result collected to the driver
   * @throws MetricEvaluationException if the engine fails to compute the metric
   */
  MetricResult evaluate(Metric metric) throws MetricEvaluationException;
}

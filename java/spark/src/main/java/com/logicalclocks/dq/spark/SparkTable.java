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

package com.logicalclocks.dq.spark;

import com.logicalclocks.dq.DistributedTable;
import com.logicalclocks.dq.LocalTable;
import com.logicalclocks.dq.Metric;
import com.logicalclocks.dq.MetricEvaluationException;
import com.logicalclocks.dq.MetricResult;
import com.logicalclocks.dq.spark.engine.SparkEngine;
import lombok.Getter;
import lombok.NonNull;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;

/**
 * Named Spark DataFrame. Metrics computed on it run as Spark jobs and block until the result is collected.
 */
@Getter
public class SparkTable implements DistributedTable {

  private final String name;
  private final Dataset<Row> dataset;

  public SparkTable(@NonNull String name, @NonNull Dataset<Row> dataset) {
    this.name = name;
    this.dataset = dataset;
  }

  /**
   * Distribute a local table with the process wide Spark session.
   *
   * @param table local table
   * @return Spark table with the same name and rows
   */
  public static SparkTable fromLocal(LocalTable table) {
    return new SparkTable(table.getName(), SparkEngine.getInstance().toDataset(table));
  }

  @Override
  public long count() {
    return SparkEngine.getInstance().count(this);
  }

  @Override
  public MetricResult evaluate(Metric metric) throws MetricEvaluationException {
    return SparkEngine.getInstance().evaluate(metric, this);
  }

  @Override
  public String toString() {
    return "SparkTable{name='" + name + "', schema=" + dataset.schema().simpleString() + "}";
  }
}

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

import com.logicalclocks.dq.Metric;
import com.logicalclocks.dq.MetricEvaluationException;
import com.logicalclocks.dq.MetricResult;
import com.logicalclocks.dq.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Execution strategy of every metric kind for one table representation. Both engines must return numerically
 * identical results for the same data, so a checklist passes or fails the same way on either of them.
 *
 * @param <T> table representation handled by the engine
 */
public abstract class EngineBase<T extends Table> {

  protected static final Logger LOGGER = LoggerFactory.getLogger(EngineBase.class);

  public MetricResult evaluate(Metric metric, T table) throws MetricEvaluationException {
    LOGGER.debug("Computing {} on table '{}'", metric.getDescription(), table.getName());
    switch (metric.getKind()) {
      case TOTAL_COUNT:
        return MetricResult.total(count(table));
      case ZERO_COUNT:
        return countZeros((Metric.CountZeros) metric, table);
      case NULL_COUNT:
        return countNull((Metric.CountNull) metric, table);
      case DUPLICATE_COUNT:
        return countDuplicates((Metric.CountDuplicates) metric, table);
      case EXACT_VALUE_COUNT:
        return countValue((Metric.CountValue) metric, table);
      case BELOW_THRESHOLD_COUNT:
        return countBelowValue((Metric.CountBelowValue) metric, table);
      case COLUMN_BELOW_COLUMN_COUNT:
        return countBelowColumn((Metric.CountBelowColumn) metric, table);
      case RATIO_BELOW_THRESHOLD_COUNT:
        return countRatioBelow((Metric.CountRatioBelow) metric, table);
      case CONFIDENCE_BOUND:
        return countCb((Metric.CountCb) metric, table);
      case DATE_LAG:
        return countLag((Metric.CountLag) metric, table);
      default:
        throw new UnsupportedOperationException("Metric kind not supported: " + metric.getKind());
    }
  }

  public abstract long count(T table) throws MetricEvaluationException;

  protected abstract MetricResult countZeros(Metric.CountZeros metric, T table) throws MetricEvaluationException;

  protected abstract MetricResult countNull(Metric.CountNull metric, T table) throws MetricEvaluationException;

  protected abstract MetricResult countDuplicates(Metric.CountDuplicates metric, T table)
      throws MetricEvaluationException;

  protected abstract MetricResult countValue(Metric.CountValue metric, T table) throws MetricEvaluationException;

  protected abstract MetricResult countBelowValue(Metric.CountBelowValue metric, T table)
      throws MetricEvaluationException;

  protected abstract MetricResult countBelowColumn(Metric.CountBelowColumn metric, T table)
      throws MetricEvaluationException;

  protected abstract MetricResult countRatioBelow(Metric.CountRatioBelow metric, T table)
      throws MetricEvaluationException;

  protected abstract MetricResult countCb(Metric.CountCb metric, T table) throws MetricEvaluationException;

  protected abstract MetricResult countLag(Metric.CountLag metric, T table) throws MetricEvaluationException;
}

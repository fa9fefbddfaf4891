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

package com.logicalclocks.dq.spark.engine;

import com.logicalclocks.dq.LocalTable;
import com.logicalclocks.dq.Metric;
import com.logicalclocks.dq.MetricEvaluationException;
import com.logicalclocks.dq.MetricResult;
import com.logicalclocks.dq.NullAggregation;
import com.logicalclocks.dq.engine.EngineBase;
import com.logicalclocks.dq.engine.LocalEngine;
import com.logicalclocks.dq.spark.SparkTable;
import lombok.Getter;
import org.apache.spark.sql.Column;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.RowFactory;
import org.apache.spark.sql.SparkSession;
import org.apache.spark.sql.functions;
import org.apache.spark.sql.types.DataType;
import org.apache.spark.sql.types.DataTypes;
import org.apache.spark.sql.types.DateType;
import org.apache.spark.sql.types.DoubleType;
import org.apache.spark.sql.types.FloatType;
import org.apache.spark.sql.types.NumericType;
import org.apache.spark.sql.types.StringType;
import org.apache.spark.sql.types.BooleanType;
import org.apache.spark.sql.types.StructType;
import org.apache.spark.sql.types.TimestampType;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.apache.spark.sql.functions.col;
import static org.apache.spark.sql.functions.expr;
import static org.apache.spark.sql.functions.isnan;
import static org.apache.spark.sql.functions.lit;
import static org.apache.spark.sql.functions.max;
import static org.apache.spark.sql.functions.not;
import static org.apache.spark.sql.functions.sum;
import static org.apache.spark.sql.functions.to_date;

/**
 * Distributed strategies of every metric kind on Spark DataFrames.
 *
 * <p>Null and NaN values are filtered exactly like {@link LocalEngine} does, so a checklist produces the same results
 * on a {@link LocalTable} and on the same data loaded in Spark.
 */
public class SparkEngine extends EngineBase<SparkTable> {

  public static final String APP_NAME_PROPERTY = "dq.spark.app.name";
  public static final String DEFAULT_APP_NAME = "dq-report";

  private static final String GROUP_SIZE = "__dq_group_size";

  private static SparkEngine INSTANCE = null;

  public static synchronized SparkEngine getInstance() {
    if (INSTANCE == null) {
      INSTANCE = new SparkEngine();
    }
    return INSTANCE;
  }

  @Getter
  private SparkSession sparkSession;

  private SparkEngine() {
    // master and other spark.* settings come from spark-submit or JVM system properties
    sparkSession = SparkSession.builder()
        .appName(System.getProperty(APP_NAME_PROPERTY, DEFAULT_APP_NAME))
        .getOrCreate();
    LOGGER.debug("Using Spark session {} on master {}", sparkSession.sparkContext().appName(),
        sparkSession.sparkContext().master());
  }

  @Override
  public MetricResult evaluate(Metric metric, SparkTable table) throws MetricEvaluationException {
    try {
      return super.evaluate(metric, table);
    } catch (MetricEvaluationException e) {
      throw e;
    } catch (Exception e) {
      throw new MetricEvaluationException("Failed to compute " + metric.getDescription() + " on table '"
          + table.getName() + "': " + e.getMessage(), e);
    }
  }

  @Override
  public long count(SparkTable table) {
    return table.getDataset().count();
  }

  @Override
  protected MetricResult countZeros(Metric.CountZeros metric, SparkTable table) throws MetricEvaluationException {
    Dataset<Row> df = table.getDataset();
    long total = df.count();
    // only numbers can be zero, Spark would cast strings and read false as 0
    long matching = columnType(df, metric.getColumn()) instanceof NumericType
        ? df.filter(col(metric.getColumn()).equalTo(0)).count()
        : 0L;
    return MetricResult.counts(total, matching);
  }

  @Override
  protected MetricResult countNull(Metric.CountNull metric, SparkTable table) throws MetricEvaluationException {
    Dataset<Row> df = table.getDataset();
    boolean any = metric.getAggregation() == NullAggregation.ANY;
    Column condition = null;
    for (String column : metric.getColumns()) {
      Column missing = isMissing(df, column);
      if (condition == null) {
        condition = missing;
      } else {
        condition = any ? condition.or(missing) : condition.and(missing);
      }
    }
    long total = df.count();
    long matching = df.filter(condition).count();
    return MetricResult.counts(total, matching);
  }

  @Override
  protected MetricResult countDuplicates(Metric.CountDuplicates metric, SparkTable table)
      throws MetricEvaluationException {
    Dataset<Row> df = table.getDataset();
    Column[] keys = metric.getColumns().stream().map(c -> col(c)).toArray(Column[]::new);
    long total = df.count();
    Row duplicates = df.groupBy(keys)
        .agg(functions.count(lit(1)).alias(GROUP_SIZE))
        .filter(col(GROUP_SIZE).gt(1))
        .agg(sum(GROUP_SIZE))
        .first();
    // the sum is null when no key repeats
    long matching = duplicates.isNullAt(0) ? 0L : duplicates.getLong(0);
    return MetricResult.counts(total, matching);
  }

  @Override
  protected MetricResult countValue(Metric.CountValue metric, SparkTable table) throws MetricEvaluationException {
    Dataset<Row> df = table.getDataset();
    long total = df.count();
    long matching = sameType(columnType(df, metric.getColumn()), metric.getValue())
        ? df.filter(col(metric.getColumn()).equalTo(lit(metric.getValue()))).count()
        : 0L;
    return MetricResult.counts(total, matching);
  }

  @Override
  protected MetricResult countBelowValue(Metric.CountBelowValue metric, SparkTable table)
      throws MetricEvaluationException {
    Dataset<Row> df = table.getDataset();
    Column column = col(metric.getColumn());
    long total = df.count();
    if (!requireNumeric(df, metric.getColumn())) {
      return MetricResult.counts(total, 0L);
    }
    long matching = df.filter(not(isMissing(df, metric.getColumn()))
        .and(metric.isStrict() ? column.lt(metric.getValue()) : column.leq(metric.getValue())))
        .count();
    return MetricResult.counts(total, matching);
  }

  @Override
  protected MetricResult countBelowColumn(Metric.CountBelowColumn metric, SparkTable table)
      throws MetricEvaluationException {
    Dataset<Row> df = table.getDataset();
    Dataset<Row> present = df.filter(not(isMissing(df, metric.getColumnX()))
        .and(not(isMissing(df, metric.getColumnY()))));
    Column x = col(metric.getColumnX());
    Column y = col(metric.getColumnY());
    long total = present.count();
    if (total > 0 && !comparable(columnType(df, metric.getColumnX()), columnType(df, metric.getColumnY()))) {
      throw new MetricEvaluationException("Columns '" + metric.getColumnX() + "' and '" + metric.getColumnY()
          + "' hold values that cannot be compared: " + columnType(df, metric.getColumnX()).simpleString() + " and "
          + columnType(df, metric.getColumnY()).simpleString());
    }
    long matching = present.filter(metric.isStrict() ? x.lt(y) : x.leq(y)).count();
    return MetricResult.counts(total, matching);
  }

  @Override
  protected MetricResult countRatioBelow(Metric.CountRatioBelow metric, SparkTable table)
      throws MetricEvaluationException {
    Dataset<Row> df = table.getDataset();
    Dataset<Row> present = df.filter(not(isMissing(df, metric.getColumnX()))
        .and(not(isMissing(df, metric.getColumnY())))
        .and(not(isMissing(df, metric.getColumnZ()))));
    // division by zero yields null, which never matches
    Column ratio = col(metric.getColumnX()).divide(col(metric.getColumnY()));
    Column z = col(metric.getColumnZ());
    long total = present.count();
    boolean numeric = requireNumeric(df, metric.getColumnX()) & requireNumeric(df, metric.getColumnY())
        & requireNumeric(df, metric.getColumnZ());
    if (!numeric) {
      return MetricResult.counts(total, 0L);
    }
    long matching = present.filter(metric.isStrict() ? ratio.lt(z) : ratio.leq(z)).count();
    return MetricResult.counts(total, matching);
  }

  @Override
  protected MetricResult countCb(Metric.CountCb metric, SparkTable table) throws MetricEvaluationException {
    Dataset<Row> df = table.getDataset();
    if (!requireNumeric(df, metric.getColumn())) {
      return MetricResult.bounds(null, null);
    }
    Row bounds = df.filter(not(isMissing(df, metric.getColumn())))
        .agg(percentile(metric.getColumn(), metric.getLowerQuantile()).alias("lcb"),
            percentile(metric.getColumn(), metric.getUpperQuantile()).alias("ucb"))
        .first();
    return MetricResult.bounds(bounds.isNullAt(0) ? null : bounds.getDouble(0),
        bounds.isNullAt(1) ? null : bounds.getDouble(1));
  }

  @Override
  protected MetricResult countLag(Metric.CountLag metric, SparkTable table) throws MetricEvaluationException {
    Dataset<Row> df = table.getDataset();
    DataType type = columnType(df, metric.getColumn());
    Column date;
    if (type instanceof StringType) {
      date = to_date(col(metric.getColumn()), metric.getFormat());
    } else if (type instanceof DateType) {
      date = col(metric.getColumn());
    } else if (type.typeName().startsWith("timestamp")) {
      date = to_date(col(metric.getColumn()));
    } else {
      LOGGER.debug("Column '{}' of type {} holds no dates", metric.getColumn(), type.simpleString());
      return LocalEngine.lag(metric, null);
    }
    Row latest = df.agg(max(date)).first();
    return LocalEngine.lag(metric, latest.isNullAt(0) ? null : toLocalDate(latest.get(0)));
  }

  /**
   * Convert a local table to a DataFrame. Integral columns become {@code bigint}, other numeric columns
   * {@code double}, dates {@code date} and date-times {@code timestamp}. A column without any value is typed as
   * {@code string}.
   *
   * @param table local table
   * @return DataFrame with one row per local row
   */
  public Dataset<Row> toDataset(LocalTable table) {
    List<DataType> types = new ArrayList<>();
    StructType schema = new StructType();
    for (int c = 0; c < table.getColumns().size(); c++) {
      DataType type = inferType(table, c);
      types.add(type);
      schema = schema.add(table.getColumns().get(c), type, true);
    }

    List<Row> rows = new ArrayList<>(table.size());
    for (List<Object> values : table.getRows()) {
      Object[] converted = new Object[values.size()];
      for (int c = 0; c < values.size(); c++) {
        converted[c] = toSparkValue(values.get(c), types.get(c));
      }
      rows.add(RowFactory.create(converted));
    }
    LOGGER.debug("Distributing local table '{}' with schema {}", table.getName(), schema.simpleString());
    return sparkSession.createDataFrame(rows, schema);
  }

  private static DataType columnType(Dataset<Row> df, String column) {
    return df.schema().apply(column).dataType();
  }

  /**
   * Check that a column can take part in arithmetic. Spark would silently cast other types, the local engine
   * rejects them.
   *
   * @return true for numeric columns, false for a non numeric column that holds no value at all
   * @throws MetricEvaluationException if a non numeric column holds values
   */
  private static boolean requireNumeric(Dataset<Row> df, String column) throws MetricEvaluationException {
    DataType type = columnType(df, column);
    if (type instanceof NumericType) {
      return true;
    }
    if (df.filter(col(column).isNotNull()).isEmpty()) {
      return false;
    }
    throw new MetricEvaluationException("Column '" + column + "' holds non numeric values of type "
        + type.simpleString());
  }

  private static boolean comparable(DataType x, DataType y) {
    if (x instanceof NumericType && y instanceof NumericType) {
      return true;
    }
    return x.equals(y) && (x instanceof StringType || x instanceof BooleanType || x instanceof DateType
        || x instanceof TimestampType);
  }

  // a literal only matches values of its own type, as in the local engine
  private static boolean sameType(DataType type, Object literal) {
    if (literal instanceof Number) {
      return type instanceof NumericType;
    }
    if (literal instanceof Boolean) {
      return type instanceof BooleanType;
    }
    return type instanceof StringType;
  }

  private static Column isMissing(Dataset<Row> df, String column) {
    DataType type = columnType(df, column);
    if (type instanceof DoubleType || type instanceof FloatType) {
      return col(column).isNull().or(isnan(col(column)));
    }
    return col(column).isNull();
  }

  // exact percentile with linear interpolation, approxQuantile returns an existing value instead
  private static Column percentile(String column, double quantile) {
    return expr("percentile(`" + column.replace("`", "``") + "`, CAST(" + quantile + " AS DOUBLE))");
  }

  private static LocalDate toLocalDate(Object value) {
    if (value instanceof LocalDate) {
      return (LocalDate) value;
    }
    return ((Date) value).toLocalDate();
  }

  private static DataType inferType(LocalTable table, int column) {
    DataType type = null;
    for (List<Object> row : table.getRows()) {
      Object value = row.get(column);
      if (value == null) {
        continue;
      }
      DataType valueType = typeOf(value, table.getColumns().get(column));
      if (type == null || type.equals(valueType)) {
        type = valueType;
      } else if (isNumeric(type) && isNumeric(valueType)) {
        type = DataTypes.DoubleType;
      } else {
        throw new IllegalArgumentException("Column '" + table.getColumns().get(column) + "' of table '"
            + table.getName() + "' mixes " + type.simpleString() + " and " + valueType.simpleString() + " values");
      }
    }
    return type != null ? type : DataTypes.StringType;
  }

  private static DataType typeOf(Object value, String column) {
    if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
      return DataTypes.LongType;
    }
    if (value instanceof Number) {
      return DataTypes.DoubleType;
    }
    if (value instanceof String) {
      return DataTypes.StringType;
    }
    if (value instanceof Boolean) {
      return DataTypes.BooleanType;
    }
    if (value instanceof LocalDate || value instanceof Date) {
      return DataTypes.DateType;
    }
    if (value instanceof LocalDateTime || value instanceof Timestamp) {
      return DataTypes.TimestampType;
    }
    throw new IllegalArgumentException("Column '" + column + "' holds a value of unsupported type "
        + value.getClass().getName());
  }

  private static boolean isNumeric(DataType type) {
    return type.equals(DataTypes.LongType) || type.equals(DataTypes.DoubleType);
  }

  private static Object toSparkValue(Object value, DataType type) {
    if (value == null) {
      return null;
    }
    if (type.equals(DataTypes.LongType)) {
      return ((Number) value).longValue();
    }
    if (type.equals(DataTypes.DoubleType)) {
      return ((Number) value).doubleValue();
    }
    if (value instanceof LocalDate) {
      return Date.valueOf((LocalDate) value);
    }
    if (value instanceof LocalDateTime) {
      return Timestamp.valueOf((LocalDateTime) value);
    }
    return value;
  }
}

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
import com.logicalclocks.dq.engine.LocalEngine;
import com.logicalclocks.dq.util.Constants;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A stateless data quality check computed on a {@link Table}.
 *
 * <p>The set of metrics is closed: every variant is a nested class of this type and is identified by its
 * {@link MetricKind}, so execution engines can switch over {@link #getKind()} exhaustively. Instances are immutable
 * and evaluating the same metric twice on the same table yields the same result.
 *
 * <pre>
 * {@code
 *        Metric zeros = Metric.countZeros("qty");
 *        MetricResult result = zeros.evaluate(salesTable);
 *        result.get("delta");
 * }
 * </pre>
 */
public abstract class Metric {

  private Metric() {
  }

  public abstract MetricKind getKind();

  protected abstract String parameters();

  /**
   * Human readable description of the metric kind and its parameters, used in the report ledger.
   *
   * @return description such as {@code CountZeros(column='qty')}
   */
  public String getDescription() {
    return getKind().getLabel() + "(" + parameters() + ")";
  }

  /**
   * Compute the metric on a table. The table's {@link TableKind} selects the local or the distributed strategy.
   *
   * @param table table to evaluate
   * @return named metric values
   * @throws MetricEvaluationException if the metric cannot be computed on this table
   * @throws UnsupportedTableKindException if the table is neither a local nor a distributed table
   */
  public MetricResult evaluate(Table table) throws MetricEvaluationException {
    if (table == null || table.getKind() == null) {
      throw new UnsupportedTableKindException(table);
    }
    switch (table.getKind()) {
      case LOCAL:
        if (table instanceof LocalTable) {
          return LocalEngine.getInstance().evaluate(this, (LocalTable) table);
        }
        break;
      case DISTRIBUTED:
        if (table instanceof DistributedTable) {
          return ((DistributedTable) table).evaluate(this);
        }
        break;
      default:
        break;
    }
    throw new UnsupportedTableKindException(table);
  }

  @Override
  public String toString() {
    return getDescription();
  }

  public static CountTotal countTotal() {
    return new CountTotal();
  }

  public static CountZeros countZeros(String column) {
    return new CountZeros(column);
  }

  public static CountNull countNull(List<String> columns) {
    return new CountNull(columns, NullAggregation.ANY);
  }

  public static CountNull countNull(List<String> columns, String aggregation) {
    return new CountNull(columns, NullAggregation.fromString(aggregation));
  }

  public static CountNull countNull(List<String> columns, NullAggregation aggregation) {
    return new CountNull(columns, aggregation);
  }

  public static CountDuplicates countDuplicates(List<String> columns) {
    return new CountDuplicates(columns);
  }

  public static CountValue countValue(String column, Object value) {
    return new CountValue(column, value);
  }

  public static CountBelowValue countBelowValue(String column, double value) {
    return new CountBelowValue(column, value, false);
  }

  public static CountBelowValue countBelowValue(String column, double value, boolean strict) {
    return new CountBelowValue(column, value, strict);
  }

  public static CountBelowColumn countBelowColumn(String columnX, String columnY) {
    return new CountBelowColumn(columnX, columnY, false);
  }

  public static CountBelowColumn countBelowColumn(String columnX, String columnY, boolean strict) {
    return new CountBelowColumn(columnX, columnY, strict);
  }

  public static CountRatioBelow countRatioBelow(String columnX, String columnY, String columnZ) {
    return new CountRatioBelow(columnX, columnY, columnZ, false);
  }

  public static CountRatioBelow countRatioBelow(String columnX, String columnY, String columnZ, boolean strict) {
    return new CountRatioBelow(columnX, columnY, columnZ, strict);
  }

  public static CountCb countCb(String column) {
    return new CountCb(column, Constants.DEFAULT_CONFIDENCE);
  }

  public static CountCb countCb(String column, double conf) {
    return new CountCb(column, conf);
  }

  public static CountLag countLag(String column) {
    return new CountLag(column, Constants.DEFAULT_DATE_FORMAT, Clock.systemDefaultZone());
  }

  public static CountLag countLag(String column, String format) {
    return new CountLag(column, format, Clock.systemDefaultZone());
  }

  public static CountLag countLag(String column, String format, Clock clock) {
    return new CountLag(column, format, clock);
  }

  private static String checkColumn(String column) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(column), "Column name must not be empty");
    return column;
  }

  private static List<String> checkColumns(List<String> columns) {
    Preconditions.checkArgument(columns != null && !columns.isEmpty(), "At least one column is required");
    columns.forEach(Metric::checkColumn);
    return Collections.unmodifiableList(new ArrayList<>(columns));
  }

  /**
   * Formatter that rejects impossible calendar dates such as {@code 2024-02-30} instead of moving them to the
   * closest valid day. Strict resolution needs an era with year-of-era, so {@code y} is read as proleptic year
   * {@code u} outside quoted literals.
   */
  private static DateTimeFormatter strictFormatter(String format) {
    StringBuilder pattern = new StringBuilder(format.length());
    boolean quoted = false;
    for (char c : format.toCharArray()) {
      if (c == '\'') {
        quoted = !quoted;
      }
      pattern.append(!quoted && c == 'y' ? 'u' : c);
    }
    return DateTimeFormatter.ofPattern(pattern.toString()).withResolverStyle(ResolverStyle.STRICT);
  }

  private static String quote(String value) {
    return "'" + value + "'";
  }

  private static String quote(List<String> values) {
    return values.stream().map(Metric::quote).collect(Collectors.joining(", ", "[", "]"));
  }

  /**
   * Total number of rows.
   */
  @EqualsAndHashCode(callSuper = false)
  public static final class CountTotal extends Metric {

    private CountTotal() {
    }

    @Override
    public MetricKind getKind() {
      return MetricKind.TOTAL_COUNT;
    }

    @Override
    protected String parameters() {
      return "";
    }
  }

  /**
   * Number of zeros in a column.
   */
  @Getter
  @EqualsAndHashCode(callSuper = false)
  public static final class CountZeros extends Metric {
    private final String column;

    private CountZeros(String column) {
      this.column = checkColumn(column);
    }

    @Override
    public MetricKind getKind() {
      return MetricKind.ZERO_COUNT;
    }

    @Override
    protected String parameters() {
      return "column=" + quote(column);
    }
  }

  /**
   * Number of rows where any, or all, of the given columns are empty.
   */
  @Getter
  @EqualsAndHashCode(callSuper = false)
  public static final class CountNull extends Metric {
    private final List<String> columns;
    private final NullAggregation aggregation;

    private CountNull(List<String> columns, NullAggregation aggregation) {
      this.columns = checkColumns(columns);
      this.aggregation = Objects.requireNonNull(aggregation, "aggregation");
    }

    @Override
    public MetricKind getKind() {
      return MetricKind.NULL_COUNT;
    }

    @Override
    protected String parameters() {
      return "columns=" + quote(columns) + ", aggregation=" + quote(aggregation.getName());
    }
  }

  /**
   * Number of rows whose key, made of the given columns, is shared with at least one other row.
   */
  @Getter
  @EqualsAndHashCode(callSuper = false)
  public static final class CountDuplicates extends Metric {
    private final List<String> columns;

    private CountDuplicates(List<String> columns) {
      this.columns = checkColumns(columns);
    }

    @Override
    public MetricKind getKind() {
      return MetricKind.DUPLICATE_COUNT;
    }

    @Override
    protected String parameters() {
      return "columns=" + quote(columns);
    }
  }

  /**
   * Number of rows where a column equals a literal value.
   */
  @Getter
  @EqualsAndHashCode(callSuper = false)
  public static final class CountValue extends Metric {
    private final String column;
    private final Object value;

    private CountValue(String column, Object value) {
      Preconditions.checkArgument(value instanceof String || value instanceof Number || value instanceof Boolean,
          "Value must be a string, a number or a boolean, got: %s", value);
      Preconditions.checkArgument(!(value instanceof Double && ((Double) value).isNaN())
          && !(value instanceof Float && ((Float) value).isNaN()), "Value must not be NaN");
      this.column = checkColumn(column);
      this.value = value;
    }

    @Override
    public MetricKind getKind() {
      return MetricKind.EXACT_VALUE_COUNT;
    }

    @Override
    protected String parameters() {
      return "column=" + quote(column) + ", value=" + (value instanceof String ? quote((String) value) : value);
    }
  }

  /**
   * Number of values below a threshold.
   */
  @Getter
  @EqualsAndHashCode(callSuper = false)
  public static final class CountBelowValue extends Metric {
    private final String column;
    private final double value;
    private final boolean strict;

    private CountBelowValue(String column, double value, boolean strict) {
      Preconditions.checkArgument(!Double.isNaN(value), "Threshold must be a number");
      this.column = checkColumn(column);
      this.value = value;
      this.strict = strict;
    }

    @Override
    public MetricKind getKind() {
      return MetricKind.BELOW_THRESHOLD_COUNT;
    }

    @Override
    protected String parameters() {
      return "column=" + quote(column) + ", value=" + value + ", strict=" + strict;
    }
  }

  /**
   * How often column X is below column Y. Rows with an empty X or Y are left out.
   */
  @Getter
  @EqualsAndHashCode(callSuper = false)
  public static final class CountBelowColumn extends Metric {
    private final String columnX;
    private final String columnY;
    private final boolean strict;

    private CountBelowColumn(String columnX, String columnY, boolean strict) {
      this.columnX = checkColumn(columnX);
      this.columnY = checkColumn(columnY);
      this.strict = strict;
    }

    @Override
    public MetricKind getKind() {
      return MetricKind.COLUMN_BELOW_COLUMN_COUNT;
    }

    @Override
    protected String parameters() {
      return "column_x=" + quote(columnX) + ", column_y=" + quote(columnY) + ", strict=" + strict;
    }
  }

  /**
   * How often X / Y is below Z. Rows with an empty X, Y or Z are left out.
   */
  @Getter
  @EqualsAndHashCode(callSuper = false)
  public static final class CountRatioBelow extends Metric {
    private final String columnX;
    private final String columnY;
    private final String columnZ;
    private final boolean strict;

    private CountRatioBelow(String columnX, String columnY, String columnZ, boolean strict) {
      this.columnX = checkColumn(columnX);
      this.columnY = checkColumn(columnY);
      this.columnZ = checkColumn(columnZ);
      this.strict = strict;
    }

    @Override
    public MetricKind getKind() {
      return MetricKind.RATIO_BELOW_THRESHOLD_COUNT;
    }

    @Override
    protected String parameters() {
      return "column_x=" + quote(columnX) + ", column_y=" + quote(columnY) + ", column_z=" + quote(columnZ)
          + ", strict=" + strict;
    }
  }

  /**
   * Lower and upper bounds of the two-sided {@code conf} confidence interval of a column.
   */
  @Getter
  @EqualsAndHashCode(callSuper = false)
  public static final class CountCb extends Metric {
    private final String column;
    private final double conf;

    private CountCb(String column, double conf) {
      Preconditions.checkArgument(conf > 0 && conf < 1, "Confidence level must be in (0, 1), got: %s", conf);
      this.column = checkColumn(column);
      this.conf = conf;
    }

    public double getLowerQuantile() {
      return (1 - conf) / 2;
    }

    public double getUpperQuantile() {
      return 1 - getLowerQuantile();
    }

    @Override
    public MetricKind getKind() {
      return MetricKind.CONFIDENCE_BOUND;
    }

    @Override
    protected String parameters() {
      return "column=" + quote(column) + ", conf=" + conf;
    }
  }

  /**
   * Lag in days between the latest date of a column and today.
   */
  @Getter
  @EqualsAndHashCode(callSuper = false)
  public static final class CountLag extends Metric {
    private final String column;
    private final String format;
    @EqualsAndHashCode.Exclude
    private final DateTimeFormatter formatter;
    @EqualsAndHashCode.Exclude
    private final Clock clock;

    private CountLag(String column, String format, Clock clock) {
      Preconditions.checkArgument(!Strings.isNullOrEmpty(format), "Date format must not be empty");
      this.column = checkColumn(column);
      this.format = format;
      this.formatter = strictFormatter(format);
      this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public MetricKind getKind() {
      return MetricKind.DATE_LAG;
    }

    @Override
    protected String parameters() {
      return "column=" + quote(column) + ", fmt=" + quote(format);
    }
  }
}

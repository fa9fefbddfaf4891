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
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fully materialized in-memory table. Rows are positional and follow the order of {@link #getColumns()}.
 *
 * <pre>
 * {@code
 *        LocalTable sales = LocalTable.builder()
 *            .name("sales")
 *            .column("qty").column("price")
 *            .values(0, 1.0)
 *            .values(5, 2.5)
 *            .build();
 * }
 * </pre>
 */
public class LocalTable implements Table {

  @Getter
  private final String name;
  @Getter
  private final List<String> columns;
  @Getter
  private final List<List<Object>> rows;

  @Builder
  public LocalTable(@NonNull String name, @Singular List<String> columns, @Singular List<List<Object>> rows) {
    Preconditions.checkArgument(new LinkedHashSet<>(columns).size() == columns.size(),
        "Duplicate column names in table '%s': %s", name, columns);
    List<List<Object>> copy = new ArrayList<>(rows.size());
    for (int i = 0; i < rows.size(); i++) {
      List<Object> row = rows.get(i);
      Preconditions.checkArgument(row.size() == columns.size(),
          "Row %s of table '%s' has %s values but the table has %s columns", i, name, row.size(), columns.size());
      copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
    }
    this.name = name;
    this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
    this.rows = Collections.unmodifiableList(copy);
  }

  /**
   * Build a table from records keyed by column name. Columns are taken in first-seen order across all records and a
   * key missing from a record is read as null.
   *
   * @param name table name
   * @param records rows as column name to value maps
   * @return local table
   */
  public static LocalTable fromRecords(String name, List<Map<String, Object>> records) {
    Set<String> columnNames = new LinkedHashSet<>();
    for (Map<String, Object> record : records) {
      columnNames.addAll(record.keySet());
    }
    LocalTableBuilder builder = LocalTable.builder().name(name).columns(columnNames);
    for (Map<String, Object> record : records) {
      List<Object> row = new ArrayList<>(columnNames.size());
      for (String column : columnNames) {
        row.add(record.get(column));
      }
      builder.row(row);
    }
    return builder.build();
  }

  @Override
  public TableKind getKind() {
    return TableKind.LOCAL;
  }

  public int size() {
    return rows.size();
  }

  public boolean hasColumn(String column) {
    return columns.contains(column);
  }

  public int columnIndex(String column) throws MetricEvaluationException {
    int index = columns.indexOf(column);
    if (index < 0) {
      throw new MetricEvaluationException("Column '" + column + "' does not exist in table '" + name
          + "'. Available columns: " + columns);
    }
    return index;
  }

  /**
   * Values of a single column in row order.
   *
   * @param column column name
   * @return read-only list of values, nulls included
   * @throws MetricEvaluationException if the column does not exist
   */
  public List<Object> column(String column) throws MetricEvaluationException {
    int index = columnIndex(column);
    List<Object> values = new ArrayList<>(rows.size());
    for (List<Object> row : rows) {
      values.add(row.get(index));
    }
    return Collections.unmodifiableList(values);
  }

  /**
   * Null test shared by every local strategy: floating point NaN is treated as missing, the same way the
   * distributed strategies filter it out.
   */
  public static boolean isNull(Object value) {
    if (value == null) {
      return true;
    }
    if (value instanceof Double) {
      return ((Double) value).isNaN();
    }
    if (value instanceof Float) {
      return ((Float) value).isNaN();
    }
    return false;
  }

  @Override
  public String toString() {
    return "LocalTable{name='" + name + "', columns=" + columns + ", rows=" + rows.size() + "}";
  }

  public static class LocalTableBuilder {

    public LocalTableBuilder values(Object... values) {
      return row(Arrays.asList(values));
    }
  }
}

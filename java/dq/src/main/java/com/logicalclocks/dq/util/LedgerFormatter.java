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

package com.logicalclocks.dq.util;

import com.google.common.base.CharMatcher;
import com.google.common.base.Strings;
import com.logicalclocks.dq.CheckResult;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Renders report ledger rows as a fixed width text table with a leading row index. Cells longer than the maximum
 * column width are cut and end with {@value Constants#TRUNCATION_MARK}.
 */
public class LedgerFormatter {

  private static final List<String> HEADER =
      Arrays.asList("", "table_name", "metric", "limits", "values", "status", "error");
  private static final String SEPARATOR = "  ";

  private final int maxColWidth;

  public LedgerFormatter(int maxColWidth) {
    this.maxColWidth = Math.max(maxColWidth, Constants.TRUNCATION_MARK.length() + 1);
  }

  /**
   * Formatter configured from the {@value Constants#MAX_COLWIDTH_PROPERTY} system property.
   */
  public static LedgerFormatter fromSystemProperties() {
    return new LedgerFormatter(Integer.getInteger(Constants.MAX_COLWIDTH_PROPERTY, Constants.DEFAULT_MAX_COLWIDTH));
  }

  public String format(List<CheckResult> rows) {
    List<List<String>> cells = new ArrayList<>();
    cells.add(HEADER);
    for (int i = 0; i < rows.size(); i++) {
      CheckResult row = rows.get(i);
      cells.add(Arrays.asList(
          String.valueOf(i),
          truncate(row.getTableName()),
          truncate(row.getMetric()),
          truncate(row.getLimits()),
          truncate(row.getValues() == null ? "" : row.getValues().toString()),
          row.getStatus().getSymbol(),
          truncate(row.getError())));
    }

    int[] widths = new int[HEADER.size()];
    for (List<String> line : cells) {
      for (int c = 0; c < line.size(); c++) {
        widths[c] = Math.max(widths[c], line.get(c).length());
      }
    }

    StringBuilder builder = new StringBuilder();
    for (int r = 0; r < cells.size(); r++) {
      List<String> line = cells.get(r);
      StringBuilder text = new StringBuilder();
      for (int c = 0; c < line.size(); c++) {
        if (c > 0) {
          text.append(SEPARATOR);
        }
        // index column is left aligned, values are right aligned
        text.append(c == 0
            ? Strings.padEnd(line.get(c), widths[c], ' ')
            : Strings.padStart(line.get(c), widths[c], ' '));
      }
      builder.append(CharMatcher.is(' ').trimTrailingFrom(text));
      if (r < cells.size() - 1) {
        builder.append('\n');
      }
    }
    return builder.toString();
  }

  String truncate(String value) {
    if (value == null) {
      return "";
    }
    if (value.length() <= maxColWidth) {
      return value;
    }
    return value.substring(0, maxColWidth - Constants.TRUNCATION_MARK.length()) + Constants.TRUNCATION_MARK;
  }
}

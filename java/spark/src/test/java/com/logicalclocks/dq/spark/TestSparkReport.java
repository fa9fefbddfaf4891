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

import com.logicalclocks.dq.Check;
import com.logicalclocks.dq.CheckResult;
import com.logicalclocks.dq.CheckStatus;
import com.logicalclocks.dq.DataQualityException;
import com.logicalclocks.dq.Limits;
import com.logicalclocks.dq.LocalTable;
import com.logicalclocks.dq.Metric;
import com.logicalclocks.dq.Report;
import com.logicalclocks.dq.Table;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class TestSparkReport {

  private final LocalTable localTable = LocalTable.builder()
      .name("T")
      .column("x").column("y")
      .values(0, 1)
      .values(0, 2)
      .values(5, 1)
      .build();

  private Report.ReportBuilder checks() {
    return Report.builder()
        .check(Check.of("T", Metric.countZeros("x"), Limits.of("delta", 0.5, 1.0)))
        .check(Check.of("T", Metric.countValue("x", 5), Limits.of("count", 2, 10)))
        .check(Check.of("missing", Metric.countTotal(), null))
        .check(Check.of("T", Metric.countDuplicates(Collections.singletonList("x")), Limits.of("count", 2, 2)));
  }

  @Test
  public void testFitOnSparkTables() throws DataQualityException {
    // Arrange
    Map<String, Table> tables = new HashMap<>();
    tables.put("T", SparkTable.fromLocal(localTable));

    // Act
    Report report = checks().engine("spark").build().fit(tables);

    // Assert
    Assertions.assertEquals("DQ Report for tables [T]", report.getTitle());
    Assertions.assertEquals(2, report.getPassed());
    Assertions.assertEquals(1, report.getFailed());
    Assertions.assertEquals(1, report.getErrors());
    List<CheckResult> rows = report.getRows();
    Assertions.assertEquals(CheckStatus.PASSED, rows.get(0).getStatus());
    Assertions.assertEquals(2L, rows.get(0).getValues().get("count"));
    Assertions.assertEquals(CheckStatus.FAILED, rows.get(1).getStatus());
    Assertions.assertEquals(CheckStatus.ERROR, rows.get(2).getStatus());
    Assertions.assertEquals(2L, rows.get(3).getValues().get("count"));
  }

  @Test
  public void testLedgersMatchAcrossEngines() throws DataQualityException {
    // Arrange
    Map<String, Table> localTables = new HashMap<>();
    localTables.put("T", localTable);
    Map<String, Table> sparkTables = new HashMap<>();
    sparkTables.put("T", SparkTable.fromLocal(localTable));

    // Act
    Report local = checks().engine("local").build().fit(localTables);
    Report spark = checks().engine("spark").parallelism(2).build().fit(sparkTables);

    // Assert
    Assertions.assertEquals(local.getRows(), spark.getRows());
    Assertions.assertEquals(local.toStr(), spark.toStr());
  }

  @Test
  public void testLocalEngineRejectsSparkTables() throws DataQualityException {
    // Arrange
    Map<String, Table> tables = new HashMap<>();
    tables.put("T", SparkTable.fromLocal(localTable));
    Report report = Report.builder()
        .check(Check.of("T", Metric.countTotal(), null))
        .engine("local")
        .build();

    // Act
    report.fit(tables);

    // Assert
    Assertions.assertEquals(1, report.getErrors());
    Assertions.assertTrue(report.getRows().get(0).getError().contains("local"));
  }
}

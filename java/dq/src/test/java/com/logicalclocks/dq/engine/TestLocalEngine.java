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

import com.logicalclocks.dq.LocalTable;
import com.logicalclocks.dq.Metric;
import com.logicalclocks.dq.MetricEvaluationException;
import com.logicalclocks.dq.MetricResult;
import com.logicalclocks.dq.NullAggregation;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Collections;

public class TestLocalEngine {

  private static final Clock CLOCK = Clock.fixed(Instant.parse("2022-10-24T12:00:00Z"), ZoneOffset.UTC);

  private final LocalEngine localEngine = LocalEngine.getInstance();

  private LocalTable xyTable() {
    return LocalTable.builder()
        .name("T")
        .column("x").column("y")
        .values(0, 1)
        .values(0, 2)
        .values(5, 1)
        .build();
  }

  @Test
  public void testCountTotal() throws MetricEvaluationException {
    // Act
    MetricResult result = localEngine.evaluate(Metric.countTotal(), xyTable());

    // Assert
    Assertions.assertEquals(Collections.singleton("total"), result.keySet());
    Assertions.assertEquals(3L, result.get("total"));
  }

  @Test
  public void testCountTotalEmptyTable() throws MetricEvaluationException {
    // Arrange
    LocalTable table = LocalTable.builder().name("empty").column("x").build();

    // Act
    MetricResult result = localEngine.evaluate(Metric.countTotal(), table);

    // Assert
    Assertions.assertEquals(0L, result.get("total"));
  }

  @Test
  public void testCountZeros() throws MetricEvaluationException {
    // Act
    MetricResult result = localEngine.evaluate(Metric.countZeros("x"), xyTable());

    // Assert
    Assertions.assertEquals(Arrays.asList("total", "count", "delta"), Arrays.asList(result.keySet().toArray()));
    Assertions.assertEquals(3L, result.get("total"));
    Assertions.assertEquals(2L, result.get("count"));
    Assertions.assertEquals(2.0 / 3, result.getNumber("delta"), 1e-9);
  }

  @Test
  public void testCountZerosIgnoresNullsAndMixedNumbers() throws MetricEvaluationException {
    // Arrange
    LocalTable table = LocalTable.builder()
        .name("T")
        .column("x")
        .values(0.0)
        .values(-0.0)
        .values(0L)
        .values((Object) null)
        .values(Double.NaN)
        .values(1.5)
        .build();

    // Act
    MetricResult result = localEngine.evaluate(Metric.countZeros("x"), table);

    // Assert
    Assertions.assertEquals(6L, result.get("total"));
    Assertions.assertEquals(3L, result.get("count"));
  }

  @Test
  public void testCountZerosEmptyTable() {
    // Arrange
    LocalTable table = LocalTable.builder().name("empty").column("x").build();

    // Act
    MetricEvaluationException exception = Assertions.assertThrows(MetricEvaluationException.class,
        () -> localEngine.evaluate(Metric.countZeros("x"), table));

    // Assert
    Assertions.assertTrue(exception.getMessage().contains("Division by zero"));
  }

  @Test
  public void testMissingColumn() {
    // Act
    MetricEvaluationException exception = Assertions.assertThrows(MetricEvaluationException.class,
        () -> localEngine.evaluate(Metric.countZeros("z"), xyTable()));

    // Assert
    Assertions.assertTrue(exception.getMessage().contains("'z'"));
  }

  @Test
  public void testCountNullAnyAndAll() throws MetricEvaluationException {
    // Arrange
    LocalTable table = LocalTable.builder()
        .name("T")
        .column("a").column("b")
        .values(1, "x")
        .values(null, "y")
        .values(Double.NaN, null)
        .values(2, null)
        .build();

    // Act
    MetricResult any = localEngine.evaluate(Metric.countNull(Arrays.asList("a", "b")), table);
    MetricResult all = localEngine.evaluate(Metric.countNull(Arrays.asList("a", "b"), NullAggregation.ALL), table);
    MetricResult single = localEngine.evaluate(Metric.countNull(Collections.singletonList("a"), "all"), table);

    // Assert
    Assertions.assertEquals(3L, any.get("count"));
    Assertions.assertEquals(0.75, any.getNumber("delta"), 1e-9);
    Assertions.assertEquals(1L, all.get("count"));
    Assertions.assertEquals(2L, single.get("count"));
  }

  @Test
  public void testCountDuplicates() throws MetricEvaluationException {
    // Act
    MetricResult result = localEngine.evaluate(Metric.countDuplicates(Collections.singletonList("x")), xyTable());

    // Assert
    Assertions.assertEquals(3L, result.get("total"));
    Assertions.assertEquals(2L, result.get("count"));
    Assertions.assertEquals(2.0 / 3, result.getNumber("delta"), 1e-9);
  }

  @Test
  public void testCountDuplicatesCompositeKey() throws MetricEvaluationException {
    // Arrange
    LocalTable table = LocalTable.builder()
        .name("T")
        .column("a").column("b")
        .values(1, "x")
        .values(1L, "x")
        .values(1, "y")
        .values(null, "z")
        .values(null, "z")
        .values(2, "x")
        .build();

    // Act
    MetricResult result = localEngine.evaluate(Metric.countDuplicates(Arrays.asList("a", "b")), table);

    // Assert
    Assertions.assertEquals(6L, result.get("total"));
    Assertions.assertEquals(4L, result.get("count"));
  }

  @Test
  public void testCountDuplicatesMixedNumbers() throws MetricEvaluationException {
    // Arrange
    LocalTable table = LocalTable.builder()
        .name("T")
        .column("x")
        .values(1)
        .values(1.0)
        .values(2)
        .values(-0.0)
        .values(0L)
        .values(2.5)
        .build();

    // Act
    MetricResult result = localEngine.evaluate(Metric.countDuplicates(Collections.singletonList("x")), table);

    // Assert
    Assertions.assertEquals(6L, result.get("total"));
    Assertions.assertEquals(4L, result.get("count"));
  }

  @Test
  public void testCountValue() throws MetricEvaluationException {
    // Arrange
    LocalTable table = LocalTable.builder()
        .name("T")
        .column("n").column("s")
        .values(5, "a")
        .values(5.0, "b")
        .values(null, "a")
        .values(4, null)
        .build();

    // Act
    MetricResult numbers = localEngine.evaluate(Metric.countValue("n", 5), table);
    MetricResult strings = localEngine.evaluate(Metric.countValue("s", "a"), table);

    // Assert
    Assertions.assertEquals(2L, numbers.get("count"));
    Assertions.assertEquals(4L, numbers.get("total"));
    Assertions.assertEquals(2L, strings.get("count"));
  }

  @Test
  public void testCountBelowValue() throws MetricEvaluationException {
    // Arrange
    LocalTable table = LocalTable.builder()
        .name("T")
        .column("price")
        .values(10.0)
        .values(20.0)
        .values(Double.NaN)
        .values(5)
        .build();

    // Act
    MetricResult inclusive = localEngine.evaluate(Metric.countBelowValue("price", 10), table);
    MetricResult strict = localEngine.evaluate(Metric.countBelowValue("price", 10, true), table);

    // Assert
    Assertions.assertEquals(4L, inclusive.get("total"));
    Assertions.assertEquals(2L, inclusive.get("count"));
    Assertions.assertEquals(1L, strict.get("count"));
  }

  @Test
  public void testCountBelowValueNonNumeric() {
    // Arrange
    LocalTable table = LocalTable.builder().name("T").column("price").values("cheap").build();

    // Act
    MetricEvaluationException exception = Assertions.assertThrows(MetricEvaluationException.class,
        () -> localEngine.evaluate(Metric.countBelowValue("price", 10), table));

    // Assert
    Assertions.assertTrue(exception.getMessage().contains("non numeric"));
  }

  @Test
  public void testCountBelowColumnSkipsIncompleteRows() throws MetricEvaluationException {
    // Arrange
    LocalTable table = LocalTable.builder()
        .name("T")
        .column("x").column("y")
        .values(1, 2)
        .values(5, 5)
        .values(null, 1)
        .values(3, null)
        .values(7, 1.5)
        .build();

    // Act
    MetricResult inclusive = localEngine.evaluate(Metric.countBelowColumn("x", "y"), table);
    MetricResult strict = localEngine.evaluate(Metric.countBelowColumn("x", "y", true), table);

    // Assert
    Assertions.assertEquals(3L, inclusive.get("total"));
    Assertions.assertEquals(2L, inclusive.get("count"));
    Assertions.assertEquals(1L, strict.get("count"));
    Assertions.assertEquals(1.0 / 3, strict.getNumber("delta"), 1e-9);
  }

  @Test
  public void testCountBelowColumnOnDatesAndStrings() throws MetricEvaluationException {
    // Arrange
    LocalTable table = LocalTable.builder()
        .name("T")
        .column("start").column("end").column("a").column("b")
        .values(LocalDate.of(2022, 10, 1), LocalDate.of(2022, 10, 5), "a", "b")
        .values(LocalDate.of(2022, 10, 7), LocalDate.of(2022, 10, 3), "c", "b")
        .values(LocalDate.of(2022, 10, 4), LocalDate.of(2022, 10, 4), "b", "b")
        .values(null, LocalDate.of(2022, 10, 4), null, "b")
        .build();

    // Act
    MetricResult inclusive = localEngine.evaluate(Metric.countBelowColumn("start", "end"), table);
    MetricResult strict = localEngine.evaluate(Metric.countBelowColumn("start", "end", true), table);
    MetricResult strings = localEngine.evaluate(Metric.countBelowColumn("a", "b", true), table);

    // Assert
    Assertions.assertEquals(3L, inclusive.get("total"));
    Assertions.assertEquals(2L, inclusive.get("count"));
    Assertions.assertEquals(1L, strict.get("count"));
    Assertions.assertEquals(1L, strings.get("count"));
  }

  @Test
  public void testCountBelowColumnIncompatibleTypes() {
    // Arrange
    LocalTable table = LocalTable.builder()
        .name("T")
        .column("start").column("label")
        .values(LocalDate.of(2022, 10, 1), "2022-10-05")
        .build();

    // Act
    MetricEvaluationException exception = Assertions.assertThrows(MetricEvaluationException.class,
        () -> localEngine.evaluate(Metric.countBelowColumn("start", "label"), table));

    // Assert
    Assertions.assertTrue(exception.getMessage().contains("cannot be compared"));
  }

  @Test
  public void testCountBelowColumnNoCompleteRows() {
    // Arrange
    LocalTable table = LocalTable.builder()
        .name("T")
        .column("x").column("y")
        .values(null, 1)
        .build();

    // Act
    Assertions.assertThrows(MetricEvaluationException.class,
        () -> localEngine.evaluate(Metric.countBelowColumn("x", "y"), table));
  }

  @Test
  public void testCountRatioBelow() throws MetricEvaluationException {
    // Arrange
    LocalTable table = LocalTable.builder()
        .name("T")
        .column("x").column("y").column("z")
        .values(1, 2, 1)
        .values(4, 2, 1)
        .values(3, 0, 1)
        .values(null, 1, 1)
        .values(5, 5, 1)
        .build();

    // Act
    MetricResult inclusive = localEngine.evaluate(Metric.countRatioBelow("x", "y", "z"), table);
    MetricResult strict = localEngine.evaluate(Metric.countRatioBelow("x", "y", "z", true), table);

    // Assert
    Assertions.assertEquals(4L, inclusive.get("total"));
    Assertions.assertEquals(2L, inclusive.get("count"));
    Assertions.assertEquals(0.5, inclusive.getNumber("delta"), 1e-9);
    Assertions.assertEquals(1L, strict.get("count"));
  }

  @Test
  public void testCountCb() throws MetricEvaluationException {
    // Arrange
    LocalTable table = LocalTable.builder()
        .name("T")
        .column("v")
        .values(3.0)
        .values(1)
        .values((Object) null)
        .values(5L)
        .values(2.0)
        .values(4.0)
        .build();

    // Act
    MetricResult half = localEngine.evaluate(Metric.countCb("v", 0.5), table);
    MetricResult wide = localEngine.evaluate(Metric.countCb("v"), table);

    // Assert
    Assertions.assertEquals(Arrays.asList("lcb", "ucb"), Arrays.asList(half.keySet().toArray()));
    Assertions.assertEquals(2.0, half.getNumber("lcb"), 1e-9);
    Assertions.assertEquals(4.0, half.getNumber("ucb"), 1e-9);
    Assertions.assertEquals(1.1, wide.getNumber("lcb"), 1e-9);
    Assertions.assertEquals(4.9, wide.getNumber("ucb"), 1e-9);
  }

  @Test
  public void testCountCbNoValues() throws MetricEvaluationException {
    // Arrange
    LocalTable table = LocalTable.builder().name("T").column("v").values((Object) null).build();

    // Act
    MetricResult result = localEngine.evaluate(Metric.countCb("v"), table);

    // Assert
    Assertions.assertTrue(result.containsKey("lcb"));
    Assertions.assertNull(result.get("lcb"));
    Assertions.assertNull(result.get("ucb"));
  }

  @Test
  public void testQuantile() {
    // Assert
    Assertions.assertNull(LocalEngine.quantile(Collections.emptyList(), 0.5));
    Assertions.assertEquals(7.0, LocalEngine.quantile(Collections.singletonList(7.0), 0.025), 1e-9);
    Assertions.assertEquals(2.5, LocalEngine.quantile(Arrays.asList(1.0, 2.0, 3.0, 4.0), 0.5), 1e-9);
    Assertions.assertEquals(1.0, LocalEngine.quantile(Arrays.asList(1.0, 2.0, 3.0, 4.0), 0.0), 1e-9);
    Assertions.assertEquals(4.0, LocalEngine.quantile(Arrays.asList(1.0, 2.0, 3.0, 4.0), 1.0), 1e-9);
  }

  @Test
  public void testCountLag() throws MetricEvaluationException {
    // Arrange
    LocalTable table = LocalTable.builder()
        .name("T")
        .column("day")
        .values("2022-10-21")
        .values("2022-10-22")
        .values("not a date")
        .values((Object) null)
        .build();

    // Act
    MetricResult result = localEngine.evaluate(Metric.countLag("day", "yyyy-MM-dd", CLOCK), table);

    // Assert
    Assertions.assertEquals(Arrays.asList("today", "last_day", "lag"), Arrays.asList(result.keySet().toArray()));
    Assertions.assertEquals("2022-10-24", result.get("today"));
    Assertions.assertEquals("2022-10-22", result.get("last_day"));
    Assertions.assertEquals(2L, result.get("lag"));
  }

  @Test
  public void testCountLagCustomFormatAndTemporalValues() throws MetricEvaluationException {
    // Arrange
    LocalTable table = LocalTable.builder()
        .name("T")
        .column("day")
        .values(LocalDate.of(2022, 10, 1))
        .values(LocalDateTime.of(2022, 10, 14, 23, 59))
        .values("20/10/2022")
        .build();

    // Act
    MetricResult result = localEngine.evaluate(Metric.countLag("day", "dd/MM/yyyy", CLOCK), table);

    // Assert
    Assertions.assertEquals("24/10/2022", result.get("today"));
    Assertions.assertEquals("20/10/2022", result.get("last_day"));
    Assertions.assertEquals(4L, result.get("lag"));
  }

  @Test
  public void testCountLagIgnoresImpossibleDates() throws MetricEvaluationException {
    // Arrange
    LocalTable table = LocalTable.builder()
        .name("T")
        .column("day")
        .values("2022-02-30")
        .values("2022-02-01")
        .build();

    // Act
    MetricResult result = localEngine.evaluate(Metric.countLag("day", "yyyy-MM-dd", CLOCK), table);

    // Assert
    Assertions.assertEquals("2022-02-01", result.get("last_day"));
    Assertions.assertEquals(265L, result.get("lag"));
  }

  @Test
  public void testCountLagNoDates() throws MetricEvaluationException {
    // Arrange
    LocalTable table = LocalTable.builder().name("T").column("day").values("garbage").build();

    // Act
    MetricResult result = localEngine.evaluate(Metric.countLag("day", "yyyy-MM-dd", CLOCK), table);

    // Assert
    Assertions.assertEquals("2022-10-24", result.get("today"));
    Assertions.assertNull(result.get("last_day"));
    Assertions.assertNull(result.get("lag"));
  }
}

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

public class Constants {

  // result keys
  public static final String TOTAL = "total";
  public static final String COUNT = "count";
  public static final String DELTA = "delta";
  public static final String LCB = "lcb";
  public static final String UCB = "ucb";
  public static final String TODAY = "today";
  public static final String LAST_DAY = "last_day";
  public static final String LAG = "lag";

  // metric defaults
  public static final double DEFAULT_CONFIDENCE = 0.95;
  public static final String DEFAULT_DATE_FORMAT = "yyyy-MM-dd";

  // report rendering
  public static final String REPORT_TITLE_PREFIX = "DQ Report for tables ";
  public static final String MAX_COLWIDTH_PROPERTY = "dq.report.max.colwidth";
  public static final int DEFAULT_MAX_COLWIDTH = 20;
  public static final String TRUNCATION_MARK = "...";

  // engine selectors accepted by Report
  public static final String LOCAL_ENGINE = "local";
  public static final String SPARK_ENGINE = "spark";

  private Constants() {
  }
}

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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * A row of the report ledger. {@code values} is null when the check errored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"table_name", "metric", "limits", "values", "status", "error"})
@AllArgsConstructor
@Builder
@Getter
@EqualsAndHashCode
public class CheckResult {

  @JsonProperty("table_name")
  private final String tableName;
  private final String metric;
  private final String limits;
  private final MetricResult values;
  private final CheckStatus status;
  private final String error;

  @Override
  public String toString() {
    return "CheckResult{"
      + "tableName='" + tableName + '\''
      + ", metric='" + metric + '\''
      + ", limits='" + limits + '\''
      + ", values=" + values
      + ", status=" + status
      + ", error='" + error + '\''
      + '}';
  }
}

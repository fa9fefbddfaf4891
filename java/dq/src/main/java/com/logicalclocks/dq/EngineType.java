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

import com.logicalclocks.dq.util.Constants;

public enum EngineType {
  LOCAL(Constants.LOCAL_ENGINE, TableKind.LOCAL),
  SPARK(Constants.SPARK_ENGINE, TableKind.DISTRIBUTED);

  private final String name;
  private final TableKind tableKind;

  EngineType(String name, TableKind tableKind) {
    this.name = name;
    this.tableKind = tableKind;
  }

  public String getName() {
    return name;
  }

  public TableKind getTableKind() {
    return tableKind;
  }

  public static EngineType fromString(String name) {
    for (EngineType engineType : values()) {
      if (engineType.name.equalsIgnoreCase(name)) {
        return engineType;
      }
    }
    throw new UnsupportedOperationException("Engine '" + name + "' is not supported. Only "
        + Constants.LOCAL_ENGINE + " and " + Constants.SPARK_ENGINE + " engines are currently supported!");
  }
}

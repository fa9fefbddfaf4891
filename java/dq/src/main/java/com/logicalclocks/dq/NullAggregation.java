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

public enum NullAggregation {
  ANY("any"),
  ALL("all");

  private final String name;

  NullAggregation(String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  public static NullAggregation fromString(String name) {
    for (NullAggregation aggregation : values()) {
      if (aggregation.name.equalsIgnoreCase(name)) {
        return aggregation;
      }
    }
    throw new IllegalArgumentException("Unknown null aggregation '" + name + "', expected 'any' or 'all'");
  }

  @Override
  public String toString() {
    return name;
  }
}

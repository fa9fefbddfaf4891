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

/**
 * The table handed to a metric is neither a local nor a distributed table. This is a wiring error, so it is not
 * absorbed into the report ledger.
 */
public class UnsupportedTableKindException extends UnsupportedOperationException {

  public UnsupportedTableKindException(Table table) {
    super("Not supported type of table: " + (table == null ? "null" : table.getClass().getName())
        + ". Supported types: " + LocalTable.class.getName() + ", " + DistributedTable.class.getName());
  }
}

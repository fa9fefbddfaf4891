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
 * A named, read-only two dimensional dataset that metrics are evaluated against.
 *
 * <p>The {@link TableKind} returned by {@link #getKind()} decides which execution strategy a {@link Metric} uses.
 * Implementations tagged {@link TableKind#LOCAL} must extend {@link LocalTable}, implementations tagged
 * {@link TableKind#DISTRIBUTED} must implement {@link DistributedTable}.
 */
public interface Table {

  String getName();

  TableKind getKind();
}

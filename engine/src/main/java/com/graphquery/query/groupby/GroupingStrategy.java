/*
 * Copyright © 2021-present Arcade Data Ltd (info@arcadedata.com)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-FileCopyrightText: 2021-present Arcade Data Ltd (info@arcadedata.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.graphquery.query.groupby;

/**
 * Algorithms that distribute the rows among the workers and merge their partial groups.
 */
public enum GroupingStrategy {
  /**
   * Every worker groups its row range in a private dictionary, then the dictionaries are merged pairwise in a binary tree.
   */
  LOCAL_MERGE,

  /**
   * Every worker groups its row range in a private dictionary, then drains it into one concurrent dictionary shared by all the
   * workers.
   */
  GLOBAL_MERGE,

  /**
   * Every worker inserts its rows straight into one concurrent dictionary, updating the aggregates with atomic operations. Best
   * with few distinct groups.
   */
  GLOBAL
}

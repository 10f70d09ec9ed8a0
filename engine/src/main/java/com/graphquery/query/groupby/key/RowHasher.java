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
package com.graphquery.query.groupby.key;

/**
 * Hashing view of a {@link RowKeyEvaluator}.
 */
public final class RowHasher {
  private final RowKeyEvaluator evaluator;

  RowHasher(final RowKeyEvaluator evaluator) {
    this.evaluator = evaluator;
  }

  public int hash(final int rowIndex) {
    return evaluator.hash(rowIndex);
  }

  /**
   * Builds the key of the row. The key values stay cached in the evaluator until the next row is hashed.
   */
  public GroupKey keyOf(final int rowIndex) {
    return new GroupKey(evaluator.hash(rowIndex), rowIndex);
  }

  public RowKeyEvaluator getEvaluator() {
    return evaluator;
  }
}

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

import org.eclipse.collections.api.block.HashingStrategy;

/**
 * Equality view of a {@link RowKeyEvaluator}. Two keys are equal only if their hashes match and the key values of their rows are
 * pairwise equal: the hash alone never decides. Used as the {@link HashingStrategy} of the per-worker group dictionaries.
 */
public final class RowEqualityComparer implements HashingStrategy<GroupKey> {
  private final transient RowKeyEvaluator evaluator;

  RowEqualityComparer(final RowKeyEvaluator evaluator) {
    this.evaluator = evaluator;
  }

  @Override
  public int computeHashCode(final GroupKey key) {
    return key.getHash();
  }

  @Override
  public boolean equals(final GroupKey key1, final GroupKey key2) {
    if (key1 == key2)
      return true;
    return key1.getHash() == key2.getHash() && evaluator.rowsEqual(key1.getRow(), key2.getRow());
  }

  public boolean rowsEqual(final int rowIndexA, final int rowIndexB) {
    return evaluator.rowsEqual(rowIndexA, rowIndexB);
  }

  public RowKeyEvaluator getEvaluator() {
    return evaluator;
  }
}

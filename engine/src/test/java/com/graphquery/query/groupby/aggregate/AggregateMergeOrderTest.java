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
package com.graphquery.query.groupby.aggregate;

import com.graphquery.query.expression.ColumnReference;
import com.graphquery.query.expression.ValueType;
import com.graphquery.query.result.TableResults;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Splits the rows in random partitions, folds every partition on its own and merges the partial states in random order. The
 * result must not depend on the split nor on the order.
 */
class AggregateMergeOrderTest {
  private static final int ROWS   = 2_000;
  private static final int ROUNDS = 20;

  @ParameterizedTest
  @EnumSource(AggregateFunction.class)
  void mergeOrderDoesNotChangeTheResult(final AggregateFunction function) {
    final Random random = new Random(function.ordinal() * 31L + 7);
    final TableResults table = new TableResults("n");
    for (int i = 0; i < ROWS; i++)
      table.addRow(random.nextInt(10) == 0 ? null : (long) random.nextInt(2_000) - 1_000);

    final Aggregate aggregate = Aggregate.create(function, new ColumnReference(0, ValueType.INTEGER));

    final AggregateBucket whole = aggregate.createBucket();
    for (int i = 0; i < ROWS; i++)
      aggregate.apply(table.getRow(i), whole);
    final Object expected = aggregate.getFinal(whole);

    for (int round = 0; round < ROUNDS; round++) {
      final int partitions = 1 + random.nextInt(12);
      final List<AggregateBucket> buckets = new ArrayList<>();
      final AggregateList list = aggregate.createList();
      final AggregateArray array = aggregate.createArray(1);
      array.ensureCapacity(partitions);
      for (int p = 0; p < partitions; p++)
        buckets.add(aggregate.createBucket());

      for (int i = 0; i < ROWS; i++) {
        final int p = random.nextInt(partitions);
        aggregate.apply(table.getRow(i), buckets.get(p));
        aggregate.apply(table.getRow(i), list, p);
        aggregate.apply(table.getRow(i), array, p);
      }

      final List<Integer> order = new ArrayList<>();
      for (int p = 0; p < partitions; p++)
        order.add(p);
      Collections.shuffle(order, random);

      final AggregateBucket merged = aggregate.createBucket();
      final AggregateBucket mergedThreadSafe = aggregate.createBucket();
      final AggregateList mergedList = aggregate.createList();
      final AggregateArray mergedArray = aggregate.createArray(1);
      for (final int p : order) {
        aggregate.merge(merged, buckets.get(p));
        aggregate.mergeThreadSafe(mergedThreadSafe, buckets.get(p));
        if (p < list.size())
          aggregate.merge(mergedList, 0, list, p);
        aggregate.merge(mergedArray, 0, array, p);
      }

      assertThat(aggregate.getFinal(merged)).as("round %d", round).isEqualTo(expected);
      assertThat(aggregate.getFinal(mergedThreadSafe)).as("round %d thread safe", round).isEqualTo(expected);
      assertThat(aggregate.getFinal(mergedList, 0)).as("round %d list", round).isEqualTo(expected);
      assertThat(aggregate.getFinal(mergedArray, 0)).as("round %d array", round).isEqualTo(expected);
    }
  }
}

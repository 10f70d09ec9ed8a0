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
package com.graphquery.query.groupby.result;

import com.graphquery.query.expression.ColumnReference;
import com.graphquery.query.expression.ValueType;
import com.graphquery.query.groupby.aggregate.Aggregate;
import com.graphquery.query.groupby.aggregate.AggregateArray;
import com.graphquery.query.groupby.aggregate.AggregateBucket;
import com.graphquery.query.groupby.aggregate.AggregateFunction;
import com.graphquery.query.groupby.aggregate.AggregateList;
import com.graphquery.query.groupby.key.GroupKey;
import com.graphquery.query.result.TableResults;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GroupResultsTest {
  private TableResults    table;
  private List<Aggregate> aggregates;

  @BeforeEach
  void setUp() {
    table = new TableResults("k", "v");
    table.addRow("a", 1);
    table.addRow("b", 2);
    table.addRow("a", 3);

    final ColumnReference v = new ColumnReference(1, ValueType.INTEGER, "v");
    aggregates = List.of(Aggregate.create(AggregateFunction.SUM, v), Aggregate.create(AggregateFunction.MAX, v));
  }

  @Test
  void bucketsAreReadOnce() {
    final AggregateBucket[] a = new AggregateBucket[] { aggregates.get(0).createBucket(), aggregates.get(1).createBucket() };
    final AggregateBucket[] b = new AggregateBucket[] { aggregates.get(0).createBucket(), aggregates.get(1).createBucket() };
    for (final int row : new int[] { 0, 2 })
      for (int i = 0; i < 2; i++)
        aggregates.get(i).apply(table.getRow(row), a[i]);
    for (int i = 0; i < 2; i++)
      aggregates.get(i).apply(table.getRow(1), b[i]);

    final AtomicInteger reads = new AtomicInteger();
    final BucketGroupResults results = new BucketGroupResults(table, aggregates, consumer -> {
      reads.incrementAndGet();
      consumer.accept(new GroupKey(1, 0), a);
      consumer.accept(new GroupKey(2, 1), b);
    }, 2);

    assertThat(results.size()).isEqualTo(2);
    final List<String> first = results.stream().map(GroupResult::toString).collect(Collectors.toList());
    final List<String> second = new ArrayList<>();
    for (final GroupResult group : results)
      second.add(group.toString());

    assertThat(first).containsExactly("GroupResult{row=0, values=[4, 3]}", "GroupResult{row=1, values=[2, 2]}");
    assertThat(second).isEqualTo(first);
    assertThat(results.toList()).isSameAs(results.toList());
    assertThat(reads.get()).isEqualTo(1);
    assertThat(results.getAggregates()).isEqualTo(aggregates);
  }

  @Test
  void listsAndArraysAreResolvedByPosition() {
    final AggregateList[] lists = new AggregateList[] { aggregates.get(0).createList(), aggregates.get(1).createList() };
    final AggregateArray[] arrays = new AggregateArray[] { aggregates.get(0).createArray(2), aggregates.get(1).createArray(2) };
    for (int i = 0; i < 2; i++) {
      aggregates.get(i).apply(table.getRow(1), lists[i], 0);
      aggregates.get(i).apply(table.getRow(0), lists[i], 1);
      aggregates.get(i).apply(table.getRow(2), lists[i], 1);
      aggregates.get(i).apply(table.getRow(1), arrays[i], 0);
      aggregates.get(i).apply(table.getRow(0), arrays[i], 1);
      aggregates.get(i).apply(table.getRow(2), arrays[i], 1);
    }

    final GroupSource<Integer> positions = consumer -> {
      consumer.accept(new GroupKey(1, 1), 0);
      consumer.accept(new GroupKey(2, 0), 1);
    };

    for (final AbstractGroupResults results : new AbstractGroupResults[] { new ListGroupResults(table, aggregates, positions, lists, 2),
        new ArrayGroupResults(table, aggregates, positions, arrays, 2) }) {
      final List<GroupResult> groups = results.toList();
      assertThat(groups).hasSize(2);
      assertThat(groups.get(0).getRepresentativeIndex()).isEqualTo(1);
      assertThat(groups.get(0).getValues()).containsExactly(2L, 2L);
      assertThat(groups.get(1).getRepresentativeIndex()).isEqualTo(0);
      assertThat(groups.get(1).getValues()).containsExactly(4L, 3L);
      assertThatThrownBy(() -> groups.add(groups.get(0))).isInstanceOf(UnsupportedOperationException.class);
    }
  }

  @Test
  void emptyResults() {
    final EmptyGroupResults results = new EmptyGroupResults(table, aggregates);
    assertThat(results.size()).isZero();
    assertThat(results.isEmpty()).isTrue();
    assertThat(results.stream().count()).isZero();
  }

  @Test
  void groupResultValuesAreCopied() {
    final GroupResult group = new GroupResult(table.getRow(2), new Object[] { 1L, "x" });
    group.getValues()[0] = 99L;

    assertThat(group.getValue(0)).isEqualTo(1L);
    assertThat(group.getValueCount()).isEqualTo(2);
    assertThat(group.getRepresentative().getValue(0)).isEqualTo("a");
  }
}

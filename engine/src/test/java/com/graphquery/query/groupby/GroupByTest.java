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

import com.graphquery.ContextConfiguration;
import com.graphquery.GlobalConfiguration;
import com.graphquery.exception.ConfigurationException;
import com.graphquery.query.expression.ColumnReference;
import com.graphquery.query.expression.Expression;
import com.graphquery.query.expression.ValueType;
import com.graphquery.query.groupby.aggregate.Aggregate;
import com.graphquery.query.groupby.aggregate.AggregateFunction;
import com.graphquery.query.groupby.result.GroupResult;
import com.graphquery.query.groupby.result.GroupResults;
import com.graphquery.query.result.TableResults;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GroupByTest {
  private static final Expression K = new ColumnReference(0, ValueType.INTEGER, "k");
  private static final Expression V = new ColumnReference(1, ValueType.INTEGER, "v");

  private static TableResults table(final Object[]... rows) {
    final TableResults table = new TableResults("k", "v");
    for (final Object[] row : rows)
      table.addRow(row);
    return table;
  }

  private static Map<List<Object>, List<Object>> group(final TableResults table, final Aggregate aggregate, final GroupingStrategy strategy,
      final AggregateStorage storage, final int threads) {
    final GroupResults results = new GroupBy(List.of(aggregate), List.of(K), GroupingTestSupport.configuration(strategy, storage, threads)).execute(
        table);
    return GroupingTestSupport.byKey(results, List.of(K));
  }

  private static List<Object> key(final long k) {
    return List.of(k);
  }

  @Test
  void sumSingleThread() {
    final TableResults table = table(new Object[] { 1, 10 }, new Object[] { 1, 20 }, new Object[] { 2, 5 });
    for (final GroupingStrategy strategy : GroupingStrategy.values())
      assertThat(group(table, Aggregate.create(AggregateFunction.SUM, V), strategy, AggregateStorage.BUCKETS, 1)).isEqualTo(
          Map.of(key(1), List.of(30L), key(2), List.of(5L)));
  }

  @ParameterizedTest
  @EnumSource(AggregateStorage.class)
  void sumOneRowPerWorker(final AggregateStorage storage) {
    final TableResults table = table(new Object[] { 1, 10 }, new Object[] { 1, 20 }, new Object[] { 2, 5 });
    assertThat(group(table, Aggregate.create(AggregateFunction.SUM, V), GroupingStrategy.LOCAL_MERGE, storage, 3)).isEqualTo(
        Map.of(key(1), List.of(30L), key(2), List.of(5L)));
  }

  @ParameterizedTest
  @EnumSource(GroupingStrategy.class)
  void avgIgnoresMissingValues(final GroupingStrategy strategy) {
    final TableResults table = table(new Object[] { 1, null }, new Object[] { 1, 4 });
    assertThat(group(table, Aggregate.create(AggregateFunction.AVG, V), strategy, AggregateStorage.ARRAYS, 2)).isEqualTo(
        Map.of(key(1), List.of(4.0d)));
  }

  @ParameterizedTest
  @EnumSource(GroupingStrategy.class)
  void maxWithTwoRacingWorkers(final GroupingStrategy strategy) {
    for (int i = 0; i < 50; i++) {
      final TableResults table = i % 2 == 0 ? table(new Object[] { 1, 3 }, new Object[] { 1, 7 }) : table(new Object[] { 1, 7 },
          new Object[] { 1, 3 });
      final AggregateStorage storage = i % 3 == 0 ? AggregateStorage.ARRAYS : AggregateStorage.BUCKETS;
      assertThat(group(table, Aggregate.create(AggregateFunction.MAX, V), strategy, storage, 2)).isEqualTo(Map.of(key(1), List.of(7L)));
    }
  }

  @ParameterizedTest
  @EnumSource(GroupingStrategy.class)
  void zeroRowsGiveZeroGroups(final GroupingStrategy strategy) {
    final GroupResults results = new GroupBy(List.of(Aggregate.create(AggregateFunction.COUNT, null)), List.of(K),
        GroupingTestSupport.configuration(strategy, AggregateStorage.BUCKETS, 4)).execute(table());

    assertThat(results.size()).isZero();
    assertThat(results.isEmpty()).isTrue();
    assertThat(results.iterator().hasNext()).isFalse();
  }

  @ParameterizedTest
  @EnumSource(GroupingStrategy.class)
  void moreThreadsThanRowsIsRejected(final GroupingStrategy strategy) {
    final TableResults table = table(new Object[] { 1, 1 }, new Object[] { 2, 2 }, new Object[] { 3, 3 });
    final GroupBy groupBy = new GroupBy(List.of(Aggregate.create(AggregateFunction.SUM, V)), List.of(K),
        GroupingTestSupport.configuration(strategy, AggregateStorage.BUCKETS, 4));

    assertThatThrownBy(() -> groupBy.execute(table)).isInstanceOf(ConfigurationException.class).hasMessageContaining("4 grouping threads");
  }

  @Test
  void minMaxWithoutValuesReportNull() {
    final TableResults table = table(new Object[] { 1, null }, new Object[] { 1, "x" }, new Object[] { 2, 9 });
    final List<Aggregate> aggregates = List.of(Aggregate.create(AggregateFunction.MIN, V), Aggregate.create(AggregateFunction.MAX, V),
        Aggregate.create(AggregateFunction.SUM, V), Aggregate.create(AggregateFunction.COUNT, V));

    for (final AggregateStorage storage : AggregateStorage.values()) {
      final GroupResults results = new GroupBy(aggregates, List.of(K),
          GroupingTestSupport.configuration(GroupingStrategy.GLOBAL_MERGE, storage, 2)).execute(table);
      assertThat(GroupingTestSupport.byKey(results, List.of(K))).isEqualTo(
          Map.of(key(1), Arrays.asList(null, null, null, 0L), key(2), List.of(9L, 9L, 9L, 1L)));
    }
  }

  @Test
  void noKeysGiveOneGroup() {
    final TableResults table = table(new Object[] { 1, 10 }, new Object[] { 1, null }, new Object[] { 2, 5 });
    final GroupBy groupBy = new GroupBy(List.of(Aggregate.create(AggregateFunction.COUNT, null), Aggregate.create(AggregateFunction.AVG, V)),
        Collections.emptyList());
    assertThat(groupBy.isGrouped()).isFalse();

    final List<GroupResult> groups = groupBy.execute(table).stream().collect(Collectors.toList());
    assertThat(groups).hasSize(1);
    assertThat(groups.get(0).getValues()).containsExactly(3L, 7.5d);
    assertThat(groups.get(0).getRepresentativeIndex()).isEqualTo(0);
  }

  @Test
  void invalidCombinationsFailAtConstruction() {
    final List<Aggregate> aggregates = List.of(Aggregate.create(AggregateFunction.COUNT, null));

    assertThatThrownBy(() -> new GroupBy(aggregates, List.of(K),
        GroupingTestSupport.configuration(GroupingStrategy.GLOBAL, AggregateStorage.LISTS, 2))).isInstanceOf(ConfigurationException.class);

    final ContextConfiguration zeroThreads = new ContextConfiguration();
    zeroThreads.setValue(GlobalConfiguration.GROUP_BY_THREADS, 0);
    assertThatThrownBy(() -> new GroupBy(aggregates, List.of(K), zeroThreads)).isInstanceOf(ConfigurationException.class);
    assertThatThrownBy(() -> new GroupBy(aggregates, Collections.emptyList(), zeroThreads)).isInstanceOf(ConfigurationException.class);

    final ContextConfiguration badArrays = GroupingTestSupport.configuration(GroupingStrategy.GLOBAL, AggregateStorage.ARRAYS, 1);
    badArrays.setValue(GlobalConfiguration.GROUP_BY_ARRAY_INITIAL_SIZE, 0);
    assertThatThrownBy(() -> new GroupBy(aggregates, List.of(K), badArrays)).isInstanceOf(ConfigurationException.class);
  }

  @Test
  void facadeCanRunManyTimes() {
    final TableResults table = table(new Object[] { 1, 10 }, new Object[] { 2, 20 });
    final GroupBy groupBy = new GroupBy(List.of(Aggregate.create(AggregateFunction.SUM, V)), List.of(K),
        GroupingTestSupport.configuration(GroupingStrategy.GLOBAL, AggregateStorage.ARRAYS, 2));

    assertThat(groupBy.isGrouped()).isTrue();
    assertThat(groupBy.execute(table).size()).isEqualTo(2);
    assertThat(groupBy.execute(table).size()).isEqualTo(2);
  }

  @Test
  void configurationIsCopiedAtConstruction() {
    final ContextConfiguration configuration = GroupingTestSupport.configuration(GroupingStrategy.LOCAL_MERGE, AggregateStorage.LISTS, 1);
    final GroupBy groupBy = new GroupBy(List.of(Aggregate.create(AggregateFunction.SUM, V)), List.of(K), configuration);

    configuration.setValue(GlobalConfiguration.GROUP_BY_THREADS, 10);

    final TableResults table = table(new Object[] { 1, 10 }, new Object[] { 2, 20 });
    assertThat(groupBy.execute(table).size()).isEqualTo(2);
  }
}

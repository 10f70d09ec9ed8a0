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

import com.graphquery.query.expression.ColumnReference;
import com.graphquery.query.expression.Expression;
import com.graphquery.query.expression.ValueType;
import com.graphquery.query.result.Row;
import com.graphquery.query.result.TableResults;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RowKeyEvaluatorTest {
  private TableResults table;

  @BeforeEach
  void setUp() {
    table = new TableResults("name", "age");
    table.addRow("Aa", 1);
    table.addRow("BB", 1);
    table.addRow("Aa", 1);
    table.addRow(null, 1);
    table.addRow(null, null);
    table.addRow("Aa", 2);
  }

  private static List<Expression> keys() {
    return List.of(new ColumnReference(0, ValueType.STRING, "name"), new ColumnReference(1, ValueType.INTEGER, "age"));
  }

  @Test
  void equalKeysHaveEqualHashes() {
    final RowHasher hasher = new RowKeyEvaluator(table, keys(), true).getHasher();
    assertThat(hasher.hash(0)).isEqualTo(hasher.hash(2));
    assertThat(hasher.keyOf(2).getRow()).isEqualTo(2);
    assertThat(hasher.keyOf(2).getHash()).isEqualTo(hasher.hash(0));
  }

  @Test
  void nullValuesHashToZero() {
    final RowKeyEvaluator evaluator = new RowKeyEvaluator(table, keys(), false);
    final int expected = RowKeyEvaluator.combine(RowKeyEvaluator.combine(5381, null), 1L);
    assertThat(evaluator.getHasher().hash(3)).isEqualTo(expected);
    assertThat(RowKeyEvaluator.combine(5381, null)).isEqualTo(5381 * 33);
  }

  @Test
  void collidingHashesAreStillDifferentGroups() {
    assertThat("Aa".hashCode()).isEqualTo("BB".hashCode());

    final RowKeyEvaluator evaluator = new RowKeyEvaluator(table, keys(), true);
    final RowHasher hasher = evaluator.getHasher();
    final RowEqualityComparer comparer = evaluator.getComparer();

    final GroupKey aa = hasher.keyOf(0);
    final GroupKey bb = hasher.keyOf(1);
    assertThat(aa.getHash()).isEqualTo(bb.getHash());
    assertThat(comparer.equals(aa, bb)).isFalse();
    assertThat(comparer.equals(aa, hasher.keyOf(2))).isTrue();
    assertThat(comparer.computeHashCode(aa)).isEqualTo(aa.getHash());
  }

  @Test
  void nullsAreEqualToNulls() {
    final RowEqualityComparer comparer = new RowKeyEvaluator(table, keys(), false).getComparer();
    assertThat(comparer.rowsEqual(3, 4)).isFalse();
    assertThat(comparer.rowsEqual(0, 5)).isFalse();

    final TableResults nulls = new TableResults("a");
    nulls.addRow((Object) null);
    nulls.addRow((Object) null);
    assertThat(new RowKeyEvaluator(nulls, keys().subList(0, 1), false).getComparer().rowsEqual(0, 1)).isTrue();
  }

  @Test
  void groupKeyEqualityIsIdentity() {
    final GroupKey key = new GroupKey(7, 1);
    assertThat(key).isEqualTo(key);
    assertThat(key).isNotEqualTo(new GroupKey(7, 1));
    assertThat(key.hashCode()).isEqualTo(7);
  }

  @Test
  void cacheAvoidsEvaluatingTheHashedRowAgain() {
    final AtomicInteger evaluations = new AtomicInteger();
    final Expression counting = new CountingExpression(new ColumnReference(0, ValueType.STRING), evaluations);

    final RowKeyEvaluator cached = new RowKeyEvaluator(table, List.of(counting), true);
    final GroupKey probe = cached.getHasher().keyOf(2);
    assertThat(cached.getComparer().equals(probe, new GroupKey(probe.getHash(), 0))).isTrue();
    assertThat(evaluations.get()).isEqualTo(2);

    evaluations.set(0);
    final RowKeyEvaluator uncached = cached.copy(false);
    final GroupKey probe2 = uncached.getHasher().keyOf(2);
    assertThat(uncached.getComparer().equals(probe2, new GroupKey(probe2.getHash(), 0))).isTrue();
    assertThat(evaluations.get()).isEqualTo(3);
  }

  @Test
  void copiesHaveIndependentCaches() {
    final RowKeyEvaluator original = new RowKeyEvaluator(table, keys(), true);
    final RowKeyEvaluator copy = original.copy(true);

    assertThat(copy).isNotSameAs(original);
    assertThat(copy.getHasher().getEvaluator()).isSameAs(copy);
    assertThat(copy.getComparer().getEvaluator()).isSameAs(copy);
    assertThat(copy.getExpressionCount()).isEqualTo(2);

    original.getHasher().hash(0);
    copy.getHasher().hash(1);
    assertThat(original.getComparer().rowsEqual(0, 2)).isTrue();
    assertThat(copy.getComparer().rowsEqual(1, 2)).isFalse();
    assertThat(copy.getComparer().rowsEqual(0, 2)).isTrue();
  }

  @Test
  void atLeastOneExpression() {
    assertThatThrownBy(() -> new RowKeyEvaluator(table, Collections.emptyList(), true)).isInstanceOf(IllegalArgumentException.class);
  }

  private static final class CountingExpression implements Expression {
    private final Expression    delegate;
    private final AtomicInteger evaluations;

    private CountingExpression(final Expression delegate, final AtomicInteger evaluations) {
      this.delegate = delegate;
      this.evaluations = evaluations;
    }

    @Override
    public ValueType getType() {
      return delegate.getType();
    }

    @Override
    public Object evaluate(final Row row) {
      evaluations.incrementAndGet();
      return delegate.evaluate(row);
    }

    @Override
    public String getName() {
      return "counting(" + delegate.getName() + ")";
    }
  }
}

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

import com.graphquery.query.groupby.aggregate.Aggregate;

import java.util.List;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Final groups of a grouping run, consumed by the ordering and printing stages. Reading is idempotent: the groups and their values
 * never change after the run completed, whatever the number of reads.
 */
public interface GroupResults extends Iterable<GroupResult> {
  /**
   * @return number of groups
   */
  int size();

  default boolean isEmpty() {
    return size() == 0;
  }

  /**
   * @return the aggregates, in the order of the values of every {@link GroupResult}
   */
  List<Aggregate> getAggregates();

  default Stream<GroupResult> stream() {
    return StreamSupport.stream(Spliterators.spliterator(iterator(), size(), Spliterator.SIZED | Spliterator.NONNULL), false);
  }
}

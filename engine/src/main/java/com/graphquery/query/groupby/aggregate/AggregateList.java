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

import org.eclipse.collections.impl.list.mutable.FastList;
import org.eclipse.collections.impl.list.mutable.primitive.BooleanArrayList;
import org.eclipse.collections.impl.list.mutable.primitive.LongArrayList;

/**
 * Partial state of one aggregate for all the groups of a worker, indexed by group ordinal. Entries are appended lazily the first
 * time an ordinal is used. Only the slots needed by the owning aggregate are allocated. Not thread safe: a list is always owned by
 * one worker.
 */
public final class AggregateList {
  private final LongArrayList    values;
  private final LongArrayList    counts;
  private final FastList<Object> references;
  private final BooleanArrayList flags;
  private       int              size;

  public AggregateList(final StorageSlots slots) {
    this.values = slots.hasValues() ? new LongArrayList() : null;
    this.counts = slots.hasCounts() ? new LongArrayList() : null;
    this.references = slots.hasReferences() ? FastList.newList() : null;
    this.flags = slots.hasFlags() ? new BooleanArrayList() : null;
  }

  public int size() {
    return size;
  }

  /**
   * Appends empty entries until the list holds at least {@code newSize} entries.
   */
  public void ensureSize(final int newSize) {
    while (size < newSize) {
      if (values != null)
        values.add(0L);
      if (counts != null)
        counts.add(0L);
      if (references != null)
        references.add(null);
      if (flags != null)
        flags.add(false);
      ++size;
    }
  }

  public long getValue(final int position) {
    return values.get(position);
  }

  public void setValue(final int position, final long value) {
    values.set(position, value);
  }

  public void addValue(final int position, final long delta) {
    values.set(position, values.get(position) + delta);
  }

  public long getCount(final int position) {
    return counts.get(position);
  }

  public void addCount(final int position, final long delta) {
    counts.set(position, counts.get(position) + delta);
  }

  public Object getReference(final int position) {
    return references.get(position);
  }

  public void setReference(final int position, final Object reference) {
    references.set(position, reference);
  }

  public boolean isSet(final int position) {
    return flags.get(position);
  }

  public void markSet(final int position) {
    flags.set(position, true);
  }
}

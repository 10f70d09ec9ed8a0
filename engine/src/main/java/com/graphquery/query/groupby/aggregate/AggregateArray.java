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

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.util.Arrays;

/**
 * Partial state of one aggregate for many groups, indexed by group ordinal, backed by pre-allocated arrays. Used by workers whose
 * group count is bounded by the size of their row range, and by the shared arrays of the global strategy.
 * <p>
 * The atomic accessors use array element {@link VarHandle}s. {@link #ensureCapacity(int)} replaces the backing arrays: callers
 * sharing an instance must exclude updates while it runs.
 */
public final class AggregateArray {
  private static final VarHandle LONGS   = MethodHandles.arrayElementVarHandle(long[].class);
  private static final VarHandle OBJECTS = MethodHandles.arrayElementVarHandle(Object[].class);
  private static final VarHandle FLAGS   = MethodHandles.arrayElementVarHandle(boolean[].class);

  private long[]    values;
  private long[]    counts;
  private Object[]  references;
  private boolean[] flags;
  private int       capacity;

  public AggregateArray(final StorageSlots slots, final int capacity) {
    if (capacity < 1)
      throw new IllegalArgumentException("Invalid capacity " + capacity);
    this.capacity = capacity;
    this.values = slots.hasValues() ? new long[capacity] : null;
    this.counts = slots.hasCounts() ? new long[capacity] : null;
    this.references = slots.hasReferences() ? new Object[capacity] : null;
    this.flags = slots.hasFlags() ? new boolean[capacity] : null;
  }

  public int capacity() {
    return capacity;
  }

  /**
   * Grows the arrays, at least doubling them, so that {@code minCapacity} entries fit.
   */
  public void ensureCapacity(final int minCapacity) {
    if (minCapacity <= capacity)
      return;

    int newCapacity = capacity;
    while (newCapacity < minCapacity)
      newCapacity = newCapacity > Integer.MAX_VALUE / 2 ? Integer.MAX_VALUE : newCapacity * 2;

    if (values != null)
      values = Arrays.copyOf(values, newCapacity);
    if (counts != null)
      counts = Arrays.copyOf(counts, newCapacity);
    if (references != null)
      references = Arrays.copyOf(references, newCapacity);
    if (flags != null)
      flags = Arrays.copyOf(flags, newCapacity);
    capacity = newCapacity;
  }

  public long getValue(final int position) {
    return values[position];
  }

  public void setValue(final int position, final long value) {
    values[position] = value;
  }

  public void addValue(final int position, final long delta) {
    values[position] += delta;
  }

  public long getValueVolatile(final int position) {
    return (long) LONGS.getVolatile(values, position);
  }

  public void addValueAtomic(final int position, final long delta) {
    LONGS.getAndAdd(values, position, delta);
  }

  public boolean compareAndSetValue(final int position, final long expected, final long update) {
    return LONGS.compareAndSet(values, position, expected, update);
  }

  public long getCount(final int position) {
    return counts[position];
  }

  public void addCount(final int position, final long delta) {
    counts[position] += delta;
  }

  public void addCountAtomic(final int position, final long delta) {
    LONGS.getAndAdd(counts, position, delta);
  }

  public Object getReference(final int position) {
    return references[position];
  }

  public void setReference(final int position, final Object reference) {
    references[position] = reference;
  }

  public Object getReferenceVolatile(final int position) {
    return OBJECTS.getVolatile(references, position);
  }

  public boolean compareAndSetReference(final int position, final Object expected, final Object update) {
    return OBJECTS.compareAndSet(references, position, expected, update);
  }

  public boolean isSet(final int position) {
    return flags[position];
  }

  public boolean isSetVolatile(final int position) {
    return (boolean) FLAGS.getVolatile(flags, position);
  }

  public void markSet(final int position) {
    flags[position] = true;
  }

  /**
   * Volatile write of the flag, so a thread observing it set also observes the value written before.
   */
  public void markSetVolatile(final int position) {
    FLAGS.setVolatile(flags, position, true);
  }
}

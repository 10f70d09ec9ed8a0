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

/**
 * Mutable cell holding the partial state of one aggregate for one group. Every aggregate uses a subset of the slots:
 * <ul>
 *   <li>count, sum: {@code value} (running total) and {@code count} (contributing rows)</li>
 *   <li>avg: {@code value} (running sum) and {@code count} (contributing rows)</li>
 *   <li>integer min/max: {@code value} and the {@code set} flag</li>
 *   <li>string min/max: {@code reference} and the {@code set} flag</li>
 * </ul>
 * Plain accessors are for single-threaded use. The atomic accessors are backed by {@link VarHandle}s and can be mixed across
 * threads on the same instance.
 */
public final class AggregateBucket {
  private static final VarHandle VALUE;
  private static final VarHandle COUNT;
  private static final VarHandle REFERENCE;

  static {
    try {
      final MethodHandles.Lookup lookup = MethodHandles.lookup();
      VALUE = lookup.findVarHandle(AggregateBucket.class, "value", long.class);
      COUNT = lookup.findVarHandle(AggregateBucket.class, "count", long.class);
      REFERENCE = lookup.findVarHandle(AggregateBucket.class, "reference", Object.class);
    } catch (final ReflectiveOperationException e) {
      throw new ExceptionInInitializerError(e);
    }
  }

  private          long    value;
  private          long    count;
  private          Object  reference;
  private volatile boolean set;

  public long getValue() {
    return value;
  }

  public void setValue(final long value) {
    this.value = value;
  }

  public void addValue(final long delta) {
    value += delta;
  }

  public long getValueVolatile() {
    return (long) VALUE.getVolatile(this);
  }

  public void addValueAtomic(final long delta) {
    VALUE.getAndAdd(this, delta);
  }

  public boolean compareAndSetValue(final long expected, final long update) {
    return VALUE.compareAndSet(this, expected, update);
  }

  public long getCount() {
    return count;
  }

  public void addCount(final long delta) {
    count += delta;
  }

  public void addCountAtomic(final long delta) {
    COUNT.getAndAdd(this, delta);
  }

  public Object getReference() {
    return reference;
  }

  public void setReference(final Object reference) {
    this.reference = reference;
  }

  public Object getReferenceVolatile() {
    return REFERENCE.getVolatile(this);
  }

  public boolean compareAndSetReference(final Object expected, final Object update) {
    return REFERENCE.compareAndSet(this, expected, update);
  }

  public boolean isSet() {
    return set;
  }

  /**
   * Marks the slot as holding a value. The write is volatile: everything written before it is visible to a thread that reads
   * {@code isSet() == true}.
   */
  public void markSet() {
    set = true;
  }

  @Override
  public String toString() {
    return "AggregateBucket{value=" + value + ", count=" + count + ", reference=" + reference + ", set=" + set + "}";
  }
}

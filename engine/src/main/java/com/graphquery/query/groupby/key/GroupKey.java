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
 * Identifies a group: the combined hash of the grouping-key values plus the index of a representative row in the shared result
 * table. Equality is never decided by this class: it goes through a {@link RowEqualityComparer}, which compares the key values of
 * the referenced rows.
 */
public final class GroupKey {
  private final int hash;
  private final int row;

  public GroupKey(final int hash, final int row) {
    this.hash = hash;
    this.row = row;
  }

  public int getHash() {
    return hash;
  }

  public int getRow() {
    return row;
  }

  @Override
  public int hashCode() {
    return hash;
  }

  @Override
  public boolean equals(final Object obj) {
    // IDENTITY ONLY: VALUE EQUALITY NEEDS THE EXPRESSIONS, SEE RowEqualityComparer
    return this == obj;
  }

  @Override
  public String toString() {
    return "GroupKey{hash=" + hash + ", row=" + row + "}";
  }
}

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

/**
 * Slots of the storage units an aggregate needs. List and array storages allocate only these.
 */
public enum StorageSlots {
  VALUE_AND_COUNT(true, true, false, false),
  VALUE_AND_FLAG(true, false, false, true),
  REFERENCE_AND_FLAG(false, false, true, true);

  private final boolean values;
  private final boolean counts;
  private final boolean references;
  private final boolean flags;

  StorageSlots(final boolean values, final boolean counts, final boolean references, final boolean flags) {
    this.values = values;
    this.counts = counts;
    this.references = references;
    this.flags = flags;
  }

  public boolean hasValues() {
    return values;
  }

  public boolean hasCounts() {
    return counts;
  }

  public boolean hasReferences() {
    return references;
  }

  public boolean hasFlags() {
    return flags;
  }
}

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
package com.graphquery.query.expression;

/**
 * Types of the values produced by expressions. Integers are always surfaced as {@link Long}.
 */
public enum ValueType {
  INTEGER {
    @Override
    public Object coerce(final Object value) {
      if (value instanceof Long)
        return value;
      if (value instanceof Integer || value instanceof Short || value instanceof Byte)
        return ((Number) value).longValue();
      return null;
    }
  },

  STRING {
    @Override
    public Object coerce(final Object value) {
      return value instanceof String ? value : null;
    }
  },

  /**
   * Any non null value, compared with {@link Object#equals(Object)}. Usable as grouping key or with count only.
   */
  ANY {
    @Override
    public Object coerce(final Object value) {
      return value;
    }
  };

  /**
   * Converts a raw column or property value to this type.
   *
   * @return the converted value or null if the value does not belong to this type
   */
  public abstract Object coerce(Object value);
}

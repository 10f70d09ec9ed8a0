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

import com.graphquery.exception.ConfigurationException;
import com.graphquery.exception.ErrorCode;

import java.util.Locale;

/**
 * Aggregate functions supported in the projection of a grouped query.
 */
public enum AggregateFunction {
  COUNT("count"), SUM("sum"), AVG("avg"), MIN("min"), MAX("max");

  private final String name;

  AggregateFunction(final String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  /**
   * Resolves a function by the name used in the query. Case insensitive.
   *
   * @throws ConfigurationException if the name is not an aggregate function
   */
  public static AggregateFunction fromName(final String name) {
    if (name != null) {
      final String lower = name.trim().toLowerCase(Locale.ENGLISH);
      for (final AggregateFunction f : values())
        if (f.name.equals(lower))
          return f;
    }
    throw new ConfigurationException(ErrorCode.QUERY_UNKNOWN_FUNCTION, "Unknown aggregate function '" + name + "'");
  }
}

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
package com.graphquery.exception;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Standardized error codes. The thousands digit(s) select the category:
 * <ul>
 *   <li>1xxx - Configuration errors</li>
 *   <li>3xxx - Query errors (expressions, aggregate definitions)</li>
 *   <li>4xxx - Grouping execution errors</li>
 *   <li>99xxx - Internal errors</li>
 * </ul>
 *
 * @see GraphQueryException
 */
public enum ErrorCode {
  // ========== Configuration Errors (1xxx) ==========
  /** Invalid value or combination of configuration settings */
  CONFIGURATION_INVALID(1001, "Invalid configuration"),

  /** Configuration key not recognized */
  CONFIGURATION_UNKNOWN_KEY(1002, "Unknown configuration key"),

  // ========== Query Errors (3xxx) ==========
  /** Aggregate function name not recognized */
  QUERY_UNKNOWN_FUNCTION(3001, "Unknown aggregate function"),

  /** Expression type not accepted by the aggregate */
  QUERY_TYPE_MISMATCH(3002, "Expression type mismatch"),

  // ========== Grouping Errors (4xxx) ==========
  /** A worker task failed while scanning or merging */
  GROUPING_FAILED(4001, "Grouping failed"),

  /** Grouper instance invoked in a state that does not allow it */
  GROUPING_INVALID_STATE(4002, "Invalid grouper state"),

  // ========== Internal Errors (99xxx) ==========
  /** Two structures disagree on the identity of the same group */
  MERGE_INCONSISTENCY(99001, "Merge inconsistency"),

  /** Unexpected internal error */
  INTERNAL_ERROR(99999, "Internal error");

  private static final Map<Integer, ErrorCode> CODE_MAP = Arrays.stream(values())
      .collect(Collectors.toMap(ErrorCode::getCode, Function.identity()));

  private final int    code;
  private final String defaultMessage;

  ErrorCode(final int code, final String defaultMessage) {
    this.code = code;
    this.defaultMessage = defaultMessage;
  }

  public int getCode() {
    return code;
  }

  public String getDefaultMessage() {
    return defaultMessage;
  }

  public ErrorCategory getCategory() {
    switch (code / 1000) {
    case 1:
      return ErrorCategory.CONFIGURATION;
    case 3:
      return ErrorCategory.QUERY;
    case 4:
      return ErrorCategory.GROUPING;
    default:
      return ErrorCategory.INTERNAL;
    }
  }

  /**
   * Finds an ErrorCode by its numeric code.
   *
   * @return the matching ErrorCode, or INTERNAL_ERROR if not found
   */
  public static ErrorCode fromCode(final int code) {
    return CODE_MAP.getOrDefault(code, INTERNAL_ERROR);
  }
}

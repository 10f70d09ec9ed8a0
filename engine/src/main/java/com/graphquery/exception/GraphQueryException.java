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

import com.google.gson.Gson;
import com.google.gson.JsonObject;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base exception class for all the engine exceptions. Carries a standardized error code and a diagnostic context.
 */
public class GraphQueryException extends RuntimeException {
  private static final Gson                GSON = new Gson();
  private final        ErrorCode           errorCode;
  private final        Map<String, Object> context;

  public GraphQueryException(final String message) {
    this(ErrorCode.INTERNAL_ERROR, message, null, null);
  }

  public GraphQueryException(final String message, final Throwable cause) {
    this(ErrorCode.INTERNAL_ERROR, message, cause, null);
  }

  public GraphQueryException(final ErrorCode errorCode, final String message) {
    this(errorCode, message, null, null);
  }

  public GraphQueryException(final ErrorCode errorCode, final String message, final Throwable cause) {
    this(errorCode, message, cause, null);
  }

  public GraphQueryException(final ErrorCode errorCode, final String message, final Throwable cause, final Map<String, Object> context) {
    super(message != null ? message : errorCode != null ? errorCode.getDefaultMessage() : null, cause);
    this.errorCode = errorCode != null ? errorCode : ErrorCode.INTERNAL_ERROR;
    this.context = context != null ? new LinkedHashMap<>(context) : new LinkedHashMap<>();
  }

  public ErrorCode getErrorCode() {
    return errorCode;
  }

  public ErrorCategory getErrorCategory() {
    return errorCode.getCategory();
  }

  /**
   * @return unmodifiable map of diagnostic information
   */
  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  /**
   * Adds a context entry to this exception.
   *
   * @return this exception for method chaining
   */
  public GraphQueryException addContext(final String key, final Object value) {
    if (key != null)
      this.context.put(key, value);
    return this;
  }

  public String toJSON() {
    final JsonObject json = new JsonObject();
    json.addProperty("errorCode", errorCode.getCode());
    json.addProperty("errorName", errorCode.name());
    json.addProperty("category", errorCode.getCategory().getDisplayName());
    json.addProperty("message", getMessage());

    if (!context.isEmpty()) {
      final JsonObject ctx = new JsonObject();
      for (final Map.Entry<String, Object> entry : context.entrySet()) {
        final Object value = entry.getValue();
        if (value == null || value instanceof Number || value instanceof Boolean)
          ctx.add(entry.getKey(), GSON.toJsonTree(value));
        else
          ctx.addProperty(entry.getKey(), value.toString());
      }
      json.add("context", ctx);
    }

    if (getCause() != null)
      json.addProperty("cause", String.valueOf(getCause().getMessage()));

    return GSON.toJson(json);
  }

  @Override
  public String toString() {
    return String.format("%s [%s-%d]: %s", getClass().getSimpleName(), errorCode.getCategory(), errorCode.getCode(), getMessage());
  }
}

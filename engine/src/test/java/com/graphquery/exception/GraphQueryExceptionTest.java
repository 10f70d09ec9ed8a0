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

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class GraphQueryExceptionTest {
  @Test
  void errorCodesMapToCategories() {
    assertThat(ErrorCode.CONFIGURATION_INVALID.getCategory()).isEqualTo(ErrorCategory.CONFIGURATION);
    assertThat(ErrorCode.QUERY_TYPE_MISMATCH.getCategory()).isEqualTo(ErrorCategory.QUERY);
    assertThat(ErrorCode.GROUPING_FAILED.getCategory()).isEqualTo(ErrorCategory.GROUPING);
    assertThat(ErrorCode.MERGE_INCONSISTENCY.getCategory()).isEqualTo(ErrorCategory.INTERNAL);
    assertThat(ErrorCode.fromCode(4001)).isEqualTo(ErrorCode.GROUPING_FAILED);
    assertThat(ErrorCode.fromCode(12345)).isEqualTo(ErrorCode.INTERNAL_ERROR);
  }

  @Test
  void configurationExceptionCarriesCodeAndContext() {
    final GraphQueryException e = new ConfigurationException("Too many threads").addContext("threads", 8).addContext("rows", 3);

    assertThat(e.getErrorCode()).isEqualTo(ErrorCode.CONFIGURATION_INVALID);
    assertThat(e.getErrorCategory()).isEqualTo(ErrorCategory.CONFIGURATION);
    assertThat(e.getContext()).containsEntry("threads", 8).containsEntry("rows", 3);
    assertThat(e.toString()).isEqualTo("ConfigurationException [Configuration-1001]: Too many threads");
  }

  @Test
  void toJSONIncludesContextAndCause() {
    final GraphQueryException e = new GroupingException("Worker failed \"badly\"", new IllegalStateException("boom"));
    e.addContext("strategy", "global");

    final String json = e.toJSON();

    assertThat(json).contains("\"errorCode\":4001")
        .contains("\"errorName\":\"GROUPING_FAILED\"")
        .contains("\"category\":\"Grouping\"")
        .contains("\"strategy\":\"global\"")
        .contains("\"cause\":\"boom\"")
        .contains("Worker failed \\\"badly\\\"");
  }
}

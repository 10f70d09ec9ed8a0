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
package com.graphquery.log;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.LogRecord;

import static org.assertj.core.api.Assertions.assertThat;

class LoggerTest {
  private final List<String> messages = new ArrayList<>();
  private       boolean      flushed  = false;

  @AfterEach
  void tearDown() {
    LogManager.instance().setLogger(new DefaultLogger());
    LogManager.instance().setContext(null);
  }

  @Test
  void customLoggerReceivesMessagesAndContext() {
    LogManager.instance().setLogger(new Logger() {
      @Override
      public void log(final Object requester, final Level level, final String message, final Throwable exception, final String context,
          final Object arg1, final Object arg2, final Object arg3, final Object arg4, final Object arg5, final Object arg6) {
        messages.add((context != null ? "<" + context + "> " : "") + String.format(message, arg1, arg2, arg3, arg4, arg5, arg6));
      }

      @Override
      public void log(final Object requester, final Level level, final String message, final Throwable exception, final String context,
          final Object... args) {
        messages.add(String.format(message, args));
      }

      @Override
      public void flush() {
        flushed = true;
      }
    });

    LogManager.instance().log(this, Level.FINE, "Grouped %d rows", 10);
    LogManager.instance().setContext("q1");
    LogManager.instance().log(this, Level.INFO, "Strategy %s", "global");
    LogManager.instance().flush();

    assertThat(messages).containsExactly("Grouped 10 rows", "<q1> Strategy global");
    assertThat(flushed).isTrue();
  }

  @Test
  void formatterWritesLevelAndRequester() {
    final LogRecord record = new LogRecord(Level.WARNING, "something happened");
    record.setLoggerName("com.graphquery.query.groupby.grouper.GlobalGroup");

    final String line = new LogFormatter().format(record);

    assertThat(line).contains("WARNING").contains("[GlobalGroup]").contains("something happened");
  }

  @Test
  void defaultLoggerDoesNotFailOnBadFormat() {
    final DefaultLogger logger = new DefaultLogger();
    logger.log(this, Level.SEVERE, "Broken %d format", null, null, "not a number", null, null, null, null, null);
    logger.log(this, Level.INFO, "Message without arguments", null, null);
  }
}

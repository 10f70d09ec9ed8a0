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

import java.util.logging.Level;

/**
 * Logger interface. The fixed-arity overload avoids allocating a varargs array on the hot paths.
 */
public interface Logger {
  void log(Object requester, Level level, String message, Throwable exception, String context, Object arg1, Object arg2, Object arg3,
      Object arg4, Object arg5, Object arg6);

  void log(Object requester, Level level, String message, Throwable exception, String context, Object... args);

  void flush();
}

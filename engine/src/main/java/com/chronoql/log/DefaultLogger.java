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
package com.chronoql.log;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Handler;
import java.util.logging.Level;

/**
 * Default Logger implementation that writes to the Java Logging Framework.
 * Set the property `java.util.logging.config.file` to the configuration file to use.
 */
public class DefaultLogger implements Logger {
  private static final String                                          DEFAULT_LOG  = "com.chronoql";
  private final        ConcurrentMap<String, java.util.logging.Logger> loggersCache = new ConcurrentHashMap<>();

  @Override
  public void log(final Object requester, final Level level, String message, final Throwable exception, final String context,
      final Object... args) {
    if (message == null)
      return;

    final java.util.logging.Logger log = loggersCache.computeIfAbsent(getRequesterName(requester), java.util.logging.Logger::getLogger);
    if (!log.isLoggable(level))
      return;

    try {
      if (context != null)
        message = "<" + context + "> " + message;

      String msg = message;
      if (args != null && args.length > 0)
        msg = String.format(message, args);

      if (exception != null)
        log.log(level, msg, exception);
      else
        log.log(level, msg);

      if (level == Level.SEVERE)
        flush();

    } catch (Exception e) {
      System.err.print(String.format("Error on formatting message '%s'. Exception: %s", message, e));
      System.err.flush();
    }
  }

  @Override
  public void flush() {
    for (Handler h : java.util.logging.Logger.getLogger("").getHandlers())
      h.flush();
  }

  static String getRequesterName(final Object requester) {
    if (requester instanceof String)
      return (String) requester;
    else if (requester instanceof Class<?>)
      return ((Class<?>) requester).getName();
    else if (requester != null)
      return requester.getClass().getName();
    return DEFAULT_LOG;
  }
}

/*
 * Copyright IBM Corp. 2025
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.terracotta.crest.matchers.registry;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.filter.ThresholdFilter;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * A {@link ListAppender} attached to a single {@link Logger} for the duration of a test.
 * <pre>{@code
 *   try (CapturingAppender appender = CapturingAppender.attach(LoggerFactory.getLogger(MatcherRegistry.class), Level.DEBUG)) {
 *     registry.register("even", factory);
 *     assertThat(appender.messages(), hasItem(containsString("even")));
 *   }
 * }</pre>
 */
public final class CapturingAppender extends ListAppender<ILoggingEvent> implements AutoCloseable {
  private final ch.qos.logback.classic.Logger logbackLogger;

  private CapturingAppender(Logger logger) {
    this.logbackLogger = (ch.qos.logback.classic.Logger)requireNonNull(logger, "logger");
  }

  public static CapturingAppender attach(Logger logger, Level minimumLevel) {
    CapturingAppender appender = new CapturingAppender(logger);
    appender.setContext((LoggerContext)LoggerFactory.getILoggerFactory());

    ThresholdFilter filter = new ThresholdFilter();
    filter.setLevel(minimumLevel.levelStr);
    appender.addFilter(filter);
    appender.start();

    appender.logbackLogger.addAppender(appender);
    return appender;
  }

  /**
   * Returns the formatted messages captured so far.
   *
   * @return a snapshot of the captured messages
   */
  public synchronized List<String> messages() {
    List<String> messages = new ArrayList<>(list.size());
    for (ILoggingEvent event : list) {
      messages.add(event.getFormattedMessage());
    }
    return messages;
  }

  @Override
  public void stop() {
    logbackLogger.detachAppender(this);
    super.stop();
  }

  @Override
  public void close() {
    stop();
  }
}

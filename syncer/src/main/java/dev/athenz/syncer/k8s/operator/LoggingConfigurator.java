/*
 * Copyright 2024 Responsive Computing, Inc.
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
 */

package dev.athenz.syncer.k8s.operator;

import java.util.Locale;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.Appender;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.FileAppender;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.layout.PatternLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the log settings from the command line on top of the bundled log4j2.xml, which only
 * logs to the console.
 */
public final class LoggingConfigurator {
  private static final Logger LOG = LoggerFactory.getLogger(LoggingConfigurator.class);

  static final String FILE_APPENDER = "file";
  static final String PATTERN = "%d{ISO8601} %-5p [%t] %c{1}: %m%n";

  private LoggingConfigurator() {}

  public static void configure(final SyncerConfig config) {
    final Level level = level(config.getLogMode());
    Configurator.setRootLevel(level);
    config.getLogLocation().ifPresent(LoggingConfigurator::addFileAppender);
    LOG.info("Logging at {}{}", level,
        config.getLogLocation().map(l -> " to console and " + l).orElse(" to console"));
  }

  static Level level(final String mode) {
    final Level level = Level.getLevel(mode.toUpperCase(Locale.ROOT));
    if (level == null) {
      throw new IllegalArgumentException("unknown log mode " + mode);
    }
    return level;
  }

  private static void addFileAppender(final String location) {
    final LoggerContext ctx = (LoggerContext) LogManager.getContext(false);
    final Configuration configuration = ctx.getConfiguration();
    final PatternLayout layout = PatternLayout.newBuilder()
        .withConfiguration(configuration)
        .withPattern(PATTERN)
        .build();
    final Appender appender = FileAppender.newBuilder()
        .setName(FILE_APPENDER)
        .withFileName(location)
        .withAppend(true)
        .setLayout(layout)
        .setConfiguration(configuration)
        .build();
    if (appender == null) {
      throw new IllegalArgumentException("cannot log to " + location);
    }
    appender.start();
    configuration.addAppender(appender);
    configuration.getRootLogger().addAppender(appender, null, null);
    ctx.updateLoggers();
  }
}

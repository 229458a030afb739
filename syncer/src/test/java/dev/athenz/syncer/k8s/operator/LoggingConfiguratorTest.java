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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.apache.logging.log4j.Level;
import org.junit.jupiter.api.Test;

class LoggingConfiguratorTest {

  @Test
  public void shouldMapLogModesToLevels() {
    assertThat(LoggingConfigurator.level("info"), is(Level.INFO));
    assertThat(LoggingConfigurator.level("DEBUG"), is(Level.DEBUG));
    assertThat(LoggingConfigurator.level("warn"), is(Level.WARN));
  }

  @Test
  public void shouldRejectUnknownLogMode() {
    assertThrows(IllegalArgumentException.class, () -> LoggingConfigurator.level("verbose"));
  }
}

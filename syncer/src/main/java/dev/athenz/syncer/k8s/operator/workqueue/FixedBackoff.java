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

package dev.athenz.syncer.k8s.operator.workqueue;

import java.time.Duration;
import java.util.Objects;

public class FixedBackoff implements BackoffStrategy {
  private final Duration delay;

  public FixedBackoff(final Duration delay) {
    this.delay = Objects.requireNonNull(delay);
    if (delay.isNegative()) {
      throw new IllegalArgumentException("negative backoff " + delay);
    }
  }

  @Override
  public Duration backoff(final int failures) {
    return delay;
  }

  @Override
  public String toString() {
    return "FixedBackoff{delay=" + delay + '}';
  }
}

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

/**
 * Doubles the delay with every consecutive failure, starting from the base delay and never
 * exceeding the maximum.
 */
public class ExponentialBackoff implements BackoffStrategy {
  private final Duration baseDelay;
  private final Duration maxDelay;

  public ExponentialBackoff(final Duration baseDelay, final Duration maxDelay) {
    this.baseDelay = Objects.requireNonNull(baseDelay);
    this.maxDelay = Objects.requireNonNull(maxDelay);
    if (baseDelay.isNegative() || maxDelay.compareTo(baseDelay) < 0) {
      throw new IllegalArgumentException(
          String.format("invalid backoff range [%s, %s]", baseDelay, maxDelay));
    }
  }

  @Override
  public Duration backoff(final int failures) {
    if (failures < 0) {
      throw new IllegalArgumentException("negative failure count " + failures);
    }
    // past 2^62 the multiplication overflows, and any sane cap is far below that anyway
    if (failures >= 62) {
      return maxDelay;
    }
    final long factor = 1L << failures;
    final long nanos = baseDelay.toNanos();
    if (nanos != 0 && factor > maxDelay.toNanos() / nanos) {
      return maxDelay;
    }
    final Duration delay = Duration.ofNanos(nanos * factor);
    return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
  }

  @Override
  public String toString() {
    return "ExponentialBackoff{"
        + "baseDelay=" + baseDelay
        + ", maxDelay=" + maxDelay
        + '}';
  }
}

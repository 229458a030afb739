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

/**
 * Decides how long a key that failed to reconcile waits before it becomes eligible again.
 */
public interface BackoffStrategy {

  /**
   * @param failures how many times the key failed before this one, 0 for the first failure
   * @return the delay before the key is handed out again
   */
  Duration backoff(int failures);

  static BackoffStrategy fixed(final Duration delay) {
    return new FixedBackoff(delay);
  }

  static BackoffStrategy exponential(final Duration baseDelay, final Duration maxDelay) {
    return new ExponentialBackoff(baseDelay, maxDelay);
  }
}

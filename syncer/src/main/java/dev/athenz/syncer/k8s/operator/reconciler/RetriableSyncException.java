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

package dev.athenz.syncer.k8s.operator.reconciler;

/**
 * A reconcile attempt failed for a reason that is expected to go away, so the key should be
 * retried after a backoff.
 */
public class RetriableSyncException extends RuntimeException {
  private static final long serialVersionUID = 0L;

  public RetriableSyncException(final String message, final Throwable cause) {
    super(message, cause);
  }
}

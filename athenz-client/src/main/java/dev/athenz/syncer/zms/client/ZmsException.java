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

package dev.athenz.syncer.zms.client;

import java.util.OptionalInt;

/**
 * A failed ZMS call that will not succeed by retrying it, for example a response body that
 * cannot be mapped or a request rejected as invalid.
 */
public class ZmsException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final OptionalInt statusCode;

  public ZmsException(final String message) {
    this(message, OptionalInt.empty(), null);
  }

  public ZmsException(final String message, final Throwable cause) {
    this(message, OptionalInt.empty(), cause);
  }

  public ZmsException(final String message, final OptionalInt statusCode, final Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
  }

  public OptionalInt getStatusCode() {
    return statusCode;
  }

  public boolean isRetriable() {
    return false;
  }
}

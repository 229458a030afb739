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
 * A failed ZMS call that may succeed later: transport errors, timeouts, rejected credentials
 * (which a certificate reload can fix), throttling and server side errors.
 */
public class RetriableZmsException extends ZmsException {
  private static final long serialVersionUID = 1L;

  public RetriableZmsException(final String message, final Throwable cause) {
    super(message, cause);
  }

  public RetriableZmsException(final String message, final OptionalInt statusCode) {
    super(message, statusCode, null);
  }

  @Override
  public boolean isRetriable() {
    return true;
  }
}

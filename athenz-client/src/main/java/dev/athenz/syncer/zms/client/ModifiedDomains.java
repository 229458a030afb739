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

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of asking ZMS which domains changed since a previous poll.
 */
public final class ModifiedDomains {
  private final List<String> domainNames;
  private final Optional<String> etag;
  private final boolean notModified;

  private ModifiedDomains(
      final List<String> domainNames,
      final Optional<String> etag,
      final boolean notModified
  ) {
    this.domainNames = List.copyOf(domainNames);
    this.etag = Objects.requireNonNull(etag);
    this.notModified = notModified;
  }

  public static ModifiedDomains changed(
      final List<String> domainNames,
      final Optional<String> etag
  ) {
    return new ModifiedDomains(domainNames, etag, false);
  }

  public static ModifiedDomains notModified(final Optional<String> etag) {
    return new ModifiedDomains(List.of(), etag, true);
  }

  public List<String> getDomainNames() {
    return domainNames;
  }

  /**
   * @return the tag to send with the next poll, empty if ZMS did not return one
   */
  public Optional<String> getEtag() {
    return etag;
  }

  public boolean isNotModified() {
    return notModified;
  }

  @Override
  public String toString() {
    return "ModifiedDomains{"
        + "domainNames=" + domainNames
        + ", etag=" + etag
        + ", notModified=" + notModified
        + '}';
  }
}

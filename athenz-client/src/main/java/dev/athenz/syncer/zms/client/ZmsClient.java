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

import dev.athenz.syncer.zms.model.DomainSnapshot;
import java.util.Optional;

/**
 * Client for reading domain data from Athenz ZMS. Every call is authenticated with the
 * current mutual-TLS identity.
 */
public interface ZmsClient {

  /**
   * Fetch the current roles and role members of a domain.
   *
   * @param domainName the athenz domain, e.g. {@code sports.api}
   * @return the snapshot, or empty if the domain does not exist in ZMS
   * @throws RetriableZmsException if the call failed in a way a later attempt may not
   * @throws ZmsException if the response could not be understood
   */
  Optional<DomainSnapshot> getDomainSnapshot(String domainName);

  /**
   * @param etag the tag returned by the previous poll, or empty to list every domain
   * @return the names of the domains modified since {@code etag} was issued
   */
  ModifiedDomains getModifiedDomains(Optional<String> etag);
}

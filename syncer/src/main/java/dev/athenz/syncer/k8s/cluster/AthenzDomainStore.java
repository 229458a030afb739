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

package dev.athenz.syncer.k8s.cluster;

import dev.athenz.syncer.k8s.crd.AthenzDomain;
import java.util.List;
import java.util.Optional;

/**
 * Reads and writes {@link AthenzDomain} objects. Writes are checked against the resource
 * version the caller read, and fail with {@link ConflictException} instead of overwriting a
 * newer object.
 */
public interface AthenzDomainStore {

  Optional<AthenzDomain> get(String name);

  /**
   * @throws ConflictException if an object with the same name already exists
   */
  AthenzDomain create(AthenzDomain domain);

  /**
   * @throws ConflictException if the stored resource version differs from the given one
   */
  AthenzDomain update(AthenzDomain domain);

  /**
   * Deletes the object if it is still at the resource version of {@code current}.
   *
   * @return true if an object was deleted, false if it was already gone
   * @throws ConflictException if the stored resource version differs from the given one
   */
  boolean delete(AthenzDomain current);

  /**
   * @return every object managed by the syncer
   */
  List<AthenzDomain> list();
}

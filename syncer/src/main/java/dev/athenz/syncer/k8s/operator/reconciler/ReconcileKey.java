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

import java.util.Objects;
import java.util.Optional;
import javax.annotation.concurrent.Immutable;

/**
 * Identifies one unit of reconciliation work. A key derived from a namespace carries the
 * namespace and the domain it maps to. A cluster key (the admin domain, or a domain referenced
 * as a trust domain) carries only the domain.
 */
@Immutable
public final class ReconcileKey {
  private final Optional<String> namespace;
  private final String domain;

  private ReconcileKey(final Optional<String> namespace, final String domain) {
    this.namespace = Objects.requireNonNull(namespace);
    this.domain = Objects.requireNonNull(domain);
  }

  public static ReconcileKey forNamespace(final String namespace, final String domain) {
    return new ReconcileKey(Optional.of(namespace), domain);
  }

  public static ReconcileKey forDomain(final String domain) {
    return new ReconcileKey(Optional.empty(), domain);
  }

  public Optional<String> getNamespace() {
    return namespace;
  }

  public String getDomain() {
    return domain;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final ReconcileKey that = (ReconcileKey) o;
    return Objects.equals(namespace, that.namespace)
        && Objects.equals(domain, that.domain);
  }

  @Override
  public int hashCode() {
    return Objects.hash(namespace, domain);
  }

  @Override
  public String toString() {
    return namespace.map(ns -> ns + "/" + domain).orElse(domain);
  }
}

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

import com.google.common.collect.ImmutableSet;
import dev.athenz.syncer.k8s.crd.AthenzDomain;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Translates between namespace names and Athenz domain names. A single dash in a namespace
 * separates domain levels and a double dash stands for a literal dash, so namespace
 * {@code sports-api--v2} maps to domain {@code sports.api-v2}.
 */
public class NamespaceDomainMapper {
  // never valid in a namespace name
  private static final String ESCAPED_DASH = "\u0000";

  private final ImmutableSet<String> systemNamespaces;
  private final Optional<String> adminDomain;

  public NamespaceDomainMapper(
      final Set<String> systemNamespaces,
      final Optional<String> adminDomain
  ) {
    this.systemNamespaces = ImmutableSet.copyOf(systemNamespaces);
    this.adminDomain = Objects.requireNonNull(adminDomain).filter(d -> !d.isEmpty());
  }

  public String toDomain(final String namespace) {
    return namespace
        .replace("--", ESCAPED_DASH)
        .replace('-', '.')
        .replace(ESCAPED_DASH, "-");
  }

  public String toNamespace(final String domain) {
    return domain
        .replace("-", "--")
        .replace('.', '-');
  }

  public boolean isSystemNamespace(final String namespace) {
    return systemNamespaces.contains(namespace);
  }

  public boolean isAdminDomain(final String domain) {
    return adminDomain.map(domain::equals).orElse(false);
  }

  /**
   * @return the key to reconcile for the namespace, or empty for system namespaces
   */
  public Optional<ReconcileKey> keyForNamespace(final String namespace) {
    if (isSystemNamespace(namespace)) {
      return Optional.empty();
    }
    return Optional.of(ReconcileKey.forNamespace(namespace, toDomain(namespace)));
  }

  /**
   * @return the key for the admin domain, if one is configured
   */
  public Optional<ReconcileKey> adminKey() {
    return adminDomain.map(ReconcileKey::forDomain);
  }

  /**
   * @return the key an existing mirror object is reconciled under
   */
  public ReconcileKey keyForObject(final AthenzDomain domain) {
    final String name = domain.getMetadata().getName();
    final var labels = domain.getMetadata().getLabels();
    final String namespace = labels == null ? null : labels.get(AthenzDomain.NAMESPACE_LABEL);
    return namespace == null
        ? ReconcileKey.forDomain(name)
        : ReconcileKey.forNamespace(namespace, name);
  }

  public Set<String> getSystemNamespaces() {
    return systemNamespaces;
  }
}

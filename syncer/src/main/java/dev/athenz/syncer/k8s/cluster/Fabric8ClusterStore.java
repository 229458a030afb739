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
import io.fabric8.kubernetes.api.model.KubernetesResourceList;
import io.fabric8.kubernetes.api.model.Namespace;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.MixedOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import java.net.HttpURLConnection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cluster store backed by the Kubernetes API server.
 */
public class Fabric8ClusterStore implements AthenzDomainStore, NamespaceLister {
  private static final Logger LOG = LoggerFactory.getLogger(Fabric8ClusterStore.class);
  private static final String TERMINATING = "Terminating";

  private final KubernetesClient client;

  public Fabric8ClusterStore(final KubernetesClient client) {
    this.client = Objects.requireNonNull(client);
  }

  private MixedOperation<AthenzDomain, KubernetesResourceList<AthenzDomain>,
      Resource<AthenzDomain>> domains() {
    return client.resources(AthenzDomain.class);
  }

  @Override
  public Optional<AthenzDomain> get(final String name) {
    return Optional.ofNullable(domains().withName(name).get());
  }

  @Override
  public AthenzDomain create(final AthenzDomain domain) {
    try {
      final AthenzDomain created = domains().resource(domain).create();
      LOG.debug("created {} at version {}",
          created.getMetadata().getName(), created.getMetadata().getResourceVersion());
      return created;
    } catch (final KubernetesClientException e) {
      throw maybeConflict(e, domain);
    }
  }

  @Override
  public AthenzDomain update(final AthenzDomain domain) {
    Objects.requireNonNull(domain.getMetadata().getResourceVersion(), "resourceVersion");
    try {
      final AthenzDomain updated = domains().resource(domain).update();
      LOG.debug("updated {} from version {} to {}",
          updated.getMetadata().getName(),
          domain.getMetadata().getResourceVersion(),
          updated.getMetadata().getResourceVersion());
      return updated;
    } catch (final KubernetesClientException e) {
      throw maybeConflict(e, domain);
    }
  }

  @Override
  public boolean delete(final AthenzDomain current) {
    Objects.requireNonNull(current.getMetadata().getResourceVersion(), "resourceVersion");
    try {
      final boolean deleted = !domains().resource(current).lockResourceVersion().delete().isEmpty();
      LOG.debug("deleted {} at version {}: {}",
          current.getMetadata().getName(), current.getMetadata().getResourceVersion(), deleted);
      return deleted;
    } catch (final KubernetesClientException e) {
      throw maybeConflict(e, current);
    }
  }

  @Override
  public List<AthenzDomain> list() {
    return domains()
        .withLabel(AthenzDomain.MANAGED_BY_LABEL, AthenzDomain.MANAGED_BY)
        .list()
        .getItems();
  }

  @Override
  public List<String> listNamespaces() {
    return client.namespaces().list().getItems().stream()
        .filter(ns -> !isTerminating(ns))
        .map(ns -> ns.getMetadata().getName())
        .collect(Collectors.toList());
  }

  @Override
  public boolean namespaceExists(final String namespace) {
    final Namespace ns = client.namespaces().withName(namespace).get();
    return ns != null && !isTerminating(ns);
  }

  static boolean isTerminating(final Namespace ns) {
    if (ns.getMetadata().getDeletionTimestamp() != null) {
      return true;
    }
    return ns.getStatus() != null && TERMINATING.equals(ns.getStatus().getPhase());
  }

  private static RuntimeException maybeConflict(
      final KubernetesClientException e,
      final AthenzDomain domain
  ) {
    if (e.getCode() == HttpURLConnection.HTTP_CONFLICT) {
      return new ConflictException(
          String.format("conflict writing %s at version %s",
              domain.getMetadata().getName(), domain.getMetadata().getResourceVersion()),
          e
      );
    }
    return e;
  }
}

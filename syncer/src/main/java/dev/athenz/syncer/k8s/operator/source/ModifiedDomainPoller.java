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

package dev.athenz.syncer.k8s.operator.source;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.AbstractScheduledService;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import dev.athenz.syncer.k8s.cluster.AthenzDomainStore;
import dev.athenz.syncer.k8s.cluster.NamespaceLister;
import dev.athenz.syncer.k8s.crd.AthenzDomain;
import dev.athenz.syncer.k8s.operator.reconciler.NamespaceDomainMapper;
import dev.athenz.syncer.k8s.operator.reconciler.ReconcileKey;
import dev.athenz.syncer.zms.client.ModifiedDomains;
import dev.athenz.syncer.zms.client.ZmsClient;
import dev.athenz.syncer.zms.client.ZmsException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asks ZMS on every update cycle which domains changed since the previous cycle and enqueues
 * the ones the syncer tracks. A failed poll keeps the previous tag, so the next cycle picks up
 * everything the failed one missed.
 */
public class ModifiedDomainPoller extends AbstractScheduledService {
  private static final Logger LOG = LoggerFactory.getLogger(ModifiedDomainPoller.class);

  private final ZmsClient zmsClient;
  private final NamespaceLister namespaceLister;
  private final AthenzDomainStore domainStore;
  private final NamespaceDomainMapper mapper;
  private final Consumer<ReconcileKey> sink;
  private final Duration period;

  @GuardedBy("this")
  private Optional<String> etag = Optional.empty();

  public ModifiedDomainPoller(
      final ZmsClient zmsClient,
      final NamespaceLister namespaceLister,
      final AthenzDomainStore domainStore,
      final NamespaceDomainMapper mapper,
      final Consumer<ReconcileKey> sink,
      final Duration period
  ) {
    this.zmsClient = Objects.requireNonNull(zmsClient);
    this.namespaceLister = Objects.requireNonNull(namespaceLister);
    this.domainStore = Objects.requireNonNull(domainStore);
    this.mapper = Objects.requireNonNull(mapper);
    this.sink = Objects.requireNonNull(sink);
    this.period = Objects.requireNonNull(period);
  }

  /**
   * @return the keys enqueued by this poll
   */
  @VisibleForTesting
  synchronized List<ReconcileKey> poll() {
    final ModifiedDomains modified = zmsClient.getModifiedDomains(etag);
    if (modified.isNotModified()) {
      LOG.debug("No domains modified since {}", etag);
      etag = modified.getEtag().or(() -> etag);
      return List.of();
    }
    final List<ReconcileKey> keys = tracked(modified.getDomainNames());
    keys.forEach(sink);
    LOG.info("{} of {} modified domains are tracked", keys.size(),
        modified.getDomainNames().size());
    etag = modified.getEtag();
    return keys;
  }

  @VisibleForTesting
  synchronized Optional<String> getEtag() {
    return etag;
  }

  private List<ReconcileKey> tracked(final List<String> domains) {
    if (domains.isEmpty()) {
      return List.of();
    }
    final Set<String> namespaces = new HashSet<>(namespaceLister.listNamespaces());
    final Map<String, ReconcileKey> mirrored = new HashMap<>();
    for (final AthenzDomain domain : domainStore.list()) {
      mirrored.put(domain.getMetadata().getName(), mapper.keyForObject(domain));
    }
    final List<ReconcileKey> keys = new ArrayList<>();
    for (final String domain : domains) {
      final String namespace = mapper.toNamespace(domain);
      if (namespaces.contains(namespace) && !mapper.isSystemNamespace(namespace)) {
        keys.add(ReconcileKey.forNamespace(namespace, domain));
      } else if (mapper.isAdminDomain(domain)) {
        keys.add(ReconcileKey.forDomain(domain));
      } else if (mirrored.containsKey(domain)) {
        keys.add(mirrored.get(domain));
      }
    }
    return keys;
  }

  @Override
  protected void runOneIteration() {
    try {
      poll();
    } catch (final ZmsException e) {
      LOG.warn("Polling modified domains failed, retrying in {}", period, e);
    } catch (final RuntimeException e) {
      LOG.error("Unexpected error polling modified domains", e);
    }
  }

  @Override
  protected Scheduler scheduler() {
    return Scheduler.newFixedDelaySchedule(period, period);
  }

  @Override
  protected String serviceName() {
    return "athenz-modified-domain-poller";
  }
}

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
import dev.athenz.syncer.k8s.cluster.AthenzDomainStore;
import dev.athenz.syncer.k8s.cluster.NamespaceLister;
import dev.athenz.syncer.k8s.operator.reconciler.NamespaceDomainMapper;
import dev.athenz.syncer.k8s.operator.reconciler.ReconcileKey;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically re-enqueues every key the syncer knows about, whether or not anything changed.
 * This bounds how stale a mirror can get when watch events are lost.
 *
 * <p>The first pass runs immediately on start.
 */
public class ResyncTicker extends AbstractScheduledService {
  private static final Logger LOG = LoggerFactory.getLogger(ResyncTicker.class);

  private final NamespaceLister namespaceLister;
  private final AthenzDomainStore domainStore;
  private final NamespaceDomainMapper mapper;
  private final Consumer<ReconcileKey> sink;
  private final Duration period;

  public ResyncTicker(
      final NamespaceLister namespaceLister,
      final AthenzDomainStore domainStore,
      final NamespaceDomainMapper mapper,
      final Consumer<ReconcileKey> sink,
      final Duration period
  ) {
    this.namespaceLister = Objects.requireNonNull(namespaceLister);
    this.domainStore = Objects.requireNonNull(domainStore);
    this.mapper = Objects.requireNonNull(mapper);
    this.sink = Objects.requireNonNull(sink);
    this.period = Objects.requireNonNull(period);
  }

  /**
   * @return the number of distinct keys enqueued
   */
  @VisibleForTesting
  int resync() {
    final Set<ReconcileKey> keys = new LinkedHashSet<>();
    for (final String namespace : namespaceLister.listNamespaces()) {
      mapper.keyForNamespace(namespace).ifPresent(keys::add);
    }
    mapper.adminKey().ifPresent(keys::add);
    // picks up trust domains and mirrors of namespaces that are gone
    domainStore.list().stream()
        .map(mapper::keyForObject)
        .forEach(keys::add);
    keys.forEach(sink);
    LOG.info("Full resync enqueued {} keys", keys.size());
    return keys.size();
  }

  @Override
  protected void runOneIteration() {
    try {
      resync();
    } catch (final RuntimeException e) {
      // an exception escaping here would stop the schedule for good
      LOG.error("Full resync failed, retrying in {}", period, e);
    }
  }

  @Override
  protected Scheduler scheduler() {
    return Scheduler.newFixedRateSchedule(Duration.ZERO, period);
  }

  @Override
  protected String serviceName() {
    return "athenz-resync-ticker";
  }
}

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

import com.google.errorprone.annotations.concurrent.GuardedBy;
import dev.athenz.syncer.k8s.crd.AthenzDomain;
import dev.athenz.syncer.k8s.operator.reconciler.NamespaceDomainMapper;
import dev.athenz.syncer.k8s.operator.reconciler.ReconcileKey;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.informers.SharedIndexInformer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Watches namespaces and the syncer's own {@link AthenzDomain} objects through fabric8
 * informers. Informer resync is off, periodic re-enqueueing is left to {@link ResyncTicker}.
 */
public class Fabric8WatchSource implements WatchSource {
  private static final Logger LOG = LoggerFactory.getLogger(Fabric8WatchSource.class);

  private final KubernetesClient client;
  private final NamespaceDomainMapper mapper;

  @GuardedBy("this")
  private final List<SharedIndexInformer<?>> informers = new ArrayList<>();

  public Fabric8WatchSource(final KubernetesClient client, final NamespaceDomainMapper mapper) {
    this.client = Objects.requireNonNull(client);
    this.mapper = Objects.requireNonNull(mapper);
  }

  @Override
  public synchronized void start(final Consumer<ReconcileKey> sink) {
    if (!informers.isEmpty()) {
      throw new IllegalStateException("watch source already started");
    }
    informers.add(client.namespaces().inform(new NamespaceEventHandler(mapper, sink), 0L));
    informers.add(client.resources(AthenzDomain.class)
        .withLabel(AthenzDomain.MANAGED_BY_LABEL, AthenzDomain.MANAGED_BY)
        .inform(new AthenzDomainEventHandler(mapper, sink), 0L));
    LOG.info("Watching namespaces and {} objects", AthenzDomain.class.getSimpleName());
  }

  @Override
  public synchronized void close() {
    informers.forEach(SharedIndexInformer::stop);
    informers.clear();
    LOG.info("Stopped watching");
  }
}

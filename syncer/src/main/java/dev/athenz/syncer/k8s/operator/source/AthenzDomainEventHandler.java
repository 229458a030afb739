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

import dev.athenz.syncer.k8s.crd.AthenzDomain;
import dev.athenz.syncer.k8s.operator.reconciler.NamespaceDomainMapper;
import dev.athenz.syncer.k8s.operator.reconciler.ReconcileKey;
import io.fabric8.kubernetes.client.informers.ResourceEventHandler;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Re-reconciles a mirror whenever someone else changes or deletes it.
 */
class AthenzDomainEventHandler implements ResourceEventHandler<AthenzDomain> {
  private final NamespaceDomainMapper mapper;
  private final Consumer<ReconcileKey> sink;

  AthenzDomainEventHandler(
      final NamespaceDomainMapper mapper,
      final Consumer<ReconcileKey> sink
  ) {
    this.mapper = Objects.requireNonNull(mapper);
    this.sink = Objects.requireNonNull(sink);
  }

  @Override
  public void onAdd(final AthenzDomain domain) {
    sink.accept(mapper.keyForObject(domain));
  }

  @Override
  public void onUpdate(final AthenzDomain oldDomain, final AthenzDomain newDomain) {
    // status-only writes, e.g. our own sync timestamps, don't need another pass
    if (Objects.equals(oldDomain.getSpec(), newDomain.getSpec())
        && Objects.equals(
            oldDomain.getMetadata().getLabels(), newDomain.getMetadata().getLabels())) {
      return;
    }
    sink.accept(mapper.keyForObject(newDomain));
  }

  @Override
  public void onDelete(final AthenzDomain domain, final boolean deletedFinalStateUnknown) {
    sink.accept(mapper.keyForObject(domain));
  }
}

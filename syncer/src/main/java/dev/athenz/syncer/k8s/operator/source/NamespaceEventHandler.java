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

import dev.athenz.syncer.k8s.operator.reconciler.NamespaceDomainMapper;
import dev.athenz.syncer.k8s.operator.reconciler.ReconcileKey;
import io.fabric8.kubernetes.api.model.Namespace;
import io.fabric8.kubernetes.client.informers.ResourceEventHandler;
import java.util.Objects;
import java.util.function.Consumer;

class NamespaceEventHandler implements ResourceEventHandler<Namespace> {
  private final NamespaceDomainMapper mapper;
  private final Consumer<ReconcileKey> sink;

  NamespaceEventHandler(final NamespaceDomainMapper mapper, final Consumer<ReconcileKey> sink) {
    this.mapper = Objects.requireNonNull(mapper);
    this.sink = Objects.requireNonNull(sink);
  }

  @Override
  public void onAdd(final Namespace namespace) {
    enqueue(namespace);
  }

  @Override
  public void onUpdate(final Namespace oldNamespace, final Namespace newNamespace) {
    enqueue(newNamespace);
  }

  @Override
  public void onDelete(final Namespace namespace, final boolean deletedFinalStateUnknown) {
    enqueue(namespace);
  }

  private void enqueue(final Namespace namespace) {
    mapper.keyForNamespace(namespace.getMetadata().getName()).ifPresent(sink);
  }
}

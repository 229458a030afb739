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

import dev.athenz.syncer.k8s.cluster.AthenzDomainStore;
import dev.athenz.syncer.k8s.cluster.NamespaceLister;
import dev.athenz.syncer.zms.client.ZmsClient;
import java.time.Clock;
import java.util.Objects;

/**
 * POJO holding the collaborators shared by the reconciler and the event sources
 */
public final class SyncContext {
  private final ZmsClient zmsClient;
  private final AthenzDomainStore domainStore;
  private final NamespaceLister namespaceLister;
  private final NamespaceDomainMapper mapper;
  private final Clock clock;

  public SyncContext(
      final ZmsClient zmsClient,
      final AthenzDomainStore domainStore,
      final NamespaceLister namespaceLister,
      final NamespaceDomainMapper mapper
  ) {
    this(zmsClient, domainStore, namespaceLister, mapper, Clock.systemUTC());
  }

  public SyncContext(
      final ZmsClient zmsClient,
      final AthenzDomainStore domainStore,
      final NamespaceLister namespaceLister,
      final NamespaceDomainMapper mapper,
      final Clock clock
  ) {
    this.zmsClient = Objects.requireNonNull(zmsClient);
    this.domainStore = Objects.requireNonNull(domainStore);
    this.namespaceLister = Objects.requireNonNull(namespaceLister);
    this.mapper = Objects.requireNonNull(mapper);
    this.clock = Objects.requireNonNull(clock);
  }

  public ZmsClient getZmsClient() {
    return zmsClient;
  }

  public AthenzDomainStore getDomainStore() {
    return domainStore;
  }

  public NamespaceLister getNamespaceLister() {
    return namespaceLister;
  }

  public NamespaceDomainMapper getMapper() {
    return mapper;
  }

  public Clock getClock() {
    return clock;
  }
}

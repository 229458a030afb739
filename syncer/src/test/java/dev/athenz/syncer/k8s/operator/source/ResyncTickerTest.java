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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.is;
import static org.mockito.Mockito.when;

import dev.athenz.syncer.k8s.cluster.AthenzDomainStore;
import dev.athenz.syncer.k8s.cluster.NamespaceLister;
import dev.athenz.syncer.k8s.crd.AthenzDomain;
import dev.athenz.syncer.k8s.operator.reconciler.NamespaceDomainMapper;
import dev.athenz.syncer.k8s.operator.reconciler.ReconcileKey;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ResyncTickerTest {
  @Mock
  private NamespaceLister namespaces;
  @Mock
  private AthenzDomainStore store;

  private final List<ReconcileKey> enqueued = new CopyOnWriteArrayList<>();
  private ResyncTicker ticker;

  @BeforeEach
  public void setup() {
    ticker = new ResyncTicker(
        namespaces,
        store,
        new NamespaceDomainMapper(Set.of("kube-system"), Optional.of("k8s.admin")),
        enqueued::add,
        Duration.ofMillis(20)
    );
  }

  @Test
  public void shouldEnqueueEveryTrackedKey() {
    // given:
    when(namespaces.listNamespaces()).thenReturn(List.of("kube-system", "search", "sports-api"));
    when(store.list()).thenReturn(List.of(mirror("sports", null), mirror("search", "search")));

    // when:
    final int count = ticker.resync();

    // then:
    assertThat(count, is(4));
    assertThat(enqueued, containsInAnyOrder(
        ReconcileKey.forNamespace("search", "search"),
        ReconcileKey.forNamespace("sports-api", "sports.api"),
        ReconcileKey.forDomain("k8s.admin"),
        ReconcileKey.forDomain("sports")
    ));
  }

  @Test
  public void shouldEnqueueMirrorsOfDeletedNamespaces() {
    // given:
    when(namespaces.listNamespaces()).thenReturn(List.of());
    when(store.list()).thenReturn(List.of(mirror("media", "media")));

    // when:
    ticker.resync();

    // then:
    assertThat(enqueued, hasItem(ReconcileKey.forNamespace("media", "media")));
  }

  @Test
  public void shouldKeepTickingAfterFailedResync() throws Exception {
    // given:
    when(namespaces.listNamespaces())
        .thenThrow(new IllegalStateException("api server unavailable"))
        .thenReturn(List.of("search"));
    when(store.list()).thenReturn(List.of());

    // when:
    ticker.startAsync().awaitRunning();
    final long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
    while (!enqueued.contains(ReconcileKey.forNamespace("search", "search"))
        && System.nanoTime() < deadline) {
      Thread.sleep(10);
    }
    ticker.stopAsync().awaitTerminated();

    // then:
    assertThat(enqueued, hasItem(ReconcileKey.forNamespace("search", "search")));
  }

  private static AthenzDomain mirror(final String name, final String namespace) {
    final var metadata = new ObjectMetaBuilder().withName(name);
    if (namespace != null) {
      metadata.addToLabels(AthenzDomain.NAMESPACE_LABEL, namespace);
    }
    final var domain = new AthenzDomain();
    domain.setMetadata(metadata.build());
    return domain;
  }
}

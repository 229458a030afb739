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
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.assertThrows;

import dev.athenz.syncer.k8s.crd.AthenzDomain;
import dev.athenz.syncer.k8s.crd.AthenzDomainSpec;
import dev.athenz.syncer.k8s.operator.reconciler.NamespaceDomainMapper;
import dev.athenz.syncer.k8s.operator.reconciler.ReconcileKey;
import io.fabric8.kubernetes.api.model.NamespaceBuilder;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

@EnableKubernetesMockClient(crud = true)
class Fabric8WatchSourceTest {
  private KubernetesClient client;
  private Fabric8WatchSource source;
  private final List<ReconcileKey> enqueued = new CopyOnWriteArrayList<>();

  @BeforeEach
  public void setup() {
    source = new Fabric8WatchSource(
        client, new NamespaceDomainMapper(Set.of("kube-system"), Optional.empty()));
  }

  @AfterEach
  public void teardown() {
    source.close();
  }

  @Test
  public void shouldEnqueueExistingAndNewNamespaces() throws InterruptedException {
    // given:
    createNamespace("search");
    createNamespace("kube-system");
    source.start(enqueued::add);

    // when:
    createNamespace("sports-api");

    // then:
    awaitKey(ReconcileKey.forNamespace("search", "search"));
    awaitKey(ReconcileKey.forNamespace("sports-api", "sports.api"));
    assertThat(enqueued, not(hasItem(ReconcileKey.forNamespace("kube-system", "kube.system"))));
  }

  @Test
  public void shouldEnqueueManagedMirrorWhenDeleted() throws InterruptedException {
    // given:
    final var mirror = new AthenzDomain();
    mirror.setMetadata(new ObjectMetaBuilder()
        .withName("sports")
        .addToLabels(AthenzDomain.MANAGED_BY_LABEL, AthenzDomain.MANAGED_BY)
        .build());
    mirror.setSpec(new AthenzDomainSpec("sports", List.of(), null));
    client.resources(AthenzDomain.class).resource(mirror).create();
    source.start(enqueued::add);
    awaitKey(ReconcileKey.forDomain("sports"));
    enqueued.clear();

    // when:
    client.resources(AthenzDomain.class).withName("sports").delete();

    // then:
    awaitKey(ReconcileKey.forDomain("sports"));
  }

  @Test
  public void shouldNotStartTwice() {
    // given:
    source.start(enqueued::add);

    // when/then:
    assertThrows(IllegalStateException.class, () -> source.start(enqueued::add));
  }

  private void createNamespace(final String name) {
    client.namespaces().resource(
        new NamespaceBuilder().withNewMetadata().withName(name).endMetadata().build()
    ).create();
  }

  private void awaitKey(final ReconcileKey key) throws InterruptedException {
    final long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
    while (!enqueued.contains(key) && System.nanoTime() < deadline) {
      Thread.sleep(10);
    }
    assertThat(enqueued, hasItem(key));
  }
}

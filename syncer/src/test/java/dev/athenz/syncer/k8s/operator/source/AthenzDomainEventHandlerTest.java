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
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;

import dev.athenz.syncer.k8s.crd.AthenzDomain;
import dev.athenz.syncer.k8s.crd.AthenzDomainSpec;
import dev.athenz.syncer.k8s.crd.AthenzDomainStatus;
import dev.athenz.syncer.k8s.crd.RoleSpec;
import dev.athenz.syncer.k8s.operator.reconciler.NamespaceDomainMapper;
import dev.athenz.syncer.k8s.operator.reconciler.ReconcileKey;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

class AthenzDomainEventHandlerTest {
  private static final ReconcileKey KEY = ReconcileKey.forNamespace("search", "search");

  private final List<ReconcileKey> enqueued = new ArrayList<>();
  private final AthenzDomainEventHandler handler = new AthenzDomainEventHandler(
      new NamespaceDomainMapper(Set.of(), Optional.empty()),
      enqueued::add
  );

  @Test
  public void shouldEnqueueOnAddAndDelete() {
    // when:
    handler.onAdd(mirror(List.of("user.alice"), "t1"));
    handler.onDelete(mirror(List.of("user.alice"), "t1"), false);

    // then:
    assertThat(enqueued, contains(KEY, KEY));
  }

  @Test
  public void shouldEnqueueWhenSpecWasChanged() {
    // when:
    handler.onUpdate(mirror(List.of("user.alice"), "t1"), mirror(List.of("user.mallory"), "t1"));

    // then:
    assertThat(enqueued, contains(KEY));
  }

  @Test
  public void shouldIgnoreStatusOnlyUpdates() {
    // when:
    handler.onUpdate(mirror(List.of("user.alice"), "t1"), mirror(List.of("user.alice"), "t2"));

    // then:
    assertThat(enqueued, is(empty()));
  }

  private static AthenzDomain mirror(final List<String> admins, final String syncedAt) {
    final var domain = new AthenzDomain();
    domain.setMetadata(new ObjectMetaBuilder()
        .withName("search")
        .addToLabels(AthenzDomain.NAMESPACE_LABEL, "search")
        .build());
    domain.setSpec(new AthenzDomainSpec(
        "search", List.of(new RoleSpec("admin", admins, null)), null));
    domain.setStatus(new AthenzDomainStatus(syncedAt));
    return domain;
  }
}

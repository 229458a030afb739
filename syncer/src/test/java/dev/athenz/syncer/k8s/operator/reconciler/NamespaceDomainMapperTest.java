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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

import dev.athenz.syncer.k8s.crd.AthenzDomain;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

class NamespaceDomainMapperTest {
  private final NamespaceDomainMapper mapper =
      new NamespaceDomainMapper(Set.of("kube-system"), Optional.of("k8s.admin"));

  @Test
  public void shouldMapDashesToDomainLevels() {
    assertThat(mapper.toDomain("search"), is("search"));
    assertThat(mapper.toDomain("sports-api"), is("sports.api"));
    assertThat(mapper.toDomain("sports-api--v2"), is("sports.api-v2"));
  }

  @Test
  public void shouldMapDomainsBackToNamespaces() {
    assertThat(mapper.toNamespace("sports.api"), is("sports-api"));
    assertThat(mapper.toNamespace("sports.api-v2"), is("sports-api--v2"));
  }

  @Test
  public void shouldRoundTripDomainsWithDashes() {
    final String domain = "media.video-stream.prod";
    assertThat(mapper.toDomain(mapper.toNamespace(domain)), is(domain));
  }

  @Test
  public void shouldNotProduceKeysForSystemNamespaces() {
    assertThat(mapper.keyForNamespace("kube-system"), is(Optional.empty()));
    assertThat(mapper.keyForNamespace("kube-public"),
        is(Optional.of(ReconcileKey.forNamespace("kube-public", "kube.public"))));
  }

  @Test
  public void shouldExposeAdminDomainAsClusterKey() {
    assertThat(mapper.adminKey(), is(Optional.of(ReconcileKey.forDomain("k8s.admin"))));
    assertThat(mapper.isAdminDomain("k8s.admin"), is(true));
    assertThat(mapper.isAdminDomain("search"), is(false));
  }

  @Test
  public void shouldTreatEmptyAdminDomainAsUnset() {
    final var noAdmin = new NamespaceDomainMapper(Set.of(), Optional.of(""));
    assertThat(noAdmin.adminKey(), is(Optional.empty()));
    assertThat(noAdmin.isAdminDomain(""), is(false));
  }

  @Test
  public void shouldDeriveKeyFromObjectLabels() {
    // given:
    final var namespaced = new AthenzDomain();
    namespaced.setMetadata(new ObjectMetaBuilder()
        .withName("sports.api")
        .addToLabels(AthenzDomain.NAMESPACE_LABEL, "sports-api")
        .build());
    final var trust = new AthenzDomain();
    trust.setMetadata(new ObjectMetaBuilder().withName("sports").build());

    // when/then:
    assertThat(mapper.keyForObject(namespaced),
        is(ReconcileKey.forNamespace("sports-api", "sports.api")));
    assertThat(mapper.keyForObject(trust), is(ReconcileKey.forDomain("sports")));
  }
}

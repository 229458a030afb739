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

import dev.athenz.syncer.k8s.cluster.ConflictException;
import dev.athenz.syncer.k8s.crd.AthenzDomain;
import dev.athenz.syncer.k8s.crd.AthenzDomainSpec;
import dev.athenz.syncer.k8s.crd.AthenzDomainStatus;
import dev.athenz.syncer.k8s.crd.CrdUtils;
import dev.athenz.syncer.zms.client.RetriableZmsException;
import dev.athenz.syncer.zms.model.DomainSnapshot;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Brings the {@link AthenzDomain} for one key in line with the domain's current state in ZMS.
 *
 * <p>Reconciling is idempotent: an object that already matches the upstream snapshot is not
 * written. Writes carry the resource version that was read, and a write that loses a race is
 * retried once against a fresh read of the stored object. The upstream snapshot is not fetched
 * again for the retry.
 */
public class AthenzDomainReconciler {
  private static final Logger LOG = LoggerFactory.getLogger(AthenzDomainReconciler.class);

  static final int MAX_CONFLICT_RETRIES = 1;

  private final SyncContext ctx;
  private final Consumer<ReconcileKey> followUp;

  /**
   * @param followUp receives the keys of trust domains referenced by a synced domain
   */
  public AthenzDomainReconciler(final SyncContext ctx, final Consumer<ReconcileKey> followUp) {
    this.ctx = Objects.requireNonNull(ctx);
    this.followUp = Objects.requireNonNull(followUp);
  }

  /**
   * @throws RetriableSyncException if the attempt failed but may succeed later
   * @throws RuntimeException for failures that retrying won't fix
   */
  public SyncResult reconcile(final ReconcileKey key) {
    final String domain = key.getDomain();
    if (key.getNamespace().isPresent()) {
      final String namespace = key.getNamespace().get();
      if (ctx.getMapper().isSystemNamespace(namespace)) {
        LOG.debug("skipping system namespace {}", namespace);
        return SyncResult.SKIPPED;
      }
      if (!ctx.getNamespaceLister().namespaceExists(namespace)) {
        return deleteForMissingNamespace(namespace, domain);
      }
    }
    if (!CrdUtils.isValidObjectName(domain)) {
      throw new IllegalArgumentException(
          String.format("domain %s of key %s can't be used as an object name", domain, key));
    }

    final Optional<DomainSnapshot> snapshot = fetch(key);
    if (snapshot.isEmpty()) {
      final Optional<AthenzDomain> current = ctx.getDomainStore().get(domain);
      if (current.isPresent() && ctx.getDomainStore().delete(current.get())) {
        LOG.info("domain {} no longer exists upstream, deleted its mirror", domain);
        return SyncResult.DELETED;
      }
      LOG.debug("domain {} does not exist upstream and has no mirror", domain);
      return SyncResult.UNCHANGED;
    }

    final AthenzDomainSpec desired = AthenzDomainSpec.fromSnapshot(snapshot.get());
    desired.validate();
    final SyncResult result = apply(key, snapshot.get(), desired);
    snapshot.get().getTrustDomains().stream()
        .filter(trust -> !trust.equals(domain))
        .map(ReconcileKey::forDomain)
        .forEach(followUp);
    return result;
  }

  private Optional<DomainSnapshot> fetch(final ReconcileKey key) {
    try {
      return ctx.getZmsClient().getDomainSnapshot(key.getDomain());
    } catch (final RetriableZmsException e) {
      throw new RetriableSyncException("failed to fetch domain " + key.getDomain(), e);
    }
  }

  private SyncResult deleteForMissingNamespace(final String namespace, final String domain) {
    if (ctx.getMapper().isAdminDomain(domain)) {
      return SyncResult.UNCHANGED;
    }
    final Optional<AthenzDomain> current = ctx.getDomainStore().get(domain);
    // the object may be mirroring the domain for another reason, e.g. as a trust domain
    if (current.isEmpty() || !ReconcileKey.forNamespace(namespace, domain)
        .equals(ctx.getMapper().keyForObject(current.get()))) {
      return SyncResult.UNCHANGED;
    }
    ctx.getDomainStore().delete(current.get());
    LOG.info("namespace {} is gone, deleted mirror of domain {}", namespace, domain);
    return SyncResult.DELETED;
  }

  private SyncResult apply(
      final ReconcileKey key,
      final DomainSnapshot snapshot,
      final AthenzDomainSpec desired
  ) {
    Optional<AthenzDomain> current = ctx.getDomainStore().get(key.getDomain());
    int conflicts = 0;
    while (true) {
      try {
        return applyOnce(key, snapshot, desired, current);
      } catch (final ConflictException e) {
        if (conflicts++ >= MAX_CONFLICT_RETRIES) {
          throw new RetriableSyncException("repeated write conflicts for " + key, e);
        }
        LOG.info("write conflict for {}, re-reading the stored object", key);
        current = ctx.getDomainStore().get(key.getDomain());
      }
    }
  }

  private SyncResult applyOnce(
      final ReconcileKey key,
      final DomainSnapshot snapshot,
      final AthenzDomainSpec desired,
      final Optional<AthenzDomain> current
  ) {
    if (current.isEmpty()) {
      if (snapshot.isEmpty()) {
        LOG.debug("domain {} has no roles, not creating a mirror", key.getDomain());
        return SyncResult.SKIPPED;
      }
      ctx.getDomainStore().create(newObject(key, desired));
      LOG.info("created mirror of domain {} with {} roles", key.getDomain(),
          desired.getRoles().size());
      return SyncResult.CREATED;
    }
    final AthenzDomain existing = current.get();
    if (desired.equals(existing.getSpec()) && hasExpectedLabels(key, existing)) {
      LOG.debug("mirror of domain {} is up to date", key.getDomain());
      return SyncResult.UNCHANGED;
    }
    ctx.getDomainStore().update(updatedObject(key, existing, desired));
    LOG.info("updated mirror of domain {} at version {}", key.getDomain(),
        existing.getMetadata().getResourceVersion());
    return SyncResult.UPDATED;
  }

  private AthenzDomain newObject(final ReconcileKey key, final AthenzDomainSpec desired) {
    final var metadata = new ObjectMetaBuilder()
        .withName(key.getDomain())
        .addToLabels(AthenzDomain.MANAGED_BY_LABEL, AthenzDomain.MANAGED_BY);
    key.getNamespace().ifPresent(ns -> metadata.addToLabels(AthenzDomain.NAMESPACE_LABEL, ns));
    final AthenzDomain domain = new AthenzDomain();
    domain.setMetadata(metadata.build());
    domain.setSpec(desired);
    domain.setStatus(newStatus());
    return domain;
  }

  private AthenzDomain updatedObject(
      final ReconcileKey key,
      final AthenzDomain existing,
      final AthenzDomainSpec desired
  ) {
    // copy, the stored object may be shared with an informer cache
    final var metadata = new ObjectMetaBuilder(existing.getMetadata())
        .addToLabels(AthenzDomain.MANAGED_BY_LABEL, AthenzDomain.MANAGED_BY);
    key.getNamespace().ifPresent(ns -> metadata.addToLabels(AthenzDomain.NAMESPACE_LABEL, ns));
    final AthenzDomain domain = new AthenzDomain();
    domain.setMetadata(metadata.build());
    domain.setSpec(desired);
    domain.setStatus(newStatus());
    return domain;
  }

  private AthenzDomainStatus newStatus() {
    return new AthenzDomainStatus(ctx.getClock().instant().toString());
  }

  private static boolean hasExpectedLabels(final ReconcileKey key, final AthenzDomain domain) {
    final var labels = domain.getMetadata().getLabels();
    if (labels == null || !AthenzDomain.MANAGED_BY.equals(
        labels.get(AthenzDomain.MANAGED_BY_LABEL))) {
      return false;
    }
    return key.getNamespace().map(ns -> ns.equals(labels.get(AthenzDomain.NAMESPACE_LABEL)))
        .orElse(true);
  }
}

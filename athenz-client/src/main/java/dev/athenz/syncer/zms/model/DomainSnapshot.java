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

package dev.athenz.syncer.zms.model;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import javax.annotation.concurrent.Immutable;

/**
 * Point-in-time copy of one Athenz domain's roles and role members. A snapshot is never
 * patched: every fetch produces a new instance that replaces the previous one wholesale.
 *
 * <p>Two snapshots are equal when they describe the same domain contents. The fetch time is
 * bookkeeping only and does not take part in equality.
 */
@Immutable
public final class DomainSnapshot {
  private final String domainName;
  private final ImmutableMap<String, ImmutableSet<String>> roleMembers;
  private final ImmutableMap<String, String> roleTrust;
  private final Optional<Instant> modified;
  private final Instant fetchedAt;

  private DomainSnapshot(final Builder builder) {
    this.domainName = Objects.requireNonNull(builder.domainName, "domainName");
    final ImmutableMap.Builder<String, ImmutableSet<String>> members = ImmutableMap.builder();
    builder.roleMembers.forEach((role, m) -> members.put(role, ImmutableSet.copyOf(m)));
    this.roleMembers = members.build();
    this.roleTrust = ImmutableMap.copyOf(builder.roleTrust);
    this.modified = Objects.requireNonNull(builder.modified);
    this.fetchedAt = Objects.requireNonNull(builder.fetchedAt, "fetchedAt");
  }

  public static Builder builder(final String domainName) {
    return new Builder(domainName);
  }

  public String getDomainName() {
    return domainName;
  }

  /**
   * @return role short name (without the {@code <domain>:role.} prefix) to member names
   */
  public Map<String, Set<String>> getRoleMembers() {
    return ImmutableMap.copyOf(roleMembers);
  }

  public Set<String> getMembers(final String role) {
    final ImmutableSet<String> members = roleMembers.get(role);
    return members == null ? ImmutableSet.of() : members;
  }

  /**
   * @return role short name to the domain it delegates membership to, for delegated roles only
   */
  public Map<String, String> getRoleTrust() {
    return roleTrust;
  }

  public Set<String> getTrustDomains() {
    return ImmutableSet.copyOf(roleTrust.values());
  }

  public Optional<Instant> getModified() {
    return modified;
  }

  public Instant getFetchedAt() {
    return fetchedAt;
  }

  public boolean isEmpty() {
    return roleMembers.isEmpty();
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final DomainSnapshot that = (DomainSnapshot) o;
    return Objects.equals(domainName, that.domainName)
        && Objects.equals(roleMembers, that.roleMembers)
        && Objects.equals(roleTrust, that.roleTrust)
        && Objects.equals(modified, that.modified);
  }

  @Override
  public int hashCode() {
    return Objects.hash(domainName, roleMembers, roleTrust, modified);
  }

  @Override
  public String toString() {
    return "DomainSnapshot{"
        + "domainName='" + domainName + '\''
        + ", roleMembers=" + roleMembers
        + ", roleTrust=" + roleTrust
        + ", modified=" + modified
        + ", fetchedAt=" + fetchedAt
        + '}';
  }

  public static final class Builder {
    private final String domainName;
    private final Map<String, Set<String>> roleMembers = new TreeMap<>();
    private final Map<String, String> roleTrust = new TreeMap<>();
    private Optional<Instant> modified = Optional.empty();
    private Instant fetchedAt = Instant.now();

    private Builder(final String domainName) {
      this.domainName = domainName;
    }

    public Builder withRole(final String role, final Set<String> members) {
      roleMembers.put(Objects.requireNonNull(role), Objects.requireNonNull(members));
      return this;
    }

    public Builder withDelegatedRole(final String role, final String trustDomain) {
      roleMembers.put(Objects.requireNonNull(role), Set.of());
      roleTrust.put(role, Objects.requireNonNull(trustDomain));
      return this;
    }

    public Builder withModified(final Instant modified) {
      this.modified = Optional.ofNullable(modified);
      return this;
    }

    public Builder withFetchedAt(final Instant fetchedAt) {
      this.fetchedAt = fetchedAt;
      return this;
    }

    public DomainSnapshot build() {
      return new DomainSnapshot(this);
    }
  }
}

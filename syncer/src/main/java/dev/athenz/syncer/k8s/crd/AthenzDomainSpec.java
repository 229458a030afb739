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

package dev.athenz.syncer.k8s.crd;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.athenz.syncer.zms.model.DomainSnapshot;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Role and member data of one domain. Roles are kept sorted by name and members sorted within
 * each role, so two specs built from equal snapshots compare equal regardless of the order the
 * upstream service returned them in.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AthenzDomainSpec {
  private final String domain;
  private final List<RoleSpec> roles;
  private final String modified;

  @JsonCreator
  public AthenzDomainSpec(
      @JsonProperty("domain") final String domain,
      @JsonProperty("roles") final List<RoleSpec> roles,
      @JsonProperty("modified") final String modified
  ) {
    this.domain = domain;
    this.roles = roles == null ? List.of() : List.copyOf(roles);
    this.modified = modified;
  }

  public static AthenzDomainSpec fromSnapshot(final DomainSnapshot snapshot) {
    final List<RoleSpec> roles = snapshot.getRoleMembers().entrySet().stream()
        .map(e -> new RoleSpec(
            e.getKey(),
            e.getValue().stream().sorted().collect(Collectors.toList()),
            snapshot.getRoleTrust().get(e.getKey())))
        .sorted(Comparator.comparing(RoleSpec::getName))
        .collect(Collectors.toList());
    return new AthenzDomainSpec(
        snapshot.getDomainName(),
        roles,
        snapshot.getModified().map(Object::toString).orElse(null)
    );
  }

  public void validate() {
    Objects.requireNonNull(domain, "domain");
    if (!CrdUtils.isValidObjectName(domain)) {
      throw new IllegalArgumentException("domain " + domain + " is not a valid object name");
    }
    roles.forEach(RoleSpec::validate);
  }

  public String getDomain() {
    return domain;
  }

  public List<RoleSpec> getRoles() {
    return roles;
  }

  public String getModified() {
    return modified;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final AthenzDomainSpec that = (AthenzDomainSpec) o;
    return Objects.equals(domain, that.domain)
        && Objects.equals(roles, that.roles)
        && Objects.equals(modified, that.modified);
  }

  @Override
  public int hashCode() {
    return Objects.hash(domain, roles, modified);
  }

  @Override
  public String toString() {
    return "AthenzDomainSpec{"
        + "domain='" + domain + '\''
        + ", roles=" + roles
        + ", modified='" + modified + '\''
        + '}';
  }
}

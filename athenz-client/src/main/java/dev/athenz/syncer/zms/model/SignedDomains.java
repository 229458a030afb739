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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Wire representation of the ZMS {@code /sys/modified_domains} response. Only the fields the
 * syncer mirrors are mapped, everything else (policies, services, signatures) is ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SignedDomains {
  private final List<SignedDomain> domains;

  @JsonCreator
  public SignedDomains(@JsonProperty("domains") final List<SignedDomain> domains) {
    this.domains = domains == null ? List.of() : List.copyOf(domains);
  }

  public List<SignedDomain> getDomains() {
    return domains;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class SignedDomain {
    private final DomainData domain;

    @JsonCreator
    public SignedDomain(@JsonProperty("domain") final DomainData domain) {
      this.domain = domain;
    }

    public DomainData getDomain() {
      return domain;
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class DomainData {
    private final String name;
    private final Optional<String> modified;
    private final List<Role> roles;

    @JsonCreator
    public DomainData(
        @JsonProperty("name") final String name,
        @JsonProperty("modified") final Optional<String> modified,
        @JsonProperty("roles") final List<Role> roles
    ) {
      this.name = name;
      this.modified = modified == null ? Optional.empty() : modified;
      this.roles = roles == null ? List.of() : List.copyOf(roles);
    }

    public String getName() {
      return name;
    }

    public Optional<String> getModified() {
      return modified;
    }

    public List<Role> getRoles() {
      return roles;
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Role {
    private final String name;
    private final List<String> members;
    private final List<RoleMember> roleMembers;
    private final Optional<String> trust;

    @JsonCreator
    public Role(
        @JsonProperty("name") final String name,
        @JsonProperty("members") final List<String> members,
        @JsonProperty("roleMembers") final List<RoleMember> roleMembers,
        @JsonProperty("trust") final Optional<String> trust
    ) {
      this.name = Objects.requireNonNull(name, "role name");
      this.members = members == null ? List.of() : List.copyOf(members);
      this.roleMembers = roleMembers == null ? List.of() : List.copyOf(roleMembers);
      this.trust = trust == null ? Optional.empty() : trust.filter(t -> !t.isEmpty());
    }

    public String getName() {
      return name;
    }

    public List<String> getMembers() {
      return members;
    }

    public List<RoleMember> getRoleMembers() {
      return roleMembers;
    }

    public Optional<String> getTrust() {
      return trust;
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class RoleMember {
    private final String memberName;
    private final Optional<String> expiration;

    @JsonCreator
    public RoleMember(
        @JsonProperty("memberName") final String memberName,
        @JsonProperty("expiration") final Optional<String> expiration
    ) {
      this.memberName = Objects.requireNonNull(memberName, "memberName");
      this.expiration = expiration == null ? Optional.empty() : expiration;
    }

    public String getMemberName() {
      return memberName;
    }

    public Optional<String> getExpiration() {
      return expiration;
    }
  }
}

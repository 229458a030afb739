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
import java.util.List;
import java.util.Objects;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class RoleSpec {
  private final String name;
  private final List<String> members;
  private final String trust;

  @JsonCreator
  public RoleSpec(
      @JsonProperty("name") final String name,
      @JsonProperty("members") final List<String> members,
      @JsonProperty("trust") final String trust
  ) {
    this.name = name;
    this.members = members == null ? List.of() : List.copyOf(members);
    this.trust = trust;
  }

  public void validate() {
    Objects.requireNonNull(name, "name");
  }

  public String getName() {
    return name;
  }

  public List<String> getMembers() {
    return members;
  }

  /**
   * @return the domain this role delegates membership to, or null for a regular role
   */
  public String getTrust() {
    return trust;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final RoleSpec roleSpec = (RoleSpec) o;
    return Objects.equals(name, roleSpec.name)
        && Objects.equals(members, roleSpec.members)
        && Objects.equals(trust, roleSpec.trust);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, members, trust);
  }

  @Override
  public String toString() {
    return "RoleSpec{"
        + "name='" + name + '\''
        + ", members=" + members
        + ", trust='" + trust + '\''
        + '}';
  }
}

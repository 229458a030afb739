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

package dev.athenz.syncer.k8s.cluster;

import java.util.List;

public interface NamespaceLister {

  /**
   * @return the names of all namespaces that are not being deleted
   */
  List<String> listNamespaces();

  /**
   * A namespace that is being deleted does not count as existing.
   */
  boolean namespaceExists(String namespace);
}

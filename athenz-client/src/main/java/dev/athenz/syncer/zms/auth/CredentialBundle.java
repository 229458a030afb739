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

package dev.athenz.syncer.zms.auth;

import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;
import javax.annotation.concurrent.Immutable;

/**
 * The private key and certificate chain that identify this service to ZMS, along with the time
 * they were loaded. A bundle is replaced as a whole on reload and never modified.
 */
@Immutable
public final class CredentialBundle {
  private final PrivateKey privateKey;
  private final X509Certificate[] certificateChain;
  private final Instant loadedAt;

  public CredentialBundle(
      final PrivateKey privateKey,
      final X509Certificate[] certificateChain,
      final Instant loadedAt
  ) {
    this.privateKey = Objects.requireNonNull(privateKey, "privateKey");
    Objects.requireNonNull(certificateChain, "certificateChain");
    if (certificateChain.length == 0) {
      throw new IllegalArgumentException("certificate chain must not be empty");
    }
    this.certificateChain = certificateChain.clone();
    this.loadedAt = Objects.requireNonNull(loadedAt, "loadedAt");
  }

  public PrivateKey getPrivateKey() {
    return privateKey;
  }

  public X509Certificate[] getCertificateChain() {
    return certificateChain.clone();
  }

  public X509Certificate getCertificate() {
    return certificateChain[0];
  }

  public Instant getLoadedAt() {
    return loadedAt;
  }

  @Override
  public String toString() {
    return "CredentialBundle{"
        + "subject=" + getCertificate().getSubjectX500Principal()
        + ", notAfter=" + getCertificate().getNotAfter().toInstant()
        + ", chainLength=" + certificateChain.length
        + ", loadedAt=" + loadedAt
        + '}';
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final CredentialBundle that = (CredentialBundle) o;
    return Objects.equals(privateKey, that.privateKey)
        && Arrays.equals(certificateChain, that.certificateChain)
        && Objects.equals(loadedAt, that.loadedAt);
  }

  @Override
  public int hashCode() {
    return Objects.hash(privateKey, Arrays.hashCode(certificateChain), loadedAt);
  }
}

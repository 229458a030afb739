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

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import java.net.Socket;
import java.security.GeneralSecurityException;
import java.security.Principal;
import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.time.Instant;
import java.util.Objects;
import javax.net.ssl.KeyManager;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.X509ExtendedKeyManager;

/**
 * Client side key manager that presents whatever identity a {@link CredentialSource} currently
 * holds. JSSE first picks an alias and then asks for the key and the chain of that alias in two
 * separate calls, so each alias names one specific bundle. A reload between the two calls can
 * therefore never pair the old key with the new certificate.
 */
public class ReloadingKeyManager extends X509ExtendedKeyManager {
  private static final String ALIAS_PREFIX = "athenz-";

  private final CredentialSource source;
  private final Cache<String, CredentialBundle> recent = CacheBuilder.newBuilder()
      .maximumSize(4)
      .build();

  public ReloadingKeyManager(final CredentialSource source) {
    this.source = Objects.requireNonNull(source);
  }

  public static SSLContext sslContext(final CredentialSource source) {
    try {
      final SSLContext context = SSLContext.getInstance("TLS");
      context.init(new KeyManager[] {new ReloadingKeyManager(source)}, null, null);
      return context;
    } catch (final GeneralSecurityException e) {
      throw new IllegalStateException("could not initialize TLS context", e);
    }
  }

  @Override
  public String chooseClientAlias(
      final String[] keyType,
      final Principal[] issuers,
      final Socket socket
  ) {
    return currentAlias();
  }

  @Override
  public String chooseEngineClientAlias(
      final String[] keyType,
      final Principal[] issuers,
      final SSLEngine engine
  ) {
    return currentAlias();
  }

  @Override
  public X509Certificate[] getCertificateChain(final String alias) {
    return bundleFor(alias).getCertificateChain();
  }

  @Override
  public PrivateKey getPrivateKey(final String alias) {
    return bundleFor(alias).getPrivateKey();
  }

  @Override
  public String[] getClientAliases(final String keyType, final Principal[] issuers) {
    return new String[] {currentAlias()};
  }

  @Override
  public String[] getServerAliases(final String keyType, final Principal[] issuers) {
    return null;
  }

  @Override
  public String chooseServerAlias(
      final String keyType,
      final Principal[] issuers,
      final Socket socket
  ) {
    return null;
  }

  private String currentAlias() {
    final CredentialBundle bundle = source.getLatestCertificate();
    final String alias = aliasOf(bundle);
    recent.put(alias, bundle);
    return alias;
  }

  private CredentialBundle bundleFor(final String alias) {
    final CredentialBundle bundle = alias == null ? null : recent.getIfPresent(alias);
    return bundle != null ? bundle : source.getLatestCertificate();
  }

  static String aliasOf(final CredentialBundle bundle) {
    final Instant loadedAt = bundle.getLoadedAt();
    return ALIAS_PREFIX + loadedAt.getEpochSecond() + "." + loadedAt.getNano();
  }
}

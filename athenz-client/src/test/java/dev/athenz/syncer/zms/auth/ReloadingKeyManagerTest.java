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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.arrayContaining;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

import java.time.Instant;
import javax.net.ssl.SSLContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ReloadingKeyManagerTest {
  private static final String[] KEY_TYPES = {"RSA"};

  @Mock
  private CredentialSource source;

  private final TestCredentials first = TestCredentials.generate("first");
  private final TestCredentials second = TestCredentials.generate("second");
  private CredentialBundle firstBundle;
  private CredentialBundle secondBundle;
  private ReloadingKeyManager keyManager;

  @BeforeEach
  public void setup() {
    firstBundle = first.bundle(Instant.ofEpochSecond(1000));
    secondBundle = second.bundle(Instant.ofEpochSecond(2000));
    keyManager = new ReloadingKeyManager(source);
  }

  @Test
  public void shouldPresentCurrentIdentity() {
    // given:
    when(source.getLatestCertificate()).thenReturn(firstBundle);

    // when:
    final String alias = keyManager.chooseEngineClientAlias(KEY_TYPES, null, null);

    // then:
    assertThat(keyManager.getCertificateChain(alias), arrayContaining(first.certificate()));
    assertThat(keyManager.getPrivateKey(alias), equalTo(first.keyPair().getPrivate()));
  }

  @Test
  public void shouldKeepKeyAndChainOfChosenAliasTogetherAcrossReload() {
    // given:
    when(source.getLatestCertificate()).thenReturn(firstBundle);
    final String alias = keyManager.chooseEngineClientAlias(KEY_TYPES, null, null);
    lenient().when(source.getLatestCertificate()).thenReturn(secondBundle);

    // when:
    final var chain = keyManager.getCertificateChain(alias);
    final var key = keyManager.getPrivateKey(alias);

    // then:
    assertThat(chain, arrayContaining(first.certificate()));
    assertThat(key, equalTo(first.keyPair().getPrivate()));
  }

  @Test
  public void shouldChooseNewAliasAfterReload() {
    // given:
    when(source.getLatestCertificate()).thenReturn(firstBundle);
    final String before = keyManager.chooseClientAlias(KEY_TYPES, null, null);
    when(source.getLatestCertificate()).thenReturn(secondBundle);

    // when:
    final String after = keyManager.chooseClientAlias(KEY_TYPES, null, null);

    // then:
    assertThat(after, not(equalTo(before)));
    assertThat(keyManager.getCertificateChain(after), arrayContaining(second.certificate()));
  }

  @Test
  public void shouldNotActAsServer() {
    assertThat(keyManager.chooseServerAlias("RSA", null, null), nullValue());
    assertThat(keyManager.getServerAliases("RSA", null), nullValue());
  }

  @Test
  public void shouldBuildTlsContext() {
    // when:
    final SSLContext context = ReloadingKeyManager.sslContext(source);

    // then:
    assertThat(context.getSocketFactory(), notNullValue());
  }
}

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
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CertReloaderTest {
  private static final Duration INTERVAL = Duration.ofMinutes(5);

  @TempDir
  Path dir;

  private Path keyFile;
  private Path certFile;
  private TestCredentials alice;
  private long mtime;

  @BeforeEach
  public void setup() throws IOException {
    keyFile = dir.resolve("service.key.pem");
    certFile = dir.resolve("service.cert.pem");
    alice = TestCredentials.generate("alice");
    mtime = Instant.now().minus(Duration.ofHours(1)).toEpochMilli();
    write(alice);
  }

  @Test
  public void shouldLoadIdentityOnConstruction() {
    // when:
    final CertReloader reloader = new CertReloader(keyFile, certFile, INTERVAL);

    // then:
    final CredentialBundle bundle = reloader.getLatestCertificate();
    assertThat(bundle.getCertificate(), equalTo(alice.certificate()));
    assertThat(bundle.getPrivateKey().getEncoded(),
        equalTo(alice.keyPair().getPrivate().getEncoded()));
  }

  @Test
  public void shouldFailConstructionWhenInitialFilesCannotBeParsed() throws IOException {
    // given:
    Files.writeString(certFile, "not a certificate", StandardCharsets.UTF_8);

    // when/then:
    assertThrows(
        InvalidCredentialsException.class,
        () -> new CertReloader(keyFile, certFile, INTERVAL));
  }

  @Test
  public void shouldFailConstructionWhenFilesAreMissing() {
    assertThrows(
        InvalidCredentialsException.class,
        () -> new CertReloader(dir.resolve("missing.pem"), certFile, INTERVAL));
  }

  @Test
  public void shouldRejectKeyThatDoesNotMatchCertificate() throws IOException {
    // given:
    TestCredentials.generate("bob").writeKey(keyFile);

    // when/then:
    assertThrows(
        InvalidCredentialsException.class,
        () -> new CertReloader(keyFile, certFile, INTERVAL));
  }

  @Test
  public void shouldSwapIdentityWhenFilesChange() throws IOException {
    // given:
    final CertReloader reloader = new CertReloader(keyFile, certFile, INTERVAL);
    final TestCredentials bob = TestCredentials.generate("bob");
    write(bob);

    // when:
    final boolean reloaded = reloader.reload();

    // then:
    assertThat(reloaded, is(true));
    assertThat(reloader.getLatestCertificate().getCertificate(), equalTo(bob.certificate()));
  }

  @Test
  public void shouldSkipReloadWhenFilesAreUnchanged() {
    // given:
    final CertReloader reloader = new CertReloader(keyFile, certFile, INTERVAL);
    final CredentialBundle before = reloader.getLatestCertificate();

    // when:
    final boolean reloaded = reloader.reload();

    // then:
    assertThat(reloaded, is(false));
    assertThat(reloader.getLatestCertificate(), sameInstance(before));
  }

  @Test
  public void shouldKeepPreviousIdentityWhenReloadCannotParseFiles() throws IOException {
    // given:
    final CertReloader reloader = new CertReloader(keyFile, certFile, INTERVAL);
    final CredentialBundle before = reloader.getLatestCertificate();
    writeGarbageCertificate();

    // when:
    final boolean reloaded = reloader.reload();

    // then:
    assertThat(reloaded, is(false));
    assertThat(reloader.getLatestCertificate(), sameInstance(before));
  }

  @Test
  public void shouldRecoverOnceBrokenFilesAreFixed() throws IOException {
    // given:
    final CertReloader reloader = new CertReloader(keyFile, certFile, INTERVAL);
    writeGarbageCertificate();
    reloader.reload();
    final TestCredentials carol = TestCredentials.generate("carol");
    write(carol);

    // when:
    final boolean reloaded = reloader.reload();

    // then:
    assertThat(reloaded, is(true));
    assertThat(reloader.getLatestCertificate().getCertificate(), equalTo(carol.certificate()));
  }

  @Test
  public void shouldNeverExposeMissingOrMismatchedIdentityWhileReloading() throws Exception {
    // given:
    final CertReloader reloader = new CertReloader(keyFile, certFile, INTERVAL);
    final List<TestCredentials> identities = List.of(
        TestCredentials.generate("dave"), TestCredentials.generate("erin"));
    final AtomicBoolean running = new AtomicBoolean(true);
    final CountDownLatch started = new CountDownLatch(4);
    final ExecutorService readers = Executors.newFixedThreadPool(4);
    final List<Future<Integer>> results = new ArrayList<>();
    for (int i = 0; i < 4; i++) {
      results.add(readers.submit(() -> {
        started.countDown();
        int reads = 0;
        while (running.get()) {
          final CredentialBundle bundle = reloader.getLatestCertificate();
          assertThat(bundle, notNullValue());
          PemCredentials.verifyKeyPair(bundle.getPrivateKey(), bundle.getCertificate());
          reads++;
        }
        return reads;
      }));
    }
    started.await();

    // when:
    for (int i = 0; i < 20; i++) {
      if (i % 2 == 0) {
        writeGarbageCertificate();
      } else {
        write(identities.get(i % identities.size()));
      }
      reloader.reload();
    }
    running.set(false);
    readers.shutdown();

    // then:
    assertThat(readers.awaitTermination(10, TimeUnit.SECONDS), is(true));
    for (final Future<Integer> result : results) {
      // rethrows any assertion failure from the reader threads
      result.get();
    }
  }

  private void write(final TestCredentials credentials) throws IOException {
    credentials.writeKey(keyFile);
    credentials.writeCertificate(certFile);
    touch(keyFile);
    touch(certFile);
  }

  private void writeGarbageCertificate() throws IOException {
    Files.writeString(certFile, "-----BEGIN CERTIFICATE-----\ngarbage\n", StandardCharsets.UTF_8);
    touch(certFile);
  }

  // file systems with coarse timestamps would otherwise hide back-to-back rewrites
  private void touch(final Path file) throws IOException {
    mtime += 1000;
    Files.setLastModifiedTime(file, FileTime.fromMillis(mtime));
  }
}

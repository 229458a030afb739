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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.AbstractScheduledService;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the mutual-TLS identity used to call ZMS current by re-reading the key and certificate
 * files on a fixed schedule. The first load happens in the constructor and must succeed. After
 * that a file that cannot be parsed (for example because it is in the middle of being
 * rewritten) is logged and the previous identity stays in use until a later reload succeeds.
 *
 * <p>{@link #getLatestCertificate()} is a single volatile read and is safe to call from any
 * number of TLS handshakes concurrently with a reload.
 */
public class CertReloader extends AbstractScheduledService implements CredentialSource {
  private static final Logger LOG = LoggerFactory.getLogger(CertReloader.class);

  private final Path keyFile;
  private final Path certFile;
  private final Duration reloadInterval;
  private final Clock clock;
  private final AtomicReference<Loaded> current;

  public CertReloader(final Path keyFile, final Path certFile, final Duration reloadInterval) {
    this(keyFile, certFile, reloadInterval, Clock.systemUTC());
  }

  @VisibleForTesting
  CertReloader(
      final Path keyFile,
      final Path certFile,
      final Duration reloadInterval,
      final Clock clock
  ) {
    this.keyFile = Objects.requireNonNull(keyFile);
    this.certFile = Objects.requireNonNull(certFile);
    this.reloadInterval = Objects.requireNonNull(reloadInterval);
    this.clock = Objects.requireNonNull(clock);
    if (reloadInterval.isNegative() || reloadInterval.isZero()) {
      throw new IllegalArgumentException("reload interval must be positive: " + reloadInterval);
    }
    final Loaded initial = load(modificationTime(keyFile), modificationTime(certFile));
    this.current = new AtomicReference<>(initial);
    LOG.info("Loaded athenz identity {} from {} and {}", initial.bundle, keyFile, certFile);
  }

  @Override
  public CredentialBundle getLatestCertificate() {
    return current.get().bundle;
  }

  /**
   * Re-reads the key and certificate if either file changed since the last successful load.
   *
   * @return true if a new identity was installed
   */
  public boolean reload() {
    final Loaded previous = current.get();
    final FileTime keyModified;
    final FileTime certModified;
    try {
      keyModified = modificationTime(keyFile);
      certModified = modificationTime(certFile);
    } catch (final InvalidCredentialsException e) {
      LOG.error("Could not stat athenz identity files, keeping {}", previous.bundle, e);
      return false;
    }
    if (previous.keyModified.equals(keyModified)
        && previous.certModified.equals(certModified)) {
      LOG.debug("Athenz identity files unchanged since {}", previous.bundle.getLoadedAt());
      return false;
    }

    final Loaded next;
    try {
      next = load(keyModified, certModified);
    } catch (final InvalidCredentialsException e) {
      LOG.error("Could not reload athenz identity, keeping {}", previous.bundle, e);
      return false;
    }
    current.set(next);
    LOG.info("Reloaded athenz identity {}", next.bundle);
    return true;
  }

  @Override
  protected void runOneIteration() {
    try {
      reload();
    } catch (final RuntimeException e) {
      // an exception escaping here would stop the schedule for good
      LOG.error("Unexpected error reloading athenz identity", e);
    }
  }

  @Override
  protected Scheduler scheduler() {
    return Scheduler.newFixedDelaySchedule(reloadInterval, reloadInterval);
  }

  @Override
  protected String serviceName() {
    return "athenz-cert-reloader";
  }

  public void start() {
    startAsync().awaitRunning();
  }

  public void close() {
    stopAsync().awaitTerminated();
  }

  private Loaded load(final FileTime keyModified, final FileTime certModified) {
    return new Loaded(
        PemCredentials.load(keyFile, certFile, clock.instant()),
        keyModified,
        certModified
    );
  }

  private static FileTime modificationTime(final Path file) {
    try {
      return Files.getLastModifiedTime(file);
    } catch (final IOException e) {
      throw new InvalidCredentialsException("could not read " + file, e);
    }
  }

  private static final class Loaded {
    private final CredentialBundle bundle;
    private final FileTime keyModified;
    private final FileTime certModified;

    private Loaded(
        final CredentialBundle bundle,
        final FileTime keyModified,
        final FileTime certModified
    ) {
      this.bundle = bundle;
      this.keyModified = keyModified;
      this.certModified = certModified;
    }
  }
}

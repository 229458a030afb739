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

package dev.athenz.syncer.k8s.operator;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;
import dev.athenz.syncer.k8s.operator.workqueue.BackoffStrategy;
import java.net.URI;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;
import java.util.function.Function;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Option;

/**
 * Typed syncer configuration. Each setting is looked up on the command line first, then in the
 * optional properties file, then falls back to its default.
 */
public final class SyncerConfig {
  public static final String DEFAULT_KEY_FILE = "/var/run/athenz/service.key.pem";
  public static final String DEFAULT_CERT_FILE = "/var/run/athenz/service.cert.pem";
  public static final String DEFAULT_UPDATE_CRON = "1m0s";
  public static final String DEFAULT_RESYNC_CRON = "1h0m0s";
  public static final String DEFAULT_QUEUE_DELAY_INTERVAL = "250ms";
  public static final String DEFAULT_LOG_MODE = "info";
  public static final int DEFAULT_WORKERS = 2;
  public static final int DEFAULT_MAX_ATTEMPTS = 5;
  public static final String DEFAULT_MAX_BACKOFF = "5m0s";
  public static final String DEFAULT_CERT_RELOAD_INTERVAL = "5m0s";
  public static final String DEFAULT_REQUEST_TIMEOUT = "10s";

  public enum BackoffType {
    EXPONENTIAL,
    FIXED
  }

  private final Path keyFile;
  private final Path certFile;
  private final String zmsUrl;
  private final Duration updateInterval;
  private final Duration resyncInterval;
  private final Duration queueDelayInterval;
  private final Optional<String> adminDomain;
  private final ImmutableSet<String> systemNamespaces;
  private final boolean disableKeepAlives;
  private final Optional<String> logLocation;
  private final String logMode;
  private final boolean inClusterConfig;
  private final Path kubeconfig;
  private final int workers;
  private final int maxAttempts;
  private final BackoffType backoffType;
  private final Duration maxBackoff;
  private final Duration certReloadInterval;
  private final Duration requestTimeout;

  private SyncerConfig(final Function<Option, Optional<String>> lookup) {
    this.keyFile = Paths.get(lookup.apply(SyncerOptions.KEY).orElse(DEFAULT_KEY_FILE));
    this.certFile = Paths.get(lookup.apply(SyncerOptions.CERT).orElse(DEFAULT_CERT_FILE));
    this.zmsUrl = validateUrl(lookup.apply(SyncerOptions.ZMS_URL).orElseThrow(
        () -> new IllegalArgumentException(
            SyncerOptions.ZMS_URL.getLongOpt() + " is required")));
    this.updateInterval = duration(lookup, SyncerOptions.UPDATE_CRON, DEFAULT_UPDATE_CRON);
    this.resyncInterval = duration(lookup, SyncerOptions.RESYNC_CRON, DEFAULT_RESYNC_CRON);
    this.queueDelayInterval = duration(
        lookup, SyncerOptions.QUEUE_DELAY_INTERVAL, DEFAULT_QUEUE_DELAY_INTERVAL);
    this.adminDomain = lookup.apply(SyncerOptions.ADMIN_DOMAIN);
    this.systemNamespaces = lookup.apply(SyncerOptions.SYSTEM_NAMESPACES)
        .map(v -> ImmutableSet.copyOf(
            Splitter.on(',').trimResults().omitEmptyStrings().split(v)))
        .orElse(ImmutableSet.of());
    this.disableKeepAlives = bool(lookup, SyncerOptions.DISABLE_KEEP_ALIVES, true);
    this.logLocation = lookup.apply(SyncerOptions.LOG_LOCATION);
    this.logMode = lookup.apply(SyncerOptions.LOG_MODE).orElse(DEFAULT_LOG_MODE);
    this.inClusterConfig = bool(lookup, SyncerOptions.IN_CLUSTER_CONFIG, true);
    this.kubeconfig = lookup.apply(SyncerOptions.KUBECONFIG)
        .map(Paths::get)
        .orElseGet(() -> Paths.get(System.getProperty("user.home"), ".kube", "config"));
    this.workers = positiveInt(lookup, SyncerOptions.WORKERS, DEFAULT_WORKERS);
    this.maxAttempts = positiveInt(lookup, SyncerOptions.MAX_ATTEMPTS, DEFAULT_MAX_ATTEMPTS);
    this.backoffType = lookup.apply(SyncerOptions.BACKOFF)
        .map(SyncerConfig::backoffType)
        .orElse(BackoffType.EXPONENTIAL);
    this.maxBackoff = duration(lookup, SyncerOptions.MAX_BACKOFF, DEFAULT_MAX_BACKOFF);
    this.certReloadInterval = duration(
        lookup, SyncerOptions.CERT_RELOAD_INTERVAL, DEFAULT_CERT_RELOAD_INTERVAL);
    this.requestTimeout = duration(
        lookup, SyncerOptions.REQUEST_TIMEOUT, DEFAULT_REQUEST_TIMEOUT);
    if (backoffType == BackoffType.EXPONENTIAL && maxBackoff.compareTo(queueDelayInterval) < 0) {
      throw new IllegalArgumentException(String.format(
          "%s (%s) must not be below %s (%s)",
          SyncerOptions.MAX_BACKOFF.getLongOpt(), maxBackoff,
          SyncerOptions.QUEUE_DELAY_INTERVAL.getLongOpt(), queueDelayInterval));
    }
  }

  /**
   * @throws IllegalArgumentException if a setting is missing or malformed
   */
  public static SyncerConfig fromCommandLine(final CommandLine cmd) {
    final Properties fileProperties = cmd.hasOption(SyncerOptions.CONFIG_FILE)
        ? PropertiesLoader.load(cmd.getOptionValue(SyncerOptions.CONFIG_FILE))
        : new Properties();
    return from(cmd, fileProperties);
  }

  @VisibleForTesting
  static SyncerConfig from(final CommandLine cmd, final Properties fileProperties) {
    return new SyncerConfig(option -> {
      if (cmd.hasOption(option)) {
        return Optional.ofNullable(cmd.getOptionValue(option));
      }
      return Optional.ofNullable(fileProperties.getProperty(option.getLongOpt()))
          .map(String::trim);
    });
  }

  public BackoffStrategy backoffStrategy() {
    switch (backoffType) {
      case FIXED:
        return BackoffStrategy.fixed(queueDelayInterval);
      case EXPONENTIAL:
      default:
        return BackoffStrategy.exponential(queueDelayInterval, maxBackoff);
    }
  }

  public Path getKeyFile() {
    return keyFile;
  }

  public Path getCertFile() {
    return certFile;
  }

  public String getZmsUrl() {
    return zmsUrl;
  }

  public Duration getUpdateInterval() {
    return updateInterval;
  }

  public Duration getResyncInterval() {
    return resyncInterval;
  }

  public Duration getQueueDelayInterval() {
    return queueDelayInterval;
  }

  public Optional<String> getAdminDomain() {
    return adminDomain;
  }

  public Set<String> getSystemNamespaces() {
    return systemNamespaces;
  }

  public boolean isDisableKeepAlives() {
    return disableKeepAlives;
  }

  public Optional<String> getLogLocation() {
    return logLocation;
  }

  public String getLogMode() {
    return logMode;
  }

  public boolean isInClusterConfig() {
    return inClusterConfig;
  }

  public Path getKubeconfig() {
    return kubeconfig;
  }

  public int getWorkers() {
    return workers;
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public BackoffType getBackoffType() {
    return backoffType;
  }

  public Duration getMaxBackoff() {
    return maxBackoff;
  }

  public Duration getCertReloadInterval() {
    return certReloadInterval;
  }

  public Duration getRequestTimeout() {
    return requestTimeout;
  }

  private static String validateUrl(final String url) {
    try {
      final URI uri = URI.create(url);
      if (uri.getScheme() == null || uri.getHost() == null) {
        throw new IllegalArgumentException("not an absolute URL: " + url);
      }
    } catch (final IllegalArgumentException e) {
      throw new IllegalArgumentException(
          SyncerOptions.ZMS_URL.getLongOpt() + ": " + e.getMessage(), e);
    }
    return url;
  }

  private static Duration duration(
      final Function<Option, Optional<String>> lookup,
      final Option option,
      final String defaultValue
  ) {
    return Durations.parsePositive(
        option.getLongOpt(), lookup.apply(option).orElse(defaultValue));
  }

  private static boolean bool(
      final Function<Option, Optional<String>> lookup,
      final Option option,
      final boolean defaultValue
  ) {
    final Optional<String> value = lookup.apply(option);
    if (value.isEmpty()) {
      return defaultValue;
    }
    switch (value.get().toLowerCase(Locale.ROOT)) {
      case "true":
        return true;
      case "false":
        return false;
      default:
        throw new IllegalArgumentException(String.format(
            "%s must be true or false, got %s", option.getLongOpt(), value.get()));
    }
  }

  private static int positiveInt(
      final Function<Option, Optional<String>> lookup,
      final Option option,
      final int defaultValue
  ) {
    final Optional<String> value = lookup.apply(option);
    if (value.isEmpty()) {
      return defaultValue;
    }
    final int parsed;
    try {
      parsed = Integer.parseInt(value.get());
    } catch (final NumberFormatException e) {
      throw new IllegalArgumentException(String.format(
          "%s must be a number, got %s", option.getLongOpt(), value.get()), e);
    }
    if (parsed < 1) {
      throw new IllegalArgumentException(String.format(
          "%s must be at least 1, got %d", option.getLongOpt(), parsed));
    }
    return parsed;
  }

  private static BackoffType backoffType(final String value) {
    try {
      return BackoffType.valueOf(value.toUpperCase(Locale.ROOT));
    } catch (final IllegalArgumentException e) {
      throw new IllegalArgumentException(String.format(
          "%s must be exponential or fixed, got %s",
          SyncerOptions.BACKOFF.getLongOpt(), value), e);
    }
  }

  @Override
  public String toString() {
    return "SyncerConfig{"
        + "keyFile=" + keyFile
        + ", certFile=" + certFile
        + ", zmsUrl='" + zmsUrl + '\''
        + ", updateInterval=" + updateInterval
        + ", resyncInterval=" + resyncInterval
        + ", queueDelayInterval=" + queueDelayInterval
        + ", adminDomain=" + adminDomain
        + ", systemNamespaces=" + systemNamespaces
        + ", disableKeepAlives=" + disableKeepAlives
        + ", logLocation=" + logLocation
        + ", logMode='" + logMode + '\''
        + ", inClusterConfig=" + inClusterConfig
        + ", kubeconfig=" + kubeconfig
        + ", workers=" + workers
        + ", maxAttempts=" + maxAttempts
        + ", backoffType=" + backoffType
        + ", maxBackoff=" + maxBackoff
        + ", certReloadInterval=" + certReloadInterval
        + ", requestTimeout=" + requestTimeout
        + '}';
  }
}

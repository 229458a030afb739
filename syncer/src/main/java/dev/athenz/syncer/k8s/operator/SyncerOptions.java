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

import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;

/**
 * Command line options. Every option can also be given in the properties file named by
 * {@link #CONFIG_FILE}, under the option's long name; the command line wins.
 */
public final class SyncerOptions {

  private SyncerOptions() {}

  public static final Option KEY = longOption("key")
      .desc("Athenz private key file (default /var/run/athenz/service.key.pem)")
      .build();

  public static final Option CERT = longOption("cert")
      .desc("Athenz certificate file (default /var/run/athenz/service.cert.pem)")
      .build();

  public static final Option ZMS_URL = longOption("zms-url")
      .desc("Athenz ZMS API URL, e.g. https://zms.example.com:4443/zms/v1 (required)")
      .build();

  public static final Option UPDATE_CRON = longOption("update-cron")
      .desc("How often to poll ZMS for modified domains (default 1m0s)")
      .build();

  public static final Option RESYNC_CRON = longOption("resync-cron")
      .desc("How often to re-enqueue every tracked domain (default 1h0m0s)")
      .build();

  public static final Option QUEUE_DELAY_INTERVAL = longOption("queue-delay-interval")
      .desc("Base delay before a failed domain is retried (default 250ms)")
      .build();

  public static final Option ADMIN_DOMAIN = longOption("admin-domain")
      .desc("Athenz domain that is always synced, whether or not a namespace maps to it")
      .build();

  public static final Option SYSTEM_NAMESPACES = longOption("system-namespaces")
      .desc("Comma separated list of namespaces that are never synced")
      .build();

  public static final Option DISABLE_KEEP_ALIVES = longOption("disable-keep-alives")
      .desc("true to open a new ZMS connection for every request (default true)")
      .build();

  public static final Option LOG_LOCATION = longOption("log-location")
      .desc("File to write logs to in addition to the console")
      .build();

  public static final Option LOG_MODE = longOption("log-mode")
      .desc("Log level: trace, debug, info, warn or error (default info)")
      .build();

  public static final Option IN_CLUSTER_CONFIG = longOption("inClusterConfig")
      .desc("true to discover cluster credentials from the pod environment (default true)")
      .build();

  public static final Option KUBECONFIG = longOption("kubeconfig")
      .desc("kubeconfig file used when inClusterConfig is false (default ~/.kube/config)")
      .build();

  public static final Option WORKERS = longOption("workers")
      .desc("Number of domains reconciled concurrently (default 2)")
      .build();

  public static final Option MAX_ATTEMPTS = longOption("max-attempts")
      .desc("Attempts before a failing domain is dropped until the next resync (default 5)")
      .build();

  public static final Option BACKOFF = longOption("backoff")
      .desc("Retry delay curve: exponential or fixed (default exponential)")
      .build();

  public static final Option MAX_BACKOFF = longOption("max-backoff")
      .desc("Upper bound for the exponential retry delay (default 5m0s)")
      .build();

  public static final Option CERT_RELOAD_INTERVAL = longOption("cert-reload-interval")
      .desc("How often to check the key and certificate files for changes (default 5m0s)")
      .build();

  public static final Option REQUEST_TIMEOUT = longOption("request-timeout")
      .desc("Timeout for a single ZMS request (default 10s)")
      .build();

  public static final Option CONFIG_FILE = longOption("config-file")
      .desc("Properties file with defaults for any option, base64 encoded if it ends in b64")
      .build();

  public static final Option HELP = Option.builder()
      .longOpt("help")
      .desc("Print this message")
      .build();

  public static final Options OPTIONS = new Options()
      .addOption(KEY)
      .addOption(CERT)
      .addOption(ZMS_URL)
      .addOption(UPDATE_CRON)
      .addOption(RESYNC_CRON)
      .addOption(QUEUE_DELAY_INTERVAL)
      .addOption(ADMIN_DOMAIN)
      .addOption(SYSTEM_NAMESPACES)
      .addOption(DISABLE_KEEP_ALIVES)
      .addOption(LOG_LOCATION)
      .addOption(LOG_MODE)
      .addOption(IN_CLUSTER_CONFIG)
      .addOption(KUBECONFIG)
      .addOption(WORKERS)
      .addOption(MAX_ATTEMPTS)
      .addOption(BACKOFF)
      .addOption(MAX_BACKOFF)
      .addOption(CERT_RELOAD_INTERVAL)
      .addOption(REQUEST_TIMEOUT)
      .addOption(CONFIG_FILE)
      .addOption(HELP);

  // the names carry dashes, which are only accepted as long options
  private static Option.Builder longOption(final String name) {
    return Option.builder()
        .longOpt(name)
        .hasArg(true)
        .numberOfArgs(1)
        .required(false);
  }
}

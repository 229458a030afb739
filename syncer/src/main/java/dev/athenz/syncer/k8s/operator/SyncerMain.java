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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import dev.athenz.syncer.k8s.cluster.Fabric8ClusterStore;
import dev.athenz.syncer.k8s.operator.reconciler.NamespaceDomainMapper;
import dev.athenz.syncer.k8s.operator.reconciler.SyncContext;
import dev.athenz.syncer.k8s.operator.source.Fabric8WatchSource;
import dev.athenz.syncer.zms.auth.CertReloader;
import dev.athenz.syncer.zms.client.ZmsHttpClient;
import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.fabric8.kubernetes.client.utils.KubernetesSerialization;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class SyncerMain {
  private static final Logger LOG = LoggerFactory.getLogger(SyncerMain.class);

  public static void main(String[] args) {
    LOG.info("Starting main");

    final Options options = SyncerOptions.OPTIONS;
    final CommandLineParser parser = new DefaultParser();
    final HelpFormatter formatter = new HelpFormatter();

    CommandLine cmd;

    try {
      cmd = parser.parse(options, args);
    } catch (ParseException e) {
      LOG.error("Error parsing command line params: ", e);
      formatter.printHelp("k8s-athenz-syncer", options);
      System.exit(1);
      return;
    }

    if (cmd.hasOption(SyncerOptions.HELP)) {
      formatter.printHelp("k8s-athenz-syncer", options);
      return;
    }

    final SyncerConfig config;
    try {
      config = SyncerConfig.fromCommandLine(cmd);
      LoggingConfigurator.configure(config);
    } catch (final RuntimeException e) {
      LOG.error("Invalid configuration: {}", e.getMessage(), e);
      formatter.printHelp("k8s-athenz-syncer", options);
      System.exit(1);
      return;
    }
    LOG.info("Using {}", config);

    final KubernetesClient client;
    final CertReloader certReloader;
    final SyncController controller;
    try {
      client = kubernetesClient(config);
      LOG.info("Successfully constructed k8s client for {}", client.getMasterUrl());

      certReloader = new CertReloader(
          config.getKeyFile(),
          config.getCertFile(),
          config.getCertReloadInterval()
      );
      final ZmsHttpClient zmsClient = new ZmsHttpClient(
          config.getZmsUrl(),
          certReloader,
          config.isDisableKeepAlives(),
          config.getRequestTimeout()
      );
      LOG.info("Successfully created ZMS client for {}", config.getZmsUrl());

      final Fabric8ClusterStore clusterStore = new Fabric8ClusterStore(client);
      final NamespaceDomainMapper mapper =
          new NamespaceDomainMapper(config.getSystemNamespaces(), config.getAdminDomain());
      controller = new SyncController(
          new SyncContext(zmsClient, clusterStore, clusterStore, mapper),
          new Fabric8WatchSource(client, mapper),
          config
      );
    } catch (final RuntimeException e) {
      LOG.error("Error occurred while setting up the syncer", e);
      System.exit(1);
      return;
    }

    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
      controller.close();
      certReloader.close();
      client.close();
    }, "athenz-syncer-shutdown"));

    try {
      certReloader.start();
      controller.start();
    } catch (final RuntimeException e) {
      // the shutdown hook stops the reloader and closes the client
      LOG.error("Error occurred while starting the syncer", e);
      System.exit(1);
    }
  }

  private static KubernetesClient kubernetesClient(final SyncerConfig config) {
    final ObjectMapper mapper = new ObjectMapper();
    mapper.registerModule(new Jdk8Module());
    final Config k8sConfig;
    if (config.isInClusterConfig()) {
      k8sConfig = Config.autoConfigure(null);
    } else {
      try {
        k8sConfig = Config.fromKubeconfig(
            null,
            Files.readString(config.getKubeconfig(), StandardCharsets.UTF_8),
            config.getKubeconfig().toString()
        );
      } catch (final IOException e) {
        throw new UncheckedIOException("Could not read kubeconfig " + config.getKubeconfig(), e);
      }
    }
    // we override the k8s serialization here so we can supply our own ObjectMapper
    return new KubernetesClientBuilder()
        .withConfig(k8sConfig)
        .withKubernetesSerialization(new KubernetesSerialization(mapper, true))
        .build();
  }
}

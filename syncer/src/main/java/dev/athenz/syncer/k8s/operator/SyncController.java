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
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.Service;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import dev.athenz.syncer.k8s.cluster.ConflictException;
import dev.athenz.syncer.k8s.operator.reconciler.AthenzDomainReconciler;
import dev.athenz.syncer.k8s.operator.reconciler.ReconcileKey;
import dev.athenz.syncer.k8s.operator.reconciler.RetriableSyncException;
import dev.athenz.syncer.k8s.operator.reconciler.SyncContext;
import dev.athenz.syncer.k8s.operator.reconciler.SyncResult;
import dev.athenz.syncer.k8s.operator.source.ModifiedDomainPoller;
import dev.athenz.syncer.k8s.operator.source.ResyncTicker;
import dev.athenz.syncer.k8s.operator.source.WatchSource;
import dev.athenz.syncer.k8s.operator.workqueue.DelayingWorkQueue;
import io.fabric8.kubernetes.client.KubernetesClientException;
import java.net.HttpURLConnection;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires the event sources to the work queue and runs the reconcile workers.
 *
 * <p>Every source only adds keys to the queue. Workers take keys off the queue one at a time
 * and hand them to the {@link AthenzDomainReconciler}. A key that fails with a retryable error
 * is put back with a growing delay until it has failed {@code maxAttempts} times in a row, at
 * which point it is dropped until the next resync adds it again. Any other error drops the key
 * straight away.
 */
public class SyncController implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(SyncController.class);
  private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

  private final DelayingWorkQueue<ReconcileKey> queue;
  private final AthenzDomainReconciler reconciler;
  private final WatchSource watchSource;
  private final List<Service> services;
  private final int workers;
  private final int maxAttempts;
  private final ExecutorService executor;

  public SyncController(
      final SyncContext ctx,
      final WatchSource watchSource,
      final SyncerConfig config
  ) {
    this(new DelayingWorkQueue<>(config.backoffStrategy()), ctx, watchSource, config);
  }

  private SyncController(
      final DelayingWorkQueue<ReconcileKey> queue,
      final SyncContext ctx,
      final WatchSource watchSource,
      final SyncerConfig config
  ) {
    this(
        queue,
        new AthenzDomainReconciler(ctx, queue::add),
        watchSource,
        ImmutableList.<Service>of(
            new ResyncTicker(
                ctx.getNamespaceLister(),
                ctx.getDomainStore(),
                ctx.getMapper(),
                queue::add,
                config.getResyncInterval()),
            new ModifiedDomainPoller(
                ctx.getZmsClient(),
                ctx.getNamespaceLister(),
                ctx.getDomainStore(),
                ctx.getMapper(),
                queue::add,
                config.getUpdateInterval())
        ),
        config.getWorkers(),
        config.getMaxAttempts()
    );
  }

  @VisibleForTesting
  SyncController(
      final DelayingWorkQueue<ReconcileKey> queue,
      final AthenzDomainReconciler reconciler,
      final WatchSource watchSource,
      final List<Service> services,
      final int workers,
      final int maxAttempts
  ) {
    this.queue = Objects.requireNonNull(queue);
    this.reconciler = Objects.requireNonNull(reconciler);
    this.watchSource = Objects.requireNonNull(watchSource);
    this.services = ImmutableList.copyOf(services);
    this.workers = workers;
    this.maxAttempts = maxAttempts;
    this.executor = Executors.newFixedThreadPool(
        workers,
        new ThreadFactoryBuilder().setNameFormat("athenz-syncer-worker-%d").setDaemon(false).build()
    );
  }

  /**
   * Starts the sources and the workers. If a source fails to start, everything started so far
   * is stopped again before the failure is rethrown.
   */
  public void start() {
    try {
      watchSource.start(queue::add);
      services.forEach(s -> s.startAsync().awaitRunning());
    } catch (final RuntimeException e) {
      LOG.error("Failed to start sources, stopping", e);
      close();
      throw e;
    }
    for (int i = 0; i < workers; i++) {
      executor.submit(this::runWorker);
    }
    LOG.info("Started {} workers, dropping keys after {} failed attempts", workers, maxAttempts);
  }

  /**
   * Stops the sources, then lets every worker finish the key it is working on.
   */
  @Override
  public void close() {
    LOG.info("Shutting down");
    watchSource.close();
    for (final Service service : services) {
      try {
        service.stopAsync().awaitTerminated();
      } catch (final IllegalStateException e) {
        LOG.warn("{} had already failed", service, e);
      }
    }
    queue.shutDown();
    executor.shutdown();
    try {
      if (!executor.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
        LOG.warn("Workers did not finish within {}, interrupting", SHUTDOWN_TIMEOUT);
        executor.shutdownNow();
      }
    } catch (final InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
    LOG.info("Shut down");
  }

  private void runWorker() {
    try {
      while (processNextItem()) {
        // keep going until the queue shuts down
      }
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    LOG.debug("Worker {} exiting", Thread.currentThread().getName());
  }

  /**
   * @return false once the queue is shutting down
   */
  @VisibleForTesting
  boolean processNextItem() throws InterruptedException {
    final Optional<ReconcileKey> next = queue.get();
    if (next.isEmpty()) {
      return false;
    }
    final ReconcileKey key = next.get();
    try {
      final SyncResult result = reconciler.reconcile(key);
      queue.forget(key);
      LOG.debug("Reconciled {}: {}", key, result);
    } catch (final RuntimeException e) {
      if (isRetriable(e)) {
        retryOrDrop(key, e);
      } else {
        LOG.error("Dropping {} after a non-retryable error", key, e);
        queue.forget(key);
      }
    } finally {
      queue.done(key);
    }
    return true;
  }

  private void retryOrDrop(final ReconcileKey key, final RuntimeException e) {
    final int attempts = queue.numRequeues(key) + 1;
    if (attempts >= maxAttempts) {
      LOG.error("Dropping {} after {} failed attempts, the next resync will add it again",
          key, attempts, e);
      queue.forget(key);
      return;
    }
    final Duration delay = queue.addRateLimited(key);
    LOG.warn("Attempt {} of {} for {} failed, retrying in {}: {}",
        attempts, maxAttempts, key, delay, e.getMessage());
    LOG.debug("Failure details for {}", key, e);
  }

  static boolean isRetriable(final RuntimeException e) {
    if (e instanceof RetriableSyncException || e instanceof ConflictException) {
      return true;
    }
    if (e instanceof KubernetesClientException) {
      // no code means the request never got a response
      final int code = ((KubernetesClientException) e).getCode();
      return code <= 0
          || code == 429
          || code == HttpURLConnection.HTTP_CONFLICT
          || code >= HttpURLConnection.HTTP_INTERNAL_ERROR;
    }
    return false;
  }

  @VisibleForTesting
  DelayingWorkQueue<ReconcileKey> getQueue() {
    return queue;
  }
}

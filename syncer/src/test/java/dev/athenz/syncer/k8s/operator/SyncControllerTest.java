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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.google.common.util.concurrent.Service;
import dev.athenz.syncer.k8s.cluster.ConflictException;
import dev.athenz.syncer.k8s.operator.reconciler.AthenzDomainReconciler;
import dev.athenz.syncer.k8s.operator.reconciler.ReconcileKey;
import dev.athenz.syncer.k8s.operator.reconciler.RetriableSyncException;
import dev.athenz.syncer.k8s.operator.reconciler.SyncResult;
import dev.athenz.syncer.k8s.operator.source.WatchSource;
import dev.athenz.syncer.k8s.operator.workqueue.BackoffStrategy;
import dev.athenz.syncer.k8s.operator.workqueue.DelayingWorkQueue;
import dev.athenz.syncer.zms.client.RetriableZmsException;
import io.fabric8.kubernetes.client.KubernetesClientException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@Timeout(value = 30, unit = TimeUnit.SECONDS)
class SyncControllerTest {
  private static final ReconcileKey SEARCH = ReconcileKey.forNamespace("search", "search");

  @Mock
  private AthenzDomainReconciler reconciler;
  @Mock
  private WatchSource watchSource;
  @Mock
  private Service service;

  private DelayingWorkQueue<ReconcileKey> queue;
  private SyncController controller;

  @BeforeEach
  public void setup() {
    queue = new DelayingWorkQueue<>(BackoffStrategy.fixed(Duration.ofMillis(1)));
    controller = new SyncController(queue, reconciler, watchSource, List.of(), 1, 3);
  }

  @AfterEach
  public void teardown() {
    queue.shutDown();
  }

  @Test
  public void shouldForgetFailuresAfterSuccess() throws InterruptedException {
    // given:
    when(reconciler.reconcile(SEARCH))
        .thenThrow(retriable())
        .thenReturn(SyncResult.UPDATED);
    queue.add(SEARCH);

    // when:
    controller.processNextItem();
    controller.processNextItem();

    // then:
    verify(reconciler, times(2)).reconcile(SEARCH);
    assertThat(queue.numRequeues(SEARCH), is(0));
    assertThat(queue.len(), is(0));
  }

  @Test
  public void shouldDropKeyAfterMaxAttempts() throws InterruptedException {
    // given:
    when(reconciler.reconcile(SEARCH)).thenThrow(retriable());
    queue.add(SEARCH);

    // when:
    controller.processNextItem();
    controller.processNextItem();
    controller.processNextItem();

    // then:
    verify(reconciler, times(3)).reconcile(SEARCH);
    assertThat(queue.numRequeues(SEARCH), is(0));
    Thread.sleep(50);
    assertThat(queue.len(), is(0));
  }

  @Test
  public void shouldRetryAgainOnceResyncAddsDroppedKey() throws InterruptedException {
    // given:
    when(reconciler.reconcile(SEARCH)).thenThrow(retriable());
    queue.add(SEARCH);
    for (int i = 0; i < 3; i++) {
      controller.processNextItem();
    }

    // when:
    queue.add(SEARCH);
    controller.processNextItem();

    // then:
    verify(reconciler, times(4)).reconcile(SEARCH);
    assertThat(queue.numRequeues(SEARCH), is(1));
  }

  @Test
  public void shouldDropNonRetryableErrorsImmediately() throws InterruptedException {
    // given:
    when(reconciler.reconcile(SEARCH)).thenThrow(new IllegalArgumentException("bad domain"));
    queue.add(SEARCH);

    // when:
    controller.processNextItem();

    // then:
    assertThat(queue.numRequeues(SEARCH), is(0));
    Thread.sleep(50);
    assertThat(queue.len(), is(0));
  }

  @Test
  public void shouldReturnFalseOnceQueueShutsDown() throws InterruptedException {
    // given:
    queue.shutDown();

    // when:
    final boolean processed = controller.processNextItem();

    // then:
    assertThat(processed, is(false));
  }

  @Test
  public void shouldClassifyRetriableErrors() {
    assertThat(SyncController.isRetriable(retriable()), is(true));
    assertThat(SyncController.isRetriable(
        new ConflictException("conflict", new RuntimeException())), is(true));
    assertThat(SyncController.isRetriable(
        new KubernetesClientException("unavailable", 503, null)), is(true));
    assertThat(SyncController.isRetriable(
        new KubernetesClientException("no response")), is(true));
    assertThat(SyncController.isRetriable(
        new KubernetesClientException("forbidden", 403, null)), is(false));
    assertThat(SyncController.isRetriable(new IllegalStateException()), is(false));
  }

  @Test
  @SuppressWarnings("unchecked")
  public void shouldFeedWatchEventsToWorkersAndStopOnClose() throws InterruptedException {
    // given:
    final var reconciled = new CountDownLatch(1);
    when(reconciler.reconcile(any())).thenAnswer(i -> {
      reconciled.countDown();
      return SyncResult.CREATED;
    });
    final var withService = new SyncController(
        queue, reconciler, watchSource, List.of(service), 2, 3);
    when(service.startAsync()).thenReturn(service);
    when(service.stopAsync()).thenReturn(service);
    withService.start();
    final ArgumentCaptor<Consumer<ReconcileKey>> sink = ArgumentCaptor.forClass(Consumer.class);
    verify(watchSource).start(sink.capture());

    // when:
    sink.getValue().accept(SEARCH);

    // then:
    assertThat(reconciled.await(10, TimeUnit.SECONDS), is(true));
    withService.close();
    verify(watchSource).close();
    verify(service).awaitRunning();
    verify(service).awaitTerminated();
    assertThat(queue.isShuttingDown(), is(true));
  }

  @Test
  public void shouldStopStartedSourcesWhenStartFails() {
    // given:
    final var withService = new SyncController(
        queue, reconciler, watchSource, List.of(service), 2, 3);
    when(service.startAsync()).thenReturn(service);
    when(service.stopAsync()).thenReturn(service);
    doThrow(new IllegalStateException("Expected to be running, but found FAILED"))
        .when(service).awaitRunning();
    doThrow(new IllegalStateException("Expected to be terminated, but found FAILED"))
        .when(service).awaitTerminated();

    // when:
    assertThrows(IllegalStateException.class, withService::start);

    // then:
    verify(watchSource).close();
    verify(service).stopAsync();
    assertThat(queue.isShuttingDown(), is(true));
    verifyNoInteractions(reconciler);
  }

  @Test
  public void shouldShutDownWhenWatchSourceCannotList() {
    // given:
    doThrow(new KubernetesClientException("athenzdomains.athenz.io is forbidden", 403, null))
        .when(watchSource).start(any());

    // when:
    assertThrows(KubernetesClientException.class, controller::start);

    // then:
    verify(watchSource).close();
    assertThat(queue.isShuttingDown(), is(true));
  }

  private static RetriableSyncException retriable() {
    return new RetriableSyncException(
        "failed to fetch domain search",
        new RetriableZmsException("timed out", new HttpTimeoutException("request timed out"))
    );
  }
}

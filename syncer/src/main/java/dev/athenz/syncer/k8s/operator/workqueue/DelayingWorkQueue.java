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

package dev.athenz.syncer.k8s.operator.workqueue;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Ticker;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import javax.annotation.concurrent.ThreadSafe;

/**
 * A work queue of keys that coalesces repeated requests and hands each key to at most one
 * worker at a time.
 *
 * <p>A key moves between three states. It is <i>queued</i> once added and until a worker takes
 * it with {@link #get()}, <i>processing</i> from then until the worker calls {@link #done}, and
 * <i>waiting</i> while a delayed add has not come due yet. Adding a key that is already queued
 * is a no-op. Adding a key that is being processed marks it dirty, and {@link #done} puts it
 * straight back in the queue so the latest request is always observed.
 *
 * <p>For delayed adds the most recent request for a key wins: a second {@link #addAfter}
 * replaces the first deadline, and a plain {@link #add} cancels a pending delay.
 *
 * <p>The queue also counts consecutive failures per key for {@link #addRateLimited}. The count
 * is only reset by {@link #forget}.
 */
@ThreadSafe
public class DelayingWorkQueue<K> {
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition changed = lock.newCondition();
  private final BackoffStrategy backoff;
  private final Ticker ticker;

  @GuardedBy("lock")
  private final Deque<K> queue = new ArrayDeque<>();
  @GuardedBy("lock")
  private final Set<K> dirty = new HashSet<>();
  @GuardedBy("lock")
  private final Set<K> processing = new HashSet<>();
  // key -> deadline in ticker nanos. Entries in schedule that don't match are stale.
  @GuardedBy("lock")
  private final Map<K, Long> waiting = new HashMap<>();
  @GuardedBy("lock")
  private final PriorityQueue<Scheduled<K>> schedule = new PriorityQueue<>();
  @GuardedBy("lock")
  private final Map<K, Integer> failures = new HashMap<>();
  @GuardedBy("lock")
  private boolean shuttingDown = false;

  public DelayingWorkQueue(final BackoffStrategy backoff) {
    this(backoff, Ticker.systemTicker());
  }

  @VisibleForTesting
  DelayingWorkQueue(final BackoffStrategy backoff, final Ticker ticker) {
    this.backoff = Objects.requireNonNull(backoff);
    this.ticker = Objects.requireNonNull(ticker);
  }

  /**
   * Makes the key eligible for processing now. Does nothing once the queue is shutting down.
   */
  public void add(final K key) {
    Objects.requireNonNull(key);
    lock.lock();
    try {
      if (shuttingDown) {
        return;
      }
      waiting.remove(key);
      enqueue(key);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Makes the key eligible for processing once the delay has elapsed. A non-positive delay is
   * the same as {@link #add}.
   */
  public void addAfter(final K key, final Duration delay) {
    Objects.requireNonNull(key);
    if (delay.isNegative() || delay.isZero()) {
      add(key);
      return;
    }
    lock.lock();
    try {
      if (shuttingDown) {
        return;
      }
      final long deadline = ticker.read() + delay.toNanos();
      waiting.put(key, deadline);
      schedule.add(new Scheduled<>(key, deadline));
      // waiters may need to wake earlier than they planned to
      changed.signalAll();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Records one more failure for the key and re-adds it after the backoff for the failures
   * recorded before this one.
   *
   * @return the delay the key was scheduled with
   */
  public Duration addRateLimited(final K key) {
    final int previous;
    lock.lock();
    try {
      previous = failures.getOrDefault(key, 0);
      failures.put(key, previous + 1);
    } finally {
      lock.unlock();
    }
    final Duration delay = backoff.backoff(previous);
    addAfter(key, delay);
    return delay;
  }

  /**
   * Clears the failure count of the key. It does not remove the key from the queue.
   */
  public void forget(final K key) {
    lock.lock();
    try {
      failures.remove(key);
    } finally {
      lock.unlock();
    }
  }

  public int numRequeues(final K key) {
    lock.lock();
    try {
      return failures.getOrDefault(key, 0);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Blocks until a key is eligible and hands it to the caller, who must call {@link #done}
   * with it when finished.
   *
   * @return the next key, or empty once the queue is shutting down
   */
  public Optional<K> get() throws InterruptedException {
    lock.lock();
    try {
      while (true) {
        if (shuttingDown) {
          return Optional.empty();
        }
        final long now = ticker.read();
        promoteDue(now);
        final K key = queue.pollFirst();
        if (key != null) {
          dirty.remove(key);
          processing.add(key);
          return Optional.of(key);
        }
        final Scheduled<K> next = schedule.peek();
        if (next == null) {
          changed.await();
        } else {
          changed.awaitNanos(next.deadline - now);
        }
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Marks the key as no longer being processed. If it was added again in the meantime it goes
   * back to the end of the queue.
   */
  public void done(final K key) {
    lock.lock();
    try {
      processing.remove(key);
      if (dirty.contains(key)) {
        queue.addLast(key);
        changed.signal();
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Stops handing out keys. Blocked and future calls to {@link #get()} return empty, and adds
   * are ignored.
   */
  public void shutDown() {
    lock.lock();
    try {
      shuttingDown = true;
      changed.signalAll();
    } finally {
      lock.unlock();
    }
  }

  public boolean isShuttingDown() {
    lock.lock();
    try {
      return shuttingDown;
    } finally {
      lock.unlock();
    }
  }

  /**
   * @return the number of keys that are eligible and not yet handed out
   */
  public int len() {
    lock.lock();
    try {
      promoteDue(ticker.read());
      return queue.size();
    } finally {
      lock.unlock();
    }
  }

  @VisibleForTesting
  int numWaiting() {
    lock.lock();
    try {
      return waiting.size();
    } finally {
      lock.unlock();
    }
  }

  @GuardedBy("lock")
  private void enqueue(final K key) {
    if (!dirty.add(key)) {
      return;
    }
    // a key being processed is re-queued by done()
    if (processing.contains(key)) {
      return;
    }
    queue.addLast(key);
    changed.signal();
  }

  @GuardedBy("lock")
  private void promoteDue(final long now) {
    while (!schedule.isEmpty() && schedule.peek().deadline - now <= 0) {
      final Scheduled<K> due = schedule.poll();
      final Long deadline = waiting.get(due.key);
      if (deadline != null && deadline == due.deadline) {
        waiting.remove(due.key);
        enqueue(due.key);
      }
    }
  }

  private static final class Scheduled<K> implements Comparable<Scheduled<K>> {
    private final K key;
    private final long deadline;

    private Scheduled(final K key, final long deadline) {
      this.key = key;
      this.deadline = deadline;
    }

    @Override
    public int compareTo(final Scheduled<K> o) {
      return Long.compare(deadline - o.deadline, 0);
    }
  }

  @Override
  public String toString() {
    lock.lock();
    try {
      return "DelayingWorkQueue{"
          + "queued=" + queue.size()
          + ", processing=" + processing.size()
          + ", waiting=" + waiting.size()
          + ", shuttingDown=" + shuttingDown
          + '}';
    } finally {
      lock.unlock();
    }
  }
}

package com.riskrecon.worker.reconcile;

import com.riskrecon.worker.config.ReconcilerProperties;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Runs reconciliation cycles back to back on a dedicated daemon thread, sleeping the poll
 * interval in between. A stop request is honoured before the next fetch or during the sleep; a
 * cycle in flight always finishes.
 */
@Component
@ConditionalOnProperty(
    prefix = "reconciler",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class ReconcilerLoop {
  private static final Logger log = LoggerFactory.getLogger(ReconcilerLoop.class);
  private static final String THREAD_NAME = "reconciler-loop";
  private static final long JOIN_TIMEOUT_MS = 10_000L;

  private final PositionReconciler reconciler;
  private final Duration pollInterval;
  private final AtomicBoolean running = new AtomicBoolean(false);
  private volatile CountDownLatch stopLatch = new CountDownLatch(0);
  private volatile Thread worker;

  @Autowired
  public ReconcilerLoop(PositionReconciler reconciler, ReconcilerProperties properties) {
    this(reconciler, properties.getPollInterval());
  }

  ReconcilerLoop(PositionReconciler reconciler, Duration pollInterval) {
    this.reconciler = reconciler;
    this.pollInterval =
        pollInterval == null || pollInterval.isNegative() ? Duration.ZERO : pollInterval;
  }

  @EventListener(ApplicationReadyEvent.class)
  public synchronized void start() {
    if (!running.compareAndSet(false, true)) {
      return;
    }
    stopLatch = new CountDownLatch(1);
    Thread thread = new Thread(this::runLoop, THREAD_NAME);
    thread.setDaemon(true);
    worker = thread;
    thread.start();
    log.info("Reconciler loop started pollIntervalMs={}", pollInterval.toMillis());
  }

  @PreDestroy
  public void stop() {
    Thread thread;
    synchronized (this) {
      if (!running.compareAndSet(true, false)) {
        return;
      }
      stopLatch.countDown();
      thread = worker;
    }
    if (thread != null && thread != Thread.currentThread()) {
      try {
        thread.join(JOIN_TIMEOUT_MS);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
    }
    log.info("Reconciler loop stopped");
  }

  public boolean isRunning() {
    return running.get();
  }

  private void runLoop() {
    CountDownLatch latch = stopLatch;
    while (running.get()) {
      try {
        reconciler.runCycle();
      } catch (RuntimeException ex) {
        log.error("Reconciliation cycle raised unexpectedly; loop continues", ex);
      }
      try {
        if (latch.await(pollInterval.toMillis(), TimeUnit.MILLISECONDS)) {
          return;
        }
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        running.set(false);
        return;
      }
    }
  }
}

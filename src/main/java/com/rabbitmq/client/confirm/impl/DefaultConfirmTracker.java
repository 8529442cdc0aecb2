// Copyright (c) 2024 Broadcom. All Rights Reserved.
// The term "Broadcom" refers to Broadcom Inc. and/or its subsidiaries.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
//
// If you have any questions regarding licensing, please contact us at
// info@rabbitmq.com.
package com.rabbitmq.client.confirm.impl;

import static com.rabbitmq.client.confirm.impl.ExceptionUtils.callEngine;
import static com.rabbitmq.client.confirm.impl.ExceptionUtils.runEngine;
import static com.rabbitmq.client.confirm.impl.Utils.checkNotNull;
import static com.rabbitmq.client.confirm.impl.Utils.checkTimeout;

import com.rabbitmq.client.confirm.Channel;
import com.rabbitmq.client.confirm.ChannelEngine;
import com.rabbitmq.client.confirm.ConfirmEventQueue;
import com.rabbitmq.client.confirm.ConfirmException;
import com.rabbitmq.client.confirm.ConfirmHandler;
import com.rabbitmq.client.confirm.ConfirmOutcome;
import com.rabbitmq.client.confirm.ConfirmSubscription;
import com.rabbitmq.client.confirm.ConfirmTracker;
import com.rabbitmq.client.confirm.ProtocolMethod;
import com.rabbitmq.client.confirm.SelectResult;
import com.rabbitmq.client.confirm.metrics.MetricsCollector;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class DefaultConfirmTracker implements ConfirmTracker {

  private static final AtomicLong ID_SEQUENCE = new AtomicLong(0);

  private static final Logger LOGGER = LoggerFactory.getLogger(DefaultConfirmTracker.class);

  private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(10);

  private final long id;
  private final ChannelEngine engine;
  private final ExecutorService executorService;
  private final boolean privateExecutorService;
  private final MetricsCollector metricsCollector;
  private final ConcurrentMap<Channel, ConfirmHandlerAdapter> adapters = new ConcurrentHashMap<>();
  private final Lock registrationLock = new ReentrantLock();
  private final AtomicBoolean closed = new AtomicBoolean(false);

  DefaultConfirmTracker(
      ChannelEngine engine, ExecutorService executorService, MetricsCollector metricsCollector) {
    this.id = ID_SEQUENCE.getAndIncrement();
    this.engine = engine;
    if (executorService == null) {
      this.executorService = Utils.executorService("confirm-tracker-%d-adapter-", this.id);
      this.privateExecutorService = true;
    } else {
      this.executorService = executorService;
      this.privateExecutorService = false;
    }
    this.metricsCollector = metricsCollector;
  }

  @Override
  public SelectResult select(Channel channel) {
    checkOpen();
    checkNotNull(channel, "Channel");
    ProtocolMethod reply;
    try {
      reply = this.engine.enableConfirms(channel);
    } catch (RuntimeException e) {
      throw ExceptionUtils.convert(
          e, "Error while activating confirms on channel %d", channel.number());
    }
    boolean ok = ProtocolMethod.CONFIRM_SELECT_OK.equals(reply);
    this.metricsCollector.select(ok);
    if (ok) {
      LOGGER.debug("Confirms activated on channel {}", channel.number());
      return SelectResult.ok();
    } else {
      LOGGER.debug("Could not activate confirms on channel {}: {}", channel.number(), reply);
      return SelectResult.error(reply);
    }
  }

  @Override
  public boolean waitForConfirms(Channel channel) {
    checkOpen();
    checkNotNull(channel, "Channel");
    boolean allAcked =
        callEngine(
            () -> this.engine.blockUntilConfirmed(channel),
            "Wait for confirms on channel %d",
            channel.number());
    this.metricsCollector.waitOutcome(ConfirmOutcome.of(allAcked));
    return allAcked;
  }

  @Override
  public ConfirmOutcome waitForConfirms(Channel channel, Duration timeout) {
    checkOpen();
    checkNotNull(channel, "Channel");
    checkTimeout(timeout);
    ConfirmOutcome outcome =
        callEngine(
            () -> this.engine.blockUntilConfirmed(channel, timeout),
            "Wait for confirms on channel %d",
            channel.number());
    this.metricsCollector.waitOutcome(outcome);
    return outcome;
  }

  @Override
  public void waitForConfirmsOrDie(Channel channel) {
    checkOpen();
    checkNotNull(channel, "Channel");
    this.waitOrDie(
        channel,
        () -> runEngine(
            () -> this.engine.blockUntilConfirmedOrAbort(channel),
            "Wait for confirms on channel %d",
            channel.number()));
  }

  @Override
  public void waitForConfirmsOrDie(Channel channel, Duration timeout) {
    checkOpen();
    checkNotNull(channel, "Channel");
    checkTimeout(timeout);
    this.waitOrDie(
        channel,
        () -> runEngine(
            () -> this.engine.blockUntilConfirmedOrAbort(channel, timeout),
            "Wait for confirms on channel %d",
            channel.number()));
  }

  private void waitOrDie(Channel channel, Runnable wait) {
    try {
      wait.run();
      this.metricsCollector.waitOutcome(ConfirmOutcome.ACKED);
    } catch (ConfirmException.NackReceivedException e) {
      LOGGER.debug("Nack received on channel {}", channel.number());
      this.metricsCollector.waitOutcome(ConfirmOutcome.NACKED);
      throw e;
    } catch (ConfirmException.ConfirmTimeoutException e) {
      LOGGER.debug("Timeout while waiting for confirms on channel {}", channel.number());
      this.metricsCollector.waitOutcome(ConfirmOutcome.TIMED_OUT);
      throw e;
    }
  }

  @Override
  public long nextPublishSeqNo(Channel channel) {
    checkOpen();
    checkNotNull(channel, "Channel");
    try {
      return this.engine.nextSequenceNumber(channel);
    } catch (RuntimeException e) {
      throw ExceptionUtils.convert(
          e, "Error while getting next publish sequence number on channel %d", channel.number());
    }
  }

  @Override
  public ConfirmSubscription registerHandler(Channel channel, ConfirmHandler handler) {
    checkOpen();
    checkNotNull(channel, "Channel");
    checkNotNull(handler, "Confirm handler");
    ConfirmHandlerAdapter adapter =
        new ConfirmHandlerAdapter(channel, handler, this.metricsCollector, this::cleanUp);
    this.registrationLock.lock();
    try {
      ConfirmHandlerAdapter previous = this.adapters.put(channel, adapter);
      if (previous != null) {
        previous.stopOnRevocation(ConfirmSubscription.Cause.REPLACED);
      }
      try {
        this.engine.subscribeConfirmEvents(channel, adapter);
      } catch (RuntimeException e) {
        if (previous == null) {
          this.adapters.remove(channel, adapter);
        } else {
          previous.stopOnRevocation(ConfirmSubscription.Cause.UNSUBSCRIBED);
          this.adapters.replace(channel, adapter, previous);
        }
        throw ExceptionUtils.convert(
            e, "Error while registering confirm handler on channel %d", channel.number());
      }
      adapter.start(this.executorService);
      if (previous != null) {
        previous.stop(ConfirmSubscription.Cause.REPLACED, null);
      }
    } finally {
      this.registrationLock.unlock();
    }
    LOGGER.debug(
        "Confirm handler registered on channel {} (adapter {})", channel.number(), adapter.id());
    return adapter;
  }

  @Override
  public void unregisterHandler(Channel channel) {
    checkOpen();
    checkNotNull(channel, "Channel");
    this.registrationLock.lock();
    try {
      ConfirmHandlerAdapter adapter = this.adapters.remove(channel);
      if (adapter != null) {
        adapter.stopOnRevocation(ConfirmSubscription.Cause.CANCELLED);
      }
      try {
        this.engine.unsubscribeConfirmEvents(channel);
      } catch (RuntimeException e) {
        throw ExceptionUtils.convert(
            e, "Error while unregistering confirm handler on channel %d", channel.number());
      } finally {
        if (adapter != null) {
          adapter.stop(ConfirmSubscription.Cause.CANCELLED, null);
        }
      }
    } finally {
      this.registrationLock.unlock();
    }
    LOGGER.debug("Confirm handler unregistered on channel {}", channel.number());
  }

  @Override
  public ConfirmEventQueue eventQueue() {
    checkOpen();
    return new BlockingConfirmEventQueue();
  }

  @Override
  public void close() {
    if (this.closed.compareAndSet(false, true)) {
      List<ConfirmHandlerAdapter> toStop = new ArrayList<>(this.adapters.values());
      toStop.forEach(a -> a.stop(ConfirmSubscription.Cause.TRACKER_CLOSED, null));
      CompletableFuture<?>[] terminations =
          toStop.stream()
              .map(ConfirmSubscription::termination)
              .toArray(CompletableFuture<?>[]::new);
      try {
        CompletableFuture.allOf(terminations).get(CLOSE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        LOGGER.info("Interrupted while waiting for confirm handler adapters to stop");
      } catch (ExecutionException e) {
        LOGGER.warn("Error while waiting for confirm handler adapters to stop", e);
      } catch (TimeoutException e) {
        LOGGER.warn(
            "Confirm handler adapters did not stop in {} second(s)", CLOSE_TIMEOUT.toSeconds());
      }
      if (this.privateExecutorService) {
        this.executorService.shutdownNow();
      }
      LOGGER.debug("Confirm tracker {} closed", this.id);
    }
  }

  // internal API

  int adapterCount() {
    return this.adapters.size();
  }

  private void cleanUp(ConfirmHandlerAdapter adapter) {
    // the engine sink of a channel can change only under the registration lock
    this.registrationLock.lock();
    try {
      if (this.adapters.remove(adapter.channel(), adapter)) {
        try {
          this.engine.unsubscribeConfirmEvents(adapter.channel());
        } catch (Exception e) {
          LOGGER.warn(
              "Error while unsubscribing confirm events on channel {}",
              adapter.channel().number(),
              e);
        }
      }
    } finally {
      this.registrationLock.unlock();
    }
  }

  private void checkOpen() {
    if (this.closed.get()) {
      throw new ConfirmException.ConfirmTrackerClosedException();
    }
  }
}

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

import static com.rabbitmq.client.confirm.Resource.State.CLOSED;
import static com.rabbitmq.client.confirm.Resource.State.CLOSING;
import static com.rabbitmq.client.confirm.Resource.State.OPEN;

import com.rabbitmq.client.confirm.Channel;
import com.rabbitmq.client.confirm.ChannelEngine;
import com.rabbitmq.client.confirm.ConfirmEvent;
import com.rabbitmq.client.confirm.ConfirmException;
import com.rabbitmq.client.confirm.ConfirmHandler;
import com.rabbitmq.client.confirm.ConfirmSubscription;
import com.rabbitmq.client.confirm.Resource;
import com.rabbitmq.client.confirm.metrics.MetricsCollector;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Relays the confirms of a channel to a handler.
 *
 * <p>The engine, the monitors, and the application only enqueue signals in the inbox. A single
 * task consumes the inbox and calls the handler, so events reach the handler in the order the
 * engine delivers them. The first termination signal in the inbox stops the task.
 */
final class ConfirmHandlerAdapter extends ResourceBase
    implements ConfirmSubscription, ChannelEngine.ConfirmSink {

  private static final AtomicLong ID_SEQUENCE = new AtomicLong(0);

  private static final Logger LOGGER = LoggerFactory.getLogger(ConfirmHandlerAdapter.class);

  private final long id;
  private final Channel channel;
  private final ConfirmHandler handler;
  private final MetricsCollector metricsCollector;
  private final Consumer<ConfirmHandlerAdapter> terminationCallback;
  private final BlockingQueue<Signal> inbox = new LinkedBlockingQueue<>();
  private final CompletableFuture<Termination> termination = new CompletableFuture<>();
  private final List<Resource.Monitor> monitors = new CopyOnWriteArrayList<>();
  private final AtomicBoolean terminated = new AtomicBoolean(false);
  private volatile Cause revocationCause = Cause.UNSUBSCRIBED;

  ConfirmHandlerAdapter(
      Channel channel,
      ConfirmHandler handler,
      MetricsCollector metricsCollector,
      Consumer<ConfirmHandlerAdapter> terminationCallback) {
    this.id = ID_SEQUENCE.getAndIncrement();
    this.channel = channel;
    this.handler = handler;
    this.metricsCollector = metricsCollector;
    this.terminationCallback = terminationCallback;
  }

  void start(ExecutorService executorService) {
    this.state(OPEN);
    this.metricsCollector.openAdapter();
    this.monitors.add(this.channel.monitor(downListener(Cause.CHANNEL_CLOSED)));
    if (this.handler instanceof Resource) {
      this.monitors.add(((Resource) this.handler).monitor(downListener(Cause.HANDLER_TERMINATED)));
    }
    try {
      executorService.submit(
          Utils.namedRunnable(this::loop, "confirm-adapter-%d-channel-%d", id, channel.number()));
    } catch (RejectedExecutionException e) {
      this.terminate(new DefaultTermination(Cause.TRACKER_CLOSED, e));
      throw new ConfirmException.ConfirmTrackerClosedException();
    }
    LOGGER.debug("Confirm handler adapter {} started on channel {}", id, channel.number());
  }

  @Override
  public void ack(long deliveryTag, boolean multiple) {
    this.inbox.add(Signal.event(ConfirmEvent.ack(deliveryTag, multiple)));
  }

  @Override
  public void nack(long deliveryTag, boolean multiple) {
    this.inbox.add(Signal.event(ConfirmEvent.nack(deliveryTag, multiple)));
  }

  @Override
  public void revoked() {
    this.stop(this.revocationCause, null);
  }

  /**
   * Set the cause to use when the engine revokes the sink.
   *
   * @param cause termination cause
   */
  void stopOnRevocation(Cause cause) {
    this.revocationCause = cause;
  }

  void stop(Cause cause, Throwable reason) {
    this.inbox.add(Signal.stop(new DefaultTermination(cause, reason)));
  }

  @Override
  @SuppressFBWarnings("EI_EXPOSE_REP")
  public Channel channel() {
    return this.channel;
  }

  @Override
  @SuppressFBWarnings("EI_EXPOSE_REP")
  public ConfirmHandler handler() {
    return this.handler;
  }

  @Override
  public boolean isActive() {
    return this.state() == OPEN;
  }

  @Override
  public CompletableFuture<Termination> termination() {
    return this.termination;
  }

  @Override
  public void cancel() {
    this.stop(Cause.CANCELLED, null);
  }

  @Override
  public void close() {
    this.cancel();
  }

  long id() {
    return this.id;
  }

  private Resource.StateListener downListener(Cause cause) {
    return context -> {
      if (context.currentState() == CLOSED) {
        Throwable reason = context.failureCause();
        if (reason == null) {
          reason = new ConfirmException.MonitoredResourceClosedException(context.resource());
        }
        this.stop(cause, reason);
      }
    };
  }

  private void loop() {
    DefaultTermination result = null;
    try {
      while (result == null) {
        result = this.process(this.inbox.take());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      result = new DefaultTermination(Cause.CANCELLED, e);
    } catch (RuntimeException e) {
      result = new DefaultTermination(Cause.HANDLER_TERMINATED, e);
    } catch (Error e) {
      this.metricsCollector.handlerFailure();
      result = new DefaultTermination(Cause.HANDLER_TERMINATED, e);
      throw e;
    } finally {
      this.terminate(result);
    }
  }

  private DefaultTermination process(Signal signal) {
    if (signal.termination != null) {
      return signal.termination;
    }
    ConfirmEvent event = signal.event;
    if (event.isAck()) {
      this.metricsCollector.ack(event.multiple());
    } else {
      this.metricsCollector.nack(event.multiple());
    }
    try {
      this.handler.handle(event);
      return null;
    } catch (Exception e) {
      this.metricsCollector.handlerFailure();
      return new DefaultTermination(Cause.HANDLER_TERMINATED, e);
    }
  }

  private void terminate(DefaultTermination result) {
    if (this.terminated.compareAndSet(false, true)) {
      Throwable reason = result.reason();
      if (result.cause() == Cause.HANDLER_TERMINATED || result.cause() == Cause.CHANNEL_CLOSED) {
        LOGGER.info(
            "Confirm handler adapter {} on channel {} terminated ({}): {}",
            id,
            channel.number(),
            result.cause(),
            reason == null ? "no reason" : reason.toString());
      } else {
        LOGGER.debug(
            "Confirm handler adapter {} on channel {} terminated ({})",
            id,
            channel.number(),
            result.cause());
      }
      this.state(CLOSING, reason);
      this.monitors.forEach(Resource.Monitor::close);
      this.monitors.clear();
      try {
        this.terminationCallback.accept(this);
      } catch (Exception e) {
        LOGGER.warn("Error while cleaning up confirm handler adapter {}", id, e);
      }
      this.state(CLOSED, reason);
      this.metricsCollector.closeAdapter();
      this.termination.complete(result);
    }
  }

  @Override
  public String toString() {
    return "ConfirmHandlerAdapter{" + "id=" + id + ", channel=" + channel.number() + '}';
  }

  private static final class Signal {

    private final ConfirmEvent event;
    private final DefaultTermination termination;

    private Signal(ConfirmEvent event, DefaultTermination termination) {
      this.event = event;
      this.termination = termination;
    }

    private static Signal event(ConfirmEvent event) {
      return new Signal(event, null);
    }

    private static Signal stop(DefaultTermination termination) {
      return new Signal(null, termination);
    }
  }

  static final class DefaultTermination implements Termination {

    private final Cause cause;
    private final Throwable reason;

    DefaultTermination(Cause cause, Throwable reason) {
      this.cause = cause;
      this.reason = reason;
    }

    @Override
    public Cause cause() {
      return this.cause;
    }

    @Override
    public Throwable reason() {
      return this.reason;
    }

    @Override
    public String toString() {
      return "Termination{" + "cause=" + cause + ", reason=" + reason + '}';
    }
  }
}

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

import static com.rabbitmq.client.confirm.impl.Assertions.assertThat;
import static com.rabbitmq.client.confirm.impl.TestUtils.waitAtMost;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.rabbitmq.client.confirm.ConfirmEvent;
import com.rabbitmq.client.confirm.ConfirmException;
import com.rabbitmq.client.confirm.ConfirmHandler;
import com.rabbitmq.client.confirm.ConfirmSubscription;
import com.rabbitmq.client.confirm.impl.TestUtils.RecordingHandler;
import com.rabbitmq.client.confirm.metrics.MicrometerMetricsCollector;
import com.rabbitmq.client.confirm.metrics.NoOpMetricsCollector;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;
import net.jqwik.api.Arbitraries;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class ConfirmHandlerAdapterTest {

  static ExecutorService executorService;
  TestChannel channel;
  List<ConfirmHandlerAdapter> cleanedUp;

  @BeforeAll
  static void beforeAll() {
    executorService = Executors.newCachedThreadPool();
  }

  @AfterAll
  static void afterAll() {
    executorService.shutdownNow();
  }

  @BeforeEach
  void init() {
    channel = new TestChannel(1);
    cleanedUp = new CopyOnWriteArrayList<>();
  }

  @Test
  void eventsShouldReachHandlerInOrder() {
    RecordingHandler handler = new RecordingHandler();
    ConfirmHandlerAdapter adapter = start(handler);
    int eventCount = Arbitraries.integers().between(10, 1000).sample();
    IntStream.rangeClosed(1, eventCount)
        .forEach(
            i -> {
              if (i % 7 == 0) {
                adapter.nack(i, i % 2 == 0);
              } else {
                adapter.ack(i, i % 3 == 0);
              }
            });
    waitAtMost(() -> handler.count() == eventCount);
    for (int i = 0; i < eventCount; i++) {
      long seqNo = i + 1;
      ConfirmEvent event = handler.events().get(i);
      assertThat(event.sequenceNumber()).isEqualTo(seqNo);
      assertThat(event.isAck()).isEqualTo(seqNo % 7 != 0);
    }
    assertThat(adapter).hasNotTerminated();
  }

  @Test
  void revocationShouldTerminateWithUnsubscribed() {
    ConfirmHandlerAdapter adapter = start(new RecordingHandler());
    adapter.revoked();
    assertThat(adapter).hasCause(ConfirmSubscription.Cause.UNSUBSCRIBED).hasNoReason();
    assertThat(cleanedUp).containsExactly(adapter);
    assertThat(adapter.state()).isEqualTo(ConfirmSubscription.State.CLOSED);
  }

  @Test
  void revocationShouldUseConfiguredCause() {
    ConfirmHandlerAdapter adapter = start(new RecordingHandler());
    adapter.stopOnRevocation(ConfirmSubscription.Cause.REPLACED);
    adapter.revoked();
    assertThat(adapter).hasCause(ConfirmSubscription.Cause.REPLACED);
  }

  @Test
  void firstTerminationSignalShouldWin() {
    ConfirmHandlerAdapter adapter = start(new RecordingHandler());
    adapter.cancel();
    adapter.stop(ConfirmSubscription.Cause.TRACKER_CLOSED, null);
    adapter.revoked();
    assertThat(adapter).hasCause(ConfirmSubscription.Cause.CANCELLED);
    assertThat(cleanedUp).hasSize(1);
  }

  @Test
  void eventsReceivedBeforeStopShouldBeHandled() {
    CountDownLatch blockLatch = new CountDownLatch(1);
    RecordingHandler recordingHandler = new RecordingHandler();
    ConfirmHandler handler =
        event -> {
          waitAtMost(() -> blockLatch.getCount() == 0);
          recordingHandler.handle(event);
        };
    ConfirmHandlerAdapter adapter = start(handler);
    adapter.ack(1, false);
    adapter.ack(2, false);
    adapter.cancel();
    adapter.ack(3, false);
    blockLatch.countDown();
    assertThat(adapter).hasCause(ConfirmSubscription.Cause.CANCELLED);
    assertThat(recordingHandler.events())
        .containsExactly(ConfirmEvent.ack(1, false), ConfirmEvent.ack(2, false));
  }

  @Test
  void handlerErrorShouldTerminateAdapterAndCountFailure() {
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    AssertionError error = new AssertionError("unexpected confirm");
    ConfirmHandlerAdapter adapter =
        new ConfirmHandlerAdapter(
            channel,
            event -> {
              throw error;
            },
            new MicrometerMetricsCollector(registry),
            cleanedUp::add);
    adapter.start(executorService);
    adapter.nack(1, false);
    assertThat(adapter)
        .hasCause(ConfirmSubscription.Cause.HANDLER_TERMINATED)
        .hasReason(error);
    assertThat(registry.get("rabbitmq.confirm.handler_failures").counter().count())
        .isEqualTo(1.0);
    assertThat(registry.get("rabbitmq.confirm.nacks").counter().count()).isEqualTo(1.0);
    assertThat(registry.get("rabbitmq.confirm.adapters").gauge().value()).isZero();
  }

  @Test
  void monitorsShouldBeReleasedOnTermination() {
    BlockingConfirmEventQueue queue = new BlockingConfirmEventQueue();
    int channelListeners = channel.monitorCount();
    ConfirmHandlerAdapter adapter = start(queue);
    assertThat(channel.monitorCount()).isEqualTo(channelListeners + 1);
    assertThat(queue.listenerCount()).isEqualTo(1);
    adapter.cancel();
    assertThat(adapter).hasCause(ConfirmSubscription.Cause.CANCELLED);
    assertThat(channel.monitorCount()).isEqualTo(channelListeners);
    assertThat(queue.listenerCount()).isZero();
  }

  @Test
  void handlerResourceClosureShouldTerminateAdapter() {
    BlockingConfirmEventQueue queue = new BlockingConfirmEventQueue();
    ConfirmHandlerAdapter adapter = start(queue);
    adapter.ack(1, false);
    waitAtMost(() -> queue.size() == 1);
    queue.close();
    assertThat(adapter)
        .hasCause(ConfirmSubscription.Cause.HANDLER_TERMINATED)
        .hasReasonInstanceOf(ConfirmException.MonitoredResourceClosedException.class);
  }

  @Test
  void terminationCallbackErrorShouldNotPreventTermination() {
    AtomicInteger callbackCalls = new AtomicInteger(0);
    ConfirmHandlerAdapter adapter =
        new ConfirmHandlerAdapter(
            channel,
            new RecordingHandler(),
            NoOpMetricsCollector.INSTANCE,
            a -> {
              callbackCalls.incrementAndGet();
              throw new IllegalStateException("cleanup failure");
            });
    adapter.start(executorService);
    adapter.close();
    assertThat(adapter).hasCause(ConfirmSubscription.Cause.CANCELLED);
    assertThat(callbackCalls).hasValue(1);
    assertThat(adapter.isActive()).isFalse();
  }

  @Test
  void rejectedStartShouldTerminateWithTrackerClosed() {
    ExecutorService executor = Executors.newSingleThreadExecutor();
    executor.shutdownNow();
    ConfirmHandlerAdapter adapter =
        new ConfirmHandlerAdapter(
            channel, new RecordingHandler(), NoOpMetricsCollector.INSTANCE, cleanedUp::add);
    assertThatThrownBy(() -> adapter.start(executor))
        .isInstanceOf(ConfirmException.ConfirmTrackerClosedException.class);
    assertThat(adapter).hasCause(ConfirmSubscription.Cause.TRACKER_CLOSED);
    assertThat(cleanedUp).containsExactly(adapter);
    assertThat(channel.monitorCount()).isZero();
  }

  private ConfirmHandlerAdapter start(ConfirmHandler handler) {
    ConfirmHandlerAdapter adapter =
        new ConfirmHandlerAdapter(
            channel, handler, NoOpMetricsCollector.INSTANCE, cleanedUp::add);
    adapter.start(executorService);
    assertThat(adapter).isActive();
    return adapter;
  }
}

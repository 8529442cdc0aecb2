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
import static com.rabbitmq.client.confirm.impl.TestUtils.simulateActivity;
import static com.rabbitmq.client.confirm.impl.TestUtils.submitTask;
import static com.rabbitmq.client.confirm.impl.TestUtils.waitAtMost;
import static java.time.Duration.ofSeconds;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.rabbitmq.client.confirm.Channel;
import com.rabbitmq.client.confirm.ChannelEngine;
import com.rabbitmq.client.confirm.ConfirmException;
import com.rabbitmq.client.confirm.ConfirmOutcome;
import com.rabbitmq.client.confirm.ConfirmSubscription;
import com.rabbitmq.client.confirm.ConfirmTracker;
import com.rabbitmq.client.confirm.ProtocolMethod;
import com.rabbitmq.client.confirm.Resource;
import com.rabbitmq.client.confirm.impl.TestUtils.RecordingHandler;
import com.rabbitmq.client.confirm.metrics.MetricsCollector;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
public class ConfirmTrackerMockTest {

  @Mock ChannelEngine engine;
  @Mock Channel channel;
  @Mock Resource.Monitor monitor;
  @Mock MetricsCollector metricsCollector;

  DefaultConfirmTracker tracker;

  @BeforeEach
  void init() {
    tracker =
        (DefaultConfirmTracker)
            new DefaultConfirmTrackerBuilder()
                .engine(engine)
                .metricsCollector(metricsCollector)
                .build();
  }

  @AfterEach
  void tearDown() {
    tracker.close();
  }

  @Test
  void selectShouldRecordOutcome() {
    when(engine.enableConfirms(channel))
        .thenReturn(ProtocolMethod.CONFIRM_SELECT_OK)
        .thenReturn(ProtocolMethod.channelClose(406, "PRECONDITION_FAILED"));
    assertThat(tracker.select(channel).isOk()).isTrue();
    assertThat(tracker.select(channel).isOk()).isFalse();
    verify(metricsCollector, times(1)).select(true);
    verify(metricsCollector, times(1)).select(false);
  }

  @Test
  void engineExceptionShouldBeConverted() {
    when(engine.enableConfirms(channel)).thenThrow(new IllegalStateException("boom"));
    assertThatThrownBy(() -> tracker.select(channel))
        .isInstanceOf(ConfirmException.class)
        .hasMessageContaining("activating confirms on channel 0")
        .hasCauseInstanceOf(IllegalStateException.class);
    verify(metricsCollector, never()).select(anyBoolean());
  }

  @Test
  void confirmExceptionFromEngineShouldPassThrough() {
    ConfirmException exception = new ConfirmException.ResourceClosedException("Channel is closed");
    when(engine.nextSequenceNumber(channel)).thenThrow(exception);
    assertThatThrownBy(() -> tracker.nextPublishSeqNo(channel)).isSameAs(exception);
  }

  @Test
  void nextPublishSeqNoShouldDelegateToEngine() {
    when(engine.nextSequenceNumber(channel)).thenReturn(42L);
    assertThat(tracker.nextPublishSeqNo(channel)).isEqualTo(42L);
  }

  @Test
  void waitForConfirmsShouldRecordOutcome() throws Exception {
    when(engine.blockUntilConfirmed(channel)).thenReturn(true).thenReturn(false);
    Duration timeout = ofSeconds(5);
    when(engine.blockUntilConfirmed(channel, timeout)).thenReturn(ConfirmOutcome.TIMED_OUT);
    assertThat(tracker.waitForConfirms(channel)).isTrue();
    assertThat(tracker.waitForConfirms(channel)).isFalse();
    assertThat(tracker.waitForConfirms(channel, timeout)).isEqualTo(ConfirmOutcome.TIMED_OUT);
    verify(metricsCollector, times(1)).waitOutcome(ConfirmOutcome.ACKED);
    verify(metricsCollector, times(1)).waitOutcome(ConfirmOutcome.NACKED);
    verify(metricsCollector, times(1)).waitOutcome(ConfirmOutcome.TIMED_OUT);
  }

  @Test
  void interruptedWaitShouldRaiseConfirmException() throws Exception {
    when(engine.blockUntilConfirmed(channel)).thenThrow(new InterruptedException());
    assertThatThrownBy(() -> tracker.waitForConfirms(channel))
        .isInstanceOf(ConfirmException.class)
        .hasMessageContaining("has been interrupted")
        .hasCauseInstanceOf(InterruptedException.class);
    assertThat(Thread.interrupted()).isTrue();
    verify(metricsCollector, never()).waitOutcome(any());
  }

  @Test
  void waitForConfirmsOrDieShouldRecordOutcome() throws Exception {
    Duration timeout = ofSeconds(1);
    ConfirmException.NackReceivedException nack =
        new ConfirmException.NackReceivedException("Nacks received on channel %d", 0);
    ConfirmException.ConfirmTimeoutException timedOut =
        new ConfirmException.ConfirmTimeoutException("Confirm timeout on channel %d", 0);
    doNothing().doThrow(nack).when(engine).blockUntilConfirmedOrAbort(channel);
    doThrow(timedOut).when(engine).blockUntilConfirmedOrAbort(channel, timeout);

    tracker.waitForConfirmsOrDie(channel);
    assertThatThrownBy(() -> tracker.waitForConfirmsOrDie(channel)).isSameAs(nack);
    assertThatThrownBy(() -> tracker.waitForConfirmsOrDie(channel, timeout)).isSameAs(timedOut);
    verify(metricsCollector, times(1)).waitOutcome(ConfirmOutcome.ACKED);
    verify(metricsCollector, times(1)).waitOutcome(ConfirmOutcome.NACKED);
    verify(metricsCollector, times(1)).waitOutcome(ConfirmOutcome.TIMED_OUT);
  }

  @Test
  void failedSubscriptionShouldNotKeepHandler() {
    doThrow(new IllegalStateException("boom"))
        .when(engine)
        .subscribeConfirmEvents(eq(channel), any());
    assertThatThrownBy(() -> tracker.registerHandler(channel, new RecordingHandler()))
        .isInstanceOf(ConfirmException.class)
        .hasCauseInstanceOf(IllegalStateException.class);
    assertThat(tracker.adapterCount()).isZero();
    verify(channel, never()).monitor(any());
    verify(metricsCollector, never()).openAdapter();
  }

  @Test
  void failedReplacementShouldKeepPreviousHandler() {
    when(channel.monitor(any())).thenReturn(monitor);
    doNothing()
        .doThrow(new IllegalStateException("boom"))
        .when(engine)
        .subscribeConfirmEvents(eq(channel), any());
    ConfirmSubscription subscription = tracker.registerHandler(channel, new RecordingHandler());
    assertThatThrownBy(() -> tracker.registerHandler(channel, new RecordingHandler()))
        .isInstanceOf(ConfirmException.class);
    assertThat(tracker.adapterCount()).isEqualTo(1);
    assertThat(subscription).isActive().hasNotTerminated();

    tracker.close();
    assertThat(subscription).hasCause(ConfirmSubscription.Cause.TRACKER_CLOSED);
    verify(monitor, times(1)).close();
    verify(engine, times(1)).unsubscribeConfirmEvents(channel);
  }

  @Test
  void unsubscribeFailureShouldNotPreventTermination() {
    when(channel.monitor(any())).thenReturn(monitor);
    doThrow(new IllegalStateException("boom")).when(engine).unsubscribeConfirmEvents(channel);
    ConfirmSubscription subscription = tracker.registerHandler(channel, new RecordingHandler());
    verify(metricsCollector, times(1)).openAdapter();
    subscription.cancel();
    assertThat(subscription).hasCause(ConfirmSubscription.Cause.CANCELLED);
    assertThat(tracker.adapterCount()).isZero();
    verify(metricsCollector, times(1)).closeAdapter();
  }

  @Test
  void lateCleanUpOfTerminatedHandlerShouldNotRevokeReplacement() {
    when(channel.monitor(any())).thenReturn(monitor);
    AtomicReference<ChannelEngine.ConfirmSink> currentSink = new AtomicReference<>();
    doAnswer(
            invocation -> {
              currentSink.set(invocation.getArgument(1));
              return null;
            })
        .when(engine)
        .subscribeConfirmEvents(eq(channel), any());
    CountDownLatch unsubscribeLatch = new CountDownLatch(1);
    CountDownLatch releaseLatch = new CountDownLatch(1);
    AtomicBoolean firstUnsubscribe = new AtomicBoolean(true);
    doAnswer(
            invocation -> {
              if (firstUnsubscribe.compareAndSet(true, false)) {
                unsubscribeLatch.countDown();
                releaseLatch.await(10, TimeUnit.SECONDS);
              }
              ChannelEngine.ConfirmSink sink = currentSink.getAndSet(null);
              if (sink != null) {
                sink.revoked();
              }
              return null;
            })
        .when(engine)
        .unsubscribeConfirmEvents(channel);

    ConfirmSubscription failing =
        tracker.registerHandler(
            channel,
            event -> {
              throw new IllegalStateException("handler failure");
            });
    currentSink.get().ack(1, false);
    // the failing handler is now unsubscribing from the engine
    assertThat(unsubscribeLatch).completes();

    AtomicReference<ConfirmSubscription> replacement = new AtomicReference<>();
    submitTask(() -> replacement.set(tracker.registerHandler(channel, new RecordingHandler())));
    simulateActivity(100);
    releaseLatch.countDown();
    waitAtMost(() -> replacement.get() != null);

    assertThat(failing)
        .hasCause(ConfirmSubscription.Cause.HANDLER_TERMINATED)
        .hasReasonInstanceOf(IllegalStateException.class);
    assertThat(replacement.get()).isActive().hasNotTerminated();
    assertThat(currentSink.get()).isNotNull();
    assertThat(tracker.adapterCount()).isEqualTo(1);
  }

  @Test
  void externalExecutorServiceShouldNotBeShutDown() {
    ExecutorService executorService = Executors.newSingleThreadExecutor();
    try {
      ConfirmTracker t =
          new DefaultConfirmTrackerBuilder()
              .engine(engine)
              .executorService(executorService)
              .build();
      t.close();
      assertThat(executorService.isShutdown()).isFalse();
    } finally {
      executorService.shutdownNow();
    }
  }
}

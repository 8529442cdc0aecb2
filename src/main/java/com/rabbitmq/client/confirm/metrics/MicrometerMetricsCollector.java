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
package com.rabbitmq.client.confirm.metrics;

import com.rabbitmq.client.confirm.ConfirmOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import java.util.Collections;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link MetricsCollector} implementation using <a href="https://micrometer.io/">Micrometer</a>.
 */
public class MicrometerMetricsCollector implements MetricsCollector {

  private final AtomicLong adapters;
  private final Counter selects, selectsFailed;
  private final Counter acks, nacks;
  private final Counter waitsAcked, waitsNacked, waitsTimedOut;
  private final Counter handlerFailures;

  public MicrometerMetricsCollector(MeterRegistry registry) {
    this(registry, "rabbitmq.confirm");
  }

  public MicrometerMetricsCollector(final MeterRegistry registry, final String prefix) {
    this(registry, prefix, Collections.emptyList());
  }

  public MicrometerMetricsCollector(
      final MeterRegistry registry, final String prefix, final String... tags) {
    this(registry, prefix, Tags.of(tags));
  }

  public MicrometerMetricsCollector(
      final MeterRegistry registry, final String prefix, final Iterable<Tag> tags) {
    this.adapters = registry.gauge(prefix + ".adapters", tags, new AtomicLong(0));
    this.selects = registry.counter(prefix + ".selects", tags);
    this.selectsFailed = registry.counter(prefix + ".selects_failed", tags);
    this.acks = registry.counter(prefix + ".acks", tags);
    this.nacks = registry.counter(prefix + ".nacks", tags);
    this.waitsAcked = registry.counter(prefix + ".waits_acked", tags);
    this.waitsNacked = registry.counter(prefix + ".waits_nacked", tags);
    this.waitsTimedOut = registry.counter(prefix + ".waits_timed_out", tags);
    this.handlerFailures = registry.counter(prefix + ".handler_failures", tags);
  }

  @Override
  public void openAdapter() {
    this.adapters.incrementAndGet();
  }

  @Override
  public void closeAdapter() {
    this.adapters.decrementAndGet();
  }

  @Override
  public void select(boolean ok) {
    this.selects.increment();
    if (!ok) {
      this.selectsFailed.increment();
    }
  }

  @Override
  public void ack(boolean multiple) {
    this.acks.increment();
  }

  @Override
  public void nack(boolean multiple) {
    this.nacks.increment();
  }

  @Override
  public void waitOutcome(ConfirmOutcome outcome) {
    switch (outcome) {
      case ACKED:
        this.waitsAcked.increment();
        break;
      case NACKED:
        this.waitsNacked.increment();
        break;
      case TIMED_OUT:
        this.waitsTimedOut.increment();
        break;
      default:
        break;
    }
  }

  @Override
  public void handlerFailure() {
    this.handlerFailures.increment();
  }
}

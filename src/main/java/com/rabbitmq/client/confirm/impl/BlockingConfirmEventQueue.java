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
import static com.rabbitmq.client.confirm.impl.Utils.checkTimeout;

import com.rabbitmq.client.confirm.ConfirmEvent;
import com.rabbitmq.client.confirm.ConfirmEventQueue;
import com.rabbitmq.client.confirm.ConfirmException;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

final class BlockingConfirmEventQueue extends ResourceBase implements ConfirmEventQueue {

  // enqueued on close to wake up consumers, compared by identity
  private static final ConfirmEvent CLOSED_MARKER = ConfirmEvent.ack(0, false);

  private final BlockingQueue<ConfirmEvent> events = new LinkedBlockingQueue<>();
  private final AtomicBoolean closed = new AtomicBoolean(false);

  BlockingConfirmEventQueue() {
    this.state(OPEN);
  }

  @Override
  public void handle(ConfirmEvent event) {
    synchronized (this.events) {
      checkOpen();
      this.events.add(event);
    }
  }

  @Override
  public ConfirmEvent take() throws InterruptedException {
    ConfirmEvent event = this.events.take();
    if (event == CLOSED_MARKER) {
      // put back for the other consumers
      this.events.add(CLOSED_MARKER);
      throw new ConfirmException.ResourceClosedException("Confirm event queue is closed");
    }
    return event;
  }

  @Override
  public ConfirmEvent poll() {
    return this.checkMarker(this.events.poll());
  }

  @Override
  public ConfirmEvent poll(Duration timeout) throws InterruptedException {
    checkTimeout(timeout);
    return this.checkMarker(this.events.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
  }

  private ConfirmEvent checkMarker(ConfirmEvent event) {
    if (event == CLOSED_MARKER) {
      this.events.add(CLOSED_MARKER);
      return null;
    }
    return event;
  }

  @Override
  public int size() {
    return (int) this.events.stream().filter(e -> e != CLOSED_MARKER).count();
  }

  @Override
  public void close() {
    this.close(null);
  }

  @Override
  public void close(Throwable reason) {
    if (this.closed.compareAndSet(false, true)) {
      this.state(CLOSING, reason);
      this.state(CLOSED, reason);
      // after any event a concurrent handle call accepted
      synchronized (this.events) {
        this.events.add(CLOSED_MARKER);
      }
    }
  }

  @Override
  public String toString() {
    return "ConfirmEventQueue{" + "size=" + this.size() + ", state=" + this.state() + '}';
  }
}

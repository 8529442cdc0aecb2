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
package com.rabbitmq.client.confirm;

import java.util.Iterator;
import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Correlation of published messages with their confirms.
 *
 * <p>The application tracks a message with the sequence number returned by {@link
 * ConfirmTracker#nextPublishSeqNo(Channel)} <b>before</b> publishing it. Once registered as the
 * handler of the channel, the instance resolves tracked messages as confirms arrive and calls back
 * the application for each of them, in sequence number order.
 *
 * <pre>{@code
 * OutstandingConfirms<String> outstanding = new OutstandingConfirms<>(
 *     (messageId, event) -> {
 *       if (!event.isAck()) {
 *         republish(messageId);
 *       }
 *     });
 * tracker.registerHandler(channel, outstanding);
 * outstanding.track(tracker.nextPublishSeqNo(channel), messageId);
 * // publish
 * }</pre>
 *
 * @param <T> type of the application context associated with each message
 */
public class OutstandingConfirms<T> implements ConfirmHandler {

  private final ConcurrentNavigableMap<Long, T> outstanding = new ConcurrentSkipListMap<>();
  private final ConfirmCallback<T> callback;

  public OutstandingConfirms(ConfirmCallback<T> callback) {
    this.callback = callback;
  }

  /**
   * Track a message.
   *
   * @param sequenceNumber sequence number of the message
   * @param context application context for the message
   */
  public void track(long sequenceNumber, T context) {
    if (context == null) {
      throw new IllegalArgumentException("Context cannot be null");
    }
    if (this.outstanding.putIfAbsent(sequenceNumber, context) != null) {
      throw new IllegalStateException("Sequence number " + sequenceNumber + " is already tracked");
    }
  }

  /**
   * The number of tracked messages not confirmed yet.
   *
   * @return outstanding message count
   */
  public int outstandingCount() {
    return this.outstanding.size();
  }

  public boolean isEmpty() {
    return this.outstanding.isEmpty();
  }

  @Override
  public void handle(ConfirmEvent event) {
    if (event.multiple()) {
      NavigableMap<Long, T> confirmed = this.outstanding.headMap(event.sequenceNumber(), true);
      Iterator<Map.Entry<Long, T>> iterator = confirmed.entrySet().iterator();
      while (iterator.hasNext()) {
        Map.Entry<Long, T> entry = iterator.next();
        iterator.remove();
        this.callback.handle(entry.getValue(), event);
      }
    } else {
      T context = this.outstanding.remove(event.sequenceNumber());
      if (context != null) {
        this.callback.handle(context, event);
      }
    }
  }

  /**
   * Callback for a resolved message.
   *
   * @param <T> type of the application context
   */
  @FunctionalInterface
  public interface ConfirmCallback<T> {

    /**
     * Handle a resolved message.
     *
     * @param context the application context of the message
     * @param event the event that resolved the message, can be cumulative
     */
    void handle(T context, ConfirmEvent event);
  }
}

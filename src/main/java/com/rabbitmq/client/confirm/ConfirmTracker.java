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

import java.time.Duration;

/**
 * API to work with publisher confirms, a RabbitMQ extension to AMQP 0.9.1.
 *
 * <p>Instances are configured and created with a {@link ConfirmTrackerBuilder}. They are expected
 * to be thread-safe.
 *
 * @see com.rabbitmq.client.confirm.impl.DefaultConfirmTrackerBuilder
 * @see <a href="https://www.rabbitmq.com/docs/confirms#publisher-confirms">Publisher Confirms</a>
 */
public interface ConfirmTracker extends AutoCloseable {

  /**
   * Activate publisher confirms on the channel.
   *
   * <p>Messages published on the channel after a successful activation get a sequence number.
   *
   * @param channel the channel
   * @return the result, carrying the reply of the engine if the activation failed
   */
  SelectResult select(Channel channel);

  /**
   * Wait until all messages published since the last call have been either acked or nacked by the
   * broker.
   *
   * @param channel the channel
   * @return true if all the messages have been acked, false if at least one has been nacked
   */
  boolean waitForConfirms(Channel channel);

  /**
   * Wait until all messages published since the last call have been either acked or nacked by the
   * broker, or until the timeout elapses.
   *
   * @param channel the channel
   * @param timeout the timeout, zero means the call does not block
   * @return the outcome, {@link ConfirmOutcome#TIMED_OUT} if the timeout elapsed
   */
  ConfirmOutcome waitForConfirms(Channel channel, Duration timeout);

  /**
   * Wait until all messages published since the last call have been acked by the broker.
   *
   * @param channel the channel
   * @throws ConfirmException.NackReceivedException if a message has been nacked
   */
  void waitForConfirmsOrDie(Channel channel);

  /**
   * Wait until all messages published since the last call have been acked by the broker, or until
   * the timeout elapses.
   *
   * @param channel the channel
   * @param timeout the timeout
   * @throws ConfirmException.NackReceivedException if a message has been nacked
   * @throws ConfirmException.ConfirmTimeoutException if the timeout elapsed
   */
  void waitForConfirmsOrDie(Channel channel, Duration timeout);

  /**
   * The sequence number of the next message published on the channel.
   *
   * <p>Use in combination with {@link #registerHandler(Channel, ConfirmHandler)} to correlate
   * messages with confirms.
   *
   * @param channel a channel with confirms activated
   * @return the next sequence number
   */
  long nextPublishSeqNo(Channel channel);

  /**
   * Register a handler for the confirms of the channel.
   *
   * <p>The handler receives either <code>{ack, seqno, multiple}</code> or <code>
   * {nack, seqno, multiple}</code> events. <code>multiple</code> means all the messages up to
   * <code>seqno</code> are confirmed.
   *
   * <p>The returned subscription stops when the channel or the handler (if it is a {@link
   * Resource}) is closed. A new registration on the same channel replaces the previous one.
   *
   * @param channel the channel
   * @param handler the handler
   * @return the subscription
   */
  ConfirmSubscription registerHandler(Channel channel, ConfirmHandler handler);

  /**
   * Unregister the handler of the channel, if any.
   *
   * @param channel the channel
   */
  void unregisterHandler(Channel channel);

  /**
   * Create an unbounded {@link ConfirmEventQueue}, to use with {@link #registerHandler(Channel,
   * ConfirmHandler)}.
   *
   * @return a new event queue
   */
  ConfirmEventQueue eventQueue();

  /** Close the tracker, cancelling its subscriptions. Channels are left untouched. */
  @Override
  void close();
}

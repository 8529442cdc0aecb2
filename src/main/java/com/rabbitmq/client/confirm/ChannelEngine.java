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
 * Protocol engine that owns AMQP 0.9.1 channels.
 *
 * <p>The engine does the framing, the channel multiplexing, and the network I/O. It also owns the
 * confirm state of each channel: the publish sequence counter and the set of outstanding
 * confirms. The {@link ConfirmTracker} delegates to it.
 *
 * <p>Implementations must be thread-safe.
 */
public interface ChannelEngine {

  /**
   * Send <code>confirm.select</code> on the channel and return the reply.
   *
   * @param channel the channel
   * @return the reply, {@link ProtocolMethod#CONFIRM_SELECT_OK} in case of success
   */
  ProtocolMethod enableConfirms(Channel channel);

  /**
   * Block until all the messages published since the last call have been acked or nacked.
   *
   * @param channel the channel
   * @return true if all the messages have been acked, false if at least one has been nacked
   * @throws InterruptedException if the calling thread is interrupted
   */
  boolean blockUntilConfirmed(Channel channel) throws InterruptedException;

  /**
   * Block until all the messages published since the last call have been acked or nacked, or
   * until the timeout elapses.
   *
   * @param channel the channel
   * @param timeout the timeout, zero means no waiting at all
   * @return the outcome
   * @throws InterruptedException if the calling thread is interrupted
   */
  ConfirmOutcome blockUntilConfirmed(Channel channel, Duration timeout)
      throws InterruptedException;

  /**
   * Block until all the messages published since the last call have been acked, abort if any has
   * been nacked.
   *
   * <p>Aborting closes the channel.
   *
   * @param channel the channel
   * @throws InterruptedException if the calling thread is interrupted
   * @throws ConfirmException.NackReceivedException if a message has been nacked
   */
  void blockUntilConfirmedOrAbort(Channel channel) throws InterruptedException;

  /**
   * Block until all the messages published since the last call have been acked, abort if any has
   * been nacked or if the timeout elapses.
   *
   * <p>Aborting closes the channel.
   *
   * @param channel the channel
   * @param timeout the timeout
   * @throws InterruptedException if the calling thread is interrupted
   * @throws ConfirmException.NackReceivedException if a message has been nacked
   * @throws ConfirmException.ConfirmTimeoutException if the timeout elapses
   */
  void blockUntilConfirmedOrAbort(Channel channel, Duration timeout) throws InterruptedException;

  /**
   * The sequence number the next published message will get.
   *
   * @param channel the channel
   * @return the next sequence number, 0 if confirms are not activated on the channel
   */
  long nextSequenceNumber(Channel channel);

  /**
   * Set the sink for the confirms of the channel.
   *
   * <p>There is one sink at most per channel. The previous sink, if any, is replaced and notified
   * with {@link ConfirmSink#revoked()}.
   *
   * @param channel the channel
   * @param sink the sink
   */
  void subscribeConfirmEvents(Channel channel, ConfirmSink sink);

  /**
   * Remove the sink for the confirms of the channel.
   *
   * <p>The removed sink, if any, is notified with {@link ConfirmSink#revoked()}.
   *
   * @param channel the channel
   */
  void unsubscribeConfirmEvents(Channel channel);

  /**
   * Engine-side destination of <code>basic.ack</code> and <code>basic.nack</code>.
   *
   * <p>The engine calls the sink in the order it receives the confirms for the channel.
   * Implementations must not block.
   */
  interface ConfirmSink {

    /**
     * <code>basic.ack</code> received.
     *
     * @param deliveryTag sequence number of the message
     * @param multiple whether all messages up to the delivery tag are acked
     */
    void ack(long deliveryTag, boolean multiple);

    /**
     * <code>basic.nack</code> received.
     *
     * @param deliveryTag sequence number of the message
     * @param multiple whether all messages up to the delivery tag are nacked
     */
    void nack(long deliveryTag, boolean multiple);

    /** The engine no longer delivers confirms to this sink. */
    default void revoked() {}
  }
}

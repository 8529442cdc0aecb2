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

import java.util.concurrent.CompletableFuture;

/**
 * Relay of the confirms of a channel to a {@link ConfirmHandler}.
 *
 * <p>The subscription is active until it is cancelled, its channel is closed, its handler fails or
 * is closed, or the engine stops delivering confirms to it. The {@link #termination()} future
 * completes when the subscription stops, whatever the reason.
 *
 * <p>Applications should {@link #cancel()} subscriptions they no longer need.
 *
 * @see ConfirmTracker#registerHandler(Channel, ConfirmHandler)
 */
public interface ConfirmSubscription extends Resource, AutoCloseable {

  /**
   * The channel the confirms come from.
   *
   * @return the channel
   */
  Channel channel();

  /**
   * The handler the confirms go to.
   *
   * @return the handler
   */
  ConfirmHandler handler();

  /**
   * Whether the subscription still relays confirms.
   *
   * @return true if active
   */
  boolean isActive();

  /**
   * Future that completes when the subscription stops.
   *
   * @return the termination future
   */
  CompletableFuture<Termination> termination();

  /**
   * Stop the subscription.
   *
   * <p>Events already received are delivered before the subscription stops.
   */
  void cancel();

  /** Same as {@link #cancel()}. */
  @Override
  void close();

  /** Why and how a subscription stopped. */
  interface Termination {

    Cause cause();

    /**
     * The failure that stopped the subscription, null for a regular cancellation.
     *
     * @return the reason, can be null
     */
    Throwable reason();
  }

  /** Termination cause. */
  enum Cause {
    /** The application cancelled the subscription. */
    CANCELLED,
    /** Another handler has been registered for the channel. */
    REPLACED,
    /** The engine stopped delivering confirms to the subscription. */
    UNSUBSCRIBED,
    /** The handler threw an exception or has been closed. */
    HANDLER_TERMINATED,
    /** The channel has been closed. */
    CHANNEL_CLOSED,
    /** The confirm tracker has been closed. */
    TRACKER_CLOSED
  }
}

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
 * {@link ConfirmHandler} that stores events in a queue the application consumes from.
 *
 * <p>The queue is unbounded. It is a {@link Resource}: closing it terminates the subscriptions it
 * is registered to, with the close reason if any.
 *
 * @see ConfirmTracker#eventQueue()
 */
public interface ConfirmEventQueue extends ConfirmHandler, Resource, AutoCloseable {

  /**
   * Retrieve the next event, waiting if necessary.
   *
   * @return the next event
   * @throws InterruptedException if interrupted while waiting
   * @throws ConfirmException.ResourceClosedException if the queue is closed and empty
   */
  ConfirmEvent take() throws InterruptedException;

  /**
   * Retrieve the next event if any.
   *
   * @return the next event, null if there is none
   */
  ConfirmEvent poll();

  /**
   * Retrieve the next event, waiting up to the timeout if necessary.
   *
   * @param timeout how long to wait
   * @return the next event, null if the timeout elapsed
   * @throws InterruptedException if interrupted while waiting
   */
  ConfirmEvent poll(Duration timeout) throws InterruptedException;

  /**
   * The number of events waiting in the queue.
   *
   * @return event count
   */
  int size();

  /** Close the queue. */
  @Override
  void close();

  /**
   * Close the queue with a failure cause.
   *
   * @param reason the reason, propagated to the subscriptions that monitor the queue
   */
  void close(Throwable reason);
}

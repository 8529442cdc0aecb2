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

/**
 * Contract for objects with a lifecycle that can be monitored.
 *
 * <p>Instances go through different states: opening, open, closing, closed. Other parties can
 * {@link #monitor(StateListener) monitor} a resource to be notified of its state changes, e.g. a
 * confirm handler adapter stops when the {@link Channel} it relays confirms for is closed.
 *
 * @see Channel
 * @see ConfirmSubscription
 * @see ConfirmEventQueue
 */
public interface Resource {

  /**
   * The current state of the resource.
   *
   * @return current state
   */
  State state();

  /**
   * Register a listener for state changes.
   *
   * <p>The listener is called for every state change after its registration, until the returned
   * {@link Monitor} is closed. Monitoring a resource that is already {@link State#CLOSED} results
   * in an immediate notification.
   *
   * @param listener the listener
   * @return the monitor, to close to stop the monitoring
   */
  Monitor monitor(StateListener listener);

  /** Handle on a state listener registration. */
  interface Monitor extends AutoCloseable {

    /** Stop the monitoring. */
    @Override
    void close();
  }

  /** Application listener for a {@link Resource}. */
  @FunctionalInterface
  interface StateListener {

    /**
     * Handle state change.
     *
     * @param context state change context
     */
    void handle(Context context);
  }

  /** Context of a resource state change. */
  interface Context {

    /**
     * The resource instance.
     *
     * @return resource instance
     */
    Resource resource();

    /**
     * The failure cause, can be null.
     *
     * @return failure cause, null if no cause for failure
     */
    Throwable failureCause();

    /**
     * The previous state of the resource.
     *
     * @return previous state
     */
    State previousState();

    /**
     * The current (new) state of the resource.
     *
     * @return current state
     */
    State currentState();
  }

  /** Resource state. */
  enum State {
    /** The resource is currently opening. */
    OPENING,
    /** The resource is open and functional. */
    OPEN,
    /** The resource is closing. */
    CLOSING,
    /** The resource is closed. */
    CLOSED
  }
}

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
 * Callback API for publisher confirms.
 *
 * <p>Events are delivered in the order the broker sends them for a given channel, from a single
 * thread. An exception thrown by the handler stops the delivery: the subscription terminates with
 * this exception as its reason.
 *
 * <p>A handler that is also a {@link Resource} is monitored: the subscription terminates when the
 * handler is closed.
 *
 * @see ConfirmTracker#registerHandler(Channel, ConfirmHandler)
 */
@FunctionalInterface
public interface ConfirmHandler {

  /**
   * Handle a confirm event.
   *
   * @param event the ack or the nack
   */
  void handle(ConfirmEvent event);
}

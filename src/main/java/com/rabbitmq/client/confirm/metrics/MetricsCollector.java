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

/** Interface to collect execution data of the confirm tracker. */
public interface MetricsCollector {

  /** Called when a {@link com.rabbitmq.client.confirm.ConfirmSubscription} starts. */
  void openAdapter();

  /** Called when a {@link com.rabbitmq.client.confirm.ConfirmSubscription} stops. */
  void closeAdapter();

  /**
   * Called after the activation of confirms on a channel.
   *
   * @param ok whether the activation succeeded
   */
  void select(boolean ok);

  /**
   * Called when an ack is relayed to a handler.
   *
   * @param multiple whether the ack is cumulative
   */
  void ack(boolean multiple);

  /**
   * Called when a nack is relayed to a handler.
   *
   * @param multiple whether the nack is cumulative
   */
  void nack(boolean multiple);

  /**
   * Called when a wait for confirms returns or fails.
   *
   * @param outcome outcome of the wait
   */
  void waitOutcome(ConfirmOutcome outcome);

  /** Called when a handler throws an exception. */
  void handlerFailure();
}

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
 * Outcome of a wait with a deadline.
 *
 * @see ConfirmTracker#waitForConfirms(Channel, java.time.Duration)
 */
public enum ConfirmOutcome {
  /** All the messages published since the last wait have been acked. */
  ACKED,
  /** At least one of the messages published since the last wait has been nacked. */
  NACKED,
  /** The deadline elapsed before all the messages were acked or nacked. */
  TIMED_OUT;

  /**
   * Outcome for a completed wait.
   *
   * @param allAcked whether all the messages have been acked
   * @return {@link #ACKED} or {@link #NACKED}
   */
  public static ConfirmOutcome of(boolean allAcked) {
    return allAcked ? ACKED : NACKED;
  }
}

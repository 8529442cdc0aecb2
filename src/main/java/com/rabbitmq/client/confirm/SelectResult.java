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
 * Result of the activation of publisher confirms on a channel.
 *
 * <p>A protocol-level failure is not an exception: the result carries the reply of the engine and
 * the application decides how to deal with it.
 *
 * @see ConfirmTracker#select(Channel)
 */
public final class SelectResult {

  private static final SelectResult OK = new SelectResult(ProtocolMethod.CONFIRM_SELECT_OK);

  private final ProtocolMethod reply;

  private SelectResult(ProtocolMethod reply) {
    this.reply = reply;
  }

  public static SelectResult ok() {
    return OK;
  }

  public static SelectResult error(ProtocolMethod reply) {
    return new SelectResult(reply);
  }

  public boolean isOk() {
    return ProtocolMethod.CONFIRM_SELECT_OK.equals(this.reply);
  }

  /**
   * The raw reply of the engine.
   *
   * @return the reply
   */
  public ProtocolMethod reply() {
    return this.reply;
  }

  /**
   * Throw an exception if the activation failed.
   *
   * @return this result instance
   * @throws ConfirmException.ConfirmSelectException if the activation failed
   */
  public SelectResult orElseThrow() {
    if (!isOk()) {
      throw new ConfirmException.ConfirmSelectException(this.reply);
    }
    return this;
  }

  @Override
  public String toString() {
    return isOk() ? "ok" : "{error, " + this.reply + "}";
  }
}

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

public class ConfirmException extends RuntimeException {

  public ConfirmException(Throwable cause) {
    super(cause);
  }

  public ConfirmException(String format, Object... args) {
    super(String.format(format, args));
  }

  public ConfirmException(String message, Throwable cause) {
    super(message, cause);
  }

  /** The engine did not reply <code>confirm.select-ok</code> to <code>confirm.select</code>. */
  public static class ConfirmSelectException extends ConfirmException {

    private final ProtocolMethod reply;

    public ConfirmSelectException(ProtocolMethod reply) {
      super("Could not activate confirms, reply was %s", reply);
      this.reply = reply;
    }

    public ProtocolMethod reply() {
      return this.reply;
    }
  }

  /** At least one message has been nacked, the channel is no longer usable. */
  public static class NackReceivedException extends ConfirmException {

    public NackReceivedException(String format, Object... args) {
      super(format, args);
    }
  }

  /** Not all the messages have been confirmed before the deadline. */
  public static class ConfirmTimeoutException extends ConfirmException {

    public ConfirmTimeoutException(String format, Object... args) {
      super(format, args);
    }
  }

  public static class ResourceClosedException extends ConfirmException {

    public ResourceClosedException(String format, Object... args) {
      super(format, args);
    }

    public ResourceClosedException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /** A monitored channel or handler has been closed without a failure cause. */
  public static class MonitoredResourceClosedException extends ResourceClosedException {

    private final Resource resource;

    public MonitoredResourceClosedException(Resource resource) {
      super("Monitored resource %s has been closed", resource);
      this.resource = resource;
    }

    public Resource resource() {
      return this.resource;
    }
  }

  public static class ConfirmTrackerClosedException extends ResourceClosedException {

    public ConfirmTrackerClosedException() {
      super("Confirm tracker is closed");
    }
  }
}

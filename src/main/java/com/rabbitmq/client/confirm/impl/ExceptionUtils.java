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
package com.rabbitmq.client.confirm.impl;

import com.rabbitmq.client.confirm.ConfirmException;
import java.util.concurrent.ExecutionException;

abstract class ExceptionUtils {

  private ExceptionUtils() {}

  static ConfirmException convert(Exception e) {
    return convert(e, null);
  }

  static ConfirmException convert(Exception e, String format, Object... args) {
    if (e instanceof ConfirmException) {
      return (ConfirmException) e;
    } else if (e instanceof ExecutionException && e.getCause() instanceof Exception) {
      return convert((Exception) e.getCause(), format, args);
    } else if (e instanceof InterruptedException) {
      Thread.currentThread().interrupt();
    }
    String message = format != null ? String.format(format, args) : null;
    return message == null ? new ConfirmException(e) : new ConfirmException(message, e);
  }

  @FunctionalInterface
  interface InterruptibleCall<T> {

    T call() throws InterruptedException;
  }

  @FunctionalInterface
  interface InterruptibleRunnable {

    void run() throws InterruptedException;
  }

  static <T> T callEngine(InterruptibleCall<T> call, String format, Object... args) {
    try {
      return call.call();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ConfirmException(String.format(format, args) + " has been interrupted", e);
    } catch (RuntimeException e) {
      throw convert(e, format + " failed", args);
    }
  }

  static void runEngine(InterruptibleRunnable call, String format, Object... args) {
    callEngine(
        () -> {
          call.run();
          return null;
        },
        format,
        args);
  }
}

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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An AMQP 0.9.1 method, as returned by a {@link ChannelEngine}.
 *
 * <p>Methods are identified by their class and method IDs. The name and the arguments are
 * informational, they are not part of the identity of the method.
 */
public final class ProtocolMethod {

  static final int CONFIRM_CLASS_ID = 85;
  static final int CHANNEL_CLASS_ID = 20;

  /** <code>confirm.select</code> */
  public static final ProtocolMethod CONFIRM_SELECT =
      new ProtocolMethod(CONFIRM_CLASS_ID, 10, "confirm.select", Collections.emptyMap());

  /** <code>confirm.select-ok</code> */
  public static final ProtocolMethod CONFIRM_SELECT_OK =
      new ProtocolMethod(CONFIRM_CLASS_ID, 11, "confirm.select-ok", Collections.emptyMap());

  private final int classId;
  private final int methodId;
  private final String name;
  private final Map<String, Object> arguments;

  private ProtocolMethod(int classId, int methodId, String name, Map<String, Object> arguments) {
    this.classId = classId;
    this.methodId = methodId;
    this.name = name;
    this.arguments = Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
  }

  /**
   * Create a method.
   *
   * @param classId class ID
   * @param methodId method ID
   * @param name method name, e.g. <code>basic.publish</code>
   * @param arguments method arguments
   * @return the method
   */
  public static ProtocolMethod of(
      int classId, int methodId, String name, Map<String, Object> arguments) {
    return new ProtocolMethod(
        classId, methodId, name, arguments == null ? Collections.emptyMap() : arguments);
  }

  /**
   * Create a <code>channel.close</code> method.
   *
   * @param replyCode reply code
   * @param replyText reply text
   * @return the method
   */
  public static ProtocolMethod channelClose(int replyCode, String replyText) {
    Map<String, Object> arguments = new LinkedHashMap<>();
    arguments.put("reply-code", replyCode);
    arguments.put("reply-text", replyText);
    return new ProtocolMethod(CHANNEL_CLASS_ID, 40, "channel.close", arguments);
  }

  public int classId() {
    return this.classId;
  }

  public int methodId() {
    return this.methodId;
  }

  public String name() {
    return this.name;
  }

  public Map<String, Object> arguments() {
    return this.arguments;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    ProtocolMethod that = (ProtocolMethod) o;
    return classId == that.classId && methodId == that.methodId;
  }

  @Override
  public int hashCode() {
    return Objects.hash(classId, methodId);
  }

  @Override
  public String toString() {
    return this.name
        + "{"
        + "classId="
        + classId
        + ", methodId="
        + methodId
        + (arguments.isEmpty() ? "" : ", arguments=" + arguments)
        + '}';
  }
}

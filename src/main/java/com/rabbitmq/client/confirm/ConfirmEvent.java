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

import java.util.Objects;

/**
 * A publisher confirm sent by the broker: <code>basic.ack</code> or <code>basic.nack</code>.
 *
 * @see ConfirmHandler
 * @see <a href="https://www.rabbitmq.com/docs/confirms#publisher-confirms">Publisher Confirms</a>
 */
public final class ConfirmEvent {

  private final Type type;
  private final long sequenceNumber;
  private final boolean multiple;

  private ConfirmEvent(Type type, long sequenceNumber, boolean multiple) {
    if (sequenceNumber < 0) {
      throw new IllegalArgumentException(
          "Sequence number must be positive or zero: " + sequenceNumber);
    }
    this.type = type;
    this.sequenceNumber = sequenceNumber;
    this.multiple = multiple;
  }

  /**
   * Create an ack event.
   *
   * @param sequenceNumber the sequence number (delivery tag)
   * @param multiple whether the event confirms all messages up to the sequence number
   * @return the event
   */
  public static ConfirmEvent ack(long sequenceNumber, boolean multiple) {
    return new ConfirmEvent(Type.ACK, sequenceNumber, multiple);
  }

  /**
   * Create a nack event.
   *
   * @param sequenceNumber the sequence number (delivery tag)
   * @param multiple whether the event rejects all messages up to the sequence number
   * @return the event
   */
  public static ConfirmEvent nack(long sequenceNumber, boolean multiple) {
    return new ConfirmEvent(Type.NACK, sequenceNumber, multiple);
  }

  public Type type() {
    return this.type;
  }

  /**
   * The sequence number of the message.
   *
   * @return the sequence number
   * @see ConfirmTracker#nextPublishSeqNo(Channel)
   */
  public long sequenceNumber() {
    return this.sequenceNumber;
  }

  /**
   * Whether the event covers all outstanding messages up to and including {@link
   * #sequenceNumber()}.
   *
   * @return true for a cumulative event
   */
  public boolean multiple() {
    return this.multiple;
  }

  public boolean isAck() {
    return this.type == Type.ACK;
  }

  /**
   * Whether the event covers the given sequence number.
   *
   * @param candidate the sequence number to check
   * @return true if the event confirms or rejects the sequence number
   */
  public boolean covers(long candidate) {
    return this.multiple ? candidate <= this.sequenceNumber : candidate == this.sequenceNumber;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    ConfirmEvent that = (ConfirmEvent) o;
    return sequenceNumber == that.sequenceNumber && multiple == that.multiple && type == that.type;
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, sequenceNumber, multiple);
  }

  @Override
  public String toString() {
    return "{" + type.name().toLowerCase() + ", " + sequenceNumber + ", " + multiple + "}";
  }

  /** Event type. */
  public enum Type {
    /** The broker took responsibility for the message(s). */
    ACK,
    /** The broker could not take responsibility for the message(s). */
    NACK
  }
}

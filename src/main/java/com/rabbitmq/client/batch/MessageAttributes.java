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
package com.rabbitmq.client.batch;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Properties of an outbound message. All of them are optional. */
public final class MessageAttributes {

  private String replyTo;
  private DeliveryMode deliveryMode;
  private String correlationId;
  private String contentType;
  private String expiration;
  private final Map<String, Object> headers = new LinkedHashMap<>();

  public MessageAttributes replyTo(String replyTo) {
    this.replyTo = replyTo;
    return this;
  }

  public MessageAttributes deliveryMode(DeliveryMode deliveryMode) {
    this.deliveryMode = deliveryMode;
    return this;
  }

  public MessageAttributes correlationId(String correlationId) {
    this.correlationId = correlationId;
    return this;
  }

  public MessageAttributes contentType(String contentType) {
    this.contentType = contentType;
    return this;
  }

  /**
   * Per-message time-to-live.
   *
   * <p>The broker expects the value as a number of milliseconds encoded as a string.
   *
   * @param ttl time-to-live, must be positive
   * @return this attributes instance
   */
  public MessageAttributes expiration(Duration ttl) {
    if (ttl == null || ttl.isNegative() || ttl.isZero()) {
      throw new IllegalArgumentException("Message expiration must be positive");
    }
    this.expiration = String.valueOf(ttl.toMillis());
    return this;
  }

  public MessageAttributes headers(Map<String, Object> headers) {
    this.headers.clear();
    if (headers != null) {
      this.headers.putAll(headers);
    }
    return this;
  }

  public MessageAttributes header(String key, Object value) {
    this.headers.put(key, value);
    return this;
  }

  public String replyTo() {
    return this.replyTo;
  }

  public DeliveryMode deliveryMode() {
    return this.deliveryMode;
  }

  public String correlationId() {
    return this.correlationId;
  }

  public String contentType() {
    return this.contentType;
  }

  /**
   * Time-to-live in milliseconds, as a string, or null if not set.
   *
   * @return the expiration
   */
  public String expiration() {
    return this.expiration;
  }

  public Map<String, Object> headers() {
    return Collections.unmodifiableMap(this.headers);
  }

  /** AMQP 0-9-1 delivery mode. */
  public enum DeliveryMode {
    NON_PERSISTENT(1),
    PERSISTENT(2);

    private final int value;

    DeliveryMode(int value) {
      this.value = value;
    }

    public int value() {
      return this.value;
    }
  }
}

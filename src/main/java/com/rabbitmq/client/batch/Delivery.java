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

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** A message delivered by the broker, from a consumer subscription or a synchronous get. */
public final class Delivery {

  private final long deliveryTag;
  private final boolean redelivery;
  private final String exchange;
  private final String routingKey;
  private final String correlationId;
  private final String replyTo;
  private final Map<String, Object> headers;
  private final byte[] body;

  private Delivery(Builder builder) {
    this.deliveryTag = builder.deliveryTag;
    this.redelivery = builder.redelivery;
    this.exchange = builder.exchange;
    this.routingKey = builder.routingKey;
    this.correlationId = builder.correlationId;
    this.replyTo = builder.replyTo;
    this.headers =
        builder.headers.isEmpty()
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
    this.body = builder.body == null ? new byte[0] : builder.body.clone();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Delivery tag, monotonically increasing on a channel.
   *
   * @return the delivery tag
   */
  public long deliveryTag() {
    return this.deliveryTag;
  }

  /**
   * Whether the broker already delivered this message before.
   *
   * @return true if the message is redelivered
   */
  public boolean isRedelivery() {
    return this.redelivery;
  }

  public String exchange() {
    return this.exchange;
  }

  public String routingKey() {
    return this.routingKey;
  }

  /**
   * Correlation ID, can be null.
   *
   * @return the correlation ID
   */
  public String correlationId() {
    return this.correlationId;
  }

  /**
   * Reply-to address (a queue name), can be null.
   *
   * @return the reply-to address
   */
  public String replyTo() {
    return this.replyTo;
  }

  public Map<String, Object> headers() {
    return this.headers;
  }

  public byte[] body() {
    return this.body.clone();
  }

  /**
   * The body decoded as a UTF-8 string.
   *
   * @return the body as a string
   */
  public String bodyAsString() {
    return new String(this.body, StandardCharsets.UTF_8);
  }

  @Override
  public String toString() {
    return "Delivery{"
        + "deliveryTag="
        + deliveryTag
        + ", redelivery="
        + redelivery
        + ", exchange='"
        + exchange
        + '\''
        + ", routingKey='"
        + routingKey
        + '\''
        + ", correlationId='"
        + correlationId
        + '\''
        + ", replyTo='"
        + replyTo
        + '\''
        + '}';
  }

  public static final class Builder {

    private long deliveryTag;
    private boolean redelivery;
    private String exchange = "";
    private String routingKey = "";
    private String correlationId;
    private String replyTo;
    private final Map<String, Object> headers = new LinkedHashMap<>();
    private byte[] body;

    private Builder() {}

    public Builder deliveryTag(long deliveryTag) {
      this.deliveryTag = deliveryTag;
      return this;
    }

    public Builder redelivery(boolean redelivery) {
      this.redelivery = redelivery;
      return this;
    }

    public Builder exchange(String exchange) {
      this.exchange = exchange;
      return this;
    }

    public Builder routingKey(String routingKey) {
      this.routingKey = routingKey;
      return this;
    }

    public Builder correlationId(String correlationId) {
      this.correlationId = correlationId;
      return this;
    }

    public Builder replyTo(String replyTo) {
      this.replyTo = replyTo;
      return this;
    }

    public Builder headers(Map<String, Object> headers) {
      this.headers.clear();
      if (headers != null) {
        this.headers.putAll(headers);
      }
      return this;
    }

    public Builder body(byte[] body) {
      this.body = body;
      return this;
    }

    public Builder body(String body) {
      this.body = body == null ? null : body.getBytes(StandardCharsets.UTF_8);
      return this;
    }

    public Delivery build() {
      return new Delivery(this);
    }
  }
}

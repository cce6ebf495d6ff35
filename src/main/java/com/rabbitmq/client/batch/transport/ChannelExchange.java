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
package com.rabbitmq.client.batch.transport;

import static com.rabbitmq.client.batch.transport.ExceptionUtils.convert;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.batch.Exchange;
import com.rabbitmq.client.batch.MessageAttributes;
import java.io.IOException;
import java.util.LinkedHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link Exchange} publishing with a RabbitMQ Java client {@link Channel}. */
public final class ChannelExchange implements Exchange {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChannelExchange.class);

  private final Channel channel;
  private final String name;

  public ChannelExchange(Channel channel, String name) {
    if (channel == null) {
      throw new IllegalArgumentException("Channel cannot be null");
    }
    if (name == null) {
      throw new IllegalArgumentException("Exchange name cannot be null");
    }
    this.channel = channel;
    this.name = name;
  }

  @Override
  public String name() {
    return this.name;
  }

  @Override
  public void publish(byte[] body, String routingKey, MessageAttributes attributes) {
    AMQP.BasicProperties properties = properties(attributes);
    try {
      this.channel.basicPublish(this.name, routingKey, properties, body);
    } catch (IOException e) {
      throw convert(e, "Error while publishing to exchange '%s'", this.name);
    }
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug(
          "Published message to exchange '{}' with routing key '{}' (correlation ID {})",
          this.name,
          routingKey,
          properties.getCorrelationId());
    }
  }

  static AMQP.BasicProperties properties(MessageAttributes attributes) {
    AMQP.BasicProperties.Builder builder = new AMQP.BasicProperties.Builder();
    if (attributes == null) {
      return builder.build();
    }
    if (attributes.deliveryMode() != null) {
      builder.deliveryMode(attributes.deliveryMode().value());
    }
    if (!attributes.headers().isEmpty()) {
      builder.headers(new LinkedHashMap<>(attributes.headers()));
    }
    return builder
        .replyTo(attributes.replyTo())
        .correlationId(attributes.correlationId())
        .contentType(attributes.contentType())
        .expiration(attributes.expiration())
        .build();
  }

  @Override
  public String toString() {
    return "ChannelExchange{name='" + name + "'}";
  }
}

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
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.GetResponse;
import com.rabbitmq.client.LongString;
import com.rabbitmq.client.ShutdownSignalException;
import com.rabbitmq.client.batch.Delivery;
import com.rabbitmq.client.batch.Exchange;
import com.rabbitmq.client.batch.Queue;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Queue} on top of a RabbitMQ Java client {@link Channel}.
 *
 * <p>The channel should be dedicated to the queue: the prefetch count applies to the whole
 * channel and delivery tags are scoped to it.
 *
 * <pre>{@code
 * Channel channel = connection.createChannel();
 * Queue queue = ChannelQueue.create(channel, "orders", 50);
 * }</pre>
 */
public final class ChannelQueue implements Queue {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChannelQueue.class);

  // marks the end of the subscription in the hand-off queue
  private static final Delivery CANCELLED = Delivery.builder().build();

  private final Channel channel;
  private final String name;
  private final int prefetchCount;

  private ChannelQueue(Channel channel, String name, int prefetchCount) {
    this.channel = channel;
    this.name = name;
    this.prefetchCount = prefetchCount;
  }

  /**
   * Create a queue handle and apply the prefetch count to the channel.
   *
   * @param channel the channel
   * @param name the queue name, the queue must exist
   * @param prefetchCount the prefetch count, also the block size of consumers
   * @return the queue handle
   */
  public static ChannelQueue create(Channel channel, String name, int prefetchCount) {
    if (channel == null) {
      throw new IllegalArgumentException("Channel cannot be null");
    }
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Queue name cannot be empty");
    }
    if (prefetchCount < 0) {
      throw new IllegalArgumentException("Prefetch count cannot be negative");
    }
    try {
      channel.basicQos(prefetchCount);
    } catch (IOException e) {
      throw convert(e, "Error while setting prefetch count on channel for queue '%s'", name);
    }
    return new ChannelQueue(channel, name, prefetchCount);
  }

  @Override
  public String name() {
    return this.name;
  }

  @Override
  public int prefetchCount() {
    return this.prefetchCount;
  }

  @Override
  public void consume(DeliveryCallback callback, Duration waitTimeout) {
    BlockingQueue<Delivery> deliveries = new LinkedBlockingQueue<>();
    String consumerTag;
    try {
      consumerTag =
          this.channel.basicConsume(
              this.name,
              false,
              new DefaultConsumer(this.channel) {
                @Override
                public void handleDelivery(
                    String consumerTag,
                    Envelope envelope,
                    AMQP.BasicProperties properties,
                    byte[] body) {
                  deliveries.add(delivery(envelope, properties, body));
                }

                @Override
                public void handleCancel(String consumerTag) {
                  LOGGER.info("Subscription to queue '{}' cancelled by the broker", name);
                  deliveries.add(CANCELLED);
                }

                @Override
                public void handleShutdownSignal(String consumerTag, ShutdownSignalException sig) {
                  LOGGER.info("Channel of queue '{}' closed: {}", name, sig.getMessage());
                  deliveries.add(CANCELLED);
                }
              });
    } catch (IOException e) {
      throw convert(e, "Error while subscribing to queue '%s'", this.name);
    }
    LOGGER.debug("Subscribed to queue '{}' with consumer tag {}", this.name, consumerTag);

    long waitTimeoutInMs = waitTimeout.toMillis();
    boolean keepConsuming = true;
    try {
      while (keepConsuming) {
        Delivery delivery = deliveries.poll(waitTimeoutInMs, TimeUnit.MILLISECONDS);
        if (delivery == null) {
          keepConsuming = callback.idle();
        } else if (delivery == CANCELLED) {
          keepConsuming = false;
        } else {
          keepConsuming = callback.handle(delivery);
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.debug("Interrupted while consuming from queue '{}'", this.name);
    } finally {
      this.cancel(consumerTag);
      this.requeueUnhandled(deliveries);
    }
  }

  // deliveries prefetched but never handed to the callback
  private void requeueUnhandled(BlockingQueue<Delivery> deliveries) {
    List<Delivery> unhandled = new ArrayList<>(deliveries.size());
    deliveries.drainTo(unhandled);
    unhandled.removeIf(delivery -> delivery == CANCELLED);
    if (unhandled.isEmpty()) {
      return;
    }
    if (!this.channel.isOpen()) {
      LOGGER.debug(
          "Channel closed, {} prefetched message(s) of queue '{}' go back to the queue",
          unhandled.size(),
          this.name);
      return;
    }
    LOGGER.debug(
        "Requeuing {} prefetched message(s) of queue '{}'", unhandled.size(), this.name);
    for (Delivery delivery : unhandled) {
      try {
        this.channel.basicReject(delivery.deliveryTag(), true);
      } catch (IOException | ShutdownSignalException e) {
        LOGGER.warn(
            "Error while requeuing delivery {} of queue '{}': {}",
            delivery.deliveryTag(),
            this.name,
            e.getMessage());
        return;
      }
    }
  }

  private void cancel(String consumerTag) {
    if (this.channel.isOpen()) {
      try {
        this.channel.basicCancel(consumerTag);
      } catch (IOException | ShutdownSignalException e) {
        LOGGER.debug(
            "Error while cancelling subscription to queue '{}': {}", this.name, e.getMessage());
      }
    }
  }

  @Override
  public Delivery get(boolean autoAck) {
    GetResponse response;
    try {
      response = this.channel.basicGet(this.name, autoAck);
    } catch (IOException e) {
      throw convert(e, "Error while fetching message from queue '%s'", this.name);
    }
    return response == null
        ? null
        : delivery(response.getEnvelope(), response.getProps(), response.getBody());
  }

  @Override
  public void ack(long deliveryTag, boolean multiple) {
    try {
      this.channel.basicAck(deliveryTag, multiple);
    } catch (IOException e) {
      throw convert(e, "Error while acking delivery %d on queue '%s'", deliveryTag, this.name);
    }
  }

  @Override
  public void nack(long deliveryTag, boolean multiple, boolean requeue) {
    try {
      this.channel.basicNack(deliveryTag, multiple, requeue);
    } catch (IOException e) {
      throw convert(e, "Error while nacking delivery %d on queue '%s'", deliveryTag, this.name);
    }
  }

  @Override
  public void reject(long deliveryTag, boolean requeue) {
    try {
      this.channel.basicReject(deliveryTag, requeue);
    } catch (IOException e) {
      throw convert(
          e, "Error while rejecting delivery %d on queue '%s'", deliveryTag, this.name);
    }
  }

  @Override
  public Exchange exchange(String name) {
    return new ChannelExchange(this.channel, name);
  }

  static Delivery delivery(Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
    Delivery.Builder builder =
        Delivery.builder()
            .deliveryTag(envelope.getDeliveryTag())
            .redelivery(envelope.isRedeliver())
            .exchange(envelope.getExchange())
            .routingKey(envelope.getRoutingKey())
            .body(body);
    if (properties != null) {
      builder
          .correlationId(properties.getCorrelationId())
          .replyTo(properties.getReplyTo())
          .headers(headers(properties.getHeaders()));
    }
    return builder.build();
  }

  private static Map<String, Object> headers(Map<String, Object> headers) {
    if (headers == null || headers.isEmpty()) {
      return Collections.emptyMap();
    }
    Map<String, Object> result = new LinkedHashMap<>(headers.size());
    // the client decodes string header values as LongString
    headers.forEach((k, v) -> result.put(k, v instanceof LongString ? v.toString() : v));
    return result;
  }

  @Override
  public String toString() {
    return "ChannelQueue{name='" + name + "', prefetchCount=" + prefetchCount + "}";
  }
}

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
package com.rabbitmq.client.batch.impl;

import com.rabbitmq.client.batch.Delivery;
import com.rabbitmq.client.batch.Exchange;
import com.rabbitmq.client.batch.MessageAttributes;
import com.rabbitmq.client.batch.Queue;
import com.rabbitmq.client.batch.metrics.MetricsCollector;
import com.rabbitmq.client.batch.metrics.NoOpMetricsCollector;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

abstract class TestUtils {

  private TestUtils() {}

  static AmqpBatchEnvironment environment(Clock clock) {
    return environment(clock, NoOpMetricsCollector.INSTANCE);
  }

  static AmqpBatchEnvironment environment(Clock clock, MetricsCollector metricsCollector) {
    return (AmqpBatchEnvironment)
        new BatchEnvironmentBuilder().clock(clock).metricsCollector(metricsCollector).build();
  }

  static Delivery delivery(long deliveryTag) {
    return delivery(deliveryTag, false);
  }

  static Delivery delivery(long deliveryTag, boolean redelivery) {
    return Delivery.builder()
        .deliveryTag(deliveryTag)
        .redelivery(redelivery)
        .body("message " + deliveryTag)
        .build();
  }

  static Delivery reply(String correlationId, String body) {
    return Delivery.builder().correlationId(correlationId).body(body).build();
  }

  /** Clock that moves only when told to. */
  static class TestClock extends Clock {

    private long time = 0;

    @Override
    long time() {
      return this.time;
    }

    void advance(Duration duration) {
      this.time += duration.toNanos();
    }
  }

  /**
   * Queue keeping everything in memory.
   *
   * <p>{@link #consume(DeliveryCallback, Duration)} hands over the pending deliveries, then makes
   * the configured number of idle calls, and returns. Acknowledgments and publications are
   * recorded in {@link #operations()} in the order they happen.
   */
  static class InMemoryQueue implements Queue {

    private final String name;
    private final int prefetchCount;
    private final Deque<Delivery> deliveries = new ArrayDeque<>();
    private final Deque<Delivery> replies = new ArrayDeque<>();
    private final List<String> operations = new ArrayList<>();
    private final List<PublishedMessage> published = new ArrayList<>();
    private int idleCalls = 0;
    private Runnable onIdle = () -> {};
    private Runnable onGet = () -> {};
    private int getCount = 0;

    InMemoryQueue(String name, int prefetchCount) {
      this.name = name;
      this.prefetchCount = prefetchCount;
    }

    InMemoryQueue deliveries(Delivery... deliveries) {
      for (Delivery delivery : deliveries) {
        this.deliveries.add(delivery);
      }
      return this;
    }

    InMemoryQueue replies(Delivery... replies) {
      for (Delivery reply : replies) {
        this.replies.add(reply);
      }
      return this;
    }

    InMemoryQueue idleCalls(int idleCalls, Runnable onIdle) {
      this.idleCalls = idleCalls;
      this.onIdle = onIdle;
      return this;
    }

    InMemoryQueue onGet(Runnable onGet) {
      this.onGet = onGet;
      return this;
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
      boolean keepConsuming = true;
      while (keepConsuming) {
        Delivery delivery = this.deliveries.poll();
        if (delivery != null) {
          keepConsuming = callback.handle(delivery);
        } else if (this.idleCalls > 0) {
          this.idleCalls--;
          this.onIdle.run();
          keepConsuming = callback.idle();
        } else {
          keepConsuming = false;
        }
      }
    }

    @Override
    public Delivery get(boolean autoAck) {
      this.getCount++;
      this.onGet.run();
      return this.replies.poll();
    }

    @Override
    public void ack(long deliveryTag, boolean multiple) {
      this.operations.add("ack:" + deliveryTag + ":" + multiple);
    }

    @Override
    public void nack(long deliveryTag, boolean multiple, boolean requeue) {
      this.operations.add("nack:" + deliveryTag + ":" + multiple + ":" + requeue);
    }

    @Override
    public void reject(long deliveryTag, boolean requeue) {
      this.operations.add("reject:" + deliveryTag + ":" + requeue);
    }

    @Override
    public Exchange exchange(String exchangeName) {
      return new Exchange() {
        @Override
        public String name() {
          return exchangeName;
        }

        @Override
        public void publish(byte[] body, String routingKey, MessageAttributes attributes) {
          operations.add("publish:" + exchangeName + ":" + routingKey);
          published.add(new PublishedMessage(exchangeName, routingKey, body, attributes));
        }
      };
    }

    List<String> operations() {
      return this.operations;
    }

    List<PublishedMessage> published() {
      return this.published;
    }

    int pendingDeliveries() {
      return this.deliveries.size();
    }

    int getCount() {
      return this.getCount;
    }
  }

  static class PublishedMessage {

    private final String exchange;
    private final String routingKey;
    private final byte[] body;
    private final MessageAttributes attributes;

    private PublishedMessage(
        String exchange, String routingKey, byte[] body, MessageAttributes attributes) {
      this.exchange = exchange;
      this.routingKey = routingKey;
      this.body = body;
      this.attributes = attributes;
    }

    String exchange() {
      return this.exchange;
    }

    String routingKey() {
      return this.routingKey;
    }

    String body() {
      return new String(this.body, StandardCharsets.UTF_8);
    }

    MessageAttributes attributes() {
      return this.attributes;
    }
  }
}

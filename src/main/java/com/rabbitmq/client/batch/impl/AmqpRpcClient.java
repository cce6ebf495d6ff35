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

import com.rabbitmq.client.batch.AmqpException;
import com.rabbitmq.client.batch.Delivery;
import com.rabbitmq.client.batch.Exchange;
import com.rabbitmq.client.batch.MessageAttributes;
import com.rabbitmq.client.batch.Queue;
import com.rabbitmq.client.batch.RpcClient;
import com.rabbitmq.client.batch.metrics.MetricsCollector;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class AmqpRpcClient implements RpcClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(AmqpRpcClient.class);

  private final Queue replyQueue;
  private final RpcRequestTracker tracker = new RpcRequestTracker();
  private final Map<String, Exchange> exchanges = new HashMap<>();
  private final RequestPostProcessor requestPostProcessor;
  private final Duration pollInterval;
  private final Duration replyTimeout;
  private final Clock clock;
  private final MetricsCollector metricsCollector;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  AmqpRpcClient(RpcSupport.AmqpRpcClientBuilder builder) {
    this.replyQueue = builder.replyQueue();
    this.requestPostProcessor = builder.requestPostProcessor();
    this.pollInterval = builder.pollInterval();
    this.replyTimeout = builder.replyTimeout();
    this.clock = builder.environment().clock();
    this.metricsCollector = builder.environment().metricsCollector();
  }

  @Override
  public void addRequest(String body, String server, String requestId) {
    this.addRequest(body, server, requestId, "", 0, Collections.emptyMap());
  }

  @Override
  public void addRequest(String body, String server, String requestId, String routingKey) {
    this.addRequest(body, server, requestId, routingKey, 0, Collections.emptyMap());
  }

  @Override
  public void addRequest(
      String body, String server, String requestId, String routingKey, int expiration) {
    this.addRequest(body, server, requestId, routingKey, expiration, Collections.emptyMap());
  }

  @Override
  public void addRequest(
      String body,
      String server,
      String requestId,
      String routingKey,
      int expiration,
      Map<String, Object> headers) {
    checkOpen();
    if (requestId == null || requestId.isEmpty()) {
      throw new IllegalArgumentException("You must provide a request ID");
    }
    Request request = new Request(body, server, requestId, routingKey, expiration, headers);
    Request processed = this.requestPostProcessor.process(request);
    if (processed != null) {
      request = processed;
    }
    if (request.expiration() < 0) {
      throw new IllegalArgumentException("Request expiration cannot be negative");
    }

    MessageAttributes attributes =
        new MessageAttributes()
            .replyTo(this.replyQueue.name())
            .deliveryMode(MessageAttributes.DeliveryMode.NON_PERSISTENT)
            .correlationId(request.requestId())
            .headers(request.headers());
    if (request.expiration() > 0) {
      attributes.expiration(Duration.ofSeconds(request.expiration()));
    }

    byte[] payload =
        request.body() == null ? new byte[0] : request.body().getBytes(StandardCharsets.UTF_8);
    String routing = request.routingKey() == null ? "" : request.routingKey();
    this.exchange(request.server()).publish(payload, routing, attributes);
    this.metricsCollector.publish();
    this.tracker.add(request.requestId(), request.expiration());
    LOGGER.debug("Published request {}", request);
  }

  @Override
  public Map<String, String> getReplies() {
    checkOpen();
    Map<String, String> replies = new LinkedHashMap<>();
    Duration timeout = this.tracker.timeout();
    if (timeout.isZero()) {
      timeout = this.replyTimeout;
    }
    long timeoutInNanos = timeout.toNanos();
    long start = this.clock.time();
    try {
      while (replies.size() < this.tracker.outstandingCount()) {
        Delivery reply = this.replyQueue.get(true);
        if (reply != null && this.tracker.isOutstanding(reply.correlationId())) {
          replies.put(reply.correlationId(), reply.bodyAsString());
        } else {
          if (reply != null) {
            LOGGER.debug("Discarding reply with unknown correlation ID {}", reply.correlationId());
          }
          Thread.sleep(this.pollInterval.toMillis());
        }
        if (timeoutInNanos > 0 && (this.clock.time() - start) >= timeoutInNanos) {
          break;
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.debug("Interrupted while waiting for RPC replies");
    } finally {
      int outstanding = this.tracker.outstandingCount();
      if (replies.size() < outstanding) {
        LOGGER.debug("Received {} reply(ies) for {} request(s)", replies.size(), outstanding);
      }
      this.tracker.clear();
    }
    return replies;
  }

  @Override
  public void close() {
    if (this.closed.compareAndSet(false, true)) {
      int outstanding = this.tracker.outstandingCount();
      if (outstanding > 0) {
        LOGGER.info("Closing RPC client with {} outstanding request(s)", outstanding);
      }
      this.tracker.clear();
      this.exchanges.clear();
    }
  }

  Exchange exchange(String name) {
    return this.exchanges.computeIfAbsent(name, this.replyQueue::exchange);
  }

  RpcRequestTracker tracker() {
    return this.tracker;
  }

  private void checkOpen() {
    if (this.closed.get()) {
      throw new AmqpException.AmqpResourceClosedException("RPC client is closed");
    }
  }
}

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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import com.rabbitmq.client.batch.Delivery;
import com.rabbitmq.client.batch.Exchange;
import com.rabbitmq.client.batch.MessageAttributes;
import com.rabbitmq.client.batch.ProcessingFlag;
import com.rabbitmq.client.batch.Queue;
import com.rabbitmq.client.batch.RpcServer;
import com.rabbitmq.client.batch.metrics.MetricsCollector;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class AmqpRpcServer extends AmqpConsumer implements RpcServer {

  private static final Logger LOGGER = LoggerFactory.getLogger(AmqpRpcServer.class);

  private static final Gson GSON = new GsonBuilder().serializeNulls().create();
  private static final String CONTENT_TYPE = "application/json";

  private final Handler handler;
  private final MetricsCollector metricsCollector;
  private Exchange replyExchange;

  AmqpRpcServer(RpcSupport.AmqpRpcServerBuilder builder) {
    super(builder.consumerBuilder());
    this.handler = builder.handler();
    this.replyExchange = builder.replyExchange();
    this.metricsCollector = builder.consumerBuilder().environment().metricsCollector();
  }

  /**
   * Acknowledge the request, run the handler, and reply with its outcome.
   *
   * @return always null, the processing flag is ignored
   */
  @Override
  public ProcessingFlag handleDelivery(Delivery request, Queue queue) {
    String reply;
    try {
      AckBatcher batcher = this.batcher();
      batcher.recordAccepted(request.deliveryTag(), request.isRedelivery());
      batcher.ack();

      Object result = this.handler.handle(request, queue);
      reply = success(result);
    } catch (Exception e) {
      LOGGER.info(
          "Error while processing RPC request (correlation ID {}): {}",
          request.correlationId(),
          e.getMessage());
      reply = failure(e);
    }
    this.sendReply(reply, request.replyTo(), request.correlationId());
    return null;
  }

  /** The request has already been acknowledged, nothing to do. */
  @Override
  public void handleProcessFlag(Delivery delivery, ProcessingFlag flag) {}

  @Override
  public Exchange replyExchange() {
    if (this.replyExchange == null) {
      this.replyExchange = this.queue().exchange("");
    }
    return this.replyExchange;
  }

  @Override
  public void replyExchange(Exchange exchange) {
    this.replyExchange = exchange;
  }

  private void sendReply(String body, String replyTo, String correlationId) {
    if (replyTo == null || replyTo.isEmpty()) {
      LOGGER.warn("No reply-to on RPC request (correlation ID {}), dropping reply", correlationId);
      return;
    }
    MessageAttributes attributes =
        new MessageAttributes().correlationId(correlationId).contentType(CONTENT_TYPE);
    this.replyExchange().publish(body.getBytes(StandardCharsets.UTF_8), replyTo, attributes);
    this.metricsCollector.publish();
  }

  static String success(Object result) {
    JsonObject reply = new JsonObject();
    reply.addProperty("success", true);
    reply.add("result", GSON.toJsonTree(result));
    return GSON.toJson(reply);
  }

  static String failure(Exception exception) {
    JsonObject reply = new JsonObject();
    reply.addProperty("success", false);
    String message = exception.getMessage();
    reply.addProperty("error", message == null ? exception.getClass().getName() : message);
    return GSON.toJson(reply);
  }
}

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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.rabbitmq.client.batch.Delivery;
import com.rabbitmq.client.batch.Exchange;
import com.rabbitmq.client.batch.MessageAttributes;
import com.rabbitmq.client.batch.Queue;
import com.rabbitmq.client.batch.RpcServer;
import com.rabbitmq.client.batch.impl.TestUtils.InMemoryQueue;
import com.rabbitmq.client.batch.impl.TestUtils.PublishedMessage;
import com.rabbitmq.client.batch.impl.TestUtils.TestClock;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
public class AmqpRpcServerTest {

  @Mock Queue requestQueue;
  @Mock Exchange replyExchange;

  AmqpBatchEnvironment environment;

  @BeforeEach
  void init() {
    environment = TestUtils.environment(new TestClock());
  }

  @Test
  void requestShouldBeAckedBeforeReplyIsPublished() throws Exception {
    when(requestQueue.prefetchCount()).thenReturn(10);
    RpcServer.Handler handler = mock(RpcServer.Handler.class);
    Delivery request = request(7, "amq.gen-1", "c1", "ping");
    when(handler.handle(request, requestQueue)).thenReturn("pong");
    AmqpRpcServer server =
        (AmqpRpcServer)
            environment
                .rpcServerBuilder()
                .queue(requestQueue)
                .handler(handler)
                .replyExchange(replyExchange)
                .build();

    server.handleDelivery(request, requestQueue);

    InOrder inOrder = inOrder(requestQueue, handler, replyExchange);
    inOrder.verify(requestQueue).ack(7L, true);
    inOrder.verify(handler).handle(request, requestQueue);
    ArgumentCaptor<byte[]> body = ArgumentCaptor.forClass(byte[].class);
    ArgumentCaptor<MessageAttributes> attributes =
        ArgumentCaptor.forClass(MessageAttributes.class);
    inOrder.verify(replyExchange).publish(body.capture(), eq("amq.gen-1"), attributes.capture());
    assertThat(new String(body.getValue(), StandardCharsets.UTF_8))
        .isEqualTo("{\"success\":true,\"result\":\"pong\"}");
    assertThat(attributes.getValue().correlationId()).isEqualTo("c1");
    assertThat(attributes.getValue().contentType()).isEqualTo("application/json");
  }

  @Test
  void failedRequestShouldBeAckedAndReplyWithError() throws Exception {
    when(requestQueue.prefetchCount()).thenReturn(10);
    AmqpRpcServer server =
        (AmqpRpcServer)
            environment
                .rpcServerBuilder()
                .queue(requestQueue)
                .handler(
                    (r, q) -> {
                      throw new IllegalStateException("unknown operation");
                    })
                .replyExchange(replyExchange)
                .build();

    server.handleDelivery(request(3, "amq.gen-1", "c1", "ping"), requestQueue);

    InOrder inOrder = inOrder(requestQueue, replyExchange);
    inOrder.verify(requestQueue).ack(3L, true);
    ArgumentCaptor<byte[]> body = ArgumentCaptor.forClass(byte[].class);
    inOrder.verify(replyExchange).publish(body.capture(), eq("amq.gen-1"), any());
    JsonObject reply =
        JsonParser.parseString(new String(body.getValue(), StandardCharsets.UTF_8))
            .getAsJsonObject();
    assertThat(reply.get("success").getAsBoolean()).isFalse();
    assertThat(reply.get("error").getAsString()).isEqualTo("unknown operation");
  }

  @Test
  void exceptionWithoutMessageShouldReplyWithExceptionClassName() {
    InMemoryQueue queue =
        new InMemoryQueue("rpc-requests", 10).deliveries(request(1, "amq.gen-a", "c1", "ping"));
    RpcServer server =
        environment
            .rpcServerBuilder()
            .queue(queue)
            .handler(
                (r, q) -> {
                  throw new RuntimeException();
                })
            .build();

    server.consume();

    JsonObject reply =
        JsonParser.parseString(queue.published().get(0).body()).getAsJsonObject();
    assertThat(reply.get("success").getAsBoolean()).isFalse();
    assertThat(reply.get("error").isJsonNull()).isFalse();
    assertThat(reply.get("error").getAsString()).isEqualTo("java.lang.RuntimeException");
  }

  @Test
  void requestsShouldBeServedFromConsumeLoop() {
    InMemoryQueue queue =
        new InMemoryQueue("rpc-requests", 10)
            .deliveries(
                request(1, "amq.gen-a", "c1", "2"),
                request(2, "amq.gen-b", "c2", "x"),
                request(3, "amq.gen-a", "c3", "5"));
    List<Exception> deliveryExceptions = new ArrayList<>();
    RpcServer server =
        environment
            .rpcServerBuilder()
            .queue(queue)
            .handler((request, q) -> Integer.parseInt(request.bodyAsString()) * 2)
            .deliveryExceptionListener(deliveryExceptions::add)
            .build();

    server.consume();

    assertThat(queue.operations())
        .containsExactly(
            "ack:1:true",
            "publish::amq.gen-a",
            "ack:2:true",
            "publish::amq.gen-b",
            "ack:3:true",
            "publish::amq.gen-a");
    List<PublishedMessage> replies = queue.published();
    assertThat(replies.get(0).body()).isEqualTo("{\"success\":true,\"result\":4}");
    assertThat(replies.get(0).attributes().correlationId()).isEqualTo("c1");
    assertThat(replies.get(1).body()).startsWith("{\"success\":false,\"error\":");
    assertThat(replies.get(2).body()).isEqualTo("{\"success\":true,\"result\":10}");
    assertThat(deliveryExceptions).isEmpty();
    assertThat(server.unackedMessageCount()).isZero();
    assertThat(server.consumedMessageCount()).isEqualTo(3);
  }

  @Test
  void nullResultShouldBeSerialized() {
    InMemoryQueue queue =
        new InMemoryQueue("rpc-requests", 10).deliveries(request(1, "amq.gen-a", "c1", "ping"));
    RpcServer server =
        environment.rpcServerBuilder().queue(queue).handler((request, q) -> null).build();

    server.consume();

    assertThat(queue.published().get(0).body()).isEqualTo("{\"success\":true,\"result\":null}");
  }

  @Test
  void structuredResultShouldBeSerializedAsJson() {
    InMemoryQueue queue =
        new InMemoryQueue("rpc-requests", 10).deliveries(request(1, "amq.gen-a", "c1", "ping"));
    RpcServer server =
        environment
            .rpcServerBuilder()
            .queue(queue)
            .handler((request, q) -> Map.of("status", "ok"))
            .build();

    server.consume();

    JsonObject reply =
        JsonParser.parseString(queue.published().get(0).body()).getAsJsonObject();
    assertThat(reply.get("success").getAsBoolean()).isTrue();
    assertThat(reply.getAsJsonObject("result").get("status").getAsString()).isEqualTo("ok");
  }

  @Test
  void requestWithoutReplyToShouldBeAckedWithoutReply() {
    InMemoryQueue queue =
        new InMemoryQueue("rpc-requests", 10).deliveries(request(1, null, "c1", "ping"));
    RpcServer server =
        environment.rpcServerBuilder().queue(queue).handler((request, q) -> "pong").build();

    server.consume();

    assertThat(queue.operations()).containsExactly("ack:1:true");
    assertThat(queue.published()).isEmpty();
  }

  @Test
  void requestWithEmptyReplyToShouldBeAckedWithoutReply() {
    InMemoryQueue queue =
        new InMemoryQueue("rpc-requests", 10).deliveries(request(1, "", "c1", "ping"));
    RpcServer server =
        environment.rpcServerBuilder().queue(queue).handler((request, q) -> "pong").build();

    server.consume();

    assertThat(queue.operations()).containsExactly("ack:1:true");
    assertThat(queue.published()).isEmpty();
  }

  @Test
  void defaultReplyExchangeShouldBeDefaultExchangeOfQueue() {
    InMemoryQueue queue = new InMemoryQueue("rpc-requests", 10);
    RpcServer server =
        environment.rpcServerBuilder().queue(queue).handler((request, q) -> "pong").build();
    assertThat(server.replyExchange().name()).isEmpty();
    assertThat(server.replyExchange()).isSameAs(server.replyExchange());

    server.replyExchange(replyExchange);
    assertThat(server.replyExchange()).isSameAs(replyExchange);
  }

  @Test
  void replyPublishFailureShouldBeReportedToExceptionListener() {
    InMemoryQueue queue =
        new InMemoryQueue("rpc-requests", 10).deliveries(request(1, "amq.gen-a", "c1", "ping"));
    doThrow(new IllegalStateException("channel closed"))
        .when(replyExchange)
        .publish(any(), any(), any());
    List<Exception> deliveryExceptions = new ArrayList<>();
    RpcServer server =
        environment
            .rpcServerBuilder()
            .queue(queue)
            .handler((request, q) -> "pong")
            .replyExchange(replyExchange)
            .deliveryExceptionListener(deliveryExceptions::add)
            .build();

    server.consume();

    assertThat(deliveryExceptions).hasSize(1);
    assertThat(queue.operations()).containsExactly("ack:1:true");
  }

  @Test
  void builderShouldRequireQueueAndHandler() {
    assertThatThrownBy(() -> environment.rpcServerBuilder().handler((r, q) -> "pong").build())
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(
            () -> environment.rpcServerBuilder().queue(new InMemoryQueue("q", 1)).build())
        .isInstanceOf(IllegalArgumentException.class);
  }

  private static Delivery request(
      long deliveryTag, String replyTo, String correlationId, String body) {
    return Delivery.builder()
        .deliveryTag(deliveryTag)
        .replyTo(replyTo)
        .correlationId(correlationId)
        .body(body)
        .build();
  }
}

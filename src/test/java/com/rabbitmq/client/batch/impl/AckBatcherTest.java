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

import static java.time.Duration.ofSeconds;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

import com.rabbitmq.client.batch.Consumer;
import com.rabbitmq.client.batch.Queue;
import com.rabbitmq.client.batch.impl.TestUtils.TestClock;
import com.rabbitmq.client.batch.metrics.MetricsCollector;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
public class AckBatcherTest {

  @Mock Queue queue;
  @Mock Consumer.FlushDeferredHandler flushDeferredHandler;
  @Mock MetricsCollector metricsCollector;

  TestClock clock;
  List<Exception> flushExceptions;
  List<Consumer.AckContext> ackContexts;

  @BeforeEach
  void init() {
    clock = new TestClock();
    flushExceptions = new CopyOnWriteArrayList<>();
    ackContexts = new CopyOnWriteArrayList<>();
  }

  @Test
  void fullBlockShouldBeAckedOnLastDeliveryTag() throws Exception {
    when(flushDeferredHandler.flush()).thenReturn(true);
    AckBatcher batcher = batcher(3, ofSeconds(10));
    batcher.recordAccepted(1, false);
    batcher.recordAccepted(2, false);
    assertThat(batcher.shouldFlush(clock.time())).isFalse();
    batcher.recordAccepted(3, false);
    assertThat(batcher.shouldFlush(clock.time())).isTrue();

    batcher.flush();

    verify(queue).ack(3L, true);
    verify(queue, never()).nack(anyLong(), anyBoolean(), anyBoolean());
    verify(metricsCollector).consumeDisposition(MetricsCollector.ConsumeDisposition.ACKED, 3);
    assertThat(batcher.unackedCount()).isZero();
    assertThat(batcher.lastDeliveryTag()).isNull();
    assertThat(batcher.consumedCount()).isEqualTo(3);
  }

  @Test
  void failedFlushShouldRequeueBlockWithoutRedelivery() throws Exception {
    when(flushDeferredHandler.flush()).thenReturn(false);
    AckBatcher batcher = batcher(10, ofSeconds(10));
    batcher.recordAccepted(1, false);
    batcher.recordAccepted(2, false);

    batcher.flush();

    verify(queue).nack(2L, true, true);
    verify(queue, never()).ack(anyLong(), anyBoolean());
    verify(metricsCollector).consumeDisposition(MetricsCollector.ConsumeDisposition.REQUEUED, 2);
    assertThat(batcher.unackedCount()).isZero();
  }

  @Test
  void failedFlushShouldDiscardBlockWithRedelivery() throws Exception {
    when(flushDeferredHandler.flush()).thenReturn(false);
    AckBatcher batcher = batcher(10, ofSeconds(10));
    batcher.recordAccepted(1, false);
    batcher.recordAccepted(2, true);
    batcher.recordAccepted(3, false);
    assertThat(batcher.redeliverySeen()).isTrue();

    batcher.flush();

    verify(queue).nack(3L, true, false);
    verify(metricsCollector).consumeDisposition(MetricsCollector.ConsumeDisposition.DISCARDED, 3);
    assertThat(batcher.redeliverySeen()).isFalse();
  }

  @Test
  void redeliveryFlagShouldBeResetAfterAck() throws Exception {
    when(flushDeferredHandler.flush()).thenReturn(true, false);
    AckBatcher batcher = batcher(10, ofSeconds(10));
    batcher.recordAccepted(1, true);
    batcher.flush();
    verify(queue).ack(1L, true);
    assertThat(batcher.redeliverySeen()).isFalse();

    batcher.recordAccepted(2, false);
    batcher.flush();
    verify(queue).nack(2L, true, true);
  }

  @Test
  void flushHandlerExceptionShouldBeReportedAndBlockRequeued() throws Exception {
    IllegalStateException exception = new IllegalStateException("database is down");
    when(flushDeferredHandler.flush()).thenThrow(exception);
    AckBatcher batcher = batcher(10, ofSeconds(10));
    batcher.recordAccepted(1, false);

    batcher.flush();

    assertThat(flushExceptions).containsExactly(exception);
    verify(queue).nack(1L, true, true);
  }

  @Test
  void flushWithoutDeliveryShouldDoNothing() throws Exception {
    AckBatcher batcher = batcher(10, ofSeconds(10));
    batcher.flush();
    batcher.ack();
    verify(flushDeferredHandler, never()).flush();
    verifyNoInteractions(queue);
    assertThat(ackContexts).isEmpty();
  }

  @Test
  void ackShouldNotCallFlushHandler() throws Exception {
    AckBatcher batcher = batcher(10, ofSeconds(10));
    batcher.recordAccepted(5, false);
    batcher.ack();
    verify(queue).ack(5L, true);
    verify(flushDeferredHandler, never()).flush();
  }

  @Test
  void idleTimeoutShouldTriggerFlushOfPartialBlock() {
    AckBatcher batcher = batcher(10, ofSeconds(1));
    assertThat(batcher.shouldFlush(clock.time())).isFalse();
    batcher.recordAccepted(1, false);
    assertThat(batcher.shouldFlush(clock.time())).isFalse();
    clock.advance(Duration.ofMillis(1001));
    assertThat(batcher.shouldFlush(clock.time())).isTrue();
  }

  @Test
  void idleTimeoutShouldNotTriggerFlushOfEmptyBlock() {
    AckBatcher batcher = batcher(10, ofSeconds(1));
    clock.advance(ofSeconds(5));
    assertThat(batcher.shouldFlush(clock.time())).isFalse();
  }

  @Test
  void zeroBlockSizeShouldOnlyFlushOnIdleTimeout() {
    AckBatcher batcher = batcher(0, ofSeconds(1));
    for (int i = 1; i <= 50; i++) {
      batcher.recordAccepted(i, false);
      assertThat(batcher.shouldFlush(clock.time())).isFalse();
    }
    clock.advance(ofSeconds(2));
    assertThat(batcher.shouldFlush(clock.time())).isTrue();
  }

  @Test
  void startShouldRestartIdleTimeout() {
    AckBatcher batcher = batcher(10, ofSeconds(1));
    clock.advance(ofSeconds(5));
    batcher.start();
    batcher.recordAccepted(1, false);
    assertThat(batcher.shouldFlush(clock.time())).isFalse();
  }

  @Test
  void ackListenerShouldReceiveBlockInformation() throws Exception {
    when(flushDeferredHandler.flush()).thenReturn(true);
    AckBatcher batcher = batcher(10, ofSeconds(10));
    long start = clock.time();
    clock.advance(ofSeconds(1));
    batcher.recordAccepted(1, false);
    clock.advance(ofSeconds(1));
    batcher.recordAccepted(2, false);
    long lastMessage = clock.time();
    clock.advance(ofSeconds(1));

    batcher.flush();

    assertThat(ackContexts).hasSize(1);
    Consumer.AckContext context = ackContexts.get(0);
    assertThat(context.messageCount()).isEqualTo(2);
    assertThat(context.timestampLastMessage()).isEqualTo(lastMessage);
    assertThat(context.timestampLastAck()).isEqualTo(start);
    assertThat(batcher.timestampLastAck()).isEqualTo(clock.time());
  }

  @Test
  void ackListenerExceptionShouldNotPreventAck() {
    AckBatcher batcher =
        new AckBatcher(
            new QueueCursor(List.of(queue)),
            10,
            ofSeconds(10),
            clock,
            flushDeferredHandler,
            flushExceptions::add,
            ctx -> {
              throw new IllegalStateException("listener failure");
            },
            metricsCollector);
    batcher.recordAccepted(1, false);
    batcher.ack();
    verify(queue).ack(1L, true);
    assertThat(batcher.unackedCount()).isZero();
  }

  @Test
  void nackShouldNotMoveLastAckTimestamp() throws Exception {
    when(flushDeferredHandler.flush()).thenReturn(false);
    AckBatcher batcher = batcher(10, ofSeconds(10));
    long start = batcher.timestampLastAck();
    clock.advance(ofSeconds(3));
    batcher.recordAccepted(1, false);
    batcher.flush();
    assertThat(batcher.timestampLastAck()).isEqualTo(start);
  }

  private AckBatcher batcher(int blockSize, Duration idleTimeout) {
    return new AckBatcher(
        new QueueCursor(List.of(queue)),
        blockSize,
        idleTimeout,
        clock,
        flushDeferredHandler,
        flushExceptions::add,
        ackContexts::add,
        metricsCollector);
  }
}

package com.example.gamesession.engine;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DisconnectGraceHandlerTest {

  private ScheduledExecutorService scheduler;

  @BeforeEach
  void setUp() {
    scheduler = Executors.newSingleThreadScheduledExecutor();
  }

  @AfterEach
  void tearDown() {
    scheduler.shutdownNow();
  }

  @Test
  void runsCheckAfterGraceWindow() throws InterruptedException {
    final DisconnectGraceHandler handler =
        new DisconnectGraceHandler(scheduler, Duration.ofMillis(20));
    final CountDownLatch ran = new CountDownLatch(1);

    handler.schedule("p1", ran::countDown);

    assertThat(handler.isPending("p1")).isTrue();
    assertThat(ran.await(2, TimeUnit.SECONDS)).isTrue();
    assertThat(handler.isPending("p1")).isFalse();
  }

  @Test
  void cancelPreventsCheck() throws InterruptedException {
    final DisconnectGraceHandler handler =
        new DisconnectGraceHandler(scheduler, Duration.ofMillis(50));
    final CountDownLatch ran = new CountDownLatch(1);

    handler.schedule("p1", ran::countDown);

    assertThat(handler.cancel("p1")).isTrue();
    assertThat(handler.cancel("p1")).isFalse();
    assertThat(ran.await(200, TimeUnit.MILLISECONDS)).isFalse();
  }

  @Test
  void reschedulingReplacesEarlierCheck() throws InterruptedException {
    final DisconnectGraceHandler handler =
        new DisconnectGraceHandler(scheduler, Duration.ofMillis(30));
    final AtomicInteger first = new AtomicInteger();
    final CountDownLatch second = new CountDownLatch(1);

    handler.schedule("p1", first::incrementAndGet);
    handler.schedule("p1", second::countDown);

    assertThat(second.await(2, TimeUnit.SECONDS)).isTrue();
    assertThat(first.get()).isZero();
  }
}

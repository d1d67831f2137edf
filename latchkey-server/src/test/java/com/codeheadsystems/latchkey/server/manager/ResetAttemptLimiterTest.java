package com.codeheadsystems.latchkey.server.manager;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.latchkey.server.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ResetAttemptLimiterTest {

  private MutableClock clock;
  private ResetAttemptLimiter limiter;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
    limiter = new ResetAttemptLimiter(3, Duration.ofMinutes(15), clock);
  }

  @Test
  void refusesAttemptsPastTheLimit() {
    assertThat(limiter.tryAcquire("alice")).isTrue();
    assertThat(limiter.tryAcquire("alice")).isTrue();
    assertThat(limiter.isBlocked("alice")).isFalse();

    assertThat(limiter.tryAcquire("alice")).isTrue();
    assertThat(limiter.isBlocked("alice")).isTrue();
    assertThat(limiter.tryAcquire("alice")).isFalse();
    assertThat(limiter.tryAcquire("alice")).isFalse();
  }

  @Test
  void countsCaseInsensitively() {
    limiter.tryAcquire("alice");
    limiter.tryAcquire("Alice");
    limiter.tryAcquire("ALICE");

    assertThat(limiter.tryAcquire("aLiCe")).isFalse();
  }

  @Test
  void usernamesAreIndependent() {
    for (int i = 0; i < 3; i++) {
      limiter.tryAcquire("alice");
    }

    assertThat(limiter.tryAcquire("bob")).isTrue();
  }

  @Test
  void windowExpiryUnblocks() {
    for (int i = 0; i < 4; i++) {
      limiter.tryAcquire("alice");
    }
    clock.advance(Duration.ofMinutes(15));

    assertThat(limiter.isBlocked("alice")).isFalse();
    assertThat(limiter.tryAcquire("alice")).isTrue();
    assertThat(limiter.isBlocked("alice")).as("a new window starts counting from one").isFalse();
  }

  @Test
  void resetClearsAttempts() {
    limiter.tryAcquire("alice");
    limiter.tryAcquire("alice");
    limiter.reset("ALICE");
    limiter.tryAcquire("alice");

    assertThat(limiter.isBlocked("alice")).isFalse();
  }

  @Test
  void nullUsernameIsCountedLikeAnyOther() {
    for (int i = 0; i < 3; i++) {
      limiter.tryAcquire(null);
    }

    assertThat(limiter.tryAcquire(null)).isFalse();
    assertThat(limiter.tryAcquire("alice")).isTrue();
  }

  @Test
  void concurrentAttempts_neverExceedTheLimit() throws Exception {
    int threads = 20;
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<Boolean>> results = new ArrayList<>();
    try {
      for (int i = 0; i < threads; i++) {
        results.add(executor.submit(() -> {
          start.await();
          return limiter.tryAcquire("alice");
        }));
      }
      start.countDown();

      int granted = 0;
      for (Future<Boolean> result : results) {
        if (result.get(10, TimeUnit.SECONDS)) {
          granted++;
        }
      }
      assertThat(granted).isEqualTo(3);
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void expiredWindowsAreSweptAtMostOncePerWindow() {
    ResetAttemptLimiter small = new ResetAttemptLimiter(3, Duration.ofMinutes(15), clock, 2);
    small.tryAcquire("a");
    small.tryAcquire("b");
    small.tryAcquire("c");
    assertThat(small.trackedUsernames()).isEqualTo(3);

    clock.advance(Duration.ofMinutes(10));
    small.tryAcquire("d");
    assertThat(small.trackedUsernames()).isEqualTo(4);

    clock.advance(Duration.ofMinutes(5));
    small.tryAcquire("e");
    assertThat(small.trackedUsernames()).as("a, b and c expired and were swept").isEqualTo(2);

    clock.advance(Duration.ofMinutes(10));
    small.tryAcquire("f");
    assertThat(small.trackedUsernames()).as("d expired but the next sweep is not due").isEqualTo(3);
  }
}

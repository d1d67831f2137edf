package com.codeheadsystems.latchkey.server.manager;

import com.codeheadsystems.latchkey.server.model.Account;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Fixed-window limit on password-reset attempts per username.
 * <p>
 * An attempt is reserved with {@link #tryAcquire(String)} before the answer is checked, so
 * concurrent guesses for one username can never exceed the limit.  A correct answer clears the
 * window through {@link #reset(String)}.  Usernames are counted whether or not an account exists,
 * so being throttled reveals nothing about account existence.
 * <p>
 * Each username is updated atomically through {@link ConcurrentHashMap#compute}; unrelated
 * usernames never contend.  Expired windows are swept at most once per window length, and only
 * while many usernames are tracked.
 */
public class ResetAttemptLimiter {

  private static final int DEFAULT_SWEEP_THRESHOLD = 10_000;

  private final int maxAttempts;
  private final Duration window;
  private final Clock clock;
  private final int sweepThreshold;
  private final ConcurrentHashMap<String, Window> windows = new ConcurrentHashMap<>();
  private final AtomicReference<Instant> nextSweep;

  /**
   * Instantiates a new reset attempt limiter.
   *
   * @param maxAttempts unsuccessful attempts allowed per window
   * @param window      window length
   * @param clock       time source
   */
  public ResetAttemptLimiter(int maxAttempts, Duration window, Clock clock) {
    this(maxAttempts, window, clock, DEFAULT_SWEEP_THRESHOLD);
  }

  ResetAttemptLimiter(int maxAttempts, Duration window, Clock clock, int sweepThreshold) {
    this.maxAttempts = maxAttempts;
    this.window = window;
    this.clock = clock;
    this.sweepThreshold = sweepThreshold;
    this.nextSweep = new AtomicReference<>(clock.instant());
  }

  /**
   * Reserves one attempt for this username in the current window.
   *
   * @param username the username, any case
   * @return {@code false} if the limit is already used up and the attempt must be refused
   */
  public boolean tryAcquire(String username) {
    Instant now = clock.instant();
    // counts stop one past the limit so refused attempts cannot overflow
    Window updated = windows.compute(key(username), (k, current) ->
        current == null || current.isOver(now, window)
            ? new Window(now, 1)
            : new Window(current.start(), Math.min(current.attempts() + 1, maxAttempts + 1)));
    sweepIfDue(now);
    return updated.attempts() <= maxAttempts;
  }

  /**
   * Whether further attempts for this username are refused in the current window.
   *
   * @param username the username, any case
   * @return {@code true} if throttled
   */
  public boolean isBlocked(String username) {
    Window current = windows.get(key(username));
    return current != null && !current.isOver(clock.instant(), window)
        && current.attempts() >= maxAttempts;
  }

  /**
   * Clears the window after a correct answer.
   *
   * @param username the username, any case
   */
  public void reset(String username) {
    windows.remove(key(username));
  }

  int trackedUsernames() {
    return windows.size();
  }

  private void sweepIfDue(Instant now) {
    if (windows.size() <= sweepThreshold) {
      return;
    }
    Instant due = nextSweep.get();
    if (now.isBefore(due) || !nextSweep.compareAndSet(due, now.plus(window))) {
      return;
    }
    windows.entrySet().removeIf(e -> e.getValue().isOver(now, window));
  }

  private static String key(String username) {
    return username == null ? "" : Account.keyOf(username);
  }

  private record Window(Instant start, int attempts) {

    boolean isOver(Instant now, Duration length) {
      return !now.isBefore(start.plus(length));
    }
  }
}

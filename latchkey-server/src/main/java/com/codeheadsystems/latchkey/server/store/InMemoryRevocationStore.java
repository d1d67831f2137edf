package com.codeheadsystems.latchkey.server.store;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link RevocationStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * Expired entries are evicted lazily on {@link #isRevoked} and in bulk by a background reaper.
 * Revocations are lost on restart, which re-admits revoked but unexpired tokens; use a shared
 * store when that matters or when several server instances verify the same tokens.
 */
public class InMemoryRevocationStore implements RevocationStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryRevocationStore.class);

  /**
   * Default interval between reaper runs.
   */
  public static final Duration DEFAULT_PRUNE_INTERVAL = Duration.ofMinutes(5);

  private final ConcurrentHashMap<String, Instant> revoked = new ConcurrentHashMap<>();
  private final Clock clock;
  private final ScheduledExecutorService reaper;

  /**
   * Creates a store using the system clock and the default prune interval.
   */
  public InMemoryRevocationStore() {
    this(Clock.systemUTC(), DEFAULT_PRUNE_INTERVAL);
  }

  /**
   * Creates a store with a custom clock and prune interval.
   *
   * @param clock         time source for lazy eviction and the reaper
   * @param pruneInterval interval between reaper runs; {@link Duration#ZERO} disables the reaper
   */
  public InMemoryRevocationStore(Clock clock, Duration pruneInterval) {
    this.clock = clock;
    if (pruneInterval.isZero()) {
      this.reaper = null;
    } else {
      this.reaper = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "latchkey-revocation-reaper");
        t.setDaemon(true);
        return t;
      });
      long millis = pruneInterval.toMillis();
      reaper.scheduleAtFixedRate(() -> prune(clock.instant()), millis, millis, TimeUnit.MILLISECONDS);
    }
  }

  @Override
  public void revoke(String jti, Instant expiresAt) {
    if (!expiresAt.isAfter(clock.instant())) {
      return;
    }
    revoked.putIfAbsent(jti, expiresAt);
    log.debug("Revoked jti={}", jti);
  }

  @Override
  public boolean isRevoked(String jti) {
    Instant expiresAt = revoked.get(jti);
    if (expiresAt == null) {
      return false;
    }
    if (!expiresAt.isAfter(clock.instant())) {
      revoked.remove(jti, expiresAt);
      return false;
    }
    return true;
  }

  @Override
  public int prune(Instant now) {
    int removed = 0;
    for (Map.Entry<String, Instant> entry : revoked.entrySet()) {
      if (!entry.getValue().isAfter(now) && revoked.remove(entry.getKey(), entry.getValue())) {
        removed++;
      }
    }
    if (removed > 0) {
      log.debug("Pruned {} expired revocation(s)", removed);
    }
    return removed;
  }

  /**
   * Number of entries currently held.
   *
   * @return the size of the revocation set
   */
  public int size() {
    return revoked.size();
  }

  /**
   * Stops the background reaper.
   */
  public void shutdown() {
    if (reaper != null) {
      reaper.shutdown();
    }
  }
}

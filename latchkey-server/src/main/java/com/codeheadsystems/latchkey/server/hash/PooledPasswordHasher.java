package com.codeheadsystems.latchkey.server.hash;

import com.codeheadsystems.latchkey.server.model.HashedSecret;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a delegate {@link PasswordHasher} on a fixed pool of worker threads.
 * <p>
 * Argon2id is CPU- and memory-hard, so the number of hashes in flight is capped at the pool
 * size no matter how many request threads call in.  Callers block until their hash completes.
 * Call {@link #shutdown()} on application shutdown.
 */
public class PooledPasswordHasher implements PasswordHasher {

  private final PasswordHasher delegate;
  private final ExecutorService pool;

  /**
   * Instantiates a new pooled password hasher.
   *
   * @param delegate the hasher doing the work
   * @param threads  number of worker threads
   */
  public PooledPasswordHasher(PasswordHasher delegate, int threads) {
    if (threads < 1) {
      throw new IllegalArgumentException("threads must be >= 1");
    }
    this.delegate = delegate;
    AtomicInteger counter = new AtomicInteger();
    this.pool = Executors.newFixedThreadPool(threads, r -> {
      Thread t = new Thread(r, "hashing-worker-" + counter.incrementAndGet());
      t.setDaemon(true);
      return t;
    });
  }

  @Override
  public HashedSecret hash(String secret) {
    return run(() -> delegate.hash(secret));
  }

  @Override
  public byte[] hash(String secret, byte[] salt) {
    return run(() -> delegate.hash(secret, salt));
  }

  @Override
  public boolean verify(String secret, HashedSecret hashed) {
    return run(() -> delegate.verify(secret, hashed));
  }

  /**
   * Stops the worker threads once queued work is done.
   */
  public void shutdown() {
    pool.shutdown();
  }

  private <T> T run(Callable<T> task) {
    Future<T> future = pool.submit(task);
    try {
      return future.get();
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while hashing", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw new IllegalStateException("Hashing failed", cause);
    }
  }
}

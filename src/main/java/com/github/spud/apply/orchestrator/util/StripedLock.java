package com.github.spud.apply.orchestrator.util;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Fixed set of locks keyed by hash. Keys on the same stripe serialise, keys on different stripes
 * never contend.
 */
public class StripedLock {

  private final ReentrantLock[] stripes;

  public StripedLock(int stripes) {
    if (stripes <= 0) {
      throw new IllegalArgumentException("stripes must be positive: " + stripes);
    }
    this.stripes = new ReentrantLock[stripes];
    for (int i = 0; i < stripes; i++) {
      this.stripes[i] = new ReentrantLock();
    }
  }

  public ReentrantLock lockFor(String key) {
    return stripes[(key.hashCode() & 0x7fffffff) % stripes.length];
  }

  public <T> T withLock(String key, Supplier<T> action) {
    ReentrantLock lock = lockFor(key);
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }

  public void withLock(String key, Runnable action) {
    withLock(key, () -> {
      action.run();
      return null;
    });
  }

  public int size() {
    return stripes.length;
  }
}

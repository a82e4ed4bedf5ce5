package com.jz.gateway.common;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 进程内按 key 串行化“读-改-写”。固定条带数，内存不随 key 数量增长。
 * 同一 key 一定落在同一把锁上；不同 key 偶尔共享一把锁，只影响吞吐不影响正确性。
 */
public class StripedLocks {

    private final ReentrantLock[] stripes;

    public StripedLocks(int stripes) {
        if (stripes <= 0) throw new IllegalArgumentException("stripes must be > 0");
        this.stripes = new ReentrantLock[stripes];
        for (int i = 0; i < stripes; i++) {
            this.stripes[i] = new ReentrantLock();
        }
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

    ReentrantLock lockFor(String key) {
        int h = key == null ? 0 : key.hashCode();
        h ^= (h >>> 16);
        return stripes[Math.floorMod(h, stripes.length)];
    }
}

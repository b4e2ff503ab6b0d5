package com.argosware.pcq;

import java.lang.management.ManagementFactory;
import java.lang.management.ThreadInfo;
import java.lang.management.ThreadMXBean;
import java.util.concurrent.*;
import java.util.concurrent.locks.LockSupport;

final class ConcurrentTestSupport {
    private ConcurrentTestSupport() {}

    static void microJitter() {
        // 1/64 chance, up to 50µs
        ThreadLocalRandom rnd = ThreadLocalRandom.current();
        if ((rnd.nextInt() & 63) != 0) return;
        LockSupport.parkNanos(rnd.nextInt(50_000));
    }

    static <T> T getOrDump(Future<T> f, int sec, ExecutorService pool, String tag) throws Exception {
        try {
            return f.get(sec, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            System.err.println("=== TIMEOUT [" + tag + "] thread dump ===");
            dumpThreads();
            pool.shutdownNow();
            throw new AssertionError("Timeout: " + tag, e);
        }
    }

    /** Gives a thread that is about to block time to actually block. */
    static void letBlock() throws InterruptedException {
        Thread.sleep(50);
    }

    static void dumpThreads() {
        ThreadMXBean mx = ManagementFactory.getThreadMXBean();
        for (ThreadInfo ti : mx.dumpAllThreads(true, true))
            System.err.println(ti.toString());
        long[] dead = mx.findDeadlockedThreads();
        if (dead != null && dead.length > 0) {
            System.err.println("=== DEADLOCK DETECTED ===");
            for (ThreadInfo ti : mx.getThreadInfo(dead, true, true))
                System.err.println(ti.toString());
        }
    }

    static void await(CountDownLatch latch) {
        try { latch.await(); } catch (InterruptedException e) { throw new RuntimeException(e); }
    }

    static void call(ThrowingRunnable r) {
        try { r.run(); } catch (Exception e) { throw new RuntimeException(e); }
    }

    @FunctionalInterface
    interface ThrowingRunnable {
        void run() throws Exception;
    }
}

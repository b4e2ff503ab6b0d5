/*
 * Copyright (c) 2014, Oracle America, Inc.
 * All rights reserved.
 *
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions are met:
 *
 *  * Redistributions of source code must retain the above copyright notice,
 *    this list of conditions and the following disclaimer.
 *
 *  * Redistributions in binary form must reproduce the above copyright
 *    notice, this list of conditions and the following disclaimer in the
 *    documentation and/or other materials provided with the distribution.
 *
 *  * Neither the name of Oracle nor the names of its contributors may be used
 *    to endorse or promote products derived from this software without
 *    specific prior written permission.
 *
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS"
 * AND ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE
 * IMPLIED WARRANTIES OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE
 * ARE DISCLAIMED. IN NO EVENT SHALL THE COPYRIGHT HOLDER OR CONTRIBUTORS BE
 * LIABLE FOR ANY DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR
 * CONSEQUENTIAL DAMAGES (INCLUDING, BUT NOT LIMITED TO, PROCUREMENT OF
 * SUBSTITUTE GOODS OR SERVICES; LOSS OF USE, DATA, OR PROFITS; OR BUSINESS
 * INTERRUPTION) HOWEVER CAUSED AND ON ANY THEORY OF LIABILITY, WHETHER IN
 * CONTRACT, STRICT LIABILITY, OR TORT (INCLUDING NEGLIGENCE OR OTHERWISE)
 * ARISING IN ANY WAY OUT OF THE USE OF THIS SOFTWARE, EVEN IF ADVISED OF
 * THE POSSIBILITY OF SUCH DAMAGE.
 */

package com.argosware.pcq;

import org.checkerframework.checker.nullness.qual.MonotonicNonNull;
import org.checkerframework.checker.nullness.qual.NonNull;
import org.openjdk.jmh.annotations.*;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

@State(Scope.Benchmark)
@Threads(1)
@Fork(value = 3)
@Measurement(iterations = 10, time = 100, timeUnit = TimeUnit.MILLISECONDS)
@Warmup(iterations = 10, time = 200, timeUnit = TimeUnit.MILLISECONDS)
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
public class PCQueueBenchmark {
    static final Integer STOP = Integer.MIN_VALUE;

    public enum Implementation {
        BOUNDED_CONDITION,
        BOUNDED_JDK,
        UNBOUNDED;
        public WorkQueue<Integer> create(int capacity) {
            return switch (this) {
                case BOUNDED_CONDITION -> new BoundedQueue<>(capacity, () -> 0,
                        Assigner.reference(), SemaphoreKind.CONDITION);
                case BOUNDED_JDK       -> new BoundedQueue<>(capacity, () -> 0,
                        Assigner.reference(), SemaphoreKind.JDK);
                case UNBOUNDED         -> new UnboundedSingleQueue<>(capacity, () -> 0,
                        Assigner.reference());
            };
        }
    }

    @Param public Implementation implementation;
    @Param({"1", "4", "16", "256"}) public int capacity;
    private final ExecutorService counterpartExecutor
            = Executors.newCachedThreadPool(new ThreadFactory() {
        private final AtomicInteger nextThreadId = new AtomicInteger();
        private final ThreadGroup group
                = new ThreadGroup(Thread.currentThread().getThreadGroup(), "counterparts");
        @Override public Thread newThread(@NonNull Runnable r) {
            var name = "counterpart-" + nextThreadId.getAndIncrement();
            var thread = new Thread(group, r, name);
            thread.setDaemon(true);
            return thread;
        }
    });

    @TearDown(Level.Trial) public void shutdown() {
        counterpartExecutor.shutdownNow();
    }

    @Override public String toString() {
        return getClass().getSimpleName();
    }

    /**
     * One queue per benchmark thread plus a counterpart thread working its other side. Neither
     * queue can be closed, so stopping the counterpart goes through the queue itself.
     */
    @State(Scope.Thread)
    public static class PairState implements Runnable {
        protected volatile boolean stopping;
        protected @MonotonicNonNull Future<?> counterpartFuture;
        public @MonotonicNonNull WorkQueue<Integer> queue;
        public int counter;

        @Setup(Level.Iteration) public void setup(PCQueueBenchmark outer) {
            this.queue = outer.implementation.create(outer.capacity);
            this.stopping = false;
            this.counter = 0;
            reset();
            this.counterpartFuture = outer.counterpartExecutor.submit(this);
        }

        @TearDown(Level.Iteration) public void tearDown() {
            stopping = true;
            release(queue);
            try {
                counterpartFuture.get();
            } catch (InterruptedException | ExecutionException e) {
                throw new RuntimeException("Unexpected", e);
            }
        }

        @Override public void run() {}

        protected void reset() {}

        /** Unblocks the counterpart after {@link #stopping} was set. */
        protected void release(WorkQueue<Integer> queue) {}
    }

    /** The benchmark thread produces; the counterpart consumes until it sees {@link #STOP}. */
    @State(Scope.Thread)
    public static class ProducerState extends PairState {
        @Override public void run() {
            Integer out = 0;
            while (!STOP.equals(out = queue.consume(out))) { }
        }

        @Override protected void release(WorkQueue<Integer> queue) {
            queue.produce(STOP);
        }
    }

    /**
     * The benchmark thread consumes; the counterpart produces until stopped, then produces
     * {@link #STOP}. The counterpart stays at most {@link #MAX_LAG} items ahead, which only
     * matters for the unbounded queue.
     */
    @State(Scope.Thread)
    public static class ConsumerState extends PairState {
        static final long MAX_LAG = 1 << 16;
        private static final VarHandle CONSUMED;

        static {
            try {
                CONSUMED = MethodHandles.lookup()
                        .findVarHandle(ConsumerState.class, "plainConsumed", long.class);
            } catch (NoSuchFieldException | IllegalAccessException e) {
                throw new ExceptionInInitializerError(e);
            }
        }

        @SuppressWarnings("unused") private long plainConsumed;

        @Override protected void reset() {
            CONSUMED.setRelease(this, 0L);
        }

        /** Benchmark thread only. */
        void consumed() {
            CONSUMED.setRelease(this, plainConsumed+1);
        }

        @Override public void run() {
            for (long i = 0; !stopping; i++) {
                while (i - (long)CONSUMED.getAcquire(this) > MAX_LAG && !stopping)
                    Thread.onSpinWait();
                queue.produce((int)(i & Integer.MAX_VALUE));
            }
            queue.produce(STOP);
        }

        @Override protected void release(WorkQueue<Integer> queue) {
            // a bounded counterpart may be blocked on a full queue
            Integer out = 0;
            while (!STOP.equals(out = queue.consume(out))) { }
        }
    }

    @Benchmark public void produce(ProducerState s) {
        s.queue.produce(s.counter++);
    }

    @Benchmark public Integer consume(ConsumerState s) {
        Integer value = s.queue.consume();
        s.consumed();
        return value;
    }
}

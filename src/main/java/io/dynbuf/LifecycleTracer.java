/*
 * Copyright 2020 The Netty Project
 *
 * The Netty Project licenses this file to you under the Apache License,
 * version 2.0 (the "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at:
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */
package io.dynbuf;

import io.netty.util.internal.SystemPropertyUtil;

import java.util.ArrayDeque;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * Records where a reference counted object was allocated, retained, released, sliced and dropped, so that the
 * exceptions thrown for use-after-release can point at the code that did the releasing.
 * <p>
 * Tracing is off unless the {@code io.dynbuf.traceLifecycleDepth} system property is set to a positive stack depth.
 */
abstract class LifecycleTracer {
    static final int TRACE_LIFECYCLE_DEPTH =
            Math.max(SystemPropertyUtil.getInt("io.dynbuf.traceLifecycleDepth", 0), 0);

    static LifecycleTracer get() {
        if (TRACE_LIFECYCLE_DEPTH == 0) {
            return NoOpTracer.INSTANCE;
        }
        StackTracer stackTracer = new StackTracer();
        stackTracer.addTrace(StackTracer.WALKER.walk(new Trace("allocate", 1)));
        return stackTracer;
    }

    abstract void retain(int refCount);

    abstract void release(int refCount);

    abstract void drop();

    abstract void event(String name, int refCount);

    abstract <E extends Throwable> E attachTrace(E throwable);

    private static final class NoOpTracer extends LifecycleTracer {
        private static final NoOpTracer INSTANCE = new NoOpTracer();

        @Override
        void retain(int refCount) {
        }

        @Override
        void release(int refCount) {
        }

        @Override
        void drop() {
        }

        @Override
        void event(String name, int refCount) {
        }

        @Override
        <E extends Throwable> E attachTrace(E throwable) {
            return throwable;
        }
    }

    private static final class StackTracer extends LifecycleTracer {
        private static final int MAX_TRACE_POINTS =
                Math.min(SystemPropertyUtil.getInt("io.dynbuf.maxTracePoints", 50), 1000);
        private static final StackWalker WALKER;
        static {
            int depth = TRACE_LIFECYCLE_DEPTH;
            WALKER = depth > 0 ? StackWalker.getInstance(Set.of(), depth + 2) : null;
        }

        private final ArrayDeque<Trace> traces = new ArrayDeque<>();

        void addTrace(Trace trace) {
            synchronized (traces) {
                if (traces.size() == MAX_TRACE_POINTS) {
                    traces.pollFirst();
                }
                traces.addLast(trace);
            }
        }

        @Override
        void retain(int refCount) {
            addTrace(WALKER.walk(new Trace("retain", refCount)));
        }

        @Override
        void release(int refCount) {
            addTrace(WALKER.walk(new Trace("release", refCount)));
        }

        @Override
        void drop() {
            addTrace(WALKER.walk(new Trace("drop", 0)));
        }

        @Override
        void event(String name, int refCount) {
            addTrace(WALKER.walk(new Trace(name, refCount)));
        }

        @Override
        <E extends Throwable> E attachTrace(E throwable) {
            synchronized (traces) {
                long timestamp = System.nanoTime();
                for (Trace trace : traces) {
                    trace.attach(throwable, timestamp);
                }
            }
            return throwable;
        }
    }

    private static final class Trace implements Function<Stream<StackWalker.StackFrame>, Trace> {
        final String name;
        final int refCount;
        final long timestamp;
        StackWalker.StackFrame[] frames;

        Trace(String name, int refCount) {
            this.name = name;
            this.refCount = refCount;
            timestamp = System.nanoTime();
        }

        @Override
        public Trace apply(Stream<StackWalker.StackFrame> frames) {
            this.frames = frames.limit(TRACE_LIFECYCLE_DEPTH + 1).toArray(StackWalker.StackFrame[]::new);
            return this;
        }

        <E extends Throwable> void attach(E throwable, long timestamp) {
            String message = name + " (refCount = " + refCount + ") T" + (this.timestamp - timestamp) / 1000 + "µs.";
            Traceback exception = new Traceback(message);
            StackTraceElement[] stackTrace = new StackTraceElement[frames.length];
            for (int i = 0; i < frames.length; i++) {
                stackTrace[i] = frames[i].toStackTraceElement();
            }
            exception.setStackTrace(stackTrace);
            throwable.addSuppressed(exception);
        }
    }

    private static final class Traceback extends Throwable {
        private static final long serialVersionUID = 941453986194634605L;

        Traceback(String message) {
            super(message);
        }

        @Override
        public synchronized Throwable fillInStackTrace() {
            return this;
        }
    }
}

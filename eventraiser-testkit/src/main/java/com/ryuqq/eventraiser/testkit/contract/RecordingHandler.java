package com.ryuqq.eventraiser.testkit.contract;

import com.ryuqq.eventraiser.core.handler.EventHandler;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread-safe event handler that records every invocation.
 *
 * <p>Optionally throws a fixed exception after recording, and optionally blocks
 * on a gate latch before returning, so that tests can observe ordering,
 * fault isolation and concurrency of the decorators.</p>
 *
 * <p><strong>Features:</strong></p>
 * <ul>
 *   <li>Invocation log (source, args, thread name)</li>
 *   <li>Failure injection via {@link #failingWith(String, RuntimeException)}</li>
 *   <li>Blocking via {@link #blockingOn(String, CountDownLatch)}</li>
 *   <li>Shared sequence journal for cross-handler ordering</li>
 * </ul>
 *
 * @param <T> the event data type
 * @author EventRaiser Team
 * @since 1.0.0
 */
public class RecordingHandler<T> implements EventHandler<T> {

    private static final long GATE_TIMEOUT_SECONDS = 5L;

    private final String name;
    private final List<Invocation<T>> invocations;
    private final List<String> journal;
    private final RuntimeException failure;
    private final CountDownLatch gate;
    private final AtomicInteger inFlight;
    private final AtomicInteger maxInFlight;

    private RecordingHandler(String name, List<String> journal, RuntimeException failure, CountDownLatch gate) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        this.name = name;
        this.invocations = new CopyOnWriteArrayList<>();
        this.journal = journal;
        this.failure = failure;
        this.gate = gate;
        this.inFlight = new AtomicInteger();
        this.maxInFlight = new AtomicInteger();
    }

    /**
     * Creates a handler that records and returns normally.
     *
     * @param name the handler name written to the journal
     * @param <T> the event data type
     * @return a new recording handler
     */
    public static <T> RecordingHandler<T> named(String name) {
        return new RecordingHandler<>(name, new CopyOnWriteArrayList<>(), null, null);
    }

    /**
     * Creates a handler that records and then throws the given exception.
     *
     * @param name the handler name written to the journal
     * @param failure the exception thrown on every invocation
     * @param <T> the event data type
     * @return a new recording handler
     */
    public static <T> RecordingHandler<T> failingWith(String name, RuntimeException failure) {
        if (failure == null) {
            throw new IllegalArgumentException("failure cannot be null");
        }
        return new RecordingHandler<>(name, new CopyOnWriteArrayList<>(), failure, null);
    }

    /**
     * Creates a handler that records and then waits for the gate to open.
     *
     * @param name the handler name written to the journal
     * @param gate the latch the handler waits on (at most 5 seconds)
     * @param <T> the event data type
     * @return a new recording handler
     */
    public static <T> RecordingHandler<T> blockingOn(String name, CountDownLatch gate) {
        if (gate == null) {
            throw new IllegalArgumentException("gate cannot be null");
        }
        return new RecordingHandler<>(name, new CopyOnWriteArrayList<>(), null, gate);
    }

    /**
     * Returns a copy of this handler that writes its name to the shared journal.
     *
     * @param sharedJournal journal shared by several handlers
     * @return a new recording handler with the same behavior
     */
    public RecordingHandler<T> journalingTo(List<String> sharedJournal) {
        if (sharedJournal == null) {
            throw new IllegalArgumentException("sharedJournal cannot be null");
        }
        return new RecordingHandler<>(name, sharedJournal, failure, gate);
    }

    @Override
    public void handle(Object source, T args) {
        int current = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(current, Math::max);
        try {
            invocations.add(new Invocation<>(source, args, Thread.currentThread().getName()));
            journal.add(name);
            if (gate != null) {
                awaitGate();
            }
            if (failure != null) {
                throw failure;
            }
        } finally {
            inFlight.decrementAndGet();
        }
    }

    private void awaitGate() {
        try {
            if (!gate.await(GATE_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                throw new IllegalStateException("Gate was not opened for handler " + name);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting on gate for handler " + name, e);
        }
    }

    public String getName() {
        return name;
    }

    /**
     * @return number of recorded invocations
     */
    public int getInvocationCount() {
        return invocations.size();
    }

    /**
     * @return snapshot of the recorded invocations in arrival order
     */
    public List<Invocation<T>> getInvocations() {
        return List.copyOf(invocations);
    }

    /**
     * @return snapshot of the journal this handler writes to
     */
    public List<String> getJournal() {
        return List.copyOf(journal);
    }

    /**
     * @return highest number of concurrent invocations of this handler observed so far
     */
    public int getMaxInFlight() {
        return maxInFlight.get();
    }

    @Override
    public String toString() {
        return "RecordingHandler{" + name + '}';
    }

    /**
     * A single recorded invocation.
     *
     * @param source the event source
     * @param args the event data
     * @param threadName the thread the handler ran on
     * @param <T> the event data type
     */
    public record Invocation<T>(Object source, T args, String threadName) {
    }
}

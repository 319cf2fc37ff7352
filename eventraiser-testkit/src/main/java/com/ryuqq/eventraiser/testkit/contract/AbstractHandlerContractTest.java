package com.ryuqq.eventraiser.testkit.contract;

import com.ryuqq.eventraiser.runner.EventRaiser;
import com.ryuqq.eventraiser.runner.EventRaiserConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Abstract base class for handler Contract Tests.
 *
 * <p>This class provides a dedicated worker pool, an {@link EventRaiser} bound to it,
 * a shared invocation journal and helper methods for building recording handlers.</p>
 *
 * <p><strong>Test Infrastructure:</strong></p>
 * <ul>
 *   <li>executorService: fixed pool used by Parallel, Async and raiseAsync</li>
 *   <li>raiser: EventRaiser configured with executorService</li>
 *   <li>journal: names of handlers in the order they ran</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * public class MyContractTest extends AbstractHandlerContractTest {
 *     {@literal @}Test
 *     void testScenario() {
 *         RecordingHandler&lt;TestEventArgs&gt; a = recording("A");
 *         RecordingHandler&lt;TestEventArgs&gt; b = recording("B");
 *
 *         raiser.raise(HandlerChain.combine(a, b), source, event("E-1"));
 *
 *         assertJournal("A", "B");
 *     }
 * }
 * </pre>
 *
 * @author EventRaiser Team
 * @since 1.0.0
 */
public abstract class AbstractHandlerContractTest {

    private static final int WORKER_THREADS = 4;

    protected final Object source = new Object();

    protected ExecutorService executorService;
    protected EventRaiser raiser;
    protected List<String> journal;

    /**
     * Sets up test fixtures before each test.
     *
     * <p>Creates a fresh worker pool, raiser and journal.</p>
     */
    @BeforeEach
    void setUp() {
        executorService = Executors.newFixedThreadPool(WORKER_THREADS);
        raiser = new EventRaiser(new EventRaiserConfig().withExecutor(executorService));
        journal = new CopyOnWriteArrayList<>();
    }

    /**
     * Cleans up test fixtures after each test.
     *
     * <p>Shuts down the worker pool to prevent test interference.</p>
     */
    @AfterEach
    void tearDown() throws InterruptedException {
        if (executorService != null) {
            executorService.shutdownNow();
            executorService.awaitTermination(5, TimeUnit.SECONDS);
        }
    }

    /**
     * Creates event data with the given label.
     *
     * @param label the event label
     * @return new event data
     */
    protected TestEventArgs event(String label) {
        return new TestEventArgs(label);
    }

    /**
     * Creates a recording handler that writes to the shared journal.
     *
     * @param name the handler name
     * @return a new recording handler
     */
    protected RecordingHandler<TestEventArgs> recording(String name) {
        return RecordingHandler.<TestEventArgs>named(name).journalingTo(journal);
    }

    /**
     * Creates a recording handler that writes to the shared journal and then throws.
     *
     * @param name the handler name
     * @param failure the exception to throw
     * @return a new recording handler
     */
    protected RecordingHandler<TestEventArgs> failing(String name, RuntimeException failure) {
        return RecordingHandler.<TestEventArgs>failingWith(name, failure).journalingTo(journal);
    }

    /**
     * Creates a recording handler that writes to the shared journal and then waits on the gate.
     *
     * @param name the handler name
     * @param gate the latch to wait on
     * @return a new recording handler
     */
    protected RecordingHandler<TestEventArgs> blocking(String name, CountDownLatch gate) {
        return RecordingHandler.<TestEventArgs>blockingOn(name, gate).journalingTo(journal);
    }

    /**
     * Asserts that the journal contains exactly the given handler names in order.
     *
     * @param expected expected handler names
     */
    protected void assertJournal(String... expected) {
        assertEquals(List.of(expected), List.copyOf(journal),
                String.format("Expected handler order %s but was %s", List.of(expected), journal));
    }

    /**
     * Asserts that the handler was invoked exactly the given number of times.
     *
     * @param handler the recording handler
     * @param expected expected invocation count
     */
    protected void assertInvokedTimes(RecordingHandler<?> handler, int expected) {
        assertEquals(expected, handler.getInvocationCount(),
                String.format("Expected %s to be invoked %d times but was %d",
                        handler.getName(), expected, handler.getInvocationCount()));
    }

    /**
     * Asserts that the handler received exactly one invocation with the given source and data.
     *
     * @param handler the recording handler
     * @param expectedArgs expected event data
     */
    protected void assertInvokedOnceWith(RecordingHandler<TestEventArgs> handler, TestEventArgs expectedArgs) {
        assertInvokedTimes(handler, 1);
        RecordingHandler.Invocation<TestEventArgs> invocation = handler.getInvocations().get(0);
        assertTrue(invocation.source() == source,
                String.format("Expected source %s but was %s", source, invocation.source()));
        assertEquals(expectedArgs, invocation.args());
    }

    /**
     * Waits for the latch, failing the test on timeout.
     *
     * @param latch the latch to wait for
     */
    protected void awaitLatch(CountDownLatch latch) {
        try {
            assertTrue(latch.await(5, TimeUnit.SECONDS), "Timed out waiting for latch");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Wait interrupted", e);
        }
    }
}

package com.ryuqq.eventraiser.testkit.contract;

import com.ryuqq.eventraiser.core.handler.EventHandler;
import com.ryuqq.eventraiser.core.handler.HandlerChain;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for Scenario 2: Composition and Sequential Raise.
 *
 * <p>This test validates that combined handler lists run in registration order
 * on the calling thread, and that a missing handler list is a silent no-op.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>combine([A, B, C]) → A, B, C called in order, once each</li>
 *   <li>raise(null) → no effect, no exception</li>
 *   <li>Unprotected failure → later handlers skipped, raiser observes the error</li>
 *   <li>Nested combination → flattened</li>
 * </ul>
 *
 * @author EventRaiser Team
 * @since 1.0.0
 */
class CompositionContractTest extends AbstractHandlerContractTest {

    @Test
    void testRaise_CombinedList_CalledInOrderOnceEach() {
        // Given
        RecordingHandler<TestEventArgs> a = recording("A");
        RecordingHandler<TestEventArgs> b = recording("B");
        RecordingHandler<TestEventArgs> c = recording("C");
        TestEventArgs event = event("E-1");

        // When
        raiser.raise(HandlerChain.combine(List.of(a, b, c)), source, event);

        // Then
        assertJournal("A", "B", "C");
        assertInvokedOnceWith(a, event);
        assertInvokedOnceWith(b, event);
        assertInvokedOnceWith(c, event);
    }

    @Test
    void testRaise_OnCallingThread() {
        // Given
        RecordingHandler<TestEventArgs> a = recording("A");

        // When
        raiser.raise(a, source, event("E-2"));

        // Then
        assertEquals(Thread.currentThread().getName(), a.getInvocations().get(0).threadName());
    }

    @Test
    void testRaise_NullList_NoEffect() {
        // When & Then
        assertDoesNotThrow(() -> raiser.raise((EventHandler<TestEventArgs>) null, source, event("E-3")));
        assertJournal();
    }

    @Test
    void testRaise_CombinationOfNullsOnly_IsNull() {
        // Given
        List<EventHandler<TestEventArgs>> nothing = Arrays.asList(null, null, null);

        // When
        EventHandler<TestEventArgs> combined = HandlerChain.combine(nothing);

        // Then
        assertNull(combined);
        assertDoesNotThrow(() -> raiser.raise(combined, source, event("E-4")));
    }

    @Test
    void testRaise_UnprotectedFailure_StopsAndPropagates() {
        // Given
        IllegalStateException failure = new IllegalStateException("H failed");
        RecordingHandler<TestEventArgs> h = failing("H", failure);
        EventHandler<TestEventArgs> list = HandlerChain.combine(h, h, h);

        // When
        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> raiser.raise(list, source, event("E-5")));

        // Then: H called once, the raiser observes the original error
        assertSame(failure, thrown);
        assertInvokedTimes(h, 1);
    }

    @Test
    void testCombine_NestedChains_Flattened() {
        // Given
        RecordingHandler<TestEventArgs> a = recording("A");
        RecordingHandler<TestEventArgs> b = recording("B");
        RecordingHandler<TestEventArgs> c = recording("C");

        // When
        EventHandler<TestEventArgs> nested = HandlerChain.combine(HandlerChain.combine(a, b), HandlerChain.combine(c, a));
        raiser.raise(nested, source, event("E-6"));

        // Then
        assertEquals(List.of(a, b, c, a), HandlerChain.invocationList(nested));
        assertJournal("A", "B", "C", "A");
        assertInvokedTimes(a, 2);
    }
}

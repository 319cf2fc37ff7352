package com.ryuqq.eventraiser.testkit.contract;

import com.ryuqq.eventraiser.core.handler.EventArgs;

import java.util.Objects;

/**
 * Event data used by the contract tests.
 *
 * <p>Carries a single label so that a recorded invocation can be matched
 * against the event that produced it.</p>
 *
 * @author EventRaiser Team
 * @since 1.0.0
 */
public class TestEventArgs extends EventArgs {

    private final String label;

    /**
     * Creates test event data.
     *
     * @param label the label identifying this event
     * @throws IllegalArgumentException if label is null
     */
    public TestEventArgs(String label) {
        if (label == null) {
            throw new IllegalArgumentException("label cannot be null");
        }
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return label.equals(((TestEventArgs) o).label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(label);
    }

    @Override
    public String toString() {
        return "TestEventArgs{label=" + label + '}';
    }
}

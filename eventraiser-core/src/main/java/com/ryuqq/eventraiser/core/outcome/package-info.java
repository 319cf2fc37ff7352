/**
 * Handler execution outcome package.
 *
 * <p>This package defines the per-handler result channel used by the fault-isolating
 * and parallel decorators, so that partial failure can be suppressed or aggregated
 * without relying on exception flow alone.</p>
 *
 * <h2>Sealed Interface</h2>
 * <ul>
 *   <li>{@link com.ryuqq.eventraiser.core.outcome.HandlerOutcome} - Sealed interface (permits Delivered, Faulted)</li>
 * </ul>
 *
 * <h2>Outcome Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.eventraiser.core.outcome.Delivered} - Handler ran to completion</li>
 *   <li>{@link com.ryuqq.eventraiser.core.outcome.Faulted} - Handler threw an exception</li>
 * </ul>
 *
 * @since 1.0.0
 * @author EventRaiser Team
 */
package com.ryuqq.eventraiser.core.outcome;

/**
 * Process-lifetime state of the engine and the dispatcher.
 *
 * <p>
 * Both states are immutable snapshots held by injectable stores. Only the
 * in-memory stores ship here; running more than one evaluator against the
 * same channel requires a shared store with atomic updates, otherwise
 * cooldown and dedup guarantees no longer hold.
 * </p>
 *
 * @since 1.0.0
 */
package com.signalsentinel.core.state;

/**
 * Delivery-level throttling, deduplication and message formatting.
 *
 * <p>
 * {@link com.signalsentinel.core.dispatch.AlertDispatcher} takes the
 * candidates of one cycle plus caller-built
 * {@link com.signalsentinel.core.dispatch.AlertContexts}, renders at most one
 * of them with {@link com.signalsentinel.core.dispatch.AlertMessageFormatter}
 * and hands it to an {@link com.signalsentinel.core.channel.AlertChannel}.
 * </p>
 *
 * @since 1.0.0
 */
package com.signalsentinel.core.dispatch;

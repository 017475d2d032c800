/**
 * Alert evaluation: folds the rules of
 * {@link com.signalsentinel.core.rules} over one snapshot and persists the
 * resulting {@link com.signalsentinel.core.state.EvaluationState}.
 *
 * @since 1.0.0
 */
package com.signalsentinel.core.engine;

/**
 * Pipeline execution outcome package.
 *
 * <p>This package defines the sealed interface hierarchy returned by every pipeline call.
 * Exactly one variant is populated per call.</p>
 *
 * <h2>Outcome Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.conduit.core.outcome.Success} - Decoded result</li>
 *   <li>{@link com.ryuqq.conduit.core.outcome.ApplicationFailure} - Envelope declared {@code success:false}</li>
 *   <li>{@link com.ryuqq.conduit.core.outcome.TransportFailure} - Transport, HTTP status, malformed body or pipeline rejection,
 *       discriminated by {@link com.ryuqq.conduit.core.outcome.FailureKind}</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Conduit Team
 */
package com.ryuqq.conduit.core.outcome;

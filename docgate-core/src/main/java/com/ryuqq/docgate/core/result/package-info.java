/**
 * Uniform success/failure results.
 *
 * <p>This package defines the sealed {@link com.ryuqq.docgate.core.result.Result} hierarchy
 * returned by every gateway and repository operation.</p>
 *
 * <h2>Result Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.docgate.core.result.Success} - value produced</li>
 *   <li>{@link com.ryuqq.docgate.core.result.Failure} - structured error, never a thrown exception</li>
 * </ul>
 *
 * <p>{@link com.ryuqq.docgate.core.result.Unit} is the value of operations that
 * produce nothing (e.g. delete).</p>
 *
 * @since 1.0.0
 * @author DocGate Team
 */
package com.ryuqq.docgate.core.result;

/**
 * Structured error model and mapping.
 *
 * <h2>Core Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.docgate.core.error.StructuredError} - title, code, description, severity, metadata</li>
 *   <li>{@link com.ryuqq.docgate.core.error.ErrorMapper} - converts exceptions and business-error payloads</li>
 *   <li>{@link com.ryuqq.docgate.core.error.DefaultErrorMapper} - JSON-payload conventions</li>
 *   <li>{@link com.ryuqq.docgate.core.error.DatabaseErrors} - catalog (NotFound, StreamClosed, ...)</li>
 * </ul>
 *
 * @since 1.0.0
 * @author DocGate Team
 */
package com.ryuqq.docgate.core.error;

/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.ttsbatch.exception.TtsBatchException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.ttsbatch.exception.InvalidRequestException} - Request rejected
 *       before any work (empty text, bad sample rate, malformed model id)</li>
 *   <li>{@link com.phillippitts.ttsbatch.exception.ModelUnavailableException} - Voice model could
 *       not be resolved (unknown, over capacity, download or load failure)</li>
 *   <li>{@link com.phillippitts.ttsbatch.exception.SynthesisException} - Engine failed to
 *       produce audio</li>
 *   <li>{@link com.phillippitts.ttsbatch.exception.CacheUnavailableException} - Cache backend
 *       failure; internal only, always degraded to a miss</li>
 * </ul>
 *
 * <p>Only the orchestrator converts lower-level failures into this caller-facing taxonomy, and
 * only {@code GlobalExceptionHandler} maps it to HTTP status codes.
 *
 * @see com.phillippitts.ttsbatch.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.ttsbatch.exception;

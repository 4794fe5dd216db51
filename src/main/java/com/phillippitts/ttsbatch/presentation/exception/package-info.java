/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.ttsbatch.exception.InvalidRequestException} → 400 Bad Request</li>
 *   <li>{@link com.phillippitts.ttsbatch.exception.ModelUnavailableException} → 404 Not Found
 *       (unknown or not permitted) or 503 Service Unavailable (load failure, capacity)</li>
 *   <li>{@link com.phillippitts.ttsbatch.exception.SynthesisException} → 500 Internal Server Error</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * { "detail": "Invalid request (text): must not be empty" }
 * </pre>
 */
package com.phillippitts.ttsbatch.presentation.exception;

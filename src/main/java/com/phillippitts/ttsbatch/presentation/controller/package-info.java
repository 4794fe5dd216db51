/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Current Endpoints:
 * <ul>
 *   <li>{@code POST /synthesize} (alias {@code /synthesizeSpeech}) - text to raw PCM</li>
 *   <li>{@code GET /health} - liveness probe</li>
 * </ul>
 *
 * @see com.phillippitts.ttsbatch.presentation.exception
 */
package com.phillippitts.ttsbatch.presentation.controller;

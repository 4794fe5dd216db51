/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>Architecture:
 * <ul>
 *   <li><b>Controllers</b> - REST endpoints that accept HTTP requests and delegate to services</li>
 *   <li><b>DTOs</b> - request and error bodies of the API contract</li>
 *   <li><b>Exception Handlers</b> - translate domain exceptions to HTTP responses</li>
 * </ul>
 *
 * <p>Controllers are thin adapters; validation and business logic live in
 * {@link com.phillippitts.ttsbatch.service.orchestration.SynthesisOrchestrator}.
 */
package com.phillippitts.ttsbatch.presentation;

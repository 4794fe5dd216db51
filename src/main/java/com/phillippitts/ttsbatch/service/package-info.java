/**
 * Service layer: the synthesis-and-cache pipeline and the voice model lifecycle.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code service.orchestration} - cache-aside request pipeline</li>
 *   <li>{@code service.model} - model registry, local files and remote model source</li>
 *   <li>{@code service.synthesis} - engine abstraction and the Piper binary implementation</li>
 *   <li>{@code service.audio} - PCM format helpers and sample rate conversion</li>
 *   <li>{@code service.cache} - cache key derivation and the Redis-backed store</li>
 *   <li>{@code service.metrics}, {@code service.events}, {@code service.health} - observability</li>
 * </ul>
 */
package com.phillippitts.ttsbatch.service;

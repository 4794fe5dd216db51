/**
 * Immutable domain values: requests, audio payloads and voice model snapshots.
 *
 * @since 1.0
 */
package com.phillippitts.ttsbatch.domain;

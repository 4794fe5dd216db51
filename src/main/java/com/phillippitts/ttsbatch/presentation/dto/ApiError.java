package com.phillippitts.ttsbatch.presentation.dto;

/**
 * Error body for every failed request: {@code {"detail": "..."}}.
 */
public record ApiError(String detail) {
}

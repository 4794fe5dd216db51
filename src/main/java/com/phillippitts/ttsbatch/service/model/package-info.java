/**
 * Voice model lifecycle.
 *
 * <p>{@link com.phillippitts.ttsbatch.service.model.ModelRegistry} is the single owner of model
 * state. Acquisition is single-flight per id: local lookup, then download through a
 * {@link com.phillippitts.ttsbatch.service.model.ModelSource} into a staging directory, atomic
 * publish, and engine load.
 */
package com.phillippitts.ttsbatch.service.model;

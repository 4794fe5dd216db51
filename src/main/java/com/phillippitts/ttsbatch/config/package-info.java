/**
 * Spring configuration: typed properties, executors, cache wiring and startup validation.
 */
package com.phillippitts.ttsbatch.config;

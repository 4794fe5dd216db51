/**
 * Speech synthesis engines.
 *
 * <p>The Piper implementation runs the external {@code piper} binary once per request, text on
 * stdin and raw PCM on stdout. Process handling goes through a package-private
 * {@code ProcessFactory} so it can be tested without the binary.
 */
package com.phillippitts.ttsbatch.service.synthesis;

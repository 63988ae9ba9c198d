/**
 * Run orchestration: sequences intake and the analysis stages and assembles the immutable pipeline result.
 * <p><strong>Concurrency:</strong> Only intake fans out; every later stage runs on the calling thread.</p>
 */
package org.smae.application.pipeline;

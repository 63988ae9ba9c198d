/**
 * Concurrent multi-source intake: the source registry, the fan-out/fan-in fetch stage and its error log.
 * <p><strong>Concurrency:</strong> One worker thread per source per run; results are joined in registration order.</p>
 * <p><strong>Observability:</strong> Worker log lines carry the MDC key {@code source}.</p>
 */
package org.smae.application.intake;

package org.smae.application.port;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import org.smae.domain.events.Event;
import org.smae.domain.ontology.MetabolicNetwork;
import org.smae.domain.source.SourceTier;

/**
 * <strong>What:</strong> Port through which one external feed supplies tagged events to the analytical pipeline.
 * <p><strong>Why:</strong> Keeps the pipeline agnostic of each feed's transport, authentication, and wire format.</p>
 * <p><strong>Role:</strong> Capability interface implemented by feed adapters (conflict, deforestation,
 * displacement databases, and so on).</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Fetch events detected since a date, already tagged with networks and layers.</li>
 *   <li>Apply any retry, backoff, or timeout policy internally; the pipeline never retries.</li>
 *   <li>Release clients and connections on {@link #close()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> The intake stage calls {@link #fetchEvents(LocalDate)} from a dedicated worker
 * thread, at most once per run; implementations need not support concurrent fetches.</p>
 * <p><strong>Observability:</strong> Intake logs failures with the {@link #name()} in the {@code source} MDC key.</p>
 *
 * @implNote Orchestrating callers must invoke {@link #close()} after each run regardless of success or failure.
 * @since 0.1.0
 */
public interface SourceGateway extends AutoCloseable {
  /**
   * Returns the unique source name used for registration and error attribution.
   *
   * @return stable, non-blank name
   */
  String name();

  /**
   * Returns the tier of the citations this source produces.
   *
   * @return source tier
   */
  SourceTier tier();

  /**
   * Returns the networks this source primarily feeds.
   *
   * @return immutable network set; may be empty
   */
  Set<MetabolicNetwork> networks();

  /**
   * Fetches events since the given date.
   *
   * @param since inclusive lower bound of the lookback window
   * @return tagged events in source order; never {@code null}
   * @throws SourceFetchException on transport, authentication, or decoding failure
   */
  List<Event> fetchEvents(LocalDate since) throws SourceFetchException;

  /**
   * Releases adapter resources.
   *
   * @throws Exception if teardown fails
   */
  @Override
  void close() throws Exception;
}

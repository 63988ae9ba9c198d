package org.smae.application.intake;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smae.application.port.SourceGateway;
import org.smae.domain.ontology.MetabolicNetwork;
import org.smae.domain.source.SourceTier;

/**
 * <strong>What:</strong> Registration-ordered catalogue of the feed adapters taking part in a pipeline run.
 * <p><strong>Role:</strong> Owned by the pipeline; consulted by intake and closed by the session.</p>
 * <p><strong>Thread-safety:</strong> Methods are synchronized; iteration results are snapshots.</p>
 *
 * @since 0.1.0
 */
public final class SourceRegistry {
  private static final Logger log = LoggerFactory.getLogger(SourceRegistry.class);

  private final List<SourceGateway> sources = new ArrayList<>();

  /**
   * Appends a source. Several adapters may share a name (two configured instances of one feed); each is fetched
   * and closed on its own.
   *
   * @param source adapter to register
   */
  public synchronized void register(SourceGateway source) {
    Objects.requireNonNull(source, "source");
    String name = Objects.requireNonNull(source.name(), "source.name()");
    sources.add(source);
    log.debug("Registered source {} (tier {})", name, source.tier());
  }

  /**
   * @param name adapter name
   * @return the earliest registered source named {@code name}
   */
  public synchronized Optional<SourceGateway> get(String name) {
    for (SourceGateway source : sources) {
      if (source.name().equals(name)) {
        return Optional.of(source);
      }
    }
    return Optional.empty();
  }

  /**
   * @return every registered source in registration order
   */
  public synchronized List<SourceGateway> all() {
    return List.copyOf(sources);
  }

  /**
   * @param network network of interest
   * @return sources declaring coverage of {@code network}, in registration order
   */
  public synchronized List<SourceGateway> byNetwork(MetabolicNetwork network) {
    Objects.requireNonNull(network, "network");
    List<SourceGateway> result = new ArrayList<>();
    for (SourceGateway source : sources) {
      if (source.networks().contains(network)) {
        result.add(source);
      }
    }
    return List.copyOf(result);
  }

  /**
   * @param maxTier lowest-priority tier to include
   * @return sources whose tier ranks at or above {@code maxTier}, in registration order
   */
  public synchronized List<SourceGateway> byTier(SourceTier maxTier) {
    Objects.requireNonNull(maxTier, "maxTier");
    List<SourceGateway> result = new ArrayList<>();
    for (SourceGateway source : sources) {
      if (source.tier().isAtLeast(maxTier)) {
        result.add(source);
      }
    }
    return List.copyOf(result);
  }

  public synchronized int size() {
    return sources.size();
  }

  /**
   * Closes every registered adapter. The first failure is rethrown once all adapters were closed; later failures
   * are attached to it as suppressed exceptions.
   *
   * @throws Exception first close failure
   */
  public void closeAll() throws Exception {
    Exception failure = null;
    for (SourceGateway source : all()) {
      try {
        source.close();
        log.debug("Source {} closed", source.name());
      } catch (Exception ex) {
        log.error("Source {} close failure", source.name(), ex);
        if (failure == null) {
          failure = ex;
        } else {
          failure.addSuppressed(ex);
        }
      }
    }
    if (failure != null) {
      throw failure;
    }
  }
}

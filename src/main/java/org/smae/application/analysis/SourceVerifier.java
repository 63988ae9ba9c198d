package org.smae.application.analysis;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.smae.domain.events.Event;
import org.smae.domain.source.Source;
import org.smae.domain.source.SourceTier;

/**
 * Marks the sources of weakly corroborated events as provisional.
 * <p>An event is weakly corroborated when it has fewer than two sources, when its sources all share one tier, or
 * when it names actors but has fewer than three sources. Provisional flags are never cleared.</p>
 *
 * @since 0.1.0
 */
public final class SourceVerifier {
  static final int MIN_SOURCES = 2;
  static final int MIN_DISTINCT_TIERS = 2;
  static final int MIN_SOURCES_WITH_ACTORS = 3;

  public List<Event> verify(List<Event> events) {
    Objects.requireNonNull(events, "events");
    List<Event> result = new ArrayList<>(events.size());
    for (Event event : events) {
      result.add(verify(event));
    }
    return List.copyOf(result);
  }

  Event verify(Event event) {
    List<Source> sources = event.sources();
    if (sources.isEmpty() || !needsCorroboration(event)) {
      return event;
    }
    List<Source> marked = new ArrayList<>(sources.size());
    boolean changed = false;
    for (Source source : sources) {
      Source provisional = source.markProvisional();
      changed |= provisional != source;
      marked.add(provisional);
    }
    return changed ? event.withSources(marked) : event;
  }

  /**
   * Evaluates every corroboration rule against the event.
   *
   * @param event event to check
   * @return {@code true} when at least one rule fires
   */
  public boolean needsCorroboration(Event event) {
    List<Source> sources = event.sources();
    boolean tooFewSources = sources.size() < MIN_SOURCES;
    boolean singleTier = sources.size() >= MIN_SOURCES && distinctTiers(sources) < MIN_DISTINCT_TIERS;
    boolean actorsUnderSourced = !event.actors().isEmpty() && sources.size() < MIN_SOURCES_WITH_ACTORS;
    return tooFewSources || singleTier || actorsUnderSourced;
  }

  private static int distinctTiers(List<Source> sources) {
    Set<SourceTier> tiers = EnumSet.noneOf(SourceTier.class);
    for (Source source : sources) {
      tiers.add(source.tier());
    }
    return tiers.size();
  }
}

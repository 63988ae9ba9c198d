package org.smae.domain.convergence;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.smae.domain.events.AlertLevel;
import org.smae.domain.events.Event;
import org.smae.domain.ontology.MetabolicNetwork;
import org.smae.validation.Numbers;
import org.smae.validation.Strings;

/**
 * Multi-network convergence score for a single event.
 *
 * <p>{@code CI = sum(network involvement x severity weight)} over distinct networks; without weights every
 * network counts {@code 1.0}, so the score equals the distinct network count. Breakpoints:</p>
 * <ul>
 *   <li>CI &lt; 2: single-network, monitor per network thresholds.</li>
 *   <li>2 &le; CI &lt; 4: multi-network, escalate to cross-network analysis.</li>
 *   <li>CI &ge; 4: systemic node, immediate high-priority briefing.</li>
 * </ul>
 * <p>Weighted scores use the same breakpoints without rounding.</p>
 *
 * @param eventId identifier of the scored event
 * @param networks the event's network list (duplicates collapse when scoring)
 * @param severityWeights optional per-network weights; empty when unweighted
 * @since 0.1.0
 */
public record ConvergenceScore(
    String eventId,
    List<MetabolicNetwork> networks,
    Map<MetabolicNetwork, Double> severityWeights) {

  private static final double DEFAULT_WEIGHT = 1.0d;
  private static final double SYSTEMIC_BREAKPOINT = 4.0d;
  private static final double CRITICAL_BREAKPOINT = 3.0d;
  private static final double MULTI_NETWORK_BREAKPOINT = 2.0d;

  public ConvergenceScore {
    eventId = Strings.requireNonBlank("eventId", eventId);
    networks = List.copyOf(Objects.requireNonNull(networks, "networks"));
    if (severityWeights == null || severityWeights.isEmpty()) {
      severityWeights = Map.of();
    } else {
      severityWeights.forEach((network, weight) -> Numbers.requireFinite("severityWeights." + network,
          Objects.requireNonNull(weight, "severityWeights." + network)));
      severityWeights = Map.copyOf(severityWeights);
    }
  }

  /**
   * Creates an unweighted score carrying the event's network set.
   *
   * @param event scored event
   * @return unweighted score
   */
  public static ConvergenceScore of(Event event) {
    Objects.requireNonNull(event, "event");
    return new ConvergenceScore(event.id(), event.networks(), Map.of());
  }

  /**
   * Returns a copy carrying the supplied severity weights.
   *
   * @param weights per-network weights; networks without an entry count {@code 1.0}
   * @return weighted score
   */
  public ConvergenceScore withWeights(Map<MetabolicNetwork, Double> weights) {
    Map<MetabolicNetwork, Double> copy = new EnumMap<>(MetabolicNetwork.class);
    if (weights != null) {
      copy.putAll(weights);
    }
    return new ConvergenceScore(eventId, networks, copy);
  }

  /**
   * Computes the convergence index score.
   *
   * @return distinct network count when unweighted; weighted sum otherwise
   */
  public double ciScore() {
    Set<MetabolicNetwork> distinct = distinctNetworks();
    if (severityWeights.isEmpty()) {
      return distinct.size();
    }
    double total = 0d;
    for (MetabolicNetwork network : distinct) {
      total += severityWeights.getOrDefault(network, DEFAULT_WEIGHT);
    }
    return total;
  }

  public String classification() {
    double score = ciScore();
    if (score >= SYSTEMIC_BREAKPOINT) {
      return "Systemic node";
    } else if (score >= MULTI_NETWORK_BREAKPOINT) {
      return "Multi-network";
    }
    return "Single-network";
  }

  public String recommendedAction() {
    double score = ciScore();
    if (score >= SYSTEMIC_BREAKPOINT) {
      return "Immediate high-priority briefing, structural analysis";
    } else if (score >= MULTI_NETWORK_BREAKPOINT) {
      return "Escalate to cross-network analysis";
    }
    return "Monitor per network thresholds";
  }

  /**
   * Maps the score onto the alert scale independently of threshold crossings.
   *
   * @return SYSTEMIC at 4+, CRITICAL at 3+, ALERT at 2+, MONITOR otherwise
   */
  public AlertLevel recommendedAlertLevel() {
    double score = ciScore();
    if (score >= SYSTEMIC_BREAKPOINT) {
      return AlertLevel.SYSTEMIC;
    } else if (score >= CRITICAL_BREAKPOINT) {
      return AlertLevel.CRITICAL;
    } else if (score >= MULTI_NETWORK_BREAKPOINT) {
      return AlertLevel.ALERT;
    }
    return AlertLevel.MONITOR;
  }

  public boolean isConvergenceNode() {
    return ciScore() >= MULTI_NETWORK_BREAKPOINT;
  }

  private Set<MetabolicNetwork> distinctNetworks() {
    return networks.isEmpty() ? Set.of() : EnumSet.copyOf(networks);
  }
}

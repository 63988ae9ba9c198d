package org.smae.domain.events;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.smae.domain.ontology.AnalyticalLayer;
import org.smae.domain.ontology.CouplingPattern;
import org.smae.domain.ontology.MetabolicNetwork;
import org.smae.domain.ontology.OntologyNode;
import org.smae.domain.source.Source;
import org.smae.domain.threshold.ThresholdCrossing;
import org.smae.domain.threshold.ThresholdStatus;
import org.smae.validation.Strings;

/**
 * Immutable analytical event decomposed through the SMAE ontology.
 *
 * <p><strong>Why:</strong> Every event is tagged to network(s), layer(s), and ontology node(s), and optionally
 * linked to coupling patterns, so that the pipeline can score cross-network convergence and triage it.</p>
 * <p><strong>Thread-safety:</strong> Records are immutable and safe to share across threads. Pipeline stages
 * derive new instances through the {@code with*} methods or {@link #toBuilder()}.</p>
 * <p>Network and layer lists may be empty at construction; the tag stage rejects such events before analysis.</p>
 *
 * @param id stable event identifier; never blank
 * @param title short title; never blank
 * @param summary descriptive summary; never {@code null}
 * @param eventDate date the event occurred
 * @param detectedAt detection timestamp
 * @param country country name; never blank
 * @param region optional sub-national region
 * @param coordinates optional coordinate pair
 * @param networks tagged networks; may contain duplicates
 * @param layers tagged analytical layers
 * @param nodes tagged ontology nodes
 * @param couplingPatterns tagged coupling patterns
 * @param actors attributed actors
 * @param thresholdCrossings threshold crossings owned by the event
 * @param sources supporting citations
 * @param alertLevel triage level; defaults to {@link AlertLevel#WATCH}
 * @param resistanceSummary optional resistance narrative
 * @param governanceContext optional governance narrative
 * @param outlook30d optional 30-day outlook narrative
 * @since 0.1.0
 */
public record Event(
    String id,
    String title,
    String summary,
    LocalDate eventDate,
    Instant detectedAt,
    String country,
    String region,
    GeoPoint coordinates,
    List<MetabolicNetwork> networks,
    List<AnalyticalLayer> layers,
    List<OntologyNode> nodes,
    List<CouplingPattern> couplingPatterns,
    List<Actor> actors,
    List<ThresholdCrossing> thresholdCrossings,
    List<Source> sources,
    AlertLevel alertLevel,
    String resistanceSummary,
    String governanceContext,
    String outlook30d) {

  public Event {
    id = Strings.requireNonBlank("id", id);
    title = Strings.requireNonBlank("title", title);
    summary = Objects.requireNonNull(summary, "summary");
    eventDate = Objects.requireNonNull(eventDate, "eventDate");
    detectedAt = Objects.requireNonNull(detectedAt, "detectedAt");
    country = Strings.requireNonBlank("country", country);
    region = Strings.trimToNull(region);
    networks = copy(networks);
    layers = copy(layers);
    nodes = copy(nodes);
    couplingPatterns = copy(couplingPatterns);
    actors = copy(actors);
    thresholdCrossings = copy(thresholdCrossings);
    sources = copy(sources);
    alertLevel = Objects.requireNonNullElse(alertLevel, AlertLevel.WATCH);
  }

  /**
   * Starts a builder for a new event.
   *
   * @param id event identifier
   * @return builder seeded with {@code id}
   */
  public static Builder builder(String id) {
    return new Builder().id(id);
  }

  /**
   * Returns a builder pre-populated with every component of this event.
   *
   * @return mutable builder
   */
  public Builder toBuilder() {
    return new Builder()
        .id(id)
        .title(title)
        .summary(summary)
        .eventDate(eventDate)
        .detectedAt(detectedAt)
        .country(country)
        .region(region)
        .coordinates(coordinates)
        .networks(networks)
        .layers(layers)
        .nodes(nodes)
        .couplingPatterns(couplingPatterns)
        .actors(actors)
        .thresholdCrossings(thresholdCrossings)
        .sources(sources)
        .alertLevel(alertLevel)
        .resistanceSummary(resistanceSummary)
        .governanceContext(governanceContext)
        .outlook30d(outlook30d);
  }

  /**
   * Convergence index: the number of distinct networks the event touches.
   *
   * @return distinct network count
   */
  public int convergenceIndex() {
    return distinctNetworks().size();
  }

  /**
   * Returns whether the event spans two or more distinct networks.
   *
   * @return {@code true} for convergence nodes
   */
  public boolean isConvergenceNode() {
    return convergenceIndex() >= 2;
  }

  /**
   * Returns the distinct networks in index order.
   *
   * @return unmodifiable ordered set
   */
  public Set<MetabolicNetwork> distinctNetworks() {
    if (networks.isEmpty()) {
      return Set.of();
    }
    return Collections.unmodifiableSet(EnumSet.copyOf(networks));
  }

  /**
   * Renders the distinct networks as {@code "I: Carbon Accumulation, II: Water Appropriation"}.
   *
   * @return comma separated labels; empty when untagged
   */
  public String networkLabels() {
    return distinctNetworks().stream()
        .map(network -> network.roman() + ": " + network.label())
        .collect(Collectors.joining(", "));
  }

  /**
   * Returns whether any owned crossing currently carries {@code status}.
   *
   * @param status status to look for
   * @return {@code true} when at least one crossing matches
   */
  public boolean hasCrossingWithStatus(ThresholdStatus status) {
    for (ThresholdCrossing crossing : thresholdCrossings) {
      if (crossing.status() == status) {
        return true;
      }
    }
    return false;
  }

  public Event withAlertLevel(AlertLevel level) {
    Objects.requireNonNull(level, "level");
    return level == alertLevel ? this : toBuilder().alertLevel(level).build();
  }

  public Event withResistanceSummary(String text) {
    return toBuilder().resistanceSummary(text).build();
  }

  public Event withThresholdCrossings(List<ThresholdCrossing> crossings) {
    return toBuilder().thresholdCrossings(crossings).build();
  }

  public Event withSources(List<Source> newSources) {
    return toBuilder().sources(newSources).build();
  }

  private static <T> List<T> copy(List<T> values) {
    return values == null ? List.of() : List.copyOf(values);
  }

  /**
   * Mutable builder for {@link Event}; used by source adapters and tests.
   */
  public static final class Builder {
    private String id;
    private String title;
    private String summary = "";
    private LocalDate eventDate;
    private Instant detectedAt;
    private String country;
    private String region;
    private GeoPoint coordinates;
    private List<MetabolicNetwork> networks = new ArrayList<>();
    private List<AnalyticalLayer> layers = new ArrayList<>();
    private List<OntologyNode> nodes = new ArrayList<>();
    private List<CouplingPattern> couplingPatterns = new ArrayList<>();
    private List<Actor> actors = new ArrayList<>();
    private List<ThresholdCrossing> thresholdCrossings = new ArrayList<>();
    private List<Source> sources = new ArrayList<>();
    private AlertLevel alertLevel = AlertLevel.WATCH;
    private String resistanceSummary;
    private String governanceContext;
    private String outlook30d;

    private Builder() {}

    public Builder id(String value) {
      this.id = value;
      return this;
    }

    public Builder title(String value) {
      this.title = value;
      return this;
    }

    public Builder summary(String value) {
      this.summary = value;
      return this;
    }

    public Builder eventDate(LocalDate value) {
      this.eventDate = value;
      return this;
    }

    public Builder detectedAt(Instant value) {
      this.detectedAt = value;
      return this;
    }

    public Builder country(String value) {
      this.country = value;
      return this;
    }

    public Builder region(String value) {
      this.region = value;
      return this;
    }

    public Builder coordinates(GeoPoint value) {
      this.coordinates = value;
      return this;
    }

    public Builder networks(List<MetabolicNetwork> values) {
      this.networks = new ArrayList<>(values);
      return this;
    }

    public Builder network(MetabolicNetwork value) {
      this.networks.add(value);
      return this;
    }

    public Builder layers(List<AnalyticalLayer> values) {
      this.layers = new ArrayList<>(values);
      return this;
    }

    public Builder layer(AnalyticalLayer value) {
      this.layers.add(value);
      return this;
    }

    public Builder nodes(List<OntologyNode> values) {
      this.nodes = new ArrayList<>(values);
      return this;
    }

    public Builder node(OntologyNode value) {
      this.nodes.add(value);
      return this;
    }

    public Builder couplingPatterns(List<CouplingPattern> values) {
      this.couplingPatterns = new ArrayList<>(values);
      return this;
    }

    public Builder actors(List<Actor> values) {
      this.actors = new ArrayList<>(values);
      return this;
    }

    public Builder actor(Actor value) {
      this.actors.add(value);
      return this;
    }

    public Builder thresholdCrossings(List<ThresholdCrossing> values) {
      this.thresholdCrossings = new ArrayList<>(values);
      return this;
    }

    public Builder thresholdCrossing(ThresholdCrossing value) {
      this.thresholdCrossings.add(value);
      return this;
    }

    public Builder sources(List<Source> values) {
      this.sources = new ArrayList<>(values);
      return this;
    }

    public Builder source(Source value) {
      this.sources.add(value);
      return this;
    }

    public Builder alertLevel(AlertLevel value) {
      this.alertLevel = value;
      return this;
    }

    public Builder resistanceSummary(String value) {
      this.resistanceSummary = value;
      return this;
    }

    public Builder governanceContext(String value) {
      this.governanceContext = value;
      return this;
    }

    public Builder outlook30d(String value) {
      this.outlook30d = value;
      return this;
    }

    /**
     * Builds the immutable event.
     *
     * @return new event
     * @throws NullPointerException when a required component is missing
     * @throws IllegalArgumentException when a required text component is blank
     */
    public Event build() {
      return new Event(
          id,
          title,
          summary,
          eventDate,
          detectedAt,
          country,
          region,
          coordinates,
          networks,
          layers,
          nodes,
          couplingPatterns,
          actors,
          thresholdCrossings,
          sources,
          alertLevel,
          resistanceSummary,
          governanceContext,
          outlook30d);
    }
  }
}

package org.smae.application.port;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import org.smae.domain.ontology.MetabolicNetwork;
import org.smae.domain.source.SourceTier;
import org.smae.validation.Strings;

/**
 * Convenience base for {@link SourceGateway} implementations that fixes name, tier, and networks at construction.
 *
 * @since 0.1.0
 */
public abstract class AbstractSourceGateway implements SourceGateway {
  private final String name;
  private final SourceTier tier;
  private final Set<MetabolicNetwork> networks;

  protected AbstractSourceGateway(String name, SourceTier tier, Set<MetabolicNetwork> networks) {
    this.name = Strings.requireNonBlank("name", name);
    this.tier = Objects.requireNonNull(tier, "tier");
    this.networks = networks == null || networks.isEmpty()
        ? Set.of()
        : Set.copyOf(EnumSet.copyOf(networks));
  }

  @Override
  public final String name() {
    return name;
  }

  @Override
  public final SourceTier tier() {
    return tier;
  }

  @Override
  public final Set<MetabolicNetwork> networks() {
    return networks;
  }

  /** Default teardown releases nothing; adapters holding clients override. */
  @Override
  public void close() throws Exception {}

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + name + ", " + tier + "]";
  }
}

package org.smae.domain.events;

import org.smae.validation.Strings;

/**
 * An actor involved in appropriation, governance, or resistance.
 *
 * @param name actor name; never blank
 * @param actorType category such as {@code corporation}, {@code state}, {@code armed_group}, {@code community}
 * @param jurisdiction optional jurisdiction; {@code null} when unknown
 * @param role role in the event such as {@code extractor}, {@code enabler}, {@code beneficiary}, {@code resister}
 * @since 0.1.0
 */
public record Actor(String name, String actorType, String jurisdiction, String role) {

  public Actor {
    name = Strings.requireNonBlank("name", name);
    actorType = Strings.requireNonBlank("actorType", actorType);
    jurisdiction = Strings.trimToNull(jurisdiction);
    role = Strings.requireNonBlank("role", role);
  }
}

package org.smae.application.analysis;

import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smae.domain.events.Event;

/**
 * Verifies that every event carries at least one network and one layer.
 * <p>The whole batch is checked before anything is returned, so a single untagged event rejects the batch.</p>
 *
 * @since 0.1.0
 */
public final class TagValidator {
  private static final Logger log = LoggerFactory.getLogger(TagValidator.class);

  /**
   * Validates the batch.
   *
   * @param events events from intake
   * @return the same events, unchanged
   * @throws UntaggedNetworkException if an event has no networks
   * @throws UntaggedLayerException if an event has no layers
   */
  public List<Event> validate(List<Event> events) {
    Objects.requireNonNull(events, "events");
    for (Event event : events) {
      if (event.networks().isEmpty()) {
        log.error("Rejecting batch: event {} has no network assignment", event.id());
        throw new UntaggedNetworkException(event.id());
      }
      if (event.layers().isEmpty()) {
        log.error("Rejecting batch: event {} has no layer assignment", event.id());
        throw new UntaggedLayerException(event.id());
      }
    }
    return List.copyOf(events);
  }
}

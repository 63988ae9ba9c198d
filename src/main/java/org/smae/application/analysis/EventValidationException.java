package org.smae.application.analysis;

/**
 * Raised when an event fails ontology validation. Fatal for the batch that contains it.
 *
 * @since 0.1.0
 */
public class EventValidationException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final String eventId;

  public EventValidationException(String eventId, String message) {
    super(message);
    this.eventId = eventId;
  }

  /**
   * @return identifier of the offending event
   */
  public String eventId() {
    return eventId;
  }
}

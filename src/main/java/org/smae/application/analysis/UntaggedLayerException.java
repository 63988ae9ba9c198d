package org.smae.application.analysis;

/**
 * Raised when an event arrives without any analytical layer assignment.
 */
public final class UntaggedLayerException extends EventValidationException {
  private static final long serialVersionUID = 1L;

  public UntaggedLayerException(String eventId) {
    super(eventId, "Event " + eventId + " has no layer assignment");
  }
}

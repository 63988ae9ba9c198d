package org.smae.application.analysis;

/**
 * Raised when an event arrives without any metabolic network assignment.
 */
public final class UntaggedNetworkException extends EventValidationException {
  private static final long serialVersionUID = 1L;

  public UntaggedNetworkException(String eventId) {
    super(eventId, "Event " + eventId + " has no network assignment");
  }
}

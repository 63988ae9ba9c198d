package org.smae.application.port;

/**
 * Connection, timeout, or HTTP status failure while reaching a feed.
 *
 * @since 0.1.0
 */
public class SourceTransportException extends SourceFetchException {
  private static final long serialVersionUID = 1L;

  public SourceTransportException(String sourceName, String message) {
    super(sourceName, message);
  }

  public SourceTransportException(String sourceName, String message, Throwable cause) {
    super(sourceName, message, cause);
  }
}

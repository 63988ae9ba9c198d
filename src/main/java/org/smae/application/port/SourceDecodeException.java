package org.smae.application.port;

/**
 * A feed responded but its payload could not be mapped onto events.
 *
 * @since 0.1.0
 */
public class SourceDecodeException extends SourceFetchException {
  private static final long serialVersionUID = 1L;

  public SourceDecodeException(String sourceName, String message) {
    super(sourceName, message);
  }

  public SourceDecodeException(String sourceName, String message, Throwable cause) {
    super(sourceName, message, cause);
  }
}

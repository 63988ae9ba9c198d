package org.smae.application.port;

/**
 * Credentials were missing, expired, or rejected by a feed.
 *
 * @since 0.1.0
 */
public class SourceAuthException extends SourceFetchException {
  private static final long serialVersionUID = 1L;

  public SourceAuthException(String sourceName, String message) {
    super(sourceName, message);
  }

  public SourceAuthException(String sourceName, String message, Throwable cause) {
    super(sourceName, message, cause);
  }
}

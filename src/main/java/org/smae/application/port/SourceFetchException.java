package org.smae.application.port;

import java.util.Objects;

/**
 * Failure raised by a {@link SourceGateway} while fetching events.
 *
 * <p>The intake stage catches and records these per source; they never abort a run.</p>
 *
 * @since 0.1.0
 */
public class SourceFetchException extends Exception {
  private static final long serialVersionUID = 1L;

  private final String sourceName;

  public SourceFetchException(String sourceName, String message) {
    super(message);
    this.sourceName = Objects.requireNonNull(sourceName, "sourceName");
  }

  public SourceFetchException(String sourceName, String message, Throwable cause) {
    super(message, cause);
    this.sourceName = Objects.requireNonNull(sourceName, "sourceName");
  }

  /**
   * Returns the name of the failing source.
   *
   * @return source name
   */
  public String sourceName() {
    return sourceName;
  }
}

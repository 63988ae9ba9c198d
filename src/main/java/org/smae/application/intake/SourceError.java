package org.smae.application.intake;

import java.util.Objects;

/**
 * One entry of the intake error log: the source that failed and a bounded description of why.
 *
 * @param sourceName registered name of the failing source
 * @param description {@code "<ExceptionType>: <message>"}, truncated for logging
 * @since 0.1.0
 */
public record SourceError(String sourceName, String description) {
  public SourceError {
    Objects.requireNonNull(sourceName, "sourceName");
    description = description == null ? "" : description;
  }

  @Override
  public String toString() {
    return sourceName + ": " + description;
  }
}

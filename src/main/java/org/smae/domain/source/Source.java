package org.smae.domain.source;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.smae.validation.Strings;

/**
 * A citation following the SMAE source hierarchy.
 *
 * <p><strong>Thread-safety:</strong> Immutable; the verification stage derives a provisional copy through
 * {@link #markProvisional()} instead of flipping a flag in place.</p>
 *
 * @param organization publishing organization; never blank
 * @param reportName report or record name; never blank
 * @param doi optional DOI; {@code null} when absent
 * @param reportId optional report identifier; {@code null} when absent
 * @param tier source tier; never {@code null}
 * @param accessDate date the source was accessed; never {@code null}
 * @param provisional {@code true} once triangulation failed for the owning event
 * @since 0.1.0
 */
public record Source(
    String organization,
    String reportName,
    String doi,
    String reportId,
    SourceTier tier,
    LocalDate accessDate,
    boolean provisional) {

  private static final String CITATION_SEPARATOR = " — ";

  public Source {
    organization = Strings.requireNonBlank("organization", organization);
    reportName = Strings.requireNonBlank("reportName", reportName);
    doi = Strings.trimToNull(doi);
    reportId = Strings.trimToNull(reportId);
    tier = Objects.requireNonNull(tier, "tier");
    accessDate = Objects.requireNonNull(accessDate, "accessDate");
  }

  /**
   * Creates a non-provisional source without DOI or report identifier.
   *
   * @param organization publishing organization
   * @param reportName report name
   * @param tier source tier
   * @param accessDate access date
   * @return new source
   */
  public static Source of(String organization, String reportName, SourceTier tier, LocalDate accessDate) {
    return new Source(organization, reportName, null, null, tier, accessDate, false);
  }

  /**
   * Returns this source flagged as provisional. Already provisional sources are returned unchanged.
   *
   * @return provisional source
   */
  public Source markProvisional() {
    if (provisional) {
      return this;
    }
    return new Source(organization, reportName, doi, reportId, tier, accessDate, true);
  }

  /**
   * Renders the citation as {@code organization — report — DOI}, falling back to the report id when no DOI exists.
   *
   * @return citation text
   */
  public String citation() {
    List<String> parts = new ArrayList<>(3);
    parts.add(organization);
    parts.add(reportName);
    if (doi != null) {
      parts.add(doi);
    } else if (reportId != null) {
      parts.add(reportId);
    }
    return String.join(CITATION_SEPARATOR, parts);
  }
}

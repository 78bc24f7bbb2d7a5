package com.mesosphere.secrets.audit;

import java.util.List;

/**
 * Renders an {@link AuditReport} as text: one bulleted section per non-empty category.
 */
public final class AuditReportFormatter {

  private static final String BULLET = "• ";

  private AuditReportFormatter() {
    // do not instantiate
  }

  /**
   * Returns the report as text, or an empty string if the report is clean.
   */
  public static String format(AuditReport report) {
    StringBuilder text = new StringBuilder();
    appendSection(text, "Missing secrets", report.getMissing());
    appendSection(text, "Incorrect secrets", report.getMismatched());
    appendSection(text, "Unknown secrets in Vault", report.getUnknown());
    return text.toString();
  }

  private static void appendSection(StringBuilder text, String title, List<String> secrets) {
    if (secrets.isEmpty()) {
      return;
    }
    text.append(title).append(":\n");
    for (String secret : secrets) {
      text.append(BULLET).append(secret).append('\n');
    }
  }
}

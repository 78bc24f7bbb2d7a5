package com.mesosphere.secrets.audit;

import com.mesosphere.secrets.resolve.ResolvedSecret;
import com.mesosphere.secrets.resolve.ResolvedSecrets;
import com.mesosphere.secrets.specification.SecretId;
import com.mesosphere.secrets.specification.SecretValue;
import com.mesosphere.secrets.store.StoreSnapshot;
import com.mesosphere.secrets.util.LoggingUtils;

import org.slf4j.Logger;

import java.util.Map;
import java.util.Optional;

/**
 * Compares resolved secrets against the contents of the secret store.
 *
 * <p>Only secret identifiers are reported or logged. Values are compared and then discarded.
 */
public class SecretAuditor {

  private static final Logger LOGGER = LoggingUtils.getLogger(SecretAuditor.class);

  /**
   * Classifies every resolved and every stored secret:
   * <ul><li>missing: resolved, but the store has no entry for it</li>
   * <li>mismatched: the store has an entry whose value (or lack of one) differs from the resolved value</li>
   * <li>unknown: the store has an entry which was not resolved at all</li></ul>
   * A resolved secret without a value agrees with a stored entry without a value.
   */
  public AuditReport audit(ResolvedSecrets resolved, StoreSnapshot snapshot) {
    Map<String, Map<String, Optional<SecretValue>>> remaining = snapshot.mutableCopy();
    AuditReport.Builder report = AuditReport.newBuilder();

    for (ResolvedSecret secret : resolved.getAll()) {
      Map<String, Optional<SecretValue>> stored = remaining.get(secret.getApplication());
      if (stored != null && stored.containsKey(secret.getKey())) {
        if (!secret.getValue().equals(stored.get(secret.getKey()))) {
          report.mismatched(secret.getId().toString());
        }
        stored.remove(secret.getKey());
      } else {
        report.missing(secret.getId().toString());
      }
    }

    for (Map.Entry<String, Map<String, Optional<SecretValue>>> entry : remaining.entrySet()) {
      for (String key : entry.getValue().keySet()) {
        report.unknown(SecretId.of(entry.getKey(), key).toString());
      }
    }

    AuditReport result = report.build();
    LOGGER.info("Audited {} resolved secrets against {} stored secrets: {} missing, {} mismatched, {} unknown",
        resolved.size(), snapshot.size(),
        result.getMissing().size(), result.getMismatched().size(), result.getUnknown().size());
    return result;
  }
}

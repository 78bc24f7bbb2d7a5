package com.mesosphere.secrets.resolve;

import com.mesosphere.secrets.specification.CopyRules;
import com.mesosphere.secrets.specification.GenerateRules;
import com.mesosphere.secrets.specification.SecretId;
import com.mesosphere.secrets.specification.SecretRequirement;
import com.mesosphere.secrets.specification.SecretValue;
import com.mesosphere.secrets.specification.SimpleGenerateRules;
import com.mesosphere.secrets.specification.SourceGenerateRules;
import com.mesosphere.secrets.specification.ValidationUtils;
import com.mesosphere.secrets.store.StoreSnapshot;
import com.mesosphere.secrets.util.LoggingUtils;

import com.google.common.annotations.VisibleForTesting;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Turns the declared secret requirements of an environment into resolved values.
 *
 * <p>Requirements may reference each other in any order, so resolution repeatedly passes over the requirements which
 * are still pending until all are resolved. A pass which resolves nothing means the remaining requirements can never
 * be resolved, and all of them are reported at once.
 *
 * <p>Stateless: one instance may be shared between threads.
 */
public class SecretResolver {

  private static final Logger LOGGER = LoggingUtils.getLogger(SecretResolver.class);

  /**
   * Resolves every requirement.
   *
   * @param requirements the declared secrets, with at most one requirement per application and key
   * @param snapshot the current contents of the secret store
   * @return the resolved secrets, one per requirement
   * @throws UnresolvedSecretsException if some requirements reference secrets which never resolve
   */
  public ResolvedSecrets resolve(List<SecretRequirement> requirements, StoreSnapshot snapshot)
      throws UnresolvedSecretsException
  {
    ValidationUtils.isUnique("requirements", "secrets", requirements.stream().map(SecretRequirement::getId));

    ResolvedSecrets resolved = new ResolvedSecrets();
    List<Integer> pending = IntStream.range(0, requirements.size()).boxed().collect(Collectors.toList());
    int passes = 0;

    while (!pending.isEmpty()) {
      passes++;
      List<Integer> unresolved = new ArrayList<>();
      for (int index : pending) {
        SecretRequirement requirement = requirements.get(index);
        Optional<ResolvedSecret> secret =
            tryResolve(requirement, resolved, snapshot.getValue(requirement.getId()));
        if (secret.isPresent()) {
          resolved.put(secret.get());
        } else {
          unresolved.add(index);
        }
      }
      LOGGER.debug("Pass {}: {} resolved, {} pending", passes, pending.size() - unresolved.size(), unresolved.size());

      if (unresolved.size() >= pending.size()) {
        List<UnresolvedSecret> stuck = describeUnresolved(requirements, unresolved, resolved);
        LOGGER.error("Resolution stopped after {} passes with {} secrets unresolved: {}",
            passes, stuck.size(), stuck);
        throw new UnresolvedSecretsException(stuck);
      }
      pending = unresolved;
    }

    LOGGER.info("Resolved {} secrets in {} passes", resolved.size(), passes);
    return resolved;
  }

  /**
   * Attempts to resolve a single requirement, or returns an empty value if it depends on a secret which has not been
   * resolved yet.
   *
   * @param requirement the requirement to resolve
   * @param resolved the secrets resolved so far
   * @param currentValue the value currently in the store for this requirement, if any
   */
  @VisibleForTesting
  static Optional<ResolvedSecret> tryResolve(
      SecretRequirement requirement, ResolvedSecrets resolved, Optional<SecretValue> currentValue)
  {
    SecretId id = requirement.getId();

    // A value set in configuration always wins over the store.
    Optional<SecretValue> staticValue = requirement.getValue();
    if (staticValue.isPresent()) {
      return Optional.of(new ResolvedSecret(id, staticValue));
    }

    Optional<CopyRules> copyRules = requirement.getCopyRules();
    if (copyRules.isPresent()) {
      Optional<ResolvedSecret> other = resolved.get(copyRules.get().getSource());
      if (!other.isPresent()) {
        return Optional.empty();
      }
      return Optional.of(new ResolvedSecret(id, other.get().getValue()));
    }

    // Never regenerate a secret which already has a stored value.
    Optional<GenerateRules> generateRules = requirement.getGenerateRules();
    if (generateRules.isPresent() && !SecretValue.isSet(currentValue)) {
      GenerateRules rules = generateRules.get();
      if (rules instanceof SourceGenerateRules) {
        SourceGenerateRules sourceRules = (SourceGenerateRules) rules;
        Optional<ResolvedSecret> source = resolved.get(SecretId.of(id.getApplication(), sourceRules.getSource()));
        if (!source.isPresent() || !SecretValue.isSet(source.get().getValue())) {
          return Optional.empty();
        }
        return Optional.of(new ResolvedSecret(id, Optional.of(sourceRules.generate(source.get().getValue().get()))));
      } else {
        return Optional.of(new ResolvedSecret(id, Optional.of(((SimpleGenerateRules) rules).generate())));
      }
    }

    // A plain secret, or a generated secret which already has a value: whatever the store holds, which may be nothing.
    return Optional.of(new ResolvedSecret(id, currentValue));
  }

  private static List<UnresolvedSecret> describeUnresolved(
      List<SecretRequirement> requirements, List<Integer> unresolved, ResolvedSecrets resolved)
  {
    Set<SecretId> declared = requirements.stream().map(SecretRequirement::getId).collect(Collectors.toSet());
    List<UnresolvedSecret> stuck = new ArrayList<>();
    for (int index : unresolved) {
      SecretRequirement requirement = requirements.get(index);
      SecretId reference = getReference(requirement);
      UnresolvedSecret.Reason reason;
      if (!declared.contains(reference)) {
        reason = UnresolvedSecret.Reason.REFERENCE_NOT_FOUND;
      } else if (resolved.get(reference).isPresent()) {
        reason = UnresolvedSecret.Reason.SOURCE_HAS_NO_VALUE;
      } else {
        reason = UnresolvedSecret.Reason.UNRESOLVED_REFERENCE;
      }
      stuck.add(new UnresolvedSecret(requirement, reference, reason));
    }
    return stuck;
  }

  private static SecretId getReference(SecretRequirement requirement) {
    switch (requirement.getStrategy()) {
      case COPY:
        return requirement.getCopyRules().get().getSource();
      case GENERATE:
        GenerateRules rules = requirement.getGenerateRules().get();
        if (rules instanceof SourceGenerateRules) {
          return SecretId.of(requirement.getApplication(), ((SourceGenerateRules) rules).getSource());
        }
        break;
      default:
        break;
    }
    throw new IllegalStateException(String.format(
        "Requirement without a reference cannot be left unresolved: %s", requirement));
  }
}

package com.mesosphere.secrets.resolve;

import com.mesosphere.secrets.specification.GenerateRules;
import com.mesosphere.secrets.specification.SecretGenerateType;
import com.mesosphere.secrets.specification.SecretId;
import com.mesosphere.secrets.specification.SecretRequirement;
import com.mesosphere.secrets.specification.SecretValue;
import com.mesosphere.secrets.store.StoreSnapshot;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

public class SecretResolverTest {

  private SecretResolver resolver;

  @Before
  public void beforeEach() {
    resolver = new SecretResolver();
  }

  @Test
  public void testStaticValue() throws Exception {
    ResolvedSecrets resolved = resolver.resolve(
        Collections.singletonList(SecretRequirement.newBuilder("svc", "token").value("v").build()),
        StoreSnapshot.newBuilder().put("svc", "token", "stored").build());
    Assert.assertEquals(Optional.of(SecretValue.of("v")), value(resolved, "svc", "token"));
  }

  @Test
  public void testStaticValueWinsOverCopy() throws Exception {
    List<SecretRequirement> requirements = Arrays.asList(
        SecretRequirement.newBuilder("a", "x").value("static").copyFrom("b", "y").build(),
        SecretRequirement.newBuilder("b", "y").value("copied").build());
    ResolvedSecrets resolved = resolver.resolve(requirements, StoreSnapshot.empty());
    Assert.assertEquals(Optional.of(SecretValue.of("static")), value(resolved, "a", "x"));
  }

  @Test
  public void testForwardReference() throws Exception {
    List<SecretRequirement> requirements = Arrays.asList(
        SecretRequirement.newBuilder("B", "y").copyFrom("A", "x").build(),
        SecretRequirement.newBuilder("A", "x").value("v").build());
    ResolvedSecrets resolved = resolver.resolve(requirements, StoreSnapshot.empty());
    Assert.assertEquals(Optional.of(SecretValue.of("v")), value(resolved, "B", "y"));
    Assert.assertEquals(2, resolved.size());
  }

  @Test
  public void testCopyChain() throws Exception {
    List<SecretRequirement> requirements = Arrays.asList(
        SecretRequirement.newBuilder("c", "z").copyFrom("b", "y").build(),
        SecretRequirement.newBuilder("b", "y").copyFrom("a", "x").build(),
        SecretRequirement.newBuilder("a", "x").build());
    ResolvedSecrets resolved = resolver.resolve(
        requirements, StoreSnapshot.newBuilder().put("a", "x", "stored").build());
    Assert.assertEquals(Optional.of(SecretValue.of("stored")), value(resolved, "c", "z"));
  }

  @Test
  public void testCopyOfUnsetSecretIsUnset() throws Exception {
    List<SecretRequirement> requirements = Arrays.asList(
        SecretRequirement.newBuilder("b", "y").copyFrom("a", "x").build(),
        SecretRequirement.newBuilder("a", "x").build());
    ResolvedSecrets resolved = resolver.resolve(requirements, StoreSnapshot.empty());
    Assert.assertEquals(Optional.empty(), value(resolved, "b", "y"));
    Assert.assertEquals(Optional.empty(), value(resolved, "a", "x"));
  }

  @Test
  public void testGenerateWhenNoStoredValue() throws Exception {
    AtomicInteger calls = new AtomicInteger();
    SecretRequirement requirement = SecretRequirement.newBuilder("svc", "token")
        .generateRules(GenerateRules.custom(() -> SecretValue.of("generated-" + calls.incrementAndGet())))
        .build();

    ResolvedSecrets resolved = resolver.resolve(Collections.singletonList(requirement), StoreSnapshot.empty());
    Assert.assertEquals(Optional.of(SecretValue.of("generated-1")), value(resolved, "svc", "token"));

    resolved = resolver.resolve(
        Collections.singletonList(requirement), StoreSnapshot.newBuilder().put("svc", "token", "").build());
    Assert.assertEquals(Optional.of(SecretValue.of("generated-2")), value(resolved, "svc", "token"));
  }

  @Test
  public void testGenerateKeepsStoredValue() throws Exception {
    AtomicInteger calls = new AtomicInteger();
    SecretRequirement requirement = SecretRequirement.newBuilder("svc", "password")
        .generateRules(GenerateRules.custom(() -> SecretValue.of("generated-" + calls.incrementAndGet())))
        .build();
    ResolvedSecrets resolved = resolver.resolve(
        Collections.singletonList(requirement), StoreSnapshot.newBuilder().put("svc", "password", "old").build());
    Assert.assertEquals(Optional.of(SecretValue.of("old")), value(resolved, "svc", "password"));
    Assert.assertEquals(0, calls.get());
  }

  @Test
  public void testBuiltInGeneratorKeepsStoredValue() throws Exception {
    SecretRequirement requirement = SecretRequirement.newBuilder("svc", "password")
        .generateRules(GenerateRules.simple(SecretGenerateType.PASSWORD))
        .build();
    StoreSnapshot snapshot = StoreSnapshot.newBuilder().put("svc", "password", "old").build();
    for (int i = 0; i < 3; i++) {
      Assert.assertEquals(Optional.of(SecretValue.of("old")),
          value(resolver.resolve(Collections.singletonList(requirement), snapshot), "svc", "password"));
    }
  }

  @Test
  public void testDerivedGeneration() throws Exception {
    List<SecretRequirement> requirements = Arrays.asList(
        SecretRequirement.newBuilder("A", "hash")
            .generateRules(GenerateRules.custom("seed", seed -> SecretValue.of(seed.reveal().toUpperCase())))
            .build(),
        SecretRequirement.newBuilder("A", "seed").value("s").build());
    ResolvedSecrets resolved = resolver.resolve(requirements, StoreSnapshot.empty());
    Assert.assertEquals(Optional.of(SecretValue.of("s")), value(resolved, "A", "seed"));
    Assert.assertEquals(Optional.of(SecretValue.of("S")), value(resolved, "A", "hash"));
  }

  @Test
  public void testDerivedGenerationKeepsStoredValue() throws Exception {
    List<SecretRequirement> requirements = Arrays.asList(
        SecretRequirement.newBuilder("A", "hash")
            .generateRules(GenerateRules.custom("seed", seed -> SecretValue.of(seed.reveal().toUpperCase())))
            .build(),
        SecretRequirement.newBuilder("A", "seed").value("s").build());
    ResolvedSecrets resolved = resolver.resolve(
        requirements, StoreSnapshot.newBuilder().put("A", "hash", "stored-hash").build());
    Assert.assertEquals(Optional.of(SecretValue.of("stored-hash")), value(resolved, "A", "hash"));
  }

  @Test
  public void testCycle() {
    List<SecretRequirement> requirements = Arrays.asList(
        SecretRequirement.newBuilder("A", "x").copyFrom("B", "y").build(),
        SecretRequirement.newBuilder("B", "y").copyFrom("A", "x").build(),
        SecretRequirement.newBuilder("C", "z").value("fine").build());
    try {
      resolver.resolve(requirements, StoreSnapshot.empty());
      Assert.fail("Expected an exception");
    } catch (UnresolvedSecretsException e) {
      Assert.assertEquals(Arrays.asList("A x", "B y"), ids(e.getSecrets()));
      for (UnresolvedSecret secret : e.getSecrets()) {
        Assert.assertEquals(UnresolvedSecret.Reason.UNRESOLVED_REFERENCE, secret.getReason());
      }
      Assert.assertEquals(SecretId.of("B", "y"), e.getSecrets().get(0).getReference());
      Assert.assertTrue(e.getMessage(), e.getMessage().contains("A x"));
      Assert.assertTrue(e.getMessage(), e.getMessage().contains("B y"));
    }
  }

  @Test
  public void testCycleReportsDependents() {
    List<SecretRequirement> requirements = Arrays.asList(
        SecretRequirement.newBuilder("A", "x").copyFrom("B", "y").build(),
        SecretRequirement.newBuilder("B", "y").copyFrom("A", "x").build(),
        SecretRequirement.newBuilder("C", "z").copyFrom("A", "x").build());
    try {
      resolver.resolve(requirements, StoreSnapshot.empty());
      Assert.fail("Expected an exception");
    } catch (UnresolvedSecretsException e) {
      Assert.assertEquals(Arrays.asList("A x", "B y", "C z"), ids(e.getSecrets()));
    }
  }

  @Test
  public void testMissingReference() {
    List<SecretRequirement> requirements = Collections.singletonList(
        SecretRequirement.newBuilder("A", "x").copyFrom("B", "nope").build());
    try {
      resolver.resolve(requirements, StoreSnapshot.newBuilder().put("B", "nope", "stored").build());
      Assert.fail("Expected an exception");
    } catch (UnresolvedSecretsException e) {
      Assert.assertEquals(1, e.getSecrets().size());
      Assert.assertEquals(UnresolvedSecret.Reason.REFERENCE_NOT_FOUND, e.getSecrets().get(0).getReason());
    }
  }

  @Test
  public void testSourceWithoutValue() {
    List<SecretRequirement> requirements = Arrays.asList(
        SecretRequirement.newBuilder("A", "seed").build(),
        SecretRequirement.newBuilder("A", "hash")
            .generateRules(GenerateRules.fromSource(SecretGenerateType.BCRYPT_PASSWORD_HASH, "seed"))
            .build());
    try {
      resolver.resolve(requirements, StoreSnapshot.empty());
      Assert.fail("Expected an exception");
    } catch (UnresolvedSecretsException e) {
      Assert.assertEquals(Collections.singletonList("A hash"), ids(e.getSecrets()));
      Assert.assertEquals(UnresolvedSecret.Reason.SOURCE_HAS_NO_VALUE, e.getSecrets().get(0).getReason());
      Assert.assertEquals(SecretId.of("A", "seed"), e.getSecrets().get(0).getReference());
    }
  }

  @Test
  public void testDeterministicRegardlessOfOrder() throws Exception {
    List<SecretRequirement> requirements = Arrays.asList(
        SecretRequirement.newBuilder("c", "z").copyFrom("b", "y").build(),
        SecretRequirement.newBuilder("b", "y").copyFrom("a", "x").build(),
        SecretRequirement.newBuilder("a", "x").build(),
        SecretRequirement.newBuilder("a", "w").value("static").build(),
        SecretRequirement.newBuilder("b", "hash")
            .generateRules(GenerateRules.custom("y", y -> SecretValue.of(y.reveal() + "!")))
            .build());
    StoreSnapshot snapshot = StoreSnapshot.newBuilder().put("a", "x", "stored").build();

    List<ResolvedSecret> expected = resolver.resolve(requirements, snapshot).getAll();
    List<SecretRequirement> reversed = new ArrayList<>(requirements);
    Collections.reverse(reversed);
    Assert.assertEquals(expected, resolver.resolve(reversed, snapshot).getAll());
    Assert.assertEquals(Arrays.asList("a w", "a x", "b hash", "b y", "c z"), expected.stream()
        .map(secret -> secret.getId().toString())
        .collect(Collectors.toList()));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testDuplicateRequirements() throws Exception {
    resolver.resolve(Arrays.asList(
        SecretRequirement.newBuilder("a", "x").build(),
        SecretRequirement.newBuilder("a", "x").value("v").build()),
        StoreSnapshot.empty());
  }

  @Test
  public void testTryResolveWaitsForReference() {
    SecretRequirement requirement = SecretRequirement.newBuilder("a", "x").copyFrom("b", "y").build();
    ResolvedSecrets resolved = new ResolvedSecrets();
    Assert.assertFalse(SecretResolver.tryResolve(requirement, resolved, Optional.empty()).isPresent());

    resolved.put(new ResolvedSecret(SecretId.of("b", "y"), Optional.of(SecretValue.of("v"))));
    Assert.assertEquals(
        Optional.of(new ResolvedSecret(SecretId.of("a", "x"), Optional.of(SecretValue.of("v")))),
        SecretResolver.tryResolve(requirement, resolved, Optional.empty()));
  }

  @Test(expected = IllegalStateException.class)
  public void testResolvedSecretsCannotBeReplaced() {
    ResolvedSecrets resolved = new ResolvedSecrets();
    resolved.put(new ResolvedSecret(SecretId.of("a", "x"), Optional.empty()));
    resolved.put(new ResolvedSecret(SecretId.of("a", "x"), Optional.of(SecretValue.of("v"))));
  }

  private static Optional<SecretValue> value(ResolvedSecrets resolved, String application, String key) {
    return resolved.get(SecretId.of(application, key)).get().getValue();
  }

  private static List<String> ids(List<UnresolvedSecret> secrets) {
    return secrets.stream().map(secret -> secret.getId().toString()).collect(Collectors.toList());
  }
}

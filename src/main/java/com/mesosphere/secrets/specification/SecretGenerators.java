package com.mesosphere.secrets.specification;

import com.google.common.io.BaseEncoding;
import org.bouncycastle.util.io.pem.PemObject;
import org.bouncycastle.util.io.pem.PemWriter;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.format.DateTimeFormatter;

/**
 * Implementations of the built-in {@link SecretGenerateType}s.
 */
public final class SecretGenerators {

  private static final SecureRandom RANDOM = new SecureRandom();

  private static final int PASSWORD_BYTES = 32;

  private static final int TOKEN_PART_BYTES = 16;

  private static final String TOKEN_PREFIX = "gt-";

  private static final int FERNET_KEY_BYTES = 32;

  private static final int RSA_KEY_BITS = 2048;

  private static final BCryptPasswordEncoder BCRYPT = new BCryptPasswordEncoder();

  private SecretGenerators() {
    // do not instantiate
  }

  /**
   * Returns the generator for an independent type.
   *
   * @throws IllegalArgumentException if the type requires a source secret
   */
  public static SecretGenerator generator(SecretGenerateType type) {
    switch (type) {
      case PASSWORD:
        return SecretGenerators::password;
      case TOKEN:
        return SecretGenerators::token;
      case FERNET_KEY:
        return SecretGenerators::fernetKey;
      case RSA_PRIVATE_KEY:
        return SecretGenerators::rsaPrivateKey;
      default:
        throw new IllegalArgumentException(String.format(
            "Generator type '%s' requires a source secret", type.getYamlName()));
    }
  }

  /**
   * Returns the function for a derived type.
   *
   * @throws IllegalArgumentException if the type does not take a source secret
   */
  public static SecretFunction function(SecretGenerateType type) {
    switch (type) {
      case BCRYPT_PASSWORD_HASH:
        return SecretGenerators::bcryptPasswordHash;
      case MTIME:
        return mtime(Clock.systemUTC());
      default:
        throw new IllegalArgumentException(String.format(
            "Generator type '%s' does not take a source secret", type.getYamlName()));
    }
  }

  static SecretValue password() {
    return SecretValue.of(BaseEncoding.base16().lowerCase().encode(randomBytes(PASSWORD_BYTES)));
  }

  static SecretValue token() {
    BaseEncoding encoding = BaseEncoding.base64Url().omitPadding();
    return SecretValue.of(String.format("%s%s.%s",
        TOKEN_PREFIX,
        encoding.encode(randomBytes(TOKEN_PART_BYTES)),
        encoding.encode(randomBytes(TOKEN_PART_BYTES))));
  }

  static SecretValue fernetKey() {
    return SecretValue.of(BaseEncoding.base64Url().encode(randomBytes(FERNET_KEY_BYTES)));
  }

  static SecretValue rsaPrivateKey() {
    KeyPair keyPair;
    try {
      KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
      generator.initialize(RSA_KEY_BITS, RANDOM);
      keyPair = generator.generateKeyPair();
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("RSA key generation is not available", e);
    }

    StringWriter pem = new StringWriter();
    try (PemWriter writer = new PemWriter(pem)) {
      writer.writeObject(new PemObject("PRIVATE KEY", keyPair.getPrivate().getEncoded()));
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return SecretValue.of(pem.toString());
  }

  static SecretValue bcryptPasswordHash(SecretValue source) {
    return SecretValue.of(BCRYPT.encode(source.reveal()));
  }

  static SecretFunction mtime(Clock clock) {
    return source -> SecretValue.of(DateTimeFormatter.ISO_INSTANT.format(clock.instant()));
  }

  private static byte[] randomBytes(int count) {
    byte[] bytes = new byte[count];
    RANDOM.nextBytes(bytes);
    return bytes;
  }
}

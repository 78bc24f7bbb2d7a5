package com.mesosphere.secrets.specification;

import org.apache.commons.lang3.builder.ToStringBuilder;
import org.apache.commons.lang3.builder.ToStringStyle;

import java.util.Optional;

/**
 * One secret declared for one application, along with how its value is obtained.
 *
 * <p>Several strategies may be populated at once. The effective one is chosen in priority order static value, copy,
 * generate, and finally a plain secret whose value comes from the secret store. See {@link #getStrategy()}.
 */
public final class SecretRequirement {

  /**
   * The effective way in which a requirement obtains its value.
   */
  public enum Strategy {
    STATIC,
    COPY,
    GENERATE,
    STORED
  }

  private final SecretId id;

  private final String description;

  private final SecretValue value;

  private final CopyRules copyRules;

  private final GenerateRules generateRules;

  private SecretRequirement(Builder builder) {
    this.id = SecretId.of(builder.application, builder.key);
    this.description = builder.description;
    this.value = builder.value;
    this.copyRules = builder.copyRules;
    this.generateRules = builder.generateRules;
  }

  public static Builder newBuilder(String application, String key) {
    return new Builder(application, key);
  }

  public SecretId getId() {
    return id;
  }

  public String getApplication() {
    return id.getApplication();
  }

  public String getKey() {
    return id.getKey();
  }

  public Optional<String> getDescription() {
    return Optional.ofNullable(description);
  }

  /**
   * Returns the value fixed by configuration, if any. An empty value counts as no value.
   */
  public Optional<SecretValue> getValue() {
    return value == null || value.isEmpty() ? Optional.empty() : Optional.of(value);
  }

  public Optional<CopyRules> getCopyRules() {
    return Optional.ofNullable(copyRules);
  }

  public Optional<GenerateRules> getGenerateRules() {
    return Optional.ofNullable(generateRules);
  }

  /**
   * Returns the strategy which takes effect given the populated fields.
   */
  public Strategy getStrategy() {
    if (getValue().isPresent()) {
      return Strategy.STATIC;
    } else if (copyRules != null) {
      return Strategy.COPY;
    } else if (generateRules != null) {
      return Strategy.GENERATE;
    } else {
      return Strategy.STORED;
    }
  }

  @Override
  public String toString() {
    // Never include the static value
    ToStringBuilder builder = new ToStringBuilder(this, ToStringStyle.SHORT_PREFIX_STYLE)
        .append("id", id)
        .append("strategy", getStrategy());
    switch (getStrategy()) {
      case COPY:
        builder.append("rules", copyRules);
        break;
      case GENERATE:
        builder.append("rules", generateRules);
        break;
      default:
        break;
    }
    return builder.toString();
  }

  /**
   * {@link SecretRequirement} builder static inner class.
   */
  public static final class Builder {

    private final String application;

    private final String key;

    private String description;

    private SecretValue value;

    private CopyRules copyRules;

    private GenerateRules generateRules;

    private Builder(String application, String key) {
      this.application = application;
      this.key = key;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder value(SecretValue value) {
      this.value = value;
      return this;
    }

    public Builder value(String value) {
      this.value = value == null ? null : SecretValue.of(value);
      return this;
    }

    public Builder copyRules(CopyRules copyRules) {
      this.copyRules = copyRules;
      return this;
    }

    public Builder copyFrom(String application, String key) {
      return copyRules(new CopyRules(application, key));
    }

    public Builder generateRules(GenerateRules generateRules) {
      this.generateRules = generateRules;
      return this;
    }

    public SecretRequirement build() {
      return new SecretRequirement(this);
    }
  }
}

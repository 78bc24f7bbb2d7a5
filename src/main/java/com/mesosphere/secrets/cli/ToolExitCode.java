package com.mesosphere.secrets.cli;

/**
 * Exit codes of the secrets tool.
 */
public final class ToolExitCode {

  public static final ToolExitCode SUCCESS = new ToolExitCode(0);
  public static final ToolExitCode AUDIT_FAILED = new ToolExitCode(1);
  public static final ToolExitCode UNRESOLVED_SECRETS = new ToolExitCode(2);
  public static final ToolExitCode CONFIG_ERROR = new ToolExitCode(3);
  public static final ToolExitCode STORE_ERROR = new ToolExitCode(4);
  public static final ToolExitCode ERROR = new ToolExitCode(5);

  private final int value;

  private ToolExitCode(int value) {
    this.value = value;
  }

  public int getValue() {
    return value;
  }
}

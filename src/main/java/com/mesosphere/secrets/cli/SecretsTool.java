package com.mesosphere.secrets.cli;

import com.mesosphere.secrets.audit.AuditReport;
import com.mesosphere.secrets.audit.AuditReportFormatter;
import com.mesosphere.secrets.config.ConfigException;
import com.mesosphere.secrets.config.EnvStore;
import com.mesosphere.secrets.config.SecretsToolConfig;
import com.mesosphere.secrets.config.YAMLRequirementSource;
import com.mesosphere.secrets.resolve.UnresolvedSecret;
import com.mesosphere.secrets.resolve.UnresolvedSecretsException;
import com.mesosphere.secrets.service.SecretsService;
import com.mesosphere.secrets.specification.SecretId;
import com.mesosphere.secrets.specification.SecretRequirement;
import com.mesosphere.secrets.store.SecretStore;
import com.mesosphere.secrets.store.SecretsException;
import com.mesosphere.secrets.store.vault.VaultSecretsClient;
import com.mesosphere.secrets.util.LoggingUtils;

import com.google.common.annotations.VisibleForTesting;
import org.slf4j.Logger;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * Command line entry point: audits, lists, exports and syncs the secrets of an environment.
 */
@Command(
    name = "secrets",
    mixinStandardHelpOptions = true,
    description = "Resolve the secrets of an environment and compare them to the secret store",
    subcommands = {
        SecretsTool.AuditCommand.class,
        SecretsTool.ListCommand.class,
        SecretsTool.StaticTemplateCommand.class,
        SecretsTool.ExportCommand.class,
        SecretsTool.SyncCommand.class
    })
public class SecretsTool implements Runnable {

  private static final Logger LOGGER = LoggingUtils.getLogger(SecretsTool.class);

  @Option(names = {"-c", "--config-dir"}, description = "Directory of environment configuration files")
  private String configDir;

  @Option(names = {"--vault-addr"}, description = "Base URL of the Vault server")
  private String vaultAddress;

  @Spec
  private CommandSpec spec;

  private final Map<String, String> env;

  private final Function<SecretsToolConfig, SecretStore> storeFactory;

  public SecretsTool() {
    this(System.getenv(), VaultSecretsClient::fromConfig);
  }

  @VisibleForTesting
  SecretsTool(Map<String, String> env, Function<SecretsToolConfig, SecretStore> storeFactory) {
    this.env = env;
    this.storeFactory = storeFactory;
  }

  public static void main(String[] args) {
    System.exit(new CommandLine(new SecretsTool()).execute(args));
  }

  @Override
  public void run() {
    spec.commandLine().usage(spec.commandLine().getOut());
  }

  /**
   * Returns the configuration from the environment, with any command line overrides applied.
   */
  @VisibleForTesting
  SecretsToolConfig getConfig() {
    Map<String, String> values = new HashMap<>(env);
    if (configDir != null) {
      values.put(SecretsToolConfig.CONFIG_DIR_ENV, configDir);
    }
    if (vaultAddress != null) {
      values.put(SecretsToolConfig.VAULT_ADDR_ENV, vaultAddress);
    }
    return SecretsToolConfig.fromEnvStore(EnvStore.fromMap(values));
  }

  private SecretsService createService(SecretsToolConfig config) {
    return new SecretsService(new YAMLRequirementSource(config.getConfigDir()), storeFactory.apply(config));
  }

  /**
   * Runs a command against a freshly configured service and maps its failures to exit codes.
   */
  private int execute(ServiceCommand command) {
    PrintWriter err = spec.commandLine().getErr();
    try {
      return command.call(createService(getConfig())).getValue();
    } catch (ConfigException e) {
      err.println("Configuration error: " + e.getMessage());
      return ToolExitCode.CONFIG_ERROR.getValue();
    } catch (UnresolvedSecretsException e) {
      err.println(String.format("Unable to resolve %d secrets:", e.getSecrets().size()));
      for (UnresolvedSecret secret : e.getSecrets()) {
        err.println("  " + secret);
      }
      return ToolExitCode.UNRESOLVED_SECRETS.getValue();
    } catch (SecretsException e) {
      err.println(String.format("Secret store error at %s: %s", e.getPath(), e.getMessage()));
      return ToolExitCode.STORE_ERROR.getValue();
    } catch (IOException e) {
      err.println("I/O error: " + e.getMessage());
      return ToolExitCode.STORE_ERROR.getValue();
    } catch (RuntimeException e) {
      LOGGER.error("Unexpected failure", e);
      err.println("Unexpected error: " + e.getMessage());
      return ToolExitCode.ERROR.getValue();
    }
  }

  private interface ServiceCommand {
    ToolExitCode call(SecretsService service) throws IOException, SecretsException, UnresolvedSecretsException;
  }

  @Command(name = "audit", description = "Report missing, incorrect and unknown secrets in the store")
  static class AuditCommand implements Callable<Integer> {
    @ParentCommand
    private SecretsTool parent;

    @Parameters(index = "0", description = "Environment name")
    private String environment;

    @Override
    public Integer call() {
      return parent.execute(service -> {
        AuditReport report = service.auditReport(environment);
        if (report.isClean()) {
          return ToolExitCode.SUCCESS;
        }
        PrintWriter out = parent.spec.commandLine().getOut();
        out.print(AuditReportFormatter.format(report));
        out.flush();
        return ToolExitCode.AUDIT_FAILED;
      });
    }
  }

  @Command(name = "list", description = "List the secrets required by an environment")
  static class ListCommand implements Callable<Integer> {
    @ParentCommand
    private SecretsTool parent;

    @Parameters(index = "0", description = "Environment name")
    private String environment;

    @Override
    public Integer call() {
      return parent.execute(service -> {
        PrintWriter out = parent.spec.commandLine().getOut();
        for (SecretRequirement secret : service.listSecrets(environment)) {
          out.println(secret.getId());
        }
        return ToolExitCode.SUCCESS;
      });
    }
  }

  @Command(name = "static-template", description = "Print a YAML template for the secrets which must be supplied by hand")
  static class StaticTemplateCommand implements Callable<Integer> {
    @ParentCommand
    private SecretsTool parent;

    @Parameters(index = "0", description = "Environment name")
    private String environment;

    @Override
    public Integer call() {
      return parent.execute(service -> {
        PrintWriter out = parent.spec.commandLine().getOut();
        out.print(service.generateStaticTemplate(environment));
        out.flush();
        return ToolExitCode.SUCCESS;
      });
    }
  }

  @Command(name = "export", description = "Write the stored secrets of an environment to one JSON file per application")
  static class ExportCommand implements Callable<Integer> {
    @ParentCommand
    private SecretsTool parent;

    @Parameters(index = "0", description = "Environment name")
    private String environment;

    @Parameters(index = "1", paramLabel = "<dir>", description = "Output directory")
    private File directory;

    @Override
    public Integer call() {
      return parent.execute(service -> {
        PrintWriter out = parent.spec.commandLine().getOut();
        for (File file : service.saveStoreSecrets(environment, directory)) {
          out.println(file.getPath());
        }
        return ToolExitCode.SUCCESS;
      });
    }
  }

  @Command(name = "sync", description = "Write resolved secrets which differ from the store back to the store")
  static class SyncCommand implements Callable<Integer> {
    @ParentCommand
    private SecretsTool parent;

    @Parameters(index = "0", description = "Environment name")
    private String environment;

    @Override
    public Integer call() {
      return parent.execute(service -> {
        PrintWriter out = parent.spec.commandLine().getOut();
        List<SecretId> written = service.syncSecrets(environment);
        for (SecretId id : written) {
          out.println("Updated " + id);
        }
        return ToolExitCode.SUCCESS;
      });
    }
  }
}

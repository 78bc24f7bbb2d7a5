package com.mesosphere.secrets.store.vault;

import com.mesosphere.secrets.config.SecretsToolConfig;
import com.mesosphere.secrets.specification.Environment;
import com.mesosphere.secrets.specification.SecretValue;
import com.mesosphere.secrets.store.SecretStore;
import com.mesosphere.secrets.store.SecretsException;
import com.mesosphere.secrets.store.StoreSnapshot;
import com.mesosphere.secrets.util.LoggingUtils;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import org.apache.http.HttpResponse;
import org.apache.http.HttpStatus;
import org.apache.http.StatusLine;
import org.apache.http.client.fluent.ContentResponseHandler;
import org.apache.http.client.fluent.Request;
import org.apache.http.entity.ContentType;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Client for the key/value (version 2) secrets engine of HashiCorp Vault. Each application's secrets are kept as one
 * Vault secret at {@code <environment prefix>/<application>}, whose keys are the application's secret keys.
 *
 * @see <a href="https://developer.hashicorp.com/vault/api-docs/secret/kv/kv-v2">KV secrets engine API</a>
 */
public class VaultSecretsClient implements SecretStore {

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  private final Logger logger = LoggingUtils.getLogger(getClass());

  private final String vaultAddress;

  private final VaultHttpExecutor httpExecutor;

  public VaultSecretsClient(String vaultAddress, VaultHttpExecutor httpExecutor) {
    this.vaultAddress = vaultAddress;
    this.httpExecutor = httpExecutor;
  }

  /**
   * Returns a client for the Vault server and token named in the provided configuration.
   */
  public static VaultSecretsClient fromConfig(SecretsToolConfig config) {
    VaultHttpClientBuilder clientBuilder = new VaultHttpClientBuilder()
        .setToken(config.getVaultToken())
        .setDefaultConnectionTimeout((int) config.getVaultConnectionTimeout().toMillis());
    return new VaultSecretsClient(config.getVaultAddress(), new VaultHttpExecutor(clientBuilder));
  }

  @Override
  public StoreSnapshot getEnvironmentSecrets(Environment environment) throws IOException, SecretsException {
    StoreSnapshot.Builder builder = StoreSnapshot.newBuilder();
    for (String application : listApplications(environment)) {
      builder.putAll(application, getApplicationSecrets(environment, application));
    }
    // Applications with nothing stored yet still belong to the environment.
    environment.getApplications().forEach(builder::addApplication);

    StoreSnapshot snapshot = builder.build();
    logger.info("Read {} secrets for {} applications under {}",
        snapshot.size(), snapshot.getApplications().size(), environment.getVaultPathPrefix());
    return snapshot;
  }

  /**
   * Lists the applications which have secrets stored under the environment's prefix.
   *
   * @throws IOException if the list operation failed to complete
   * @throws SecretsException if Vault rejected the request
   */
  public List<String> listApplications(Environment environment) throws IOException, SecretsException {
    VaultPath path = VaultPath.parse(environment.getVaultPathPrefix());
    String apiPath = path.metadataPath("");
    HttpResponse response = query("list", apiPath, Request.Get(uriForPath(apiPath + "?list=true")));
    if (response.getStatusLine().getStatusCode() == HttpStatus.SC_NOT_FOUND) {
      return Collections.emptyList();
    }
    handleResponseStatusLine(response.getStatusLine(), apiPath, HttpStatus.SC_OK);

    List<String> applications = new ArrayList<>();
    try {
      JSONArray keys = readJson(response).getJSONObject("data").getJSONArray("keys");
      for (int i = 0; i < keys.length(); i++) {
        String key = keys.getString(i);
        // Entries ending in a slash are nested directories rather than application secrets.
        if (!key.endsWith("/")) {
          applications.add(key);
        }
      }
    } catch (JSONException e) {
      throw new SecretsException("Malformed list response: " + e.getMessage(), e, vaultAddress, apiPath);
    }
    return applications;
  }

  @Override
  public Map<String, Optional<SecretValue>> getApplicationSecrets(Environment environment, String application)
      throws IOException, SecretsException
  {
    String apiPath = VaultPath.parse(environment.getVaultPathPrefix()).dataPath(application);
    HttpResponse response = query("read", apiPath, Request.Get(uriForPath(apiPath)));
    if (response.getStatusLine().getStatusCode() == HttpStatus.SC_NOT_FOUND) {
      return Collections.emptyMap();
    }
    handleResponseStatusLine(response.getStatusLine(), apiPath, HttpStatus.SC_OK);

    Map<String, Optional<SecretValue>> secrets = new TreeMap<>();
    try {
      JSONObject data = readJson(response).getJSONObject("data").getJSONObject("data");
      for (String key : data.keySet()) {
        secrets.put(key, data.isNull(key)
            ? Optional.empty()
            : Optional.of(SecretValue.of(String.valueOf(data.get(key)))));
      }
    } catch (JSONException e) {
      // The message of a JSONException may quote content, so it is left out.
      throw new SecretsException("Malformed read response", vaultAddress, apiPath);
    }
    return secrets;
  }

  @Override
  public void storeApplicationSecrets(
      Environment environment, String application, Map<String, Optional<SecretValue>> secrets)
      throws IOException, SecretsException
  {
    Map<String, String> plaintext = new TreeMap<>();
    secrets.forEach((key, value) -> plaintext.put(key, value.map(SecretValue::reveal).orElse(null)));
    String body = OBJECT_MAPPER.writeValueAsString(Collections.singletonMap("data", plaintext));

    String apiPath = VaultPath.parse(environment.getVaultPathPrefix()).dataPath(application);
    HttpResponse response = query("write", apiPath,
        Request.Post(uriForPath(apiPath)).bodyString(body, ContentType.APPLICATION_JSON));
    handleResponseStatusLine(response.getStatusLine(), apiPath, HttpStatus.SC_OK, HttpStatus.SC_NO_CONTENT);
  }

  private URI uriForPath(String apiPath) {
    try {
      return new URI(String.format("%s/v1/%s", vaultAddress, apiPath));
    } catch (URISyntaxException e) {
      throw new IllegalArgumentException(e);
    }
  }

  private HttpResponse query(String operation, String apiPath, Request request) throws IOException {
    logger.debug("{} {}", operation, apiPath);
    return httpExecutor.execute(request).returnResponse();
  }

  private static JSONObject readJson(HttpResponse response) throws IOException {
    return new JSONObject(new ContentResponseHandler().handleEntity(response.getEntity()).asString());
  }

  /**
   * Handle common responses from different API endpoints of Vault.
   */
  private void handleResponseStatusLine(StatusLine statusLine, String apiPath, int... okCodes)
      throws SecretsException
  {
    for (int okCode : okCodes) {
      if (statusLine.getStatusCode() == okCode) {
        return;
      }
    }

    String exceptionMessage = String.format("[%s] %s", statusLine.getStatusCode(), statusLine.getReasonPhrase());

    switch (statusLine.getStatusCode()) {
      case HttpStatus.SC_FORBIDDEN:
        throw new SecretsException("Permission denied: " + exceptionMessage, vaultAddress, apiPath);

      default:
        throw new SecretsException(exceptionMessage, vaultAddress, apiPath);
    }
  }

  /**
   * An environment prefix such as {@code secret/k8s/dev}, split into the secrets engine mount ({@code secret}) and
   * the path within it ({@code k8s/dev}).
   */
  @VisibleForTesting
  static final class VaultPath {

    private final String mount;

    private final String base;

    private VaultPath(String mount, String base) {
      this.mount = mount;
      this.base = base;
    }

    static VaultPath parse(String prefix) {
      String trimmed = prefix.replaceAll("^/+|/+$", "");
      int slash = trimmed.indexOf('/');
      if (trimmed.isEmpty()) {
        throw new IllegalArgumentException(String.format("Invalid Vault path prefix: '%s'", prefix));
      }
      return slash == -1
          ? new VaultPath(trimmed, "")
          : new VaultPath(trimmed.substring(0, slash), trimmed.substring(slash + 1));
    }

    String dataPath(String application) {
      return String.format("%s/data/%s", mount, join(base, application));
    }

    String metadataPath(String application) {
      return String.format("%s/metadata/%s", mount, join(base, application));
    }

    private static String join(String base, String child) {
      if (base.isEmpty()) {
        return child;
      }
      return child.isEmpty() ? base : base + "/" + child;
    }
  }
}

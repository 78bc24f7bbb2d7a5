package com.mesosphere.secrets.store.vault;

import java.io.IOException;

import org.apache.http.client.fluent.Executor;
import org.apache.http.client.fluent.Request;
import org.apache.http.client.fluent.Response;
import org.apache.http.impl.client.HttpClientBuilder;

/**
 * Wraps the {@link Executor} used to talk to Vault. Clients accept this type rather than a bare executor so that the
 * client configuration done by {@link VaultHttpClientBuilder} can't be skipped by accident.
 */
public class VaultHttpExecutor {

  private final Executor executor;

  public VaultHttpExecutor(HttpClientBuilder clientBuilder) {
    this.executor = Executor.newInstance(clientBuilder.build());
  }

  /**
   * Runs the provided request and returns the response.
   */
  public Response execute(Request request) throws IOException {
    return executor.execute(request);
  }
}

package com.mesosphere.secrets.store.vault;

import org.apache.http.HttpRequestInterceptor;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.impl.client.HttpClientBuilder;

/**
 * A {@link VaultHttpClientBuilder} is a helper that simplifies common modifications
 * of {@link org.apache.http.client.HttpClient} for talking to Vault.
 */
public class VaultHttpClientBuilder extends HttpClientBuilder {

  static final String TOKEN_HEADER = "X-Vault-Token";

  public VaultHttpClientBuilder() {
    super();
  }

  /**
   * Assigns the Vault token to be included in every request.
   *
   * @return this
   */
  public VaultHttpClientBuilder setToken(String token) {
    this.addInterceptorFirst((HttpRequestInterceptor) (request, context) ->
        request.addHeader(TOKEN_HEADER, token));
    return this;
  }

  /**
   * Assigns connection timeouts, in milliseconds, to be used by requests.
   *
   * @return this
   */
  public VaultHttpClientBuilder setDefaultConnectionTimeout(int connectionTimeoutMs) {
    RequestConfig requestConfig = RequestConfig.custom()
        .setConnectionRequestTimeout(connectionTimeoutMs)
        .setConnectTimeout(connectionTimeoutMs)
        .build();
    this.setDefaultRequestConfig(requestConfig);
    return this;
  }
}

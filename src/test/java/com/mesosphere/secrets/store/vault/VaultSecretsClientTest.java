package com.mesosphere.secrets.store.vault;

import com.mesosphere.secrets.specification.Environment;
import com.mesosphere.secrets.specification.SecretId;
import com.mesosphere.secrets.specification.SecretRequirement;
import com.mesosphere.secrets.specification.SecretValue;
import com.mesosphere.secrets.store.SecretsException;
import com.mesosphere.secrets.store.StoreSnapshot;

import org.apache.http.HttpEntity;
import org.apache.http.HttpEntityEnclosingRequest;
import org.apache.http.StatusLine;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.entity.ContentType;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClientBuilder;
import org.apache.http.protocol.HttpContext;
import org.json.JSONObject;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.Mockito;
import org.mockito.MockitoAnnotations;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class VaultSecretsClientTest {

  private static final String VAULT_ADDRESS = "https://vault.example.com";

  private static final String LIST_PATH = "/v1/secret/metadata/k8s/idfdev";

  private static final Environment ENVIRONMENT = Environment.newBuilder("idfdev", "secret/k8s/idfdev")
      .addSecret(SecretRequirement.newBuilder("argocd", "admin.password").build())
      .addApplication("gafaelfawr")
      .build();

  @Mock private HttpClientBuilder mockHttpClientBuilder;
  @Mock private CloseableHttpClient mockHttpClient;

  private final Map<String, CloseableHttpResponse> responses = new HashMap<>();

  private VaultSecretsClient client;

  @Rule
  public ExpectedException thrown = ExpectedException.none();

  @Before
  public void init() throws Exception {
    MockitoAnnotations.initMocks(this);
    responses.clear();
    CloseableHttpResponse notFound = mockResponse(404, "");
    when(mockHttpClientBuilder.build()).thenReturn(mockHttpClient);
    when(mockHttpClient.execute(Mockito.any(HttpUriRequest.class), Mockito.any(HttpContext.class)))
        .thenAnswer(invocation -> {
          HttpUriRequest request = invocation.getArgument(0);
          CloseableHttpResponse response = responses.get(request.getURI().getPath());
          return response == null ? notFound : response;
        });

    client = new VaultSecretsClient(VAULT_ADDRESS, new VaultHttpExecutor(mockHttpClientBuilder));
  }

  @Test
  public void testListApplications() throws Exception {
    responses.put(LIST_PATH, mockResponse(200, "{'data':{'keys':['argocd','nested/','stale']}}"));

    Assert.assertEquals(Arrays.asList("argocd", "stale"), client.listApplications(ENVIRONMENT));

    ArgumentCaptor<HttpUriRequest> passedRequest = ArgumentCaptor.forClass(HttpUriRequest.class);
    verify(mockHttpClient).execute(passedRequest.capture(), Mockito.any(HttpContext.class));
    HttpUriRequest request = passedRequest.getValue();
    Assert.assertEquals("GET", request.getMethod());
    Assert.assertEquals("vault.example.com", request.getURI().getHost());
    Assert.assertEquals(LIST_PATH, request.getURI().getPath());
    Assert.assertEquals("list=true", request.getURI().getQuery());
  }

  @Test
  public void testListNotFound() throws Exception {
    Assert.assertTrue(client.listApplications(ENVIRONMENT).isEmpty());
  }

  @Test
  public void testListWithoutPermission() throws Exception {
    thrown.expect(SecretsException.class);
    thrown.expectMessage("Permission denied: [403]");

    responses.put(LIST_PATH, mockResponse(403, ""));
    client.listApplications(ENVIRONMENT);
  }

  @Test
  public void testListMalformedResponse() throws Exception {
    thrown.expect(SecretsException.class);
    thrown.expectMessage("Malformed list response");

    responses.put(LIST_PATH, mockResponse(200, "{'data':{}}"));
    client.listApplications(ENVIRONMENT);
  }

  @Test
  public void testGetApplicationSecrets() throws Exception {
    responses.put("/v1/secret/data/k8s/idfdev/argocd",
        mockResponse(200, "{'data':{'data':{'admin.password':'abc','pending':null,'port':8080},'metadata':{}}}"));

    Map<String, Optional<SecretValue>> secrets = client.getApplicationSecrets(ENVIRONMENT, "argocd");
    Assert.assertEquals(3, secrets.size());
    Assert.assertEquals(Optional.of(SecretValue.of("abc")), secrets.get("admin.password"));
    Assert.assertEquals(Optional.empty(), secrets.get("pending"));
    Assert.assertEquals(Optional.of(SecretValue.of("8080")), secrets.get("port"));
  }

  @Test
  public void testGetApplicationSecretsNotFound() throws Exception {
    Assert.assertTrue(client.getApplicationSecrets(ENVIRONMENT, "gafaelfawr").isEmpty());
  }

  @Test
  public void testGetApplicationSecretsErrorOmitsContent() throws Exception {
    responses.put("/v1/secret/data/k8s/idfdev/argocd", mockResponse(200, "{'data':{'nodata':'hunter2'}}"));
    try {
      client.getApplicationSecrets(ENVIRONMENT, "argocd");
      Assert.fail("Expected an exception");
    } catch (SecretsException e) {
      Assert.assertFalse(e.getMessage().contains("hunter2"));
      Assert.assertEquals("secret/data/k8s/idfdev/argocd", e.getPath());
    }
  }

  @Test
  public void testGetEnvironmentSecrets() throws Exception {
    responses.put(LIST_PATH, mockResponse(200, "{'data':{'keys':['argocd','stale']}}"));
    responses.put("/v1/secret/data/k8s/idfdev/argocd",
        mockResponse(200, "{'data':{'data':{'admin.password':'abc'}}}"));
    responses.put("/v1/secret/data/k8s/idfdev/stale",
        mockResponse(200, "{'data':{'data':{'old':null}}}"));

    StoreSnapshot snapshot = client.getEnvironmentSecrets(ENVIRONMENT);
    Assert.assertEquals(Arrays.asList("argocd", "gafaelfawr", "stale"), new ArrayList<>(snapshot.getApplications()));
    Assert.assertEquals(Optional.of(SecretValue.of("abc")), snapshot.getValue(SecretId.of("argocd", "admin.password")));
    Assert.assertTrue(snapshot.contains(SecretId.of("stale", "old")));
    Assert.assertTrue(snapshot.getSecrets("gafaelfawr").isEmpty());
  }

  @Test
  public void testStoreApplicationSecrets() throws Exception {
    responses.put("/v1/secret/data/k8s/idfdev/argocd", mockResponse(200, "{}"));

    Map<String, Optional<SecretValue>> secrets = new TreeMap<>();
    secrets.put("admin.password", Optional.of(SecretValue.of("abc")));
    secrets.put("dex.clientSecret", Optional.empty());
    client.storeApplicationSecrets(ENVIRONMENT, "argocd", secrets);

    ArgumentCaptor<HttpUriRequest> passedRequest = ArgumentCaptor.forClass(HttpUriRequest.class);
    verify(mockHttpClient).execute(passedRequest.capture(), Mockito.any(HttpContext.class));
    HttpUriRequest request = passedRequest.getValue();

    Assert.assertEquals("POST", request.getMethod());
    Assert.assertEquals("/v1/secret/data/k8s/idfdev/argocd", request.getURI().getPath());

    Assert.assertTrue(request instanceof HttpEntityEnclosingRequest);
    HttpEntity httpEntity = ((HttpEntityEnclosingRequest) request).getEntity();
    Assert.assertEquals(ContentType.APPLICATION_JSON.toString(), httpEntity.getContentType().getValue());

    ByteArrayOutputStream content = new ByteArrayOutputStream();
    httpEntity.writeTo(content);
    JSONObject jsonObject = new JSONObject(content.toString("UTF-8"));
    JSONObject data = jsonObject.getJSONObject("data");
    Assert.assertEquals("abc", data.getString("admin.password"));
    Assert.assertTrue(data.has("dex.clientSecret"));
    Assert.assertTrue(data.isNull("dex.clientSecret"));
  }

  @Test(expected = SecretsException.class)
  public void testStoreWithoutPermission() throws Exception {
    responses.put("/v1/secret/data/k8s/idfdev/argocd", mockResponse(403, ""));
    client.storeApplicationSecrets(
        ENVIRONMENT, "argocd", Collections.singletonMap("key", Optional.of(SecretValue.of("abc"))));
  }

  @Test
  public void testVaultPaths() {
    VaultSecretsClient.VaultPath path = VaultSecretsClient.VaultPath.parse("/secret/k8s/idfdev/");
    Assert.assertEquals("secret/data/k8s/idfdev/argocd", path.dataPath("argocd"));
    Assert.assertEquals("secret/metadata/k8s/idfdev", path.metadataPath(""));

    VaultSecretsClient.VaultPath mount = VaultSecretsClient.VaultPath.parse("secret");
    Assert.assertEquals("secret/data/argocd", mount.dataPath("argocd"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testEmptyVaultPath() {
    VaultSecretsClient.VaultPath.parse("/");
  }

  private static CloseableHttpResponse mockResponse(int statusCode, String body) throws Exception {
    CloseableHttpResponse response = Mockito.mock(CloseableHttpResponse.class);
    StatusLine statusLine = Mockito.mock(StatusLine.class);
    HttpEntity entity = Mockito.mock(HttpEntity.class);
    byte[] content = body.getBytes(StandardCharsets.UTF_8);

    when(statusLine.getStatusCode()).thenReturn(statusCode);
    when(response.getStatusLine()).thenReturn(statusLine);
    when(response.getEntity()).thenReturn(entity);
    // The entity is read once by the fluent response and once more when parsed, so each read gets a fresh stream.
    when(entity.getContent()).thenAnswer(invocation -> new ByteArrayInputStream(content));
    return response;
  }
}

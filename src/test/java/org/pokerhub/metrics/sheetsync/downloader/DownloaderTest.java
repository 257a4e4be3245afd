/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.downloader;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.net.HttpURLConnection;
import java.net.SocketTimeoutException;
import java.net.URL;
import java.net.URLConnection;
import java.net.URLStreamHandler;
import java.net.URLStreamHandlerFactory;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Test class for {@link Downloader}.
 *
 * <p>Connections are mocked by registering a stream handler for
 * {@code http} URLs that hands out prepared {@link HttpURLConnection}
 * mocks.</p>
 */
public class DownloaderTest {

  /**
   * Custom {@link URLStreamHandler} that allows us to control the
   * {@link URLConnection URLConnections} that are returned by {@link URL URLs}
   * in the code under test.
   */
  private static class HttpUrlStreamHandler extends URLStreamHandler {

    private Map<String, URLConnection> connections = new HashMap<>();

    @Override
    protected URLConnection openConnection(URL url) {
      return this.connections.get(url.toString());
    }

    private void resetConnections() {
      this.connections = new HashMap<>();
    }

    private void addConnection(URL url, URLConnection urlConnection) {
      this.connections.put(url.toString(), urlConnection);
    }
  }

  private static HttpUrlStreamHandler httpUrlStreamHandler;

  private final Downloader downloader = new Downloader(1000);

  /**
   * Set up our own stream handler for all tests in this class.
   */
  @BeforeClass
  public static void setupUrlStreamHandlerFactory() {
    URLStreamHandlerFactory urlStreamHandlerFactory
        = mock(URLStreamHandlerFactory.class);
    URL.setURLStreamHandlerFactory(urlStreamHandlerFactory);
    httpUrlStreamHandler = new HttpUrlStreamHandler();
    given(urlStreamHandlerFactory.createURLStreamHandler("http"))
        .willReturn(httpUrlStreamHandler);
  }

  /**
   * Clear any connections from previously run tests.
   */
  @Before
  public void reset() {
    httpUrlStreamHandler.resetConnections();
  }

  private HttpURLConnection prepare(URL url, int responseCode)
      throws Exception {
    HttpURLConnection urlConnection = mock(HttpURLConnection.class);
    httpUrlStreamHandler.addConnection(url, urlConnection);
    given(urlConnection.getResponseCode()).willReturn(responseCode);
    return urlConnection;
  }

  @Test
  public void testExistingResource() throws Exception {
    URL requestedUrl = new URL("http://localhost/exists");
    byte[] expectedDownloadedBytes = "{\"sheets\":[]}".getBytes();
    HttpURLConnection urlConnection = prepare(requestedUrl, 200);
    given(urlConnection.getInputStream()).willReturn(
        new ByteArrayInputStream(expectedDownloadedBytes));
    byte[] downloadedBytes = downloader.get(requestedUrl,
        Collections.singletonMap("Authorization", "Bearer token"));
    assertArrayEquals(expectedDownloadedBytes, downloadedBytes);
    verify(urlConnection).setRequestMethod("GET");
    verify(urlConnection).setReadTimeout(1000);
    verify(urlConnection).setRequestProperty("Authorization",
        "Bearer token");
  }

  @Test
  public void testNonExistingResource() throws Exception {
    URL requestedUrl = new URL("http://localhost/notfound");
    HttpURLConnection urlConnection = prepare(requestedUrl, 404);
    given(urlConnection.getErrorStream()).willReturn(
        new ByteArrayInputStream("no such tab".getBytes()));
    try {
      downloader.get(requestedUrl);
      fail("Should have thrown an HttpStatusException.");
    } catch (HttpStatusException e) {
      assertEquals(404, e.getStatusCode());
      assertEquals("no such tab", e.getResponseBody());
      assertTrue(e.getMessage().startsWith("GET http://localhost/notfound"));
    }
  }

  @Test
  public void testLongErrorBodyIsCut() throws Exception {
    URL requestedUrl = new URL("http://localhost/quota");
    HttpURLConnection urlConnection = prepare(requestedUrl, 429);
    StringBuilder body = new StringBuilder();
    for (int i = 0; i < 100; i++) {
      body.append("quota exceeded ");
    }
    given(urlConnection.getErrorStream()).willReturn(
        new ByteArrayInputStream(body.toString().getBytes()));
    try {
      downloader.get(requestedUrl);
      fail("Should have thrown an HttpStatusException.");
    } catch (HttpStatusException e) {
      assertEquals(500, e.getResponseBody().length());
    }
  }

  @Test
  public void testEmptyResource() throws Exception {
    URL requestedUrl = new URL("http://localhost/empty");
    HttpURLConnection urlConnection = prepare(requestedUrl, 200);
    given(urlConnection.getInputStream()).willReturn(
        new ByteArrayInputStream(new byte[0]));
    assertEquals(0, downloader.get(requestedUrl).length);
  }

  @Test
  public void testPostJson() throws Exception {
    URL requestedUrl = new URL("http://localhost/users");
    HttpURLConnection urlConnection = prepare(requestedUrl, 200);
    ByteArrayOutputStream sent = new ByteArrayOutputStream();
    given(urlConnection.getOutputStream()).willReturn(sent);
    given(urlConnection.getInputStream()).willReturn(
        new ByteArrayInputStream("[]".getBytes()));
    byte[] body = "{\"users\":[1]}".getBytes(StandardCharsets.UTF_8);
    assertArrayEquals("[]".getBytes(), downloader.postJson(requestedUrl,
        Collections.<String, String>emptyMap(), body));
    assertArrayEquals(body, sent.toByteArray());
    verify(urlConnection).setRequestMethod("POST");
    verify(urlConnection).setDoOutput(true);
    verify(urlConnection).setRequestProperty("Content-Type", Downloader.JSON);
  }

  @Test
  public void testPutJson() throws Exception {
    URL requestedUrl = new URL("http://localhost/values");
    HttpURLConnection urlConnection = prepare(requestedUrl, 204);
    given(urlConnection.getOutputStream()).willReturn(
        new ByteArrayOutputStream());
    downloader.putJson(requestedUrl, Collections.<String, String>emptyMap(),
        "{}".getBytes());
    verify(urlConnection).setRequestMethod("PUT");
    verify(urlConnection).disconnect();
  }

  @Test(expected = SocketTimeoutException.class)
  public void testTimeout() throws Exception {
    URL requestedUrl = new URL("http://localhost/timeout");
    SocketTimeoutException expectedException = new SocketTimeoutException();
    HttpURLConnection urlConnection = prepare(requestedUrl, 200);
    given(urlConnection.getInputStream()).willThrow(expectedException);
    downloader.get(requestedUrl);
    fail("Should have thrown a SocketTimeoutException.");
  }
}

package io.github.wphillipmoore.mturk.requester;

import io.github.wphillipmoore.mturk.requester.exception.MturkTransportException;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import javax.net.ssl.SSLContext;
import org.jspecify.annotations.Nullable;

/**
 * JDK {@link HttpClient}-based implementation of {@link MturkTransport}.
 *
 * <p>Bodies are read as strings; the charset follows the response's {@code Content-Type}, falling
 * back to UTF-8.
 */
public final class HttpClientTransport implements MturkTransport {

  static final String ACCEPT = "application/xml, text/xml";

  private final HttpClient client;

  /** Creates a transport with a default TLS-verifying {@link HttpClient}. */
  public HttpClientTransport() {
    this.client = HttpClient.newHttpClient();
  }

  /**
   * Creates a transport with a custom {@link SSLContext}, e.g. for a corporate trust store.
   *
   * @param sslContext the SSL context to use
   */
  public HttpClientTransport(SSLContext sslContext) {
    Objects.requireNonNull(sslContext, "sslContext");
    this.client = HttpClient.newBuilder().sslContext(sslContext).build();
  }

  /**
   * Creates a transport with an injected {@link HttpClient}. Package-private for testing.
   *
   * @param client the HTTP client to use
   */
  HttpClientTransport(HttpClient client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  @Override
  public TransportResponse get(String url, @Nullable Duration timeout) {
    Objects.requireNonNull(url, "url");
    HttpRequest.Builder requestBuilder =
        HttpRequest.newBuilder().uri(URI.create(url)).header("Accept", ACCEPT).GET();
    if (timeout != null) {
      requestBuilder.timeout(timeout);
    }

    HttpResponse<String> response;
    try {
      response = client.send(requestBuilder.build(), HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new MturkTransportException("HTTP request failed", url, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new MturkTransportException("HTTP request interrupted", url, e);
    }

    String body = response.body();
    return new TransportResponse(response.statusCode(), body != null ? body : "");
  }
}

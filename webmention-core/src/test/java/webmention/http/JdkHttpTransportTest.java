package webmention.http;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import webmention.spi.HttpResponse;
import webmention.spi.HttpTimeoutException;
import webmention.spi.HttpTransportException;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class JdkHttpTransportTest {
  private HttpServer server;
  private String base;
  private final AtomicReference<String> lastBody = new AtomicReference<>();
  private final AtomicReference<String> lastUserAgent = new AtomicReference<>();
  private final AtomicReference<String> lastContentType = new AtomicReference<>();

  private final JdkHttpTransport transport = JdkHttpTransport.create(Duration.ofSeconds(2), "test-agent/1.0");

  @BeforeEach
  void setUp() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext("/page", exchange -> {
      lastUserAgent.set(exchange.getRequestHeaders().getFirst("User-Agent"));
      exchange.getResponseHeaders().add("Link", "</wm>; rel=\"webmention\"");
      exchange.getResponseHeaders().add("Content-Type", "text/html; charset=utf-8");
      respond(exchange, 200, "<p>hello</p>");
    });
    server.createContext("/moved", exchange -> {
      exchange.getResponseHeaders().add("Location", "/page");
      respond(exchange, 301, "");
    });
    server.createContext("/wm", exchange -> {
      lastContentType.set(exchange.getRequestHeaders().getFirst("Content-Type"));
      lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
      respond(exchange, 202, "");
    });
    server.createContext("/slow", exchange -> {
      try {
        Thread.sleep(1_000);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      respond(exchange, 200, "late");
    });
    server.start();
    base = "http://127.0.0.1:" + server.getAddress().getPort();
  }

  @AfterEach
  void tearDown() {
    server.stop(0);
  }

  private static void respond(HttpExchange exchange, int status, String body) throws IOException {
    byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
    if ("HEAD".equals(exchange.getRequestMethod())) {
      exchange.sendResponseHeaders(status, -1);
    } else {
      exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
      try (OutputStream out = exchange.getResponseBody()) {
        out.write(bytes);
      }
    }
    exchange.close();
  }

  @Test
  void fetchReturnsBodyHeadersAndSendsUserAgent() throws Exception {
    HttpResponse response = transport.fetch(base + "/page");

    assertEquals(200, response.statusCode());
    assertEquals("<p>hello</p>", response.body());
    assertEquals("</wm>; rel=\"webmention\"", response.header("link"));
    assertEquals("text/html", response.mediaType());
    assertEquals("test-agent/1.0", lastUserAgent.get());
  }

  @Test
  void headHasHeadersButNoBody() throws Exception {
    HttpResponse response = transport.head(base + "/page");

    assertEquals(200, response.statusCode());
    assertEquals("", response.body());
    assertEquals(1, response.headers("Link").size());
  }

  @Test
  void redirectsAreFollowedAndFinalUrlReported() throws Exception {
    HttpResponse response = transport.fetch(base + "/moved");

    assertEquals(200, response.statusCode());
    assertEquals(base + "/page", response.url());
  }

  @Test
  void notificationIsFormEncoded() throws Exception {
    HttpResponse response = transport.submitNotification(base + "/wm",
        "https://alice.example/notes/1?a=1&b=2", "https://bob.example/post 1");

    assertEquals(202, response.statusCode());
    assertEquals("application/x-www-form-urlencoded", lastContentType.get());
    assertEquals("source=https%3A%2F%2Falice.example%2Fnotes%2F1%3Fa%3D1%26b%3D2"
        + "&target=https%3A%2F%2Fbob.example%2Fpost+1", lastBody.get());
  }

  @Test
  void unknownPathIs404() throws Exception {
    HttpResponse response = transport.fetch(base + "/missing");

    assertEquals(404, response.statusCode());
    assertTrue(response.isGone());
  }

  @Test
  void slowServer_throwsTimeout() {
    JdkHttpTransport impatient = JdkHttpTransport.create(Duration.ofMillis(200), "test-agent/1.0");

    assertThrows(HttpTimeoutException.class, () -> impatient.fetch(base + "/slow"));
  }

  @Test
  void refusedConnection_throwsTransportException() throws IOException {
    int port;
    try (java.net.ServerSocket socket = new java.net.ServerSocket(0)) {
      port = socket.getLocalPort();
    }

    assertThrows(HttpTransportException.class, () -> transport.fetch("http://127.0.0.1:" + port + "/"));
  }

  @Test
  void invalidUrl_throwsTransportException() {
    assertThrows(HttpTransportException.class, () -> transport.fetch("http://exa mple.com/"));
  }
}

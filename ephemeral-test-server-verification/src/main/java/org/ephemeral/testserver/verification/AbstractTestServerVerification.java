/************************************************************************
 * Licensed under Public Domain (CC0)                                    *
 *                                                                       *
 * To the extent possible under law, the person who associated CC0 with  *
 * this code has waived all copyright and related or neighboring         *
 * rights to this code.                                                  *
 *                                                                       *
 * You should have received a copy of the CC0 legalcode along with this  *
 * work. If not, see <http://creativecommons.org/publicdomain/zero/1.0/>.*
 ************************************************************************/
package org.ephemeral.testserver.verification;

import org.eclipse.jetty.client.HttpClient;
import org.eclipse.jetty.client.api.ContentResponse;
import org.eclipse.jetty.client.api.Request;
import org.eclipse.jetty.client.util.FutureResponseListener;
import org.eclipse.jetty.client.util.StringContentProvider;
import org.eclipse.jetty.http.HttpMethod;
import org.ephemeral.testserver.ServerBackend;
import org.ephemeral.testserver.ServerState;
import org.ephemeral.testserver.TestHandler;
import org.ephemeral.testserver.TestServer;
import org.ephemeral.testserver.TestServerOptions;
import org.ephemeral.testserver.TestServers;
import org.testng.annotations.AfterClass;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.testng.Assert.*;

/**
 * Verifies a {@link ServerBackend} through the test servers started on it.
 *
 * Extend it and mix in a {@link WithServerBackend} to verify a backend.
 */
public abstract class AbstractTestServerVerification implements WithServerBackend {

  private static final TestHandler OK = (request, response) -> {
    response.setStatus(200);
    response.getWriter().write("ok");
  };

  private HttpClient client;

  @BeforeClass
  public void startClient() throws Exception {
    client = new HttpClient();
    client.setMaxConnectionsPerDestination(1000);
    client.start();
  }

  @AfterClass
  public void stopClient() throws Exception {
    client.stop();
  }

  protected TestServerOptions options() {
    return TestServerOptions.builder()
        .backend(this::createBackend)
        .build();
  }

  protected TestServer startServer(TestHandler handler) {
    return TestServers.http(options(), handler);
  }

  @Test
  public void servesTheHandlersResponse() throws Exception {
    try (TestServer server = startServer(OK)) {
      ContentResponse response = get(server.url("/x"));
      assertEquals(response.getStatus(), 200);
      assertEquals(response.getContentAsString(), "ok");
      server.assertHits(1);
    }
  }

  @Test
  public void urlsUseLoopbackAndTheAssignedPort() throws Exception {
    try (TestServer server = startServer(OK)) {
      assertTrue(server.port() > 0);
      assertEquals(server.host(), "127.0.0.1");
      assertEquals(server.baseUrl(), "http://127.0.0.1:" + server.port());
      assertEquals(server.url("/foo"), "http://127.0.0.1:" + server.port() + "/foo");
      get(server.baseUrl());
    }
  }

  @Test
  public void routesEveryPathToTheHandler() throws Exception {
    try (TestServer server = startServer((request, response) ->
        response.getWriter().write(request.getMethod() + " " + request.getRequestURI()))) {
      assertEquals(get(server.url("/a")).getContentAsString(), "GET /a");
      assertEquals(get(server.url("/b/c")).getContentAsString(), "GET /b/c");
      ContentResponse posted = client.newRequest(server.url("/d"))
          .method(HttpMethod.POST)
          .content(new StringContentProvider("body"))
          .timeout(5, TimeUnit.SECONDS)
          .send();
      assertEquals(posted.getContentAsString(), "POST /d");
      server.assertHits(3);
    }
  }

  @Test
  public void passesTheResponseThroughUnmodified() throws Exception {
    try (TestServer server = startServer((request, response) -> {
      response.setStatus(201);
      response.setHeader("X-Test", "yes");
      response.setContentType("text/plain");
      response.getOutputStream().write(request.getHeader("X-Echo").getBytes(StandardCharsets.UTF_8));
    })) {
      ContentResponse response = client.newRequest(server.url("/echo"))
          .header("X-Echo", "hello")
          .timeout(5, TimeUnit.SECONDS)
          .send();
      assertEquals(response.getStatus(), 201);
      assertEquals(response.getHeaders().get("X-Test"), "yes");
      assertEquals(response.getContentAsString(), "hello");
    }
  }

  @Test
  public void countsEverySuccessfulRequest() throws Exception {
    try (TestServer server = startServer(OK)) {
      for (int i = 1; i <= 5; i++) {
        get(server.url("/" + i));
        server.assertHits(i);
      }
      assertEquals(server.totalHits(), 5);
      assertEquals(server.successfulHits(), 5);
    }
  }

  @Test
  public void countsConcurrentRequestsWithoutLoss() throws Exception {
    int requests = 50;
    try (TestServer server = startServer(OK)) {
      CountDownLatch done = new CountDownLatch(requests);
      AtomicInteger succeeded = new AtomicInteger();
      for (int i = 0; i < requests; i++) {
        client.newRequest(server.url("/" + i))
            .send(result -> {
              if (result.isSucceeded() && result.getResponse().getStatus() == 200) {
                succeeded.incrementAndGet();
              }
              done.countDown();
            });
      }
      assertTrue(done.await(10, TimeUnit.SECONDS), "requests did not complete");
      assertEquals(succeeded.get(), requests);
      server.assertHits(requests);
      assertEquals(server.totalHits(), requests);
    }
  }

  @Test
  public void assertHitsFailsImmediatelyOnAWrongCount() throws Exception {
    try (TestServer server = startServer(OK)) {
      get(server.url("/"));
      get(server.url("/"));
      server.assertHits(2);
      expectThrows(AssertionError.class, () -> server.assertHits(3));
      expectThrows(AssertionError.class, () -> server.assertHits(1));
    }
  }

  @Test
  public void closingAnUncalledServerFails() {
    TestServer server = startServer(OK);
    AssertionError e = expectThrows(AssertionError.class, server::close);
    assertEquals(e.getMessage(), "test server exited without being called");
  }

  @Test
  public void closingReportsFailedRequests() throws Exception {
    AtomicInteger count = new AtomicInteger();
    TestServer server = startServer((request, response) -> {
      if (count.incrementAndGet() == 2) {
        throw new IllegalStateException("handler failed on purpose");
      }
      response.getWriter().write("ok");
    });

    int failedResponses = 0;
    for (int i = 0; i < 4; i++) {
      if (get(server.url("/")).getStatus() >= 500) {
        failedResponses++;
      }
    }

    assertEquals(failedResponses, 1);
    assertEquals(server.totalHits(), 4);
    server.assertHits(3);
    AssertionError e = expectThrows(AssertionError.class, server::close);
    assertEquals(e.getMessage(), "number of panicked requests: 1");
  }

  @Test
  public void closeIsIdempotent() throws Exception {
    TestServer server = startServer(OK);
    get(server.url("/"));
    server.close();
    assertEquals(server.state(), ServerState.STOPPED);
    server.close();
    assertEquals(server.state(), ServerState.STOPPED);
  }

  @Test
  public void closeDoesNotAssertTwice() {
    TestServer server = startServer(OK);
    expectThrows(AssertionError.class, server::close);
    server.close();
  }

  @Test
  public void withServerRunsTheBody() throws Exception {
    TestServers.withServer(options(), OK, server -> {
      assertEquals(get(server.url("/x")).getContentAsString(), "ok");
      server.assertHits(1);
    });
  }

  @Test
  public void backendBindsToTheRequestedAddress() throws Exception {
    ServerBackend backend = createBackend();
    InetSocketAddress address = backend.start(new InetSocketAddress("127.0.0.1", 0), Duration.ofSeconds(2), OK);
    try {
      assertEquals(address.getHostString(), "127.0.0.1");
      assertTrue(address.getPort() > 0);
      assertEquals(get("http://127.0.0.1:" + address.getPort() + "/").getContentAsString(), "ok");
    } finally {
      backend.stop();
    }
  }

  @Test
  public void backendDrainsInFlightRequestsOnStop() throws Exception {
    CountDownLatch entered = new CountDownLatch(1);
    ServerBackend backend = createBackend();
    InetSocketAddress address = backend.start(new InetSocketAddress("127.0.0.1", 0), Duration.ofSeconds(2),
        (request, response) -> {
      entered.countDown();
      try {
        Thread.sleep(300);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IOException(e);
      }
      response.getWriter().write("done");
    });

    Request request = client.newRequest("http://127.0.0.1:" + address.getPort() + "/slow");
    FutureResponseListener listener = new FutureResponseListener(request);
    request.send(listener);
    assertTrue(entered.await(5, TimeUnit.SECONDS), "request did not reach the handler");

    backend.stop();

    ContentResponse response = listener.get(5, TimeUnit.SECONDS);
    assertEquals(response.getStatus(), 200);
    assertEquals(response.getContentAsString(), "done");
  }

  @Test
  public void backendStopIsBoundedByTheDrainTimeout() throws Exception {
    CountDownLatch entered = new CountDownLatch(1);
    ServerBackend backend = createBackend();
    InetSocketAddress address = backend.start(new InetSocketAddress("127.0.0.1", 0), Duration.ofMillis(300),
        (request, response) -> {
      entered.countDown();
      try {
        Thread.sleep(3000);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IOException(e);
      }
      response.getWriter().write("too late");
    });

    client.newRequest("http://127.0.0.1:" + address.getPort() + "/stuck")
        .timeout(10, TimeUnit.SECONDS)
        .send(result -> { });
    assertTrue(entered.await(5, TimeUnit.SECONDS), "request did not reach the handler");

    long start = System.nanoTime();
    expectThrows(Exception.class, backend::stop);
    long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
    assertTrue(elapsed < 1800, "stop took " + elapsed + "ms with a 300ms drain timeout");
  }

  protected ContentResponse get(String url) throws Exception {
    return client.newRequest(url).timeout(5, TimeUnit.SECONDS).send();
  }
}

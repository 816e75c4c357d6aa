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
package org.ephemeral.testserver;

import org.eclipse.jetty.client.HttpClient;
import org.eclipse.jetty.client.api.ContentResponse;
import org.ephemeral.testserver.jetty.JettyServerBackend;
import org.testng.annotations.AfterClass;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.Test;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.testng.Assert.*;

public class TestServerTest {

  private static final TestHandler OK = (request, response) -> response.getWriter().write("ok");

  private HttpClient client;

  @BeforeClass
  public void start() throws Exception {
    client = new HttpClient();
    client.start();
  }

  @AfterClass
  public void stop() throws Exception {
    client.stop();
  }

  @Test
  public void bindsToLoopbackOnAnAssignedPort() throws Exception {
    try (TestServer server = TestServers.http(OK)) {
      assertEquals(server.host(), "127.0.0.1");
      assertTrue(server.port() > 0);
      assertEquals(server.address().getPort(), server.port());
      assertEquals(server.baseUrl(), "http://127.0.0.1:" + server.port());
      assertEquals(server.url("/foo"), "http://127.0.0.1:" + server.port() + "/foo");
      get(server.url("/"));
    }
  }

  @Test
  public void movesThroughTheLifecycle() throws Exception {
    TestServer server = TestServers.http(OK);
    assertEquals(server.state(), ServerState.RUNNING);
    get(server.url("/"));
    server.close();
    assertEquals(server.state(), ServerState.STOPPED);
  }

  @Test(expectedExceptions = NullPointerException.class)
  public void rejectsNullHandler() {
    TestServers.http(null);
  }

  @Test
  public void bindFailureReturnsNoServer() {
    AtomicBoolean stopped = new AtomicBoolean();
    TestServerOptions options = TestServerOptions.builder()
        .backend(() -> new ServerBackend() {
          @Override
          public InetSocketAddress start(InetSocketAddress bindAddress, Duration drainTimeout, TestHandler handler)
              throws Exception {
            throw new java.net.BindException("Address already in use");
          }

          @Override
          public void stop() {
            stopped.set(true);
          }
        })
        .build();

    IllegalStateException e = expectThrows(IllegalStateException.class, () -> TestServers.http(options, OK));
    assertEquals(e.getMessage(), "Failed to start test server");
    assertTrue(e.getCause() instanceof java.net.BindException);
    assertTrue(stopped.get(), "partially started backend should be stopped");
  }

  @Test
  public void interruptedStartupStopsWhatTheStarterBound() throws Exception {
    CountDownLatch stopped = new CountDownLatch(1);
    TestServerOptions options = TestServerOptions.builder()
        .backend(() -> new JettyServerBackend() {
          @Override
          public void stop() throws Exception {
            super.stop();
            stopped.countDown();
          }
        })
        .build();

    Thread.currentThread().interrupt();
    IllegalStateException e;
    try {
      e = expectThrows(IllegalStateException.class, () -> TestServers.http(options, OK));
      assertTrue(Thread.currentThread().isInterrupted(), "interrupt flag should be restored");
    } finally {
      Thread.interrupted();
    }

    assertEquals(e.getMessage(), "Interrupted while starting test server");
    assertTrue(stopped.await(5, TimeUnit.SECONDS), "server bound after the interrupt was never stopped");
  }

  @Test
  public void failureToStopFailsTheTest() throws Exception {
    TestServerOptions options = TestServerOptions.builder()
        .backend(() -> new JettyServerBackend() {
          @Override
          public void stop() throws Exception {
            super.stop();
            throw new IllegalStateException("stuck connector");
          }
        })
        .build();
    TestServer server = TestServers.http(options, OK);
    get(server.url("/"));

    AssertionError e = expectThrows(AssertionError.class, server::close);
    assertEquals(e.getMessage(), "test server should not panic");
    assertTrue(e.getCause() instanceof IllegalStateException);
    assertEquals(server.state(), ServerState.DRAINING);
  }

  @Test
  public void slowStopFailsTheTest() throws Exception {
    TestServerOptions options = TestServerOptions.builder()
        .completionTimeout(Duration.ofMillis(200))
        .backend(() -> new JettyServerBackend() {
          @Override
          public void stop() throws Exception {
            Thread.sleep(1000);
            super.stop();
          }
        })
        .build();
    TestServer server = TestServers.http(options, OK);
    get(server.url("/"));

    AssertionError e = expectThrows(AssertionError.class, server::close);
    assertTrue(e.getMessage().startsWith("test server should not panic"), e.getMessage());
  }

  @Test
  public void withServerClosesTheServer() throws Exception {
    TestServer[] captured = new TestServer[1];
    TestServers.withServer(OK, server -> {
      captured[0] = server;
      assertEquals(get(server.url("/x")).getContentAsString(), "ok");
      server.assertHits(1);
    });
    assertEquals(captured[0].state(), ServerState.STOPPED);
  }

  @Test
  public void withServerChecksUsageWhenTheBodySucceeds() {
    AssertionError e = expectThrows(AssertionError.class, () -> TestServers.withServer(OK, server -> { }));
    assertEquals(e.getMessage(), "test server exited without being called");
  }

  @Test
  public void withServerDoesNotMaskABodyFailure() {
    IllegalStateException boom = new IllegalStateException("boom");
    TestServer[] captured = new TestServer[1];

    IllegalStateException thrown = expectThrows(IllegalStateException.class,
        () -> TestServers.withServer(OK, server -> {
          captured[0] = server;
          throw boom;
        }));

    assertSame(thrown, boom);
    assertEquals(thrown.getSuppressed().length, 0);
    assertNotEquals(captured[0].state(), ServerState.RUNNING);
    // Already disposed, a later close must not assert.
    captured[0].close();
  }

  @Test
  public void tryWithResourcesKeepsTheOriginalFailure() {
    IllegalStateException thrown = expectThrows(IllegalStateException.class, () -> {
      try (TestServer server = TestServers.http(OK)) {
        throw new IllegalStateException("boom");
      }
    });

    assertEquals(thrown.getMessage(), "boom");
    assertEquals(thrown.getSuppressed().length, 1);
    assertEquals(thrown.getSuppressed()[0].getMessage(), "test server exited without being called");
  }

  private ContentResponse get(String url) throws Exception {
    return client.newRequest(url).timeout(5, TimeUnit.SECONDS).send();
  }
}

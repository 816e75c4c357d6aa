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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Starts test servers.
 *
 * <pre>
 * try (TestServer server = TestServers.http((request, response) -> response.getWriter().write("ok"))) {
 *   // make requests to server.url("/x")
 *   server.assertHits(1);
 * }
 * </pre>
 */
public final class TestServers {

  private static final Logger log = LoggerFactory.getLogger(TestServers.class);

  private TestServers() {
  }

  /**
   * Start a test server with the default options.
   *
   * @param handler The handler to handle all requests.
   * @return The server, already listening.
   */
  public static TestServer http(TestHandler handler) {
    return http(TestServerOptions.defaults(), handler);
  }

  /**
   * Start a test server.
   *
   * Binding happens on a separate thread, this method blocks until the socket is bound.
   *
   * @param options The options.
   * @param handler The handler to handle all requests.
   * @return The server, already listening.
   * @throws IllegalStateException If the server could not be started.
   */
  public static TestServer http(TestServerOptions options, TestHandler handler) {
    Objects.requireNonNull(options, "options");
    Objects.requireNonNull(handler, "handler");

    CompletableFuture<TestServer> ready = new CompletableFuture<>();
    Thread starter = new Thread(() -> {
      try {
        ready.complete(bind(options, handler));
      } catch (Throwable t) {
        ready.completeExceptionally(t);
      }
    }, "test-server-starter");
    starter.start();

    try {
      starter.join();
      return ready.get();
    } catch (InterruptedException e) {
      // The starter keeps going, shut down whatever it ends up starting.
      ready.thenAccept(server -> server.dispose(true));
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while starting test server", e);
    } catch (ExecutionException e) {
      throw new IllegalStateException("Failed to start test server", e.getCause());
    }
  }

  /**
   * Start a test server with the default options, run the body against it, and close it.
   *
   * @see #withServer(TestServerOptions, TestHandler, ServerBody)
   */
  public static void withServer(TestHandler handler, ServerBody body) throws Exception {
    withServer(TestServerOptions.defaults(), handler, body);
  }

  /**
   * Start a test server, run the body against it, and close it.
   *
   * If the body throws, the server is shut down without checking how it was used, and the body's
   * exception is rethrown as is.
   */
  public static void withServer(TestServerOptions options, TestHandler handler, ServerBody body) throws Exception {
    TestServer server = http(options, handler);
    try {
      body.accept(server);
    } catch (Throwable t) {
      server.dispose(true);
      throw t;
    }
    server.close();
  }

  private static TestServer bind(TestServerOptions options, TestHandler handler) throws Exception {
    Hits hits = new Hits();
    ServerBackend backend = options.backend().get();
    InetSocketAddress address;
    try {
      address = backend.start(new InetSocketAddress(TestServer.HOST, 0), options.drainTimeout(),
          new CountingHandler(handler, hits));
    } catch (Exception e) {
      log.error("Test server backend {} failed to start", backend.getClass().getName(), e);
      try {
        backend.stop();
      } catch (Exception stopFailure) {
        e.addSuppressed(stopFailure);
      }
      throw e;
    }

    CompletableFuture<Void> shutdownTrigger = new CompletableFuture<>();
    CompletableFuture<Void> stopped = new CompletableFuture<>();
    TestServer server = new TestServer(address, hits, shutdownTrigger, stopped, options.completionTimeout());

    Thread serving = new Thread(() -> {
      shutdownTrigger.join();
      server.transition(ServerState.DRAINING);
      try {
        backend.stop();
        server.transition(ServerState.STOPPED);
        log.debug("Test server {} stopped after {}", address, hits);
        stopped.complete(null);
      } catch (Throwable t) {
        log.error("Test server {} did not stop cleanly", address, t);
        stopped.completeExceptionally(t);
      }
    }, "test-server");
    serving.setDaemon(true);
    serving.start();

    log.info("Test server listening on {}", server.baseUrl());
    return server;
  }
}

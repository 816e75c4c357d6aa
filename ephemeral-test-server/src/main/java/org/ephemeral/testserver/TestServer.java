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
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.fail;

/**
 * A running test server.
 *
 * Closing the server shuts it down, and then asserts that it was called at least once, that no
 * handler invocation failed (panicked), and that the server stopped in time without failing. Use it in a try-with-resources
 * block, or through {@link TestServers#withServer(TestHandler, ServerBody)}, which skips those
 * assertions when the test body has already failed.
 */
public final class TestServer implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(TestServer.class);

  static final String HOST = "127.0.0.1";

  private final InetSocketAddress address;
  private final Hits hits;
  private final CompletableFuture<Void> stopped;
  private final AtomicReference<CompletableFuture<Void>> shutdownTrigger;
  private final Duration completionTimeout;
  private final AtomicBoolean disposed = new AtomicBoolean();

  private volatile ServerState state = ServerState.RUNNING;

  TestServer(InetSocketAddress address, Hits hits, CompletableFuture<Void> shutdownTrigger,
      CompletableFuture<Void> stopped, Duration completionTimeout) {
    this.address = address;
    this.hits = hits;
    this.shutdownTrigger = new AtomicReference<>(shutdownTrigger);
    this.stopped = stopped;
    this.completionTimeout = completionTimeout;
  }

  public String baseUrl() {
    return "http://" + host() + ":" + port();
  }

  /**
   * @param path The path, including its leading slash.
   */
  public String url(String path) {
    return baseUrl() + path;
  }

  /**
   * Always the IPv4 loopback literal, the only address test servers bind to.
   */
  public String host() {
    return HOST;
  }

  public int port() {
    return address.getPort();
  }

  public InetSocketAddress address() {
    return address;
  }

  public long successfulHits() {
    return hits.successful();
  }

  public long totalHits() {
    return hits.total();
  }

  public ServerState state() {
    return state;
  }

  /**
   * Assert the number of requests that were handled successfully so far.
   */
  public void assertHits(long expected) {
    assertEquals(hits.successful(), expected, "successful hits on " + baseUrl());
  }

  @Override
  public void close() {
    dispose(false);
  }

  /**
   * Shut the server down and, unless the caller is already failing, check how it was used.
   *
   * Only the first call does anything.
   *
   * @param failing Whether the test is already failing, in which case nothing is asserted.
   */
  void dispose(boolean failing) {
    requestShutdown();
    if (!disposed.compareAndSet(false, true)) {
      return;
    }
    if (failing) {
      log.debug("Skipping checks of test server {}, test already failed", address);
      return;
    }

    if (hits.total() <= 0) {
      fail("test server exited without being called");
    }
    long failed = hits.failed();
    if (failed != 0) {
      fail("number of panicked requests: " + failed);
    }

    try {
      stopped.get(completionTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      fail("test server should not panic, it did not stop within " + completionTimeout, e);
    } catch (ExecutionException e) {
      fail("test server should not panic", e.getCause());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      fail("test server should not panic, interrupted while waiting for it to stop", e);
    }
  }

  private void requestShutdown() {
    CompletableFuture<Void> trigger = shutdownTrigger.getAndSet(null);
    if (trigger != null) {
      log.debug("Shutting down test server {}", address);
      transition(ServerState.SHUTDOWN_REQUESTED);
      trigger.complete(null);
    }
  }

  void transition(ServerState next) {
    state = next;
  }

  @Override
  public String toString() {
    return "TestServer(" + baseUrl() + ", " + state + ", " + hits + ")";
  }
}

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

import java.net.InetSocketAddress;
import java.time.Duration;

/**
 * Abstraction over the servlet containers a test server can run on.
 *
 * A backend is single use: it is started once, and stopped once.
 */
public interface ServerBackend {

  /**
   * Start the server.
   *
   * Every request, whatever its path, must be passed to the handler.
   *
   * @param bindAddress The address to bind to. The port is 0, so the operating system picks one.
   * @param drainTimeout How long in flight requests are given to complete when the server stops.
   *                     Some containers only take this setting before they start.
   * @param handler The handler to handle requests.
   * @return The address the server is actually listening on.
   */
  InetSocketAddress start(InetSocketAddress bindAddress, Duration drainTimeout, TestHandler handler) throws Exception;

  /**
   * Stop the server gracefully.
   *
   * Stops accepting connections, lets in flight requests complete for at most the drain timeout
   * given to {@link #start}, and returns once the server is stopped. Requests still running when the
   * drain timeout expires are abandoned, and this then throws a {@link java.util.concurrent.TimeoutException}.
   */
  void stop() throws Exception;
}

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
package org.ephemeral.testserver.jetty;

import org.eclipse.jetty.server.Request;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.server.handler.AbstractHandler;
import org.eclipse.jetty.server.handler.StatisticsHandler;
import org.eclipse.jetty.util.thread.QueuedThreadPool;
import org.ephemeral.testserver.ServerBackend;
import org.ephemeral.testserver.TestHandler;

import javax.servlet.ServletException;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Duration;

/**
 * Runs a test server on Jetty.
 *
 * The handler is wrapped in a {@link StatisticsHandler}, which is what lets Jetty wait for in flight
 * requests when it stops. Jetty's threads are daemon threads, a server nobody stopped doesn't keep
 * the JVM alive.
 */
public class JettyServerBackend implements ServerBackend {

  private final QueuedThreadPool threadPool;
  private final Server server;

  public JettyServerBackend() {
    threadPool = new QueuedThreadPool();
    threadPool.setName("test-server-jetty");
    threadPool.setDaemon(true);
    server = new Server(threadPool);
  }

  @Override
  public InetSocketAddress start(InetSocketAddress bindAddress, Duration drainTimeout, TestHandler handler)
      throws Exception {
    ServerConnector connector = new ServerConnector(server);
    connector.setHost(bindAddress.getHostString());
    connector.setPort(bindAddress.getPort());
    server.addConnector(connector);

    StatisticsHandler statistics = new StatisticsHandler();
    statistics.setHandler(new AbstractHandler() {
      @Override
      public void handle(String target, Request baseRequest, HttpServletRequest request, HttpServletResponse response)
          throws IOException, ServletException {
        baseRequest.setHandled(true);
        handler.handle(request, response);
      }
    });
    server.setHandler(statistics);
    server.setStopAtShutdown(false);
    // A graceful stop that runs out of time fails with a TimeoutException.
    server.setStopTimeout(drainTimeout.toMillis());
    // Handler threads still busy after that are interrupted.
    threadPool.setStopTimeout(drainTimeout.toMillis());

    server.start();
    return new InetSocketAddress(bindAddress.getHostString(), connector.getLocalPort());
  }

  @Override
  public void stop() throws Exception {
    server.stop();
    server.join();
  }
}

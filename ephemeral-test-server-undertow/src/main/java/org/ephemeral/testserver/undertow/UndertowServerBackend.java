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
package org.ephemeral.testserver.undertow;

import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.handlers.GracefulShutdownHandler;
import io.undertow.servlet.Servlets;
import io.undertow.servlet.api.DeploymentInfo;
import io.undertow.servlet.api.DeploymentManager;
import io.undertow.servlet.util.ImmediateInstanceHandle;
import org.ephemeral.testserver.ServerBackend;
import org.ephemeral.testserver.TestHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xnio.OptionMap;
import org.xnio.Options;
import org.xnio.Xnio;
import org.xnio.XnioWorker;

import javax.servlet.ServletException;
import javax.servlet.http.HttpServlet;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a test server as a servlet deployment on Undertow.
 *
 * Once shutdown starts, requests on already open connections are refused with a 503 while the
 * ones in flight finish. The XNIO worker belongs to the backend, so that requests still running
 * when the drain timeout expires can be interrupted.
 */
public class UndertowServerBackend implements ServerBackend {

  private static final Logger log = LoggerFactory.getLogger(UndertowServerBackend.class);

  private XnioWorker worker;
  private Undertow server;
  private DeploymentManager manager;
  private GracefulShutdownHandler graceful;
  private Duration drainTimeout;

  @Override
  public InetSocketAddress start(InetSocketAddress bindAddress, Duration drainTimeout, TestHandler handler)
      throws Exception {
    this.drainTimeout = drainTimeout;
    DeploymentInfo servletBuilder = Servlets.deployment()
        .setClassLoader(getClass().getClassLoader())
        .setContextPath("/")
        .setDeploymentName("test-server.war")
        .addServlets(
            Servlets.servlet("TestServerServlet", HttpServlet.class, () -> new ImmediateInstanceHandle<>(new HttpServlet() {
              @Override
              protected void service(HttpServletRequest req, HttpServletResponse resp) throws ServletException, IOException {
                handler.handle(req, resp);
              }
            })).setAsyncSupported(true).addMapping("/*")
        );

    // Own container per server, deployments in the shared default one are keyed by name.
    manager = Servlets.newContainer().addDeployment(servletBuilder);
    manager.deploy();
    graceful = Handlers.gracefulShutdown(manager.start());

    worker = Xnio.getInstance(Undertow.class.getClassLoader()).createWorker(OptionMap.builder()
        .set(Options.WORKER_NAME, "test-server-undertow")
        .set(Options.THREAD_DAEMON, true)
        .set(Options.WORKER_IO_THREADS, 2)
        .set(Options.WORKER_TASK_CORE_THREADS, 16)
        .set(Options.WORKER_TASK_MAX_THREADS, 16)
        .getMap());

    server = Undertow.builder()
        .setWorker(worker)
        .addHttpListener(bindAddress.getPort(), bindAddress.getHostString())
        .setHandler(graceful)
        .build();

    server.start();

    int port = ((InetSocketAddress) server.getListenerInfo().get(0).getAddress()).getPort();
    return new InetSocketAddress(bindAddress.getHostString(), port);
  }

  @Override
  public void stop() throws Exception {
    boolean drained = true;
    if (graceful != null) {
      graceful.shutdown();
      drained = graceful.awaitShutdown(drainTimeout.toMillis());
    }
    if (server != null) {
      server.stop();
    }
    if (worker != null) {
      if (drained) {
        worker.shutdown();
      } else {
        log.warn("Requests still in flight after {}, interrupting them", drainTimeout);
        worker.shutdownNow();
      }
      if (!worker.awaitTermination(drainTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Undertow worker did not terminate within {}", drainTimeout);
      }
    }
    if (manager != null) {
      manager.stop();
      manager.undeploy();
    }
    if (!drained) {
      throw new TimeoutException("Requests still in flight after " + drainTimeout);
    }
  }
}

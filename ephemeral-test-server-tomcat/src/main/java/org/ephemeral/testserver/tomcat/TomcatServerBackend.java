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
package org.ephemeral.testserver.tomcat;

import org.apache.catalina.Context;
import org.apache.catalina.Lifecycle;
import org.apache.catalina.connector.Connector;
import org.apache.catalina.core.StandardContext;
import org.apache.catalina.core.StandardWrapper;
import org.apache.catalina.startup.Tomcat;
import org.apache.tomcat.util.http.fileupload.FileUtils;
import org.ephemeral.testserver.ServerBackend;
import org.ephemeral.testserver.TestHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.servlet.ServletException;
import javax.servlet.http.HttpServlet;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import java.io.File;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.file.Files;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Runs a test server on embedded Tomcat.
 *
 * Tomcat needs a base directory, a temporary one is created on start and deleted on stop.
 *
 * Draining is Tomcat's own: stopping the service pauses the connector, and the servlet wrapper waits
 * up to the context's unload delay for the requests using it before it is unloaded.
 */
public class TomcatServerBackend implements ServerBackend {

  private static final Logger log = LoggerFactory.getLogger(TomcatServerBackend.class);

  private final Tomcat tomcat = new Tomcat();

  private File tempDir;
  private Duration drainTimeout;
  private volatile int abandoned;

  @Override
  public InetSocketAddress start(InetSocketAddress bindAddress, Duration drainTimeout, TestHandler handler)
      throws Exception {
    this.drainTimeout = drainTimeout;
    tempDir = Files.createTempDirectory("tomcat").toFile();
    tomcat.setBaseDir(tempDir.getAbsolutePath());
    tomcat.setPort(bindAddress.getPort());

    Connector connector = tomcat.getConnector();
    connector.setProperty("address", bindAddress.getHostString());

    Context ctx = tomcat.addContext("", tempDir.getAbsolutePath());
    // Wrappers copy the unload delay when they are added, so it has to be set first.
    ((StandardContext) ctx).setUnloadDelay(drainTimeout.toMillis());

    StandardWrapper wrapper = (StandardWrapper) Tomcat.addServlet(ctx, "test-server", new HttpServlet() {
      @Override
      protected void service(HttpServletRequest req, HttpServletResponse resp) throws ServletException, IOException {
        handler.handle(req, resp);
      }
    });
    wrapper.setAsyncSupported(true);
    // Runs once the unload wait is over, before the connector and its threads are stopped.
    wrapper.addLifecycleListener(event -> {
      if (Lifecycle.AFTER_STOP_EVENT.equals(event.getType())) {
        abandoned = wrapper.getCountAllocated();
      }
    });

    ctx.addServletMappingDecoded("/*", "test-server");

    tomcat.start();
    return new InetSocketAddress(bindAddress.getHostString(), connector.getLocalPort());
  }

  @Override
  public void stop() throws Exception {
    try {
      tomcat.stop();
      tomcat.destroy();
    } finally {
      if (tempDir != null) {
        FileUtils.deleteDirectory(tempDir);
      }
    }
    int remaining = abandoned;
    if (remaining > 0) {
      log.warn("{} requests still in flight after {}", remaining, drainTimeout);
      throw new TimeoutException(remaining + " requests still in flight after " + drainTimeout);
    }
  }
}

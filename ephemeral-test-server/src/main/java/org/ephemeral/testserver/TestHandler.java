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

import javax.servlet.ServletException;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import java.io.IOException;

/**
 * Handles every request made to a test server.
 *
 * Handlers are invoked on the server's request threads, possibly concurrently, and possibly many
 * times. Whatever the handler writes to the response is sent to the client as is.
 *
 * A handler fails a request by throwing. The exception is left to the servlet container, which
 * answers with an error status, and the request is counted as a failed hit.
 */
@FunctionalInterface
public interface TestHandler {

  /**
   * Handle a request.
   *
   * @param request The request.
   * @param response The response to write to.
   */
  void handle(HttpServletRequest request, HttpServletResponse response) throws IOException, ServletException;
}

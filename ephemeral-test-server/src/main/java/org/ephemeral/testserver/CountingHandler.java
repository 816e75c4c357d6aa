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
 * Handler that counts the requests passing through it.
 *
 * Exceptions thrown by the delegate are not caught, they propagate to the container.
 */
final class CountingHandler implements TestHandler {

  private final TestHandler delegate;
  private final Hits hits;

  CountingHandler(TestHandler delegate, Hits hits) {
    this.delegate = delegate;
    this.hits = hits;
  }

  @Override
  public void handle(HttpServletRequest request, HttpServletResponse response) throws IOException, ServletException {
    hits.received();
    delegate.handle(request, response);
    hits.succeeded();
  }
}

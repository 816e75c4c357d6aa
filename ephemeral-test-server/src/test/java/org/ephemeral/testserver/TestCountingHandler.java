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

import org.testng.annotations.Test;

import javax.servlet.ServletException;
import java.util.concurrent.atomic.AtomicLong;

import static org.testng.Assert.*;

public class TestCountingHandler {

  @Test
  public void countsBeforeAndAfterTheDelegate() throws Exception {
    Hits hits = new Hits();
    AtomicLong totalSeenByDelegate = new AtomicLong(-1);
    CountingHandler handler = new CountingHandler((request, response) -> {
      totalSeenByDelegate.set(hits.total());
      assertEquals(hits.successful(), 0);
    }, hits);

    handler.handle(null, null);

    assertEquals(totalSeenByDelegate.get(), 1);
    assertEquals(hits.total(), 1);
    assertEquals(hits.successful(), 1);
  }

  @Test
  public void failingDelegateOnlyCountsTheRequest() {
    Hits hits = new Hits();
    ServletException failure = new ServletException("boom");
    CountingHandler handler = new CountingHandler((request, response) -> {
      throw failure;
    }, hits);

    ServletException thrown = expectThrows(ServletException.class, () -> handler.handle(null, null));

    assertSame(thrown, failure);
    assertEquals(hits.total(), 1);
    assertEquals(hits.successful(), 0);
    assertEquals(hits.failed(), 1);
  }

  @Test
  public void uncheckedFailuresPropagateToo() {
    Hits hits = new Hits();
    CountingHandler handler = new CountingHandler((request, response) -> {
      throw new IllegalStateException("boom");
    }, hits);

    expectThrows(IllegalStateException.class, () -> handler.handle(null, null));
    assertEquals(hits.failed(), 1);
  }
}

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

import java.util.concurrent.atomic.AtomicLong;

/**
 * Request counters of a single test server.
 *
 * The total is incremented before a handler runs, the successful count after it returned, so
 * {@code 0 <= successful() <= total()} always holds, and a handler that threw leaves the total
 * ahead of the successful count.
 */
public final class Hits {

  private final AtomicLong total = new AtomicLong();
  private final AtomicLong successful = new AtomicLong();

  void received() {
    total.incrementAndGet();
  }

  void succeeded() {
    successful.incrementAndGet();
  }

  public long total() {
    return total.get();
  }

  public long successful() {
    return successful.get();
  }

  /**
   * The number of requests whose handler did not complete.
   *
   * Requests still in flight count as failed until their handler returns.
   */
  public long failed() {
    // Read successful first, so a concurrent completion can't make this negative.
    long done = successful.get();
    return total.get() - done;
  }

  @Override
  public String toString() {
    return "Hits(total=" + total() + ", successful=" + successful() + ")";
  }
}

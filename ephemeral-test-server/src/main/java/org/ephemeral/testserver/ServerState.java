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

/**
 * Lifecycle of a test server.
 *
 * A server only ever moves forward: {@code RUNNING -> SHUTDOWN_REQUESTED -> DRAINING -> STOPPED}.
 */
public enum ServerState {
  /** Accepting and serving requests. */
  RUNNING,
  /** Shutdown was triggered, the serving thread has not picked it up yet. */
  SHUTDOWN_REQUESTED,
  /** No new connections are accepted, in flight requests are finishing. */
  DRAINING,
  /** The backend has stopped and released its socket. */
  STOPPED
}

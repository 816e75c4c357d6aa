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
package org.ephemeral.testserver.verification;

import org.ephemeral.testserver.ServerBackend;

/**
 * Trait to allow mixing in a factory for server backends.
 */
public interface WithServerBackend {

  /**
   * Create a new, not yet started, backend.
   */
  ServerBackend createBackend();
}

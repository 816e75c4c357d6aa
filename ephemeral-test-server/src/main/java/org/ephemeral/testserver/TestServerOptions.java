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

import org.ephemeral.testserver.jetty.JettyServerBackend;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Options for starting a test server.
 *
 * The bind address is not configurable, test servers always listen on a port the operating system
 * assigns on {@code 127.0.0.1}.
 */
public final class TestServerOptions {

  public static final Duration DEFAULT_COMPLETION_TIMEOUT = Duration.ofSeconds(3);
  public static final Duration DEFAULT_DRAIN_TIMEOUT = Duration.ofSeconds(2);

  private static final TestServerOptions DEFAULTS = builder().build();

  private final Supplier<? extends ServerBackend> backend;
  private final Duration completionTimeout;
  private final Duration drainTimeout;

  private TestServerOptions(Builder builder) {
    this.backend = builder.backend;
    this.completionTimeout = builder.completionTimeout;
    this.drainTimeout = builder.drainTimeout;
  }

  public static TestServerOptions defaults() {
    return DEFAULTS;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a fresh backend for each server started with these options.
   */
  public Supplier<? extends ServerBackend> backend() {
    return backend;
  }

  /**
   * How long closing a server waits for the serving thread to report that it stopped.
   */
  public Duration completionTimeout() {
    return completionTimeout;
  }

  /**
   * How long in flight requests are given to finish when the server shuts down.
   */
  public Duration drainTimeout() {
    return drainTimeout;
  }

  public static final class Builder {
    private Supplier<? extends ServerBackend> backend = JettyServerBackend::new;
    private Duration completionTimeout = DEFAULT_COMPLETION_TIMEOUT;
    private Duration drainTimeout = DEFAULT_DRAIN_TIMEOUT;

    private Builder() {
    }

    public Builder backend(Supplier<? extends ServerBackend> backend) {
      this.backend = Objects.requireNonNull(backend, "backend");
      return this;
    }

    public Builder completionTimeout(Duration completionTimeout) {
      this.completionTimeout = requirePositive(completionTimeout, "completionTimeout");
      return this;
    }

    public Builder drainTimeout(Duration drainTimeout) {
      this.drainTimeout = requirePositive(drainTimeout, "drainTimeout");
      return this;
    }

    public TestServerOptions build() {
      return new TestServerOptions(this);
    }

    private static Duration requirePositive(Duration duration, String name) {
      Objects.requireNonNull(duration, name);
      if (duration.isNegative() || duration.isZero()) {
        throw new IllegalArgumentException(name + " must be positive, was " + duration);
      }
      return duration;
    }
  }
}

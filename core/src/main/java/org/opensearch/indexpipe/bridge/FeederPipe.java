/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.indexpipe.bridge;

import java.util.concurrent.atomic.AtomicReference;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import org.opensearch.indexpipe.exception.IndexPipeException;
import org.opensearch.indexpipe.pipe.Pipe;
import org.opensearch.indexpipe.pipe.PipeEngine;

/**
 * The throwaway pipe of one bridge call, ended exactly once: either by end-of-input, which flows
 * into the downstream pipe, or by destruction, which stays inside the feeder. Whichever comes first
 * wins; later calls do nothing.
 */
@Log4j2
class FeederPipe {

  /** Lifecycle of a feeder pipe. */
  enum State {
    RUNNING,
    FINISHED,
    DESTROYED
  }

  private final PipeEngine engine;
  @Getter private final Pipe pipe;
  private final AtomicReference<State> state = new AtomicReference<>(State.RUNNING);

  FeederPipe(PipeEngine engine, Pipe pipe) {
    this.engine = engine;
    this.pipe = pipe;
  }

  State getState() {
    return state.get();
  }

  /**
   * Ends the feeder's input.
   *
   * @return false if the feeder was already ended
   * @throws IndexPipeException if the engine rejects the end-of-input; the feeder is destroyed
   */
  boolean eoi() {
    if (!state.compareAndSet(State.RUNNING, State.FINISHED)) {
      return false;
    }
    try {
      engine.eoi(pipe);
    } catch (RuntimeException e) {
      IndexPipeException failure =
          new IndexPipeException(
              IndexPipeException.Reason.EOI_FAILED,
              "Could not end input of feeder pipe " + pipe.getPipeId(),
              e);
      state.set(State.DESTROYED);
      tearDown(failure);
      throw failure;
    }
    return true;
  }

  /**
   * Destroys the feeder. A failing teardown is recorded on {@code failure} rather than thrown, so
   * the caller still reports the original problem.
   *
   * @param failure the error that made the call give up
   * @return false if the feeder was already ended
   */
  boolean destroy(Exception failure) {
    if (!state.compareAndSet(State.RUNNING, State.DESTROYED)) {
      return false;
    }
    tearDown(failure);
    return true;
  }

  private void tearDown(Exception failure) {
    try {
      engine.destroy(pipe);
    } catch (RuntimeException e) {
      log.warn("Error destroying feeder pipe {}", pipe.getPipeId(), e);
      failure.addSuppressed(e);
    }
  }

  @Override
  public String toString() {
    return "FeederPipe{" + pipe.getPipeId() + ", " + state.get() + '}';
  }
}

/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.indexpipe.pipe;

import java.util.List;

/** Handle to a built pipe: an ordered chain of fittings ending in a sink. */
public interface Pipe {

  String getPipeId();

  /** Fittings in data-flow order; the first one receives the pipe's input. */
  List<Fitting> getFittings();

  /**
   * Returns the entry fitting.
   *
   * @throws IllegalStateException if the pipe has no fittings
   */
  default Fitting head() {
    List<Fitting> fittings = getFittings();
    if (fittings.isEmpty()) {
      throw new IllegalStateException("Pipe " + getPipeId() + " has no fittings");
    }
    return fittings.get(0);
  }
}

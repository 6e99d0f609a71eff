/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.indexpipe.pipe;

/**
 * Handle to one stage of a pipe. Records sent to a fitting are processed by its workers; a fitting
 * that has received end-of-input from all its feeders finishes its queued work and then forwards
 * end-of-input to its own output.
 *
 * <p>A fitting handle can be shared: a pipe may name another pipe's fitting as its sink. The holder
 * of such a reference may feed the fitting and end its input, nothing else.
 */
public interface Fitting {

  /** Returns the fitting name, unique within its pipe. */
  String getName();

  /**
   * Delivers one input record to this fitting.
   *
   * @param input the record
   */
  void send(Object input);

  /** Signals that the feeder calling this will deliver no more records. */
  void eoi();
}

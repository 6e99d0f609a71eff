/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.indexpipe.pipe;

/**
 * Worker logic of a fitting, instantiated once per partition the fitting runs on.
 *
 * <p>Lifecycle:
 *
 * <ol>
 *   <li>{@link #init(Partition, FittingDetails)} once, before any input
 *   <li>{@link #process(Object, boolean)} once per input, sequentially, in queue order
 *   <li>{@link #done()} once, after end-of-input, when the queue has drained
 * </ol>
 *
 * A destroyed pipe interrupts the thread running {@link #process(Object, boolean)} and never calls
 * {@link #done()}.
 *
 * @param <I> input type
 */
public interface PartitionWorker<I> {

  /**
   * Prepares the worker.
   *
   * @param partition the partition this worker runs on
   * @param details the fitting this worker belongs to, including its output
   */
  void init(Partition partition, FittingDetails details);

  /**
   * Processes one input. Outputs are sent through {@link FittingDetails#sendOutput(Object)}.
   *
   * @param input the input
   * @param last true if the framework knows no more input will reach this worker
   * @throws InterruptedException if the pipe is destroyed while the worker is blocked
   */
  void process(I input, boolean last) throws InterruptedException;

  /** Called after the last input has been processed. */
  void done();
}

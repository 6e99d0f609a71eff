/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.indexpipe.pipe;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Builds, feeds and tears down pipes. Implemented by the pipeline execution library; this project
 * only consumes it.
 */
public interface PipeEngine {

  /**
   * Builds a pipe.
   *
   * @param specs the fittings, in data-flow order
   * @param options build options, including the sink
   * @return the running pipe
   */
  Pipe exec(List<FittingSpec> specs, PipeOptions options);

  /**
   * Signals end-of-input to the pipe's head. Each fitting drains, calls {@link
   * PartitionWorker#done()} on its workers and passes end-of-input on; the last fitting passes it
   * to the sink.
   */
  void eoi(Pipe pipe);

  /**
   * Tears the pipe down: queued inputs are dropped and running workers interrupted. The sink is not
   * notified in any way. Destroying a pipe twice has no effect.
   */
  void destroy(Pipe pipe);

  /**
   * Hands one input directly to the head fitting's worker at a given partition.
   *
   * @return completes when the worker has processed the input, exceptionally if it failed
   */
  CompletableFuture<Void> queueWork(Pipe pipe, Partition partition, Object input);
}

/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.indexpipe.pipe;

/**
 * Creates the per-partition workers of a fitting. The engine asks for a new worker the first time
 * input reaches a partition.
 *
 * @param <I> input type accepted by the workers
 */
public interface PartitionWorkerFactory<I> {

  /** Creates a new, uninitialized worker. */
  PartitionWorker<I> createWorker();

  /** Type of input the workers accept; other inputs are rejected by the engine. */
  Class<I> inputType();
}

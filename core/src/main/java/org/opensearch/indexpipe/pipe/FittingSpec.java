/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.indexpipe.pipe;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Declares one fitting of a pipe to be built.
 *
 * @param name fitting name, unique within the pipe
 * @param workerFactory creates the fitting's per-partition workers
 * @param nval number of partitions one input may be routed to before it is rejected
 */
public record FittingSpec(String name, PartitionWorkerFactory<?> workerFactory, int nval) {

  public FittingSpec {
    checkNotNull(name, "name");
    checkArgument(!name.isEmpty(), "fitting name must not be empty");
    checkNotNull(workerFactory, "worker factory");
    checkArgument(nval >= 1, "nval must be at least 1, got %s", nval);
  }
}

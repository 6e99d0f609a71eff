/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.indexpipe.coverage;

import org.opensearch.indexpipe.correlation.ReplyTarget;
import org.opensearch.indexpipe.exception.CoverageException;

/**
 * Runs coverage operations: selects a set of partitions that together see every replica of a bucket
 * exactly once, queues one {@link org.opensearch.indexpipe.scan.IndexScanInput.CoverageScan} per
 * partition into the request's pipe and reports the outcome. Retries, if any, happen here.
 */
public interface CoverageDispatcher {

  /**
   * Starts a coverage operation. The outcome is sent to {@code replyTo} as one {@link
   * CoverageReply}.
   *
   * @param replyTo where the terminal reply goes
   * @param request what to cover
   * @return handle to the running operation
   * @throws CoverageException if the operation could not be started
   */
  DispatcherHandle start(ReplyTarget<CoverageReply> replyTo, CoverageRequest request);
}

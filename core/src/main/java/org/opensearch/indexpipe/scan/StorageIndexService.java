/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.indexpipe.scan;

import org.opensearch.indexpipe.correlation.ReplyTarget;
import org.opensearch.indexpipe.exception.DispatchException;
import org.opensearch.indexpipe.pipe.Partition;

/** Index lookup of the storage layer, answered asynchronously. */
public interface StorageIndexService {

  /**
   * Starts an index scan on one partition. Replies go to {@code replyTo} as described by {@link
   * ScanReply}.
   *
   * @param job the scan
   * @param partition the partition to scan
   * @param replyTo where replies are sent
   * @throws DispatchException if the scan could not be issued
   */
  void scan(ScanJob job, Partition partition, ReplyTarget<ScanReply> replyTo);
}

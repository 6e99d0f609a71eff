/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.indexpipe.scan;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableSet;
import java.util.Set;
import org.opensearch.indexpipe.pipe.Partition;
import org.opensearch.indexpipe.query.BucketOrFilter;
import org.opensearch.indexpipe.query.IndexQuery;

/**
 * One index scan as sent to the storage layer of a single partition.
 *
 * @param target bucket, optionally with key filters
 * @param query the index predicate
 * @param filterPartitions partitions whose replica data the scan is restricted to; empty for a
 *     plain local scan
 */
public record ScanJob(BucketOrFilter target, IndexQuery query, Set<Partition> filterPartitions) {

  public ScanJob {
    checkNotNull(target, "target");
    checkNotNull(query, "query");
    filterPartitions = ImmutableSet.copyOf(checkNotNull(filterPartitions, "filter partitions"));
  }

  /** True when the scan is one part of a coverage operation. */
  public boolean isCoverage() {
    return !filterPartitions.isEmpty();
  }
}

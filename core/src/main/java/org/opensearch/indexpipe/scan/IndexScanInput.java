/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.indexpipe.scan;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableSet;
import java.util.Set;
import org.opensearch.indexpipe.pipe.Partition;
import org.opensearch.indexpipe.query.BucketOrFilter;
import org.opensearch.indexpipe.query.IndexQuery;

/** Input accepted by the index fitting. */
public sealed interface IndexScanInput {

  BucketOrFilter target();

  IndexQuery query();

  /** Converts the input to the job sent to the storage layer. */
  ScanJob toJob();

  /** Scans everything the local partition holds for the target. */
  record PlainScan(BucketOrFilter target, IndexQuery query) implements IndexScanInput {

    public PlainScan {
      checkNotNull(target, "target");
      checkNotNull(query, "query");
    }

    @Override
    public ScanJob toJob() {
      return new ScanJob(target, query, Set.of());
    }
  }

  /** One part of a coverage operation, restricted to the given partitions' replica data. */
  record CoverageScan(Set<Partition> filterPartitions, BucketOrFilter target, IndexQuery query)
      implements IndexScanInput {

    public CoverageScan {
      checkNotNull(filterPartitions, "filter partitions");
      checkArgument(!filterPartitions.isEmpty(), "coverage scan needs at least one partition");
      checkNotNull(target, "target");
      checkNotNull(query, "query");
      filterPartitions = ImmutableSet.copyOf(filterPartitions);
    }

    @Override
    public ScanJob toJob() {
      return new ScanJob(target, query, filterPartitions);
    }
  }
}

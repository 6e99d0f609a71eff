/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.indexpipe.coverage;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import org.opensearch.indexpipe.pipe.Pipe;
import org.opensearch.indexpipe.query.BucketOrFilter;
import org.opensearch.indexpipe.query.IndexQuery;

/**
 * Arguments of one coverage operation.
 *
 * @param pipe pipe whose head fitting receives one coverage scan per chosen partition
 * @param target bucket, optionally with key filters
 * @param query the index predicate
 * @param nval replication factor of the bucket, which decides how many partitions may be skipped
 */
public record CoverageRequest(Pipe pipe, BucketOrFilter target, IndexQuery query, int nval) {

  public CoverageRequest {
    checkNotNull(pipe, "pipe");
    checkNotNull(target, "target");
    checkNotNull(query, "query");
    checkArgument(nval >= 1, "nval must be at least 1, got %s", nval);
  }
}

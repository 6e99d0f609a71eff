/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.indexpipe.query;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Target of an index scan: a bucket, optionally with key-filter expressions that the storage layer
 * applies to every candidate key before replying. The filter expressions are opaque here.
 */
public record BucketOrFilter(String bucket, List<Object> keyFilters) {

  public BucketOrFilter {
    checkNotNull(bucket, "bucket");
    checkArgument(!bucket.isEmpty(), "bucket must not be empty");
    keyFilters = ImmutableList.copyOf(checkNotNull(keyFilters, "key filters"));
  }

  /** A whole bucket, no key filtering. */
  public static BucketOrFilter bucket(String bucket) {
    return new BucketOrFilter(bucket, List.of());
  }

  /** A bucket narrowed by key-filter expressions. */
  public static BucketOrFilter filtered(String bucket, List<?> keyFilters) {
    return new BucketOrFilter(bucket, ImmutableList.<Object>copyOf(keyFilters));
  }

  public boolean hasKeyFilters() {
    return !keyFilters.isEmpty();
  }

  @Override
  public String toString() {
    return hasKeyFilters() ? bucket + keyFilters : bucket;
  }
}

/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.indexpipe.query;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Matches entries whose index value lies in {@code [start, end]}, both ends inclusive. Bounds are
 * compared with their natural ordering, so they must be {@link Comparable} to each other. A value
 * of an unrelated type never matches.
 */
public record RangeQuery(String indexName, Object start, Object end) implements IndexQuery {

  public RangeQuery {
    checkNotNull(indexName, "index name");
    checkArgument(!indexName.isEmpty(), "index name must not be empty");
    checkNotNull(start, "start");
    checkNotNull(end, "end");
    checkArgument(
        start instanceof Comparable && end instanceof Comparable,
        "range bounds must be comparable, got %s and %s",
        start.getClass().getSimpleName(),
        end.getClass().getSimpleName());
  }

  @Override
  public boolean matches(Object candidate) {
    if (candidate == null) {
      return false;
    }
    try {
      return compare(start, candidate) <= 0 && compare(candidate, end) <= 0;
    } catch (ClassCastException e) {
      return false;
    }
  }

  @SuppressWarnings({"unchecked", "rawtypes"})
  private static int compare(Object left, Object right) {
    if (!(left instanceof Comparable comparable)) {
      throw new ClassCastException(left.getClass().getName() + " is not comparable");
    }
    return comparable.compareTo(right);
  }
}

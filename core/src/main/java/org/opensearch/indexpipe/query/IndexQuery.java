/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.indexpipe.query;

/**
 * A predicate over one secondary index. Either an exact match ({@link EqualityQuery}) or an
 * inclusive range ({@link RangeQuery}).
 */
public sealed interface IndexQuery permits EqualityQuery, RangeQuery {

  /** Name of the index the predicate applies to. */
  String indexName();

  /**
   * Tests one index value against this predicate.
   *
   * @param value the indexed value of an entry
   * @return true if the entry matches
   */
  boolean matches(Object value);

  static EqualityQuery eq(String indexName, Object value) {
    return new EqualityQuery(indexName, value);
  }

  static RangeQuery range(String indexName, Object start, Object end) {
    return new RangeQuery(indexName, start, end);
  }
}

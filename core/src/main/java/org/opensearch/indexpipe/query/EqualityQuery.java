/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.indexpipe.query;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/** Matches entries whose index value equals {@code value}. */
public record EqualityQuery(String indexName, Object value) implements IndexQuery {

  public EqualityQuery {
    checkNotNull(indexName, "index name");
    checkArgument(!indexName.isEmpty(), "index name must not be empty");
    checkNotNull(value, "value");
  }

  @Override
  public boolean matches(Object candidate) {
    return value.equals(candidate);
  }
}

/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.indexpipe.coverage;

/** Looks up bucket properties held by cluster metadata. */
@FunctionalInterface
public interface ReplicationFactorLookup {

  /**
   * Returns the replication factor (n-value) of a bucket.
   *
   * @param bucket the bucket name
   * @return n-value, at least 1
   */
  int replicationFactor(String bucket);
}

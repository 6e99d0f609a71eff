/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.indexpipe.pipe;

/** A unit of data ownership in the storage layer, identified by its position on the ring. */
public record Partition(long index) {

  @Override
  public String toString() {
    return "partition-" + index;
  }
}

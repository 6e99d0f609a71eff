/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.indexpipe.correlation;

/** Token carried by a request and every reply to it. Only meaningful while the request is open. */
public record CorrelationId(long value) {

  @Override
  public String toString() {
    return Long.toHexString(value);
  }
}

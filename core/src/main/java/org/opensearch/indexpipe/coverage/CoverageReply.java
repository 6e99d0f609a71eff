/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.indexpipe.coverage;

/** Terminal message of a coverage operation. Exactly one is sent per operation. */
public sealed interface CoverageReply {

  static CoverageDone done() {
    return new CoverageDone();
  }

  static CoverageFailed failed(String reason) {
    return new CoverageFailed(reason);
  }

  /** Every covering partition finished its scan. */
  record CoverageDone() implements CoverageReply {}

  /** A partition failed and the dispatcher gave up. */
  record CoverageFailed(String reason) implements CoverageReply {}
}

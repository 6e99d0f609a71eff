/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.indexpipe.exception;

import lombok.Getter;

/** Base class of every failure reported by an index pipe operation. */
public class IndexPipeException extends RuntimeException {

  /** Failure categories a caller can branch on. */
  public enum Reason {
    CONSTRUCTION_FAILED,
    DISPATCH_FAILED,
    COVERAGE_FAILED,
    TIMEOUT,
    INTERRUPTED,
    EOI_FAILED
  }

  @Getter private final Reason reason;

  public IndexPipeException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public IndexPipeException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }
}

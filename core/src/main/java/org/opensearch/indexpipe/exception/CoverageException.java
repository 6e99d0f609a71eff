/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.indexpipe.exception;

/** The coverage operation failed, could not be started, or its dispatcher exited abnormally. */
public class CoverageException extends IndexPipeException {

  public CoverageException(String message) {
    super(Reason.COVERAGE_FAILED, message);
  }

  public CoverageException(String message, Throwable cause) {
    super(Reason.COVERAGE_FAILED, message, cause);
  }
}

/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.indexpipe.exception;

/** Neither completion nor failure of the coverage operation arrived within the caller's timeout. */
public class PipeTimeoutException extends IndexPipeException {

  public PipeTimeoutException(String message) {
    super(Reason.TIMEOUT, message);
  }
}

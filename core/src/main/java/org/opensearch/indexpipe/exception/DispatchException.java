/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.indexpipe.exception;

/**
 * A scan could not be issued to the storage layer, or the storage layer answered it with an error
 * instead of keys.
 */
public class DispatchException extends IndexPipeException {

  public DispatchException(String message) {
    super(Reason.DISPATCH_FAILED, message);
  }

  public DispatchException(String message, Throwable cause) {
    super(Reason.DISPATCH_FAILED, message, cause);
  }
}

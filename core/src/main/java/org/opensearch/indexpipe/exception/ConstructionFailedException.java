/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.indexpipe.exception;

/** The feeder pipe could not be built. Nothing was created, so nothing needs cleaning up. */
public class ConstructionFailedException extends IndexPipeException {

  public ConstructionFailedException(String message) {
    super(Reason.CONSTRUCTION_FAILED, message);
  }

  public ConstructionFailedException(String message, Throwable cause) {
    super(Reason.CONSTRUCTION_FAILED, message, cause);
  }
}

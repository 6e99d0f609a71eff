/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.indexpipe.coverage;

import java.util.concurrent.CompletionStage;

/** Handle to a running coverage operation. */
public interface DispatcherHandle {

  /**
   * Completes when the dispatcher exits: normally after it sent its terminal reply, exceptionally
   * if it crashed.
   */
  CompletionStage<Void> termination();
}

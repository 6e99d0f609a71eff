/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.indexpipe.pipe;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/** What a worker knows about the fitting it runs in: its identity and where its output goes. */
@Getter
@ToString(exclude = "output")
@RequiredArgsConstructor
public class FittingDetails {

  private final String pipeId;
  private final String name;
  private final int nval;
  private final Fitting output;

  /**
   * Sends one output record to the next fitting, or to the sink for the last fitting.
   *
   * @param record the record
   */
  public void sendOutput(Object record) {
    output.send(record);
  }
}

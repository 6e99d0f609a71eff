/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.indexpipe.pipe;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Build options of a pipe.
 *
 * @param sink where the last fitting's output goes; the pipe does not own it
 */
public record PipeOptions(Fitting sink) {

  public PipeOptions {
    checkNotNull(sink, "sink");
  }

  public static PipeOptions withSink(Fitting sink) {
    return new PipeOptions(sink);
  }
}

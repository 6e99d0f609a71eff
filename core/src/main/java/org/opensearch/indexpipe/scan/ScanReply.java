/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.indexpipe.scan;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Message from the storage layer answering one scan. A scan is answered by zero or more {@link
 * KeyBatch}es followed by exactly one {@link ScanDone}, or by a {@link ScanFailed} that replaces
 * the rest of the stream.
 */
public sealed interface ScanReply {

  static KeyBatch keys(String bucket, List<String> keys) {
    return new KeyBatch(bucket, keys);
  }

  static ScanDone done() {
    return new ScanDone();
  }

  static ScanFailed failed(String reason) {
    return new ScanFailed(reason);
  }

  /** Matching keys found in one bucket, in storage order. */
  record KeyBatch(String bucket, List<String> keys) implements ScanReply {

    public KeyBatch {
      keys = ImmutableList.copyOf(keys);
    }
  }

  /** No more replies will follow. */
  record ScanDone() implements ScanReply {}

  /** The scan failed on the storage side. */
  record ScanFailed(String reason) implements ScanReply {}
}

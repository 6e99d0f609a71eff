/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.indexpipe.scan;

import lombok.RequiredArgsConstructor;
import org.opensearch.indexpipe.correlation.RequestCorrelator;
import org.opensearch.indexpipe.pipe.PartitionWorker;
import org.opensearch.indexpipe.pipe.PartitionWorkerFactory;

/** Creates {@link IndexScanWorker}s sharing one storage service and correlator. */
@RequiredArgsConstructor
public class IndexScanWorkerFactory implements PartitionWorkerFactory<IndexScanInput> {

  private final StorageIndexService storage;
  private final RequestCorrelator correlator;

  @Override
  public PartitionWorker<IndexScanInput> createWorker() {
    return new IndexScanWorker(storage, correlator);
  }

  @Override
  public Class<IndexScanInput> inputType() {
    return IndexScanInput.class;
  }
}

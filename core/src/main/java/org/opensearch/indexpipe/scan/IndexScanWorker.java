/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.indexpipe.scan;

import static com.google.common.base.Preconditions.checkState;

import lombok.extern.log4j.Log4j2;
import org.opensearch.indexpipe.correlation.PendingRequest;
import org.opensearch.indexpipe.correlation.RequestCorrelator;
import org.opensearch.indexpipe.exception.DispatchException;
import org.opensearch.indexpipe.pipe.FittingDetails;
import org.opensearch.indexpipe.pipe.Partition;
import org.opensearch.indexpipe.pipe.PartitionWorker;
import org.opensearch.indexpipe.scan.ScanReply.KeyBatch;
import org.opensearch.indexpipe.scan.ScanReply.ScanDone;
import org.opensearch.indexpipe.scan.ScanReply.ScanFailed;

/**
 * Worker of the index fitting. Queries the index store of the partition it runs on and emits one
 * {@link BucketKey} per matching key.
 *
 * <p>Each input becomes one scan request to the storage layer, correlated by a fresh id. The worker
 * then blocks on the replies for that id and sends every key on as soon as its batch arrives, so
 * memory is bounded by one batch and downstream fittings start before the scan ends. Keys leave in
 * the order the batches arrived; nothing is sorted.
 *
 * <p>The receive loop has no timeout. It ends on the storage layer's done reply, a failure reply,
 * or when the pipe is destroyed and the worker thread interrupted.
 */
@Log4j2
public class IndexScanWorker implements PartitionWorker<IndexScanInput> {

  private final StorageIndexService storage;
  private final RequestCorrelator correlator;

  private Partition partition;
  private FittingDetails details;

  public IndexScanWorker(StorageIndexService storage, RequestCorrelator correlator) {
    this.storage = storage;
    this.correlator = correlator;
  }

  @Override
  public void init(Partition partition, FittingDetails details) {
    this.partition = partition;
    this.details = details;
  }

  @Override
  public void process(IndexScanInput input, boolean last) throws InterruptedException {
    checkState(details != null, "worker used before init");
    ScanJob job = input.toJob();
    try (PendingRequest<ScanReply> request = correlator.open()) {
      dispatch(job, request);
      long sent = keysendLoop(request);
      log.debug(
          "Index scan {} on {} sent {} keys for {}, partition filter {}",
          request.getCorrelationId(),
          partition,
          sent,
          job.target(),
          job.filterPartitions());
    }
  }

  @Override
  public void done() {}

  private void dispatch(ScanJob job, PendingRequest<ScanReply> request) {
    try {
      storage.scan(job, partition, request.replyTarget());
    } catch (DispatchException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new DispatchException(
          "Could not issue index scan on " + partition + ": " + e.getMessage(), e);
    }
  }

  private long keysendLoop(PendingRequest<ScanReply> request) throws InterruptedException {
    long sent = 0;
    while (true) {
      ScanReply reply = request.take();
      if (reply instanceof KeyBatch batch) {
        sent += keysend(batch);
      } else if (reply instanceof ScanDone) {
        return sent;
      } else if (reply instanceof ScanFailed failed) {
        throw new DispatchException(
            "Index scan " + request.getCorrelationId() + " on " + partition + " failed: "
                + failed.reason());
      } else {
        throw new IllegalStateException("Unexpected scan reply " + reply);
      }
    }
  }

  private int keysend(KeyBatch batch) {
    for (String key : batch.keys()) {
      details.sendOutput(new BucketKey(batch.bucket(), key));
    }
    return batch.keys().size();
  }
}

/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.indexpipe.bridge;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.List;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import lombok.extern.log4j.Log4j2;
import org.opensearch.common.unit.TimeValue;
import org.opensearch.indexpipe.common.response.ResponseListener;
import org.opensearch.indexpipe.common.setting.IndexPipeSettings;
import org.opensearch.indexpipe.correlation.PendingRequest;
import org.opensearch.indexpipe.correlation.ReplyTarget;
import org.opensearch.indexpipe.correlation.RequestCorrelator;
import org.opensearch.indexpipe.coverage.CoverageDispatcher;
import org.opensearch.indexpipe.coverage.CoverageReply;
import org.opensearch.indexpipe.coverage.CoverageReply.CoverageDone;
import org.opensearch.indexpipe.coverage.CoverageReply.CoverageFailed;
import org.opensearch.indexpipe.coverage.CoverageRequest;
import org.opensearch.indexpipe.coverage.DispatcherHandle;
import org.opensearch.indexpipe.coverage.ReplicationFactorLookup;
import org.opensearch.indexpipe.exception.ConstructionFailedException;
import org.opensearch.indexpipe.exception.CoverageException;
import org.opensearch.indexpipe.exception.IndexPipeException;
import org.opensearch.indexpipe.exception.PipeTimeoutException;
import org.opensearch.indexpipe.pipe.Fitting;
import org.opensearch.indexpipe.pipe.FittingSpec;
import org.opensearch.indexpipe.pipe.Pipe;
import org.opensearch.indexpipe.pipe.PipeEngine;
import org.opensearch.indexpipe.pipe.PipeOptions;
import org.opensearch.indexpipe.query.BucketOrFilter;
import org.opensearch.indexpipe.query.IndexQuery;
import org.opensearch.indexpipe.scan.IndexScanWorkerFactory;
import org.opensearch.indexpipe.scan.StorageIndexService;

/**
 * Lists index matches directly into an existing pipe.
 *
 * <ol>
 *   <li>Builds a feeder pipe with a single index fitting whose sink is the head of the downstream
 *       pipe
 *   <li>Looks up the bucket's replication factor
 *   <li>Starts a coverage operation that queues one scan per covering partition into the feeder
 *   <li>Waits for the coverage outcome or the timeout, whichever comes first
 *   <li>On success ends the feeder's input, which flows on into the downstream pipe; otherwise
 *       destroys the feeder, leaving the downstream pipe untouched
 * </ol>
 *
 * <p>The downstream pipe is never destroyed by this class. After a failed call it may have received
 * some records and no end-of-input.
 */
@Log4j2
public class PipelineBridge {

  private final PipeEngine pipeEngine;
  private final CoverageDispatcher coverageDispatcher;
  private final ReplicationFactorLookup replicationFactorLookup;
  private final RequestCorrelator correlator;
  private final IndexScanWorkerFactory workerFactory;
  private final IndexPipeSettings settings;

  public PipelineBridge(
      PipeEngine pipeEngine,
      CoverageDispatcher coverageDispatcher,
      ReplicationFactorLookup replicationFactorLookup,
      StorageIndexService storage,
      RequestCorrelator correlator,
      IndexPipeSettings settings) {
    this.pipeEngine = pipeEngine;
    this.coverageDispatcher = coverageDispatcher;
    this.replicationFactorLookup = replicationFactorLookup;
    this.correlator = correlator;
    this.workerFactory = new IndexScanWorkerFactory(storage, correlator);
    this.settings = settings;
  }

  /**
   * Same as {@link #queueExistingPipe(Pipe, BucketOrFilter, IndexQuery, TimeValue)} with the
   * configured timeout.
   */
  public void queueExistingPipe(Pipe downstream, BucketOrFilter target, IndexQuery query) {
    queueExistingPipe(downstream, target, query, settings.getQueueTimeout());
  }

  /**
   * Queries an index and sends every matching {@code BucketKey} into {@code downstream}.
   *
   * @param downstream pipe receiving the keys; only its head fitting is used
   * @param target bucket to scan, optionally with key filters
   * @param query the index predicate
   * @param timeout how long to wait for the coverage operation
   * @throws ConstructionFailedException if the feeder pipe could not be built
   * @throws CoverageException if the coverage operation failed or could not be started
   * @throws PipeTimeoutException if the coverage operation did not finish in time
   * @throws IndexPipeException if the caller was interrupted or end-of-input failed
   */
  public void queueExistingPipe(
      Pipe downstream, BucketOrFilter target, IndexQuery query, TimeValue timeout) {
    checkNotNull(downstream, "downstream pipe");
    checkNotNull(target, "target");
    checkNotNull(query, "query");
    checkArgument(timeout.nanos() >= 0, "timeout must not be negative, got %s", timeout);

    long startNanos = System.nanoTime();
    long deadlineNanos = startNanos + timeout.nanos();
    FeederPipe feeder = buildFeeder(downstream);
    try (PendingRequest<CoverageReply> request = correlator.open()) {
      startCoverage(feeder, request.replyTarget(), target, query);
      awaitCoverage(feeder, request, timeout, deadlineNanos);
    }
    log.info(
        "Index pipe {} fed {} from {} in {}ms",
        feeder.getPipe().getPipeId(),
        downstream.getPipeId(),
        target,
        TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
  }

  /**
   * Runs {@link #queueExistingPipe(Pipe, BucketOrFilter, IndexQuery, TimeValue)} on {@code
   * executor} and reports the outcome to {@code listener}.
   */
  public void queueExistingPipe(
      Pipe downstream,
      BucketOrFilter target,
      IndexQuery query,
      TimeValue timeout,
      Executor executor,
      ResponseListener<Void> listener) {
    executor.execute(
        () -> {
          try {
            queueExistingPipe(downstream, target, query, timeout);
          } catch (Exception e) {
            listener.onFailure(e);
            return;
          }
          listener.onResponse(null);
        });
  }

  private FeederPipe buildFeeder(Pipe downstream) {
    Fitting head;
    try {
      head = downstream.head();
    } catch (IllegalStateException e) {
      throw new ConstructionFailedException(
          "Downstream pipe " + downstream.getPipeId() + " has no fitting to feed", e);
    }

    FittingSpec spec =
        new FittingSpec(settings.getFittingName(), workerFactory, settings.getFittingNval());
    try {
      return new FeederPipe(pipeEngine, pipeEngine.exec(List.of(spec), PipeOptions.withSink(head)));
    } catch (RuntimeException e) {
      throw new ConstructionFailedException(
          "Could not build index pipe feeding " + downstream.getPipeId() + ": " + e.getMessage(),
          e);
    }
  }

  private void startCoverage(
      FeederPipe feeder,
      ReplyTarget<CoverageReply> replyTo,
      BucketOrFilter target,
      IndexQuery query) {
    try {
      int nval = replicationFactorLookup.replicationFactor(target.bucket());
      DispatcherHandle handle =
          coverageDispatcher.start(
              replyTo, new CoverageRequest(feeder.getPipe(), target, query, nval));
      checkNotNull(handle, "coverage dispatcher returned no handle");
      CompletionStage<Void> termination =
          checkNotNull(handle.termination(), "coverage dispatcher has no termination stage");

      // A crashed dispatcher never replies; turn its exit into a failure reply.
      termination.whenComplete(
          (ignored, crash) -> {
            if (crash != null) {
              replyTo.reply(CoverageReply.failed("dispatcher exited: " + crash));
            }
          });
    } catch (RuntimeException e) {
      CoverageException failure =
          e instanceof CoverageException coverageException
              ? coverageException
              : new CoverageException(
                  "Could not start coverage of " + target + ": " + e.getMessage(), e);
      feeder.destroy(failure);
      throw failure;
    }
    log.debug("Coverage {} started for {} on {}", replyTo.getCorrelationId(), query, target);
  }

  private void awaitCoverage(
      FeederPipe feeder,
      PendingRequest<CoverageReply> request,
      TimeValue timeout,
      long deadlineNanos) {
    CoverageReply reply;
    try {
      long remaining = Math.max(0, deadlineNanos - System.nanoTime());
      reply = request.poll(remaining, TimeUnit.NANOSECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      IndexPipeException failure =
          new IndexPipeException(
              IndexPipeException.Reason.INTERRUPTED,
              "Interrupted while waiting for coverage " + request.getCorrelationId(),
              e);
      feeder.destroy(failure);
      throw failure;
    }

    if (reply instanceof CoverageDone) {
      feeder.eoi();
      return;
    }

    IndexPipeException failure;
    if (reply == null) {
      failure =
          new PipeTimeoutException(
              "Coverage " + request.getCorrelationId() + " did not finish within " + timeout);
    } else if (reply instanceof CoverageFailed failed) {
      failure = new CoverageException(failed.reason());
    } else {
      failure = new CoverageException("Unexpected coverage reply " + reply);
    }
    log.info(
        "Destroying feeder pipe {} after coverage {} failed: {}",
        feeder.getPipe().getPipeId(),
        request.getCorrelationId(),
        failure.getMessage());
    feeder.destroy(failure);
    throw failure;
  }
}

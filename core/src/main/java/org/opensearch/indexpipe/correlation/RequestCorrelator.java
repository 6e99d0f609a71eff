/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.indexpipe.correlation;

import com.google.common.annotations.VisibleForTesting;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.LongSupplier;

/**
 * Issues correlation ids and the mailboxes that collect replies for them.
 *
 * <p>Ids are drawn at random and re-drawn while they collide with a request that is still open, so
 * they are unique among outstanding requests of this correlator. Nothing is guaranteed across
 * requests that have already been closed.
 */
public class RequestCorrelator {

  private final Set<CorrelationId> outstanding = ConcurrentHashMap.newKeySet();
  private final LongSupplier idSource;

  public RequestCorrelator() {
    this(() -> ThreadLocalRandom.current().nextLong());
  }

  @VisibleForTesting
  RequestCorrelator(LongSupplier idSource) {
    this.idSource = idSource;
  }

  /**
   * Opens a new request.
   *
   * @param <M> reply message type
   * @return the request, to be closed by the caller once it no longer expects replies
   */
  public <M> PendingRequest<M> open() {
    CorrelationId id;
    do {
      id = new CorrelationId(idSource.getAsLong());
    } while (!outstanding.add(id));
    return new PendingRequest<>(id, this);
  }

  /** Number of requests opened and not yet closed. */
  public int outstanding() {
    return outstanding.size();
  }

  void release(CorrelationId id) {
    outstanding.remove(id);
  }
}

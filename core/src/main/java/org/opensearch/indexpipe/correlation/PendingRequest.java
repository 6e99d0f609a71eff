/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.indexpipe.correlation;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;

/**
 * The receiving end of one outstanding request: a mailbox that only holds replies carrying this
 * request's correlation id. Closing the request unregisters the id; replies that arrive later are
 * dropped.
 *
 * @param <M> reply message type
 */
@Log4j2
public class PendingRequest<M> implements AutoCloseable {

  @Getter private final CorrelationId correlationId;
  private final RequestCorrelator correlator;
  private final BlockingQueue<M> mailbox = new LinkedBlockingQueue<>();
  // Guards closed together with the mailbox, so no reply is accepted once close has cleared it.
  private final Object lock = new Object();
  private volatile boolean closed;
  private final ReplyTarget<M> replyTarget;

  PendingRequest(CorrelationId correlationId, RequestCorrelator correlator) {
    this.correlationId = correlationId;
    this.correlator = correlator;
    this.replyTarget = new ReplyTarget<>(this);
  }

  /** Address to pass along with the request. */
  public ReplyTarget<M> replyTarget() {
    return replyTarget;
  }

  /** Blocks until the next reply arrives. */
  public M take() throws InterruptedException {
    return mailbox.take();
  }

  /**
   * Blocks until the next reply arrives or the timeout elapses.
   *
   * @return the reply, or null on timeout
   */
  public M poll(long timeout, TimeUnit unit) throws InterruptedException {
    return mailbox.poll(timeout, unit);
  }

  public boolean isClosed() {
    return closed;
  }

  boolean offer(M message) {
    synchronized (lock) {
      if (!closed) {
        return mailbox.offer(message);
      }
    }
    log.debug("Dropping reply for closed request {}: {}", correlationId, message);
    return false;
  }

  @Override
  public void close() {
    synchronized (lock) {
      if (closed) {
        return;
      }
      closed = true;
      mailbox.clear();
    }
    correlator.release(correlationId);
  }
}

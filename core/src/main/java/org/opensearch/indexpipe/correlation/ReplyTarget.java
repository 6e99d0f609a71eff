/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.indexpipe.correlation;

/**
 * Address handed to a remote party so that it can answer one specific request. Every message sent
 * through it is implicitly tagged with the request's {@link CorrelationId}.
 *
 * @param <M> reply message type
 */
public final class ReplyTarget<M> {

  private final PendingRequest<M> request;

  ReplyTarget(PendingRequest<M> request) {
    this.request = request;
  }

  public CorrelationId getCorrelationId() {
    return request.getCorrelationId();
  }

  /**
   * Sends a reply to the request.
   *
   * @param message the reply
   * @return false if the request is already closed and the reply was dropped
   */
  public boolean reply(M message) {
    return request.offer(message);
  }

  @Override
  public String toString() {
    return "ReplyTarget{" + getCorrelationId() + '}';
  }
}

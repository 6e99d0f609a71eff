/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.indexpipe.common.response;

/**
 * Response listener for asynchronous operations.
 *
 * @param <Response> response type
 */
public interface ResponseListener<Response> {

  /**
   * Handle the response of a successful operation.
   *
   * @param response operation result, may be null for operations without a result
   */
  void onResponse(Response response);

  /**
   * Handle the failure of an operation.
   *
   * @param e the failure
   */
  void onFailure(Exception e);
}

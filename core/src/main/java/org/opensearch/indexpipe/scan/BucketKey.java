/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.indexpipe.scan;

/** Record emitted by the index fitting for every matching key. */
public record BucketKey(String bucket, String key) {}

/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.indexpipe.fixture;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.opensearch.indexpipe.pipe.Fitting;

/** Sink fitting that remembers every record and end-of-input it receives. */
public class RecordingFitting implements Fitting {

  private final String name;
  private final List<Object> records = new ArrayList<>();
  private final AtomicInteger eoiCount = new AtomicInteger();
  private final CountDownLatch eoiLatch = new CountDownLatch(1);

  public RecordingFitting(String name) {
    this.name = name;
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public synchronized void send(Object input) {
    records.add(input);
  }

  @Override
  public void eoi() {
    eoiCount.incrementAndGet();
    eoiLatch.countDown();
  }

  public synchronized List<Object> records() {
    return List.copyOf(records);
  }

  public int eoiCount() {
    return eoiCount.get();
  }

  /** Waits for the first end-of-input; true if it arrived in time. */
  public boolean awaitEoi(long timeout, TimeUnit unit) throws InterruptedException {
    return eoiLatch.await(timeout, unit);
  }
}

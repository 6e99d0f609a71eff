/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.indexpipe.bridge;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.opensearch.indexpipe.exception.PipeTimeoutException;
import org.opensearch.indexpipe.pipe.Pipe;
import org.opensearch.indexpipe.pipe.PipeEngine;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class FeederPipeTest {

  @Mock private PipeEngine engine;
  @Mock private Pipe pipe;

  private FeederPipe feeder;

  @BeforeEach
  void setUp() {
    when(pipe.getPipeId()).thenReturn("feeder");
    feeder = new FeederPipe(engine, pipe);
  }

  @Test
  void should_destroy_only_once() {
    assertTrue(feeder.destroy(new PipeTimeoutException("timed out")));
    assertFalse(feeder.destroy(new PipeTimeoutException("late duplicate")));

    verify(engine, times(1)).destroy(pipe);
    assertEquals(FeederPipe.State.DESTROYED, feeder.getState());
  }

  @Test
  void should_not_destroy_after_end_of_input() {
    assertTrue(feeder.eoi());
    assertFalse(feeder.destroy(new PipeTimeoutException("too late")));

    verify(engine).eoi(pipe);
    verify(engine, never()).destroy(pipe);
    assertEquals(FeederPipe.State.FINISHED, feeder.getState());
  }

  @Test
  void should_not_end_input_of_destroyed_pipe() {
    feeder.destroy(new PipeTimeoutException("timed out"));

    assertFalse(feeder.eoi());
    verify(engine, never()).eoi(pipe);
  }

  @Test
  void should_show_pipe_and_state() {
    assertEquals("FeederPipe{feeder, RUNNING}", feeder.toString());
  }
}

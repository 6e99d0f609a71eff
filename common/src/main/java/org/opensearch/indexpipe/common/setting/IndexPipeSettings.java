/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.indexpipe.common.setting;

import java.util.List;
import lombok.Getter;
import org.opensearch.common.settings.Setting;
import org.opensearch.common.settings.Settings;
import org.opensearch.common.unit.TimeValue;

/**
 * Typed view over the node {@link Settings} for index pipes. Values are read once at construction;
 * a changed configuration means a new instance.
 */
public class IndexPipeSettings {

  /** Timeout used by a queue call that does not pass one explicitly. */
  public static final Setting<TimeValue> QUEUE_TIMEOUT =
      Setting.timeSetting(
          "index_pipe.queue.timeout", TimeValue.timeValueSeconds(60), Setting.Property.NodeScope);

  /** Name given to the index fitting of every feeder pipe. */
  public static final Setting<String> FITTING_NAME =
      Setting.simpleString("index_pipe.fitting.name", "index", Setting.Property.NodeScope);

  /** Number of partitions the index fitting may route one input to. */
  public static final Setting<Integer> FITTING_NVAL =
      Setting.intSetting("index_pipe.fitting.nval", 1, 1, Setting.Property.NodeScope);

  @Getter private final TimeValue queueTimeout;
  @Getter private final String fittingName;
  @Getter private final int fittingNval;

  public IndexPipeSettings(Settings settings) {
    this.queueTimeout = QUEUE_TIMEOUT.get(settings);
    this.fittingName = FITTING_NAME.get(settings);
    this.fittingNval = FITTING_NVAL.get(settings);
    if (fittingName.isEmpty()) {
      throw new IllegalArgumentException(FITTING_NAME.getKey() + " must not be empty");
    }
  }

  /** Settings with every value at its default. */
  public static IndexPipeSettings defaults() {
    return new IndexPipeSettings(Settings.EMPTY);
  }

  /** All settings declared by this class, for registration with a settings module. */
  public static List<Setting<?>> pluginSettings() {
    return List.of(QUEUE_TIMEOUT, FITTING_NAME, FITTING_NVAL);
  }
}

// Copyright (c) 2024 Broadcom. All Rights Reserved.
// The term "Broadcom" refers to Broadcom Inc. and/or its subsidiaries.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
//
// If you have any questions regarding licensing, please contact us at
// info@rabbitmq.com.
package com.rabbitmq.client.confirm;

import com.rabbitmq.client.confirm.metrics.MetricsCollector;
import java.util.concurrent.ExecutorService;

/** API to configure and create a {@link ConfirmTracker}. */
public interface ConfirmTrackerBuilder {

  /**
   * The engine that owns the channels.
   *
   * <p>Mandatory.
   *
   * @param engine the channel engine
   * @return this builder instance
   */
  ConfirmTrackerBuilder engine(ChannelEngine engine);

  /**
   * Executor service to run the confirm handler adapters.
   *
   * <p>Each subscription uses a thread of the executor service until it stops. The tracker uses a
   * cached thread pool by default (virtual threads on Java 21 or more).
   *
   * <p>It is the developer's responsibility to shut down the executor service when it is no longer
   * needed.
   *
   * @param executorService the executor service
   * @return this builder instance
   */
  ConfirmTrackerBuilder executorService(ExecutorService executorService);

  /**
   * Set up a {@link MetricsCollector}.
   *
   * @param metricsCollector the metrics collector
   * @return this builder instance
   * @see com.rabbitmq.client.confirm.metrics.MicrometerMetricsCollector
   */
  ConfirmTrackerBuilder metricsCollector(MetricsCollector metricsCollector);

  /**
   * Create the tracker instance.
   *
   * @return the configured tracker
   */
  ConfirmTracker build();
}

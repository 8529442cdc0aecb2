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
package com.rabbitmq.client.confirm.impl;

import com.rabbitmq.client.confirm.ChannelEngine;
import com.rabbitmq.client.confirm.ConfirmTracker;
import com.rabbitmq.client.confirm.ConfirmTrackerBuilder;
import com.rabbitmq.client.confirm.metrics.MetricsCollector;
import com.rabbitmq.client.confirm.metrics.NoOpMetricsCollector;
import java.util.concurrent.ExecutorService;

/** Builder to create a {@link ConfirmTracker} instance. */
public class DefaultConfirmTrackerBuilder implements ConfirmTrackerBuilder {

  private ChannelEngine engine;
  private ExecutorService executorService;
  private MetricsCollector metricsCollector = NoOpMetricsCollector.INSTANCE;

  public DefaultConfirmTrackerBuilder() {}

  @Override
  public DefaultConfirmTrackerBuilder engine(ChannelEngine engine) {
    this.engine = engine;
    return this;
  }

  @Override
  public DefaultConfirmTrackerBuilder executorService(ExecutorService executorService) {
    this.executorService = executorService;
    return this;
  }

  @Override
  public DefaultConfirmTrackerBuilder metricsCollector(MetricsCollector metricsCollector) {
    this.metricsCollector =
        metricsCollector == null ? NoOpMetricsCollector.INSTANCE : metricsCollector;
    return this;
  }

  @Override
  public ConfirmTracker build() {
    if (this.engine == null) {
      throw new IllegalStateException("A channel engine must be set");
    }
    return new DefaultConfirmTracker(this.engine, this.executorService, this.metricsCollector);
  }
}

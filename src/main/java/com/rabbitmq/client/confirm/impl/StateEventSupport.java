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

import com.rabbitmq.client.confirm.Resource;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class StateEventSupport {

  private static final Logger LOGGER = LoggerFactory.getLogger(StateEventSupport.class);

  private final List<Resource.StateListener> listeners = new CopyOnWriteArrayList<>();

  StateEventSupport(List<Resource.StateListener> listeners) {
    this.listeners.addAll(listeners);
  }

  Resource.Monitor add(Resource.StateListener listener) {
    // wrapped so that the same listener instance can be registered several times
    Resource.StateListener registered = listener::handle;
    this.listeners.add(registered);
    return () -> this.listeners.remove(registered);
  }

  int size() {
    return this.listeners.size();
  }

  void dispatch(
      Resource resource,
      Throwable failureCause,
      Resource.State previousState,
      Resource.State currentState) {
    if (!this.listeners.isEmpty()) {
      Resource.Context context =
          new DefaultContext(resource, failureCause, previousState, currentState);
      this.listeners.forEach(l -> dispatch(l, context));
    }
  }

  static void dispatch(Resource.StateListener listener, Resource.Context context) {
    try {
      listener.handle(context);
    } catch (Exception e) {
      LOGGER.warn("Error in resource listener", e);
    }
  }

  static Resource.Context context(
      Resource resource,
      Throwable failureCause,
      Resource.State previousState,
      Resource.State currentState) {
    return new DefaultContext(resource, failureCause, previousState, currentState);
  }

  private static class DefaultContext implements Resource.Context {

    private final Resource resource;
    private final Throwable failureCause;
    private final Resource.State previousState;
    private final Resource.State currentState;

    private DefaultContext(
        Resource resource,
        Throwable failureCause,
        Resource.State previousState,
        Resource.State currentState) {
      this.resource = resource;
      this.failureCause = failureCause;
      this.previousState = previousState;
      this.currentState = currentState;
    }

    @Override
    public Resource resource() {
      return this.resource;
    }

    @Override
    public Throwable failureCause() {
      return this.failureCause;
    }

    @Override
    public Resource.State previousState() {
      return this.previousState;
    }

    @Override
    public Resource.State currentState() {
      return this.currentState;
    }
  }
}

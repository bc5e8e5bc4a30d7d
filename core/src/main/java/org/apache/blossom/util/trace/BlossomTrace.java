/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.blossom.util.trace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Contains all of the {@link org.slf4j.Logger tracers} used within
 * org.apache.blossom class libraries.
 *
 * <p>Tracers are named after the package they serve, so that the verbosity of
 * each can be set independently in the logging configuration.
 */
public abstract class BlossomTrace {
  //~ Static fields/initializers ---------------------------------------------

  /**
   * The "org.apache.blossom.matching" tracer prints the progress of the
   * matching algorithms: a summary of each computation at DEBUG, and each
   * dual adjustment at TRACE.
   */
  private static final Logger MATCHING_TRACER =
      LoggerFactory.getLogger("org.apache.blossom.matching");

  /**
   * The "org.apache.blossom.config" tracer reports how configuration
   * properties were resolved.
   */
  private static final Logger CONFIG_TRACER =
      LoggerFactory.getLogger("org.apache.blossom.config");

  //~ Methods ----------------------------------------------------------------

  public static Logger getMatchingTracer() {
    return MATCHING_TRACER;
  }

  public static Logger getConfigTracer() {
    return CONFIG_TRACER;
  }
}

// End BlossomTrace.java

/*
 * JBoss, Home of Professional Open Source.
 * Copyright 2026 Red Hat, Inc., and individual contributors
 * as indicated by the @author tags.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */

package io.pathtree;

import org.xnio.Option;

/**
 * Options understood by {@link io.pathtree.routing.Router}.
 */
public class RouterOptions {

    /**
     * If a dispatch that reaches a leaf carrying a handler while path segments remain should stop there and pass the
     * remaining segments to the handler as positional arguments.
     * <p>
     * Defaults to false, in which case every segment must match a node and handlers are invoked without arguments.
     */
    public static final Option<Boolean> FORWARD_UNCONSUMED_SEGMENTS = Option.simple(RouterOptions.class, "FORWARD_UNCONSUMED_SEGMENTS", Boolean.class);

    public static final boolean DEFAULT_FORWARD_UNCONSUMED_SEGMENTS = false;

    /**
     * If routing failures should be logged to the request logger. Defaults to true.
     */
    public static final Option<Boolean> LOG_ROUTE_FAILURES = Option.simple(RouterOptions.class, "LOG_ROUTE_FAILURES", Boolean.class);

    public static final boolean DEFAULT_LOG_ROUTE_FAILURES = true;

    private RouterOptions() {

    }
}

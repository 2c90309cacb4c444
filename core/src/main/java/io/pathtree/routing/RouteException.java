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

package io.pathtree.routing;

import java.util.List;

/**
 * Base class of the failures a {@link Router} can hand to its {@link FailureHandler}.
 */
public abstract class RouteException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String path;
    private final List<String> matchedKeys;

    protected RouteException(final String message, final String path, final List<String> matchedKeys) {
        super(message);
        this.path = path;
        this.matchedKeys = List.copyOf(matchedKeys);
    }

    /**
     * @return The canonical path that was being routed
     */
    public String getPath() {
        return path;
    }

    /**
     * @return The keys of the nodes matched below the root before routing stopped
     */
    public List<String> getMatchedKeys() {
        return matchedKeys;
    }
}

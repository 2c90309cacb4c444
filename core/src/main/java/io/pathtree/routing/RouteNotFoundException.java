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
 * A path segment did not match any child of the node reached so far.
 */
public class RouteNotFoundException extends RouteException {

    private static final long serialVersionUID = 1L;

    private final String segment;

    public RouteNotFoundException(final String message, final String path, final List<String> matchedKeys, final String segment) {
        super(message, path, matchedKeys);
        this.segment = segment;
    }

    /**
     * @return The segment that had no matching child
     */
    public String getSegment() {
        return segment;
    }
}

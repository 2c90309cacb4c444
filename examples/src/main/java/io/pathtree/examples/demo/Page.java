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

package io.pathtree.examples.demo;

/**
 * The result of a demo route, a status code and a plain text body.
 */
public final class Page {

    private final int statusCode;
    private final String body;

    private Page(final int statusCode, final String body) {
        this.statusCode = statusCode;
        this.body = body;
    }

    public static Page ok(final String body) {
        return new Page(200, body);
    }

    public static Page notFound(final String body) {
        return new Page(404, body);
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getBody() {
        return body;
    }

    @Override
    public String toString() {
        return statusCode + " " + body;
    }
}

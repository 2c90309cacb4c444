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

import io.undertow.Undertow;
import org.jboss.logging.Logger;

/**
 * Serves the demo routes on http://localhost:8080/
 */
public class DemoServer {

    private static final Logger log = Logger.getLogger(DemoServer.class);

    public static void main(final String[] args) {
        Undertow server = Undertow.builder()
                .addHttpListener(8080, "localhost")
                .setHandler(new PathTreeHttpHandler(DemoRoutes.createRouter()))
                .build();
        server.start();
        log.info("Demo routes are served on http://localhost:8080/");
    }
}

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

import io.pathtree.routing.RouteException;
import io.pathtree.routing.Router;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.jboss.logging.Logger;

/**
 * Adapts a {@link Router} to Undertow by dispatching the relative path of each exchange.
 * <p>
 * Routes that return a {@link Page} control the status code, any other result is sent as a 200 response.
 * Routing failures that reach this handler, because the router has no failure handler, are answered with a 404.
 */
public class PathTreeHttpHandler implements HttpHandler {

    private static final Logger log = Logger.getLogger(PathTreeHttpHandler.class);

    private final Router router;

    public PathTreeHttpHandler(final Router router) {
        this.router = router;
    }

    @Override
    public void handleRequest(final HttpServerExchange exchange) throws Exception {
        final Object result;
        try {
            result = router.dispatch(exchange.getRelativePath());
        } catch (RouteException e) {
            log.debugf(e, "No route for %s", exchange.getRelativePath());
            send(exchange, DemoRoutes.notFound(e));
            return;
        }
        if (result instanceof Page) {
            send(exchange, (Page) result);
        } else {
            send(exchange, Page.ok(String.valueOf(result)));
        }
    }

    private static void send(final HttpServerExchange exchange, final Page page) {
        exchange.setStatusCode(page.getStatusCode());
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain");
        exchange.getResponseSender().send(page.getBody());
    }
}

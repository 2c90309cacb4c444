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

import io.pathtree.routing.FailureHandler;
import io.pathtree.routing.RouteHandler;
import io.pathtree.routing.Router;
import io.pathtree.routing.tree.Node;
import io.pathtree.routing.tree.NodeTree;
import io.pathtree.util.SegmentCursor;
import org.xnio.OptionMap;

/**
 * Utility class with convenience methods for building routing trees and routers
 */
public class Routes {

    /**
     * Creates a new node without a handler
     *
     * @param key      The key of the node
     * @param children The children to add to the node
     * @return A new node
     */
    public static Node node(final String key, final Node... children) {
        return new Node(key).addChildren(children);
    }

    /**
     * Creates a new node
     *
     * @param key      The key of the node
     * @param handler  The handler of the node
     * @param children The children to add to the node
     * @return A new node
     */
    public static Node node(final String key, final RouteHandler handler, final Node... children) {
        return new Node(key, handler).addChildren(children);
    }

    /**
     *
     * @return a new tree rooted at the given node
     */
    public static NodeTree tree(final Node root) {
        return new NodeTree(root);
    }

    /**
     *
     * @return a new router without a failure handler
     */
    public static Router router(final Node root) {
        return new Router(new NodeTree(root));
    }

    public static Router router(final Node root, final FailureHandler failureHandler) {
        return new Router(new NodeTree(root), failureHandler);
    }

    public static Router router(final NodeTree tree, final FailureHandler failureHandler, final OptionMap options) {
        return new Router(tree, failureHandler, options);
    }

    /**
     *
     * @return a new cursor over the segments of the path
     */
    public static SegmentCursor cursor(final String path) {
        return new SegmentCursor(path);
    }

    private Routes() {

    }
}

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

import io.pathtree.PathTreeLogger;
import io.pathtree.PathTreeMessages;
import io.pathtree.RouterOptions;
import io.pathtree.routing.tree.Node;
import io.pathtree.routing.tree.NodeTree;
import io.pathtree.util.SegmentCursor;
import org.xnio.OptionMap;

import java.util.ArrayList;
import java.util.List;

/**
 * Routes a path through a {@link NodeTree} and invokes the handler of the node it ends on.
 * <p>
 * A dispatch starts from the root of the tree and steps one level down for every segment of the cursor. It fails
 * with a {@link RouteNotFoundException} as soon as a segment has no matching child, and with an
 * {@link InvalidRouteException} if the node reached once the cursor is exhausted has no handler. When a
 * {@link FailureHandler} is installed it receives these two failures and its return value becomes the result of the
 * dispatch. Anything thrown by a route handler itself, or by the failure handler, is never intercepted.
 * <p>
 * The router resets the active node of the tree before every dispatch, and again after a failed one, so the tree is
 * never left without an active node. It never resets the cursor, callers that dispatch the same cursor twice must {@link SegmentCursor#reset()} it or pass a {@link SegmentCursor#copy()}.
 * <p>
 * A dispatch holds the monitor of its tree until it completes, including while the handler runs.
 */
public class Router implements CursorHandler {

    private volatile NodeTree nodeTree;
    private volatile FailureHandler failureHandler;

    private final boolean forwardUnconsumedSegments;
    private final boolean logRouteFailures;

    public Router(final NodeTree nodeTree) {
        this(nodeTree, null, OptionMap.EMPTY);
    }

    public Router(final NodeTree nodeTree, final FailureHandler failureHandler) {
        this(nodeTree, failureHandler, OptionMap.EMPTY);
    }

    public Router(final NodeTree nodeTree, final FailureHandler failureHandler, final OptionMap options) {
        if (nodeTree == null) {
            throw PathTreeMessages.MESSAGES.argumentCannotBeNull("nodeTree");
        }
        if (options == null) {
            throw PathTreeMessages.MESSAGES.argumentCannotBeNull("options");
        }
        this.nodeTree = nodeTree;
        this.failureHandler = failureHandler;
        this.forwardUnconsumedSegments = options.get(RouterOptions.FORWARD_UNCONSUMED_SEGMENTS, RouterOptions.DEFAULT_FORWARD_UNCONSUMED_SEGMENTS);
        this.logRouteFailures = options.get(RouterOptions.LOG_ROUTE_FAILURES, RouterOptions.DEFAULT_LOG_ROUTE_FAILURES);
    }

    public NodeTree getNodeTree() {
        return nodeTree;
    }

    public Router setNodeTree(final NodeTree nodeTree) {
        if (nodeTree == null) {
            throw PathTreeMessages.MESSAGES.argumentCannotBeNull("nodeTree");
        }
        this.nodeTree = nodeTree;
        return this;
    }

    public FailureHandler getFailureHandler() {
        return failureHandler;
    }

    /**
     * @param failureHandler The failure handler, or null to let routing failures propagate
     * @return this router
     */
    public Router setFailureHandler(final FailureHandler failureHandler) {
        this.failureHandler = failureHandler;
        return this;
    }

    public boolean isForwardUnconsumedSegments() {
        return forwardUnconsumedSegments;
    }

    @Override
    public Object handle(final SegmentCursor cursor) throws Exception {
        return dispatch(cursor);
    }

    public Object dispatch(final String path) throws Exception {
        return dispatch(new SegmentCursor(path));
    }

    /**
     * Routes the remaining segments of the cursor and invokes the handler of the matched node.
     *
     * @param cursor The cursor, consumed by the dispatch
     * @return The result of the route handler, or of the failure handler if routing failed
     * @throws RouteException if routing failed and there is no failure handler
     * @throws Exception      anything thrown by the route handler or the failure handler
     */
    public Object dispatch(final SegmentCursor cursor) throws Exception {
        if (cursor == null) {
            throw PathTreeMessages.MESSAGES.argumentCannotBeNull("cursor");
        }
        final NodeTree tree = this.nodeTree;
        synchronized (tree) {
            final Node node;
            try {
                node = resolve(tree, cursor);
            } catch (RouteException e) {
                tree.resetActiveNode();
                return handleFailure(e);
            }
            if (forwardUnconsumedSegments && cursor.hasNext()) {
                final List<String> arguments = cursor.remainingSegments();
                PathTreeLogger.REQUEST_LOGGER.debugf("Forwarding segments %s of %s to node %s", arguments, cursor, node);
                return node.execute(arguments.toArray());
            }
            return node.execute();
        }
    }

    private Node resolve(final NodeTree tree, final SegmentCursor cursor) throws RouteException {
        tree.resetActiveNode();
        final List<String> matched = new ArrayList<>();
        Node node = tree.getActiveNode();
        while (cursor.hasNext()) {
            if (forwardUnconsumedSegments && node.isLeaf() && node.hasHandler()) {
                break;
            }
            final String segment = cursor.next();
            node = tree.stepToChild(segment);
            if (node == null) {
                final String path = cursor.getPath();
                throw new RouteNotFoundException(PathTreeMessages.MESSAGES.routeNotFound(path, segment), path, matched, segment);
            }
            matched.add(segment);
            PathTreeLogger.REQUEST_LOGGER.tracef("Matched segment %s of %s", segment, cursor);
        }
        if (!node.hasHandler()) {
            final String path = cursor.getPath();
            throw new InvalidRouteException(PathTreeMessages.MESSAGES.invalidRoute(path, node.getKey()), path, matched);
        }
        PathTreeLogger.REQUEST_LOGGER.debugf("Matched path %s to node %s", cursor, node);
        return node;
    }

    private Object handleFailure(final RouteException exception) throws Exception {
        final FailureHandler failureHandler = this.failureHandler;
        if (failureHandler == null) {
            if (logRouteFailures) {
                PathTreeLogger.REQUEST_LOGGER.noFailureHandler(exception.getPath(), exception);
            }
            throw exception;
        }
        if (logRouteFailures) {
            PathTreeLogger.REQUEST_LOGGER.delegatingToFailureHandler(exception.getPath(), exception);
        }
        return failureHandler.handleFailure(exception);
    }
}

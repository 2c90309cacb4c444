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

package io.pathtree.routing.tree;

import io.pathtree.PathTreeLogger;
import io.pathtree.PathTreeMessages;
import io.pathtree.routing.RouteHandler;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * A named vertex of a routing tree.
 * <p>
 * A node owns its children, which are keyed by their own key, and may carry a {@link RouteHandler} that is invoked
 * when a dispatch ends on it. Every node also knows its parent so that the path leading to it can be rebuilt.
 * <p>
 * The following invariants hold at all times:
 * <ul>
 * <li>A key is unique among the children of a node. Adding a child whose key is already in use replaces the previous
 * child, which is left without a parent.</li>
 * <li>A node has at most one parent. Adding it to another node detaches it from its current parent first.</li>
 * <li>A node is never its own child, nor the child of one of its descendants.</li>
 * </ul>
 * Children are kept and iterated in key order.
 * <p>
 * Nodes are not thread safe, a tree should be fully built before it is shared between threads.
 */
public class Node implements Iterable<Node> {

    private final String key;
    private final UUID id = UUID.randomUUID();
    private final Map<String, Node> children = new TreeMap<>();
    private RouteHandler handler;
    private Node parent;

    public Node(final String key) {
        this(key, null, null);
    }

    public Node(final String key, final RouteHandler handler) {
        this(key, handler, null);
    }

    /**
     * @param key     The key, leading and trailing whitespace is removed
     * @param handler The handler, may be null
     * @param parent  The parent this node is immediately added to, may be null
     */
    public Node(final String key, final RouteHandler handler, final Node parent) {
        if (key == null) {
            throw PathTreeMessages.MESSAGES.argumentCannotBeNull("key");
        }
        final String trimmed = key.trim();
        if (trimmed.isEmpty()) {
            throw PathTreeMessages.MESSAGES.emptyNodeKey();
        }
        this.key = trimmed;
        this.handler = handler;
        if (parent != null) {
            parent.addChild(this);
        }
    }

    public String getKey() {
        return key;
    }

    /**
     * @return An identifier that distinguishes this node from other nodes with the same key
     */
    public UUID getId() {
        return id;
    }

    public Node getParent() {
        return parent;
    }

    /**
     * Adds a child to this node, replacing any child that has the same key.
     *
     * @param child The child
     * @return this node
     */
    public Node addChild(final Node child) {
        if (child == null) {
            throw PathTreeMessages.MESSAGES.argumentCannotBeNull("child");
        }
        if (child == this) {
            throw PathTreeMessages.MESSAGES.nodeCannotBeItsOwnChild(key);
        }
        for (Node ancestor = parent; ancestor != null; ancestor = ancestor.parent) {
            if (ancestor == child) {
                throw PathTreeMessages.MESSAGES.nodeCannotBeChildOfDescendant(child.key, key);
            }
        }
        final Node oldParent = child.parent;
        if (oldParent != null && oldParent != this) {
            oldParent.unlink(child);
            PathTreeLogger.TREE_LOGGER.nodeReparented(child.key, oldParent.key, key);
        }
        final Node previous = children.put(child.key, child);
        if (previous != null && previous != child) {
            previous.parent = null;
            PathTreeLogger.TREE_LOGGER.childReplaced(child.key, key);
        }
        child.parent = this;
        return this;
    }

    /**
     * Adds every element of the given collection as a child, in iteration order.
     * <p>
     * If an element is not a {@link Node} an {@link InvalidChildException} is thrown. Elements before it have already
     * been added and stay attached.
     *
     * @param children The children
     * @return this node
     */
    public Node addChildren(final Collection<?> children) {
        if (children == null) {
            throw PathTreeMessages.MESSAGES.argumentCannotBeNull("children");
        }
        int index = 0;
        for (Object child : children) {
            if (!(child instanceof Node)) {
                throw PathTreeMessages.MESSAGES.childIsNotANode(index, child);
            }
            addChild((Node) child);
            ++index;
        }
        return this;
    }

    public Node addChildren(final Node... children) {
        return addChildren(Arrays.asList(children));
    }

    /**
     * Stores a child under the given key, which must be the key of the child. A null key behaves like
     * {@link #addChild(Node)}.
     *
     * @param key   The key, or null
     * @param child The child
     * @return this node
     */
    public Node putChild(final String key, final Node child) {
        if (child == null) {
            throw PathTreeMessages.MESSAGES.argumentCannotBeNull("child");
        }
        if (key != null && !key.equals(child.key)) {
            throw PathTreeMessages.MESSAGES.childKeyMismatch(key, child.key);
        }
        return addChild(child);
    }

    public Node getChild(final String key) {
        return children.get(key);
    }

    public boolean hasChild(final String key) {
        return children.containsKey(key);
    }

    /**
     * Removes a child and clears its parent.
     *
     * @param key The key of the child
     * @return The removed child
     * @throws ChildNotFoundException if there is no child with that key
     */
    public Node removeChild(final String key) {
        final Node child = detachChild(key);
        if (child == null) {
            throw PathTreeMessages.MESSAGES.childNotFound(this.key, key);
        }
        return child;
    }

    /**
     * Removes a child if present and clears its parent.
     *
     * @param key The key of the child
     * @return The removed child, or null if there is no child with that key
     */
    public Node detachChild(final String key) {
        final Node child = children.remove(key);
        if (child != null) {
            child.parent = null;
        }
        return child;
    }

    private void unlink(final Node child) {
        if (children.get(child.key) == child) {
            children.remove(child.key);
        }
    }

    /**
     * @return An unmodifiable view of the children, in key order
     */
    public Map<String, Node> getChildren() {
        return Collections.unmodifiableMap(children);
    }

    public int getChildCount() {
        return children.size();
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    @Override
    public Iterator<Node> iterator() {
        return Collections.unmodifiableCollection(children.values()).iterator();
    }

    public RouteHandler getHandler() {
        return handler;
    }

    /**
     * @param handler The new handler, or null to remove it
     * @return this node
     */
    public Node setHandler(final RouteHandler handler) {
        this.handler = handler;
        return this;
    }

    public boolean hasHandler() {
        return handler != null;
    }

    /**
     * Invokes the handler of this node. Anything the handler throws is passed on unchanged.
     *
     * @param arguments The positional arguments to pass to the handler
     * @return The result of the handler
     * @throws NoHandlerException if this node has no handler
     */
    public Object execute(final Object... arguments) throws Exception {
        final RouteHandler handler = this.handler;
        if (handler == null) {
            throw PathTreeMessages.MESSAGES.noHandler(key);
        }
        final List<Object> args = arguments == null ? Collections.emptyList() : Collections.unmodifiableList(Arrays.asList(arguments));
        return handler.handleRoute(args);
    }

    @Override
    public String toString() {
        return key;
    }
}

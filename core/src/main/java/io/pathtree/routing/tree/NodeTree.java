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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A routing tree, made of a root {@link Node} and an active node that marks the current position of a traversal.
 * <p>
 * The active node starts on the root and is moved one level down by {@link #stepToChild(String)}. A step that does
 * not find a matching child leaves the tree without an active node until {@link #resetActiveNode()} is called.
 * <p>
 * The active node is mutable state shared by everybody using the tree. Callers that traverse the same tree from
 * several threads must serialize their traversals, {@link io.pathtree.routing.Router} does so by holding the tree's
 * monitor for the duration of a dispatch.
 */
public class NodeTree {

    private Node rootNode;
    private Node activeNode;

    public NodeTree(final Node rootNode) {
        if (rootNode == null) {
            throw PathTreeMessages.MESSAGES.argumentCannotBeNull("rootNode");
        }
        this.rootNode = rootNode;
        this.activeNode = rootNode;
    }

    public Node getRootNode() {
        return rootNode;
    }

    /**
     * Replaces the root and moves the active node to it. Nodes only reachable from the previous root no longer belong
     * to this tree.
     *
     * @param rootNode The new root
     */
    public void setRootNode(final Node rootNode) {
        if (rootNode == null) {
            throw PathTreeMessages.MESSAGES.argumentCannotBeNull("rootNode");
        }
        if (activeNode != null && activeNode != this.rootNode) {
            PathTreeLogger.TREE_LOGGER.rootReplacedDuringTraversal(activeNode.getKey());
        }
        this.rootNode = rootNode;
        this.activeNode = rootNode;
    }

    /**
     * @return The active node, or null if the last step did not match a child
     */
    public Node getActiveNode() {
        return activeNode;
    }

    public void resetActiveNode() {
        activeNode = rootNode;
    }

    /**
     * Moves the active node to its child with the given key.
     * <p>
     * If there is no such child, or the tree has no active node because an earlier step missed, the tree is left
     * without an active node and null is returned.
     *
     * @param key The key of the child
     * @return The new active node, or null
     */
    public Node stepToChild(final String key) {
        final Node current = activeNode;
        if (current == null) {
            return null;
        }
        return activeNode = current.getChild(key);
    }

    /**
     * Looks up the node reached by following the given keys down from the root. The active node is not touched.
     *
     * @param keys The keys, top to bottom
     * @return The node, or null if a key has no matching child
     */
    public Node findNode(final List<String> keys) {
        Node current = rootNode;
        for (String key : keys) {
            current = current.getChild(key);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    /**
     * Collects the keys of a node and its ancestors, stopping before {@code stopAt}.
     * <p>
     * With a null {@code stopAt} the walk goes all the way up, so the key of the topmost ancestor is included.
     * If {@code node} is {@code stopAt} the result is empty.
     *
     * @param node   The node to start from
     * @param stopAt The ancestor to stop at, excluded from the result, or null
     * @return The keys in path order, top to bottom
     * @throws NodeNotInTreeException if {@code stopAt} is not null and is not an ancestor of {@code node}
     */
    public static List<String> pathKeys(final Node node, final Node stopAt) {
        if (node == null) {
            throw PathTreeMessages.MESSAGES.argumentCannotBeNull("node");
        }
        final List<String> keys = new ArrayList<>();
        Node current = node;
        while (current != null && current != stopAt) {
            keys.add(current.getKey());
            current = current.getParent();
        }
        if (stopAt != null && current != stopAt) {
            throw PathTreeMessages.MESSAGES.nodeNotInTree(node.getKey(), stopAt.getKey());
        }
        Collections.reverse(keys);
        return keys;
    }

    public static List<String> pathKeys(final Node node) {
        return pathKeys(node, null);
    }

    /**
     * @param node The node
     * @return The keys leading from the root to the node, the root excluded
     * @throws NodeNotInTreeException if the node does not belong to this tree
     */
    public List<String> getPathKeys(final Node node) {
        return pathKeys(node, rootNode);
    }

    /**
     * @param node The node
     * @return true if the node is the root or one of its descendants
     */
    public boolean contains(final Node node) {
        for (Node current = node; current != null; current = current.getParent()) {
            if (current == rootNode) {
                return true;
            }
        }
        return false;
    }
}

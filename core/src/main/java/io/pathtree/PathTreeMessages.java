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

import io.pathtree.routing.tree.ChildKeyMismatchException;
import io.pathtree.routing.tree.ChildNotFoundException;
import io.pathtree.routing.tree.EmptyKeyException;
import io.pathtree.routing.tree.InvalidChildException;
import io.pathtree.routing.tree.NoHandlerException;
import io.pathtree.routing.tree.NodeNotInTreeException;
import io.pathtree.routing.tree.SelfReferenceException;
import org.jboss.logging.Messages;
import org.jboss.logging.annotations.Message;
import org.jboss.logging.annotations.MessageBundle;

/**
 * Messages and exceptions raised by the routing tree and the router.
 */
@MessageBundle(projectCode = "PT")
public interface PathTreeMessages {

    PathTreeMessages MESSAGES = Messages.getBundle(PathTreeMessages.class);

    @Message(id = 1, value = "Argument %s cannot be null")
    IllegalArgumentException argumentCannotBeNull(final String argument);

    @Message(id = 2, value = "Node key cannot be empty or blank")
    EmptyKeyException emptyNodeKey();

    @Message(id = 3, value = "Node %s cannot be added as its own child")
    SelfReferenceException nodeCannotBeItsOwnChild(String key);

    @Message(id = 4, value = "Only nodes can be added as children, element %s was %s")
    InvalidChildException childIsNotANode(int index, Object value);

    @Message(id = 5, value = "Child key %s does not match the key %s of the node being stored")
    ChildKeyMismatchException childKeyMismatch(String key, String childKey);

    @Message(id = 6, value = "Node %s has no child with key %s")
    ChildNotFoundException childNotFound(String parentKey, String key);

    @Message(id = 7, value = "Node %s has no handler attached")
    NoHandlerException noHandler(String key);

    @Message(id = 8, value = "Node %s is not under the specified stop node %s")
    NodeNotInTreeException nodeNotInTree(String key, String stopKey);

    @Message(id = 9, value = "No route matches %s, segment %s has no matching node")
    String routeNotFound(String path, String segment);

    @Message(id = 10, value = "Route %s resolves to node %s which has no handler")
    String invalidRoute(String path, String nodeKey);

    // id = 11

    @Message(id = 12, value = "Node %s cannot be added as a child of its own descendant %s")
    SelfReferenceException nodeCannotBeChildOfDescendant(String key, String descendantKey);
}

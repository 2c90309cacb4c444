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

import io.pathtree.routing.RouteException;
import org.jboss.logging.BasicLogger;
import org.jboss.logging.Logger;
import org.jboss.logging.annotations.Cause;
import org.jboss.logging.annotations.LogMessage;
import org.jboss.logging.annotations.Message;
import org.jboss.logging.annotations.MessageLogger;

import static org.jboss.logging.Logger.Level.DEBUG;
import static org.jboss.logging.Logger.Level.WARN;

/**
 * log messages start at 5000
 */
@MessageLogger(projectCode = "PT")
public interface PathTreeLogger extends BasicLogger {

    PathTreeLogger ROOT_LOGGER = Logger.getMessageLogger(PathTreeLogger.class, PathTreeLogger.class.getPackage().getName());

    /**
     * Logger used to trace individual dispatches. Everything logged here is at DEBUG or below, as a busy
     * router would otherwise flood the log.
     */
    PathTreeLogger REQUEST_LOGGER = Logger.getMessageLogger(PathTreeLogger.class, PathTreeLogger.class.getPackage().getName() + ".request");
    PathTreeLogger TREE_LOGGER = Logger.getMessageLogger(PathTreeLogger.class, PathTreeLogger.class.getPackage().getName() + ".tree");

    @LogMessage(level = DEBUG)
    @Message(id = 5001, value = "Routing %s failed, delegating to the failure handler")
    void delegatingToFailureHandler(String path, @Cause RouteException cause);

    @LogMessage(level = DEBUG)
    @Message(id = 5002, value = "Routing %s failed and no failure handler is installed")
    void noFailureHandler(String path, @Cause RouteException cause);

    @LogMessage(level = DEBUG)
    @Message(id = 5003, value = "Child %s of node %s has been replaced by a node with the same key")
    void childReplaced(String key, String parentKey);

    @LogMessage(level = DEBUG)
    @Message(id = 5004, value = "Node %s has been moved from parent %s to parent %s")
    void nodeReparented(String key, String oldParentKey, String newParentKey);

    @LogMessage(level = WARN)
    @Message(id = 5005, value = "Node tree root has been replaced while the active node was %s, previous traversal state is discarded")
    void rootReplacedDuringTraversal(String activeKey);
}

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

import io.pathtree.routing.RouteHandler;
import io.pathtree.testutils.category.UnitTest;
import org.junit.Assert;
import org.junit.Test;
import org.junit.experimental.categories.Category;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

@Category(UnitTest.class)
public class NodeTestCase {

    @Test
    public void testKeyIsTrimmed() {
        Node node = new Node("  login ");
        Assert.assertEquals("login", node.getKey());
        Assert.assertEquals("login", node.toString());
        Assert.assertNull(node.getParent());
        Assert.assertFalse(node.hasHandler());
        Assert.assertTrue(node.isLeaf());
    }

    @Test
    public void testBlankKeyIsRejected() {
        EmptyKeyException e = Assert.assertThrows(EmptyKeyException.class, () -> new Node(""));
        Assert.assertTrue(e.getMessage(), e.getMessage().startsWith("PT000002"));
        Assert.assertThrows(EmptyKeyException.class, () -> new Node("   \t"));
        Assert.assertThrows(IllegalArgumentException.class, () -> new Node(null));
    }

    @Test
    public void testNodesWithTheSameKeyHaveDifferentIds() {
        Assert.assertNotEquals(new Node("a").getId(), new Node("a").getId());
    }

    @Test
    public void testConstructorWithParentAttaches() {
        Node parent = new Node("dashboard");
        Node child = new Node("users", null, parent);
        Assert.assertSame(parent, child.getParent());
        Assert.assertSame(child, parent.getChild("users"));
    }

    @Test
    public void testAddChild() {
        Node parent = new Node("auth");
        Node child = new Node("login");
        Assert.assertSame(parent, parent.addChild(child));
        Assert.assertSame(child, parent.getChild("login"));
        Assert.assertTrue(parent.hasChild("login"));
        Assert.assertFalse(parent.hasChild("register"));
        Assert.assertNull(parent.getChild("register"));
        Assert.assertSame(parent, child.getParent());
        Assert.assertEquals(1, parent.getChildCount());
        Assert.assertFalse(parent.isLeaf());
    }

    @Test
    public void testAddingSameKeyReplacesPreviousChild() {
        Node parent = new Node("root");
        Node old = new Node("login");
        Node replacement = new Node("login");
        parent.addChild(old);
        parent.addChild(replacement);
        Assert.assertSame(replacement, parent.getChild("login"));
        Assert.assertEquals(1, parent.getChildCount());
        Assert.assertNull(old.getParent());
        Assert.assertSame(parent, replacement.getParent());
    }

    @Test
    public void testAddingSameChildTwiceIsHarmless() {
        Node parent = new Node("root");
        Node child = new Node("login");
        parent.addChild(child);
        parent.addChild(child);
        Assert.assertSame(parent, child.getParent());
        Assert.assertEquals(1, parent.getChildCount());
    }

    @Test
    public void testAddingToNewParentDetachesFromOldParent() {
        Node first = new Node("first");
        Node second = new Node("second");
        Node child = new Node("child");
        first.addChild(child);
        second.addChild(child);
        Assert.assertSame(second, child.getParent());
        Assert.assertFalse(first.hasChild("child"));
        Assert.assertTrue(second.hasChild("child"));
    }

    @Test
    public void testSelfReferenceIsRejected() {
        Node node = new Node("loop");
        Assert.assertThrows(SelfReferenceException.class, () -> node.addChild(node));
        Assert.assertTrue(node.isLeaf());
        Assert.assertNull(node.getParent());
    }

    @Test
    public void testAncestorCannotBecomeChild() {
        Node root = new Node("root");
        Node middle = new Node("middle", null, root);
        Node leaf = new Node("leaf", null, middle);
        Assert.assertThrows(SelfReferenceException.class, () -> leaf.addChild(root));
        Assert.assertNull(root.getParent());
        Assert.assertTrue(leaf.isLeaf());
    }

    @Test
    public void testAddChildren() {
        Node parent = new Node("root");
        Node a = new Node("a");
        Node b = new Node("b");
        parent.addChildren(a, b);
        Assert.assertEquals(2, parent.getChildCount());
        Assert.assertSame(parent, a.getParent());
        Assert.assertSame(parent, b.getParent());
    }

    @Test
    public void testAddChildrenWithSingleNode() {
        Node root = new Node("root");
        Node login = new Node("login");
        root.addChildren(login);
        Assert.assertEquals(1, root.getChildCount());
        Assert.assertSame(login, root.getChild("login"));
        Assert.assertSame(root, login.getParent());

        Node dashboard = new Node("dashboard");
        Node users = new Node("users");
        dashboard.addChild(users);
        root.addChildren(dashboard);
        Assert.assertEquals(2, root.getChildCount());
        Assert.assertSame(dashboard, root.getChild("dashboard"));
        Assert.assertFalse(root.hasChild("users"));
        Assert.assertSame(dashboard, users.getParent());
    }

    @Test
    public void testAddChildrenStopsAtFirstInvalidElement() {
        Node parent = new Node("root");
        Node a = new Node("a");
        Node c = new Node("c");
        List<Object> children = Arrays.asList(a, "b", c);
        InvalidChildException e = Assert.assertThrows(InvalidChildException.class, () -> parent.addChildren(children));
        Assert.assertTrue(e.getMessage(), e.getMessage().startsWith("PT000004"));
        Assert.assertSame(parent, a.getParent());
        Assert.assertNull(c.getParent());
        Assert.assertEquals(1, parent.getChildCount());

        Assert.assertThrows(InvalidChildException.class, () -> parent.addChildren(Arrays.asList(c, null)));
        Assert.assertSame(parent, c.getParent());
    }

    @Test
    public void testPutChild() {
        Node parent = new Node("root");
        Node child = new Node("login");
        parent.putChild("login", child);
        Assert.assertSame(child, parent.getChild("login"));

        Node other = new Node("register");
        parent.putChild(null, other);
        Assert.assertSame(other, parent.getChild("register"));

        Assert.assertThrows(ChildKeyMismatchException.class, () -> parent.putChild("signup", new Node("logout")));
        Assert.assertFalse(parent.hasChild("signup"));
        Assert.assertFalse(parent.hasChild("logout"));
    }

    @Test
    public void testRemoveChild() {
        Node parent = new Node("root");
        Node child = new Node("login", null, parent);
        Assert.assertSame(child, parent.removeChild("login"));
        Assert.assertNull(child.getParent());
        Assert.assertTrue(parent.isLeaf());
        ChildNotFoundException e = Assert.assertThrows(ChildNotFoundException.class, () -> parent.removeChild("login"));
        Assert.assertTrue(e.getMessage(), e.getMessage().contains("login"));
    }

    @Test
    public void testDetachChild() {
        Node parent = new Node("root");
        Node child = new Node("login", null, parent);
        Assert.assertNull(parent.detachChild("missing"));
        Assert.assertSame(child, parent.detachChild("login"));
        Assert.assertNull(child.getParent());
        Assert.assertNull(parent.detachChild("login"));
    }

    @Test
    public void testIterationIsInKeyOrder() {
        Node parent = new Node("root");
        parent.addChildren(new Node("c"), new Node("a"), new Node("b"));
        List<String> keys = new ArrayList<>();
        for (Node child : parent) {
            keys.add(child.getKey());
        }
        Assert.assertEquals(Arrays.asList("a", "b", "c"), keys);
        Assert.assertEquals(Arrays.asList("a", "b", "c"), new ArrayList<>(parent.getChildren().keySet()));
        Assert.assertThrows(UnsupportedOperationException.class, () -> parent.getChildren().remove("a"));
    }

    @Test
    public void testExecutePassesArguments() throws Exception {
        List<Object> received = new ArrayList<>();
        Node node = new Node("users", arguments -> {
            received.addAll(arguments);
            return "users:" + arguments.size();
        });
        Assert.assertTrue(node.hasHandler());
        Assert.assertEquals("users:0", node.execute());
        Assert.assertEquals("users:2", node.execute("42", 7));
        Assert.assertEquals(Arrays.asList("42", 7), received);
    }

    @Test
    public void testExecuteWithoutHandler() {
        Node node = new Node("dashboard");
        NoHandlerException e = Assert.assertThrows(NoHandlerException.class, node::execute);
        Assert.assertTrue(e.getMessage(), e.getMessage().contains("dashboard"));
    }

    @Test
    public void testHandlerExceptionsPropagateUnchanged() {
        IOException failure = new IOException("disk on fire");
        Node node = new Node("upload", arguments -> {
            throw failure;
        });
        IOException thrown = Assert.assertThrows(IOException.class, node::execute);
        Assert.assertSame(failure, thrown);
    }

    @Test
    public void testSetHandler() throws Exception {
        RouteHandler handler = arguments -> "ok";
        Node node = new Node("page");
        Assert.assertSame(node, node.setHandler(handler));
        Assert.assertSame(handler, node.getHandler());
        Assert.assertEquals("ok", node.execute());
        node.setHandler(null);
        Assert.assertFalse(node.hasHandler());
        Assert.assertThrows(NoHandlerException.class, node::execute);
    }
}

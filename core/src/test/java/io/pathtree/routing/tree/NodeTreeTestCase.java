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

import io.pathtree.testutils.category.UnitTest;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.junit.experimental.categories.Category;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

@Category(UnitTest.class)
public class NodeTreeTestCase {

    private Node root;
    private Node child1;
    private Node child2;
    private Node grandChild;
    private NodeTree tree;

    @Before
    public void setup() {
        // root -> child1 -> grandChild
        //      -> child2
        root = new Node("root");
        child1 = new Node("child1");
        child2 = new Node("child2");
        grandChild = new Node("grandChild");
        root.addChildren(child1, child2);
        child1.addChild(grandChild);
        tree = new NodeTree(root);
    }

    @Test
    public void testActiveNodeStartsOnRoot() {
        Assert.assertSame(root, tree.getRootNode());
        Assert.assertSame(root, tree.getActiveNode());
    }

    @Test
    public void testStepToChild() {
        Assert.assertSame(child1, tree.stepToChild("child1"));
        Assert.assertSame(child1, tree.getActiveNode());
        Assert.assertSame(grandChild, tree.stepToChild("grandChild"));
        Assert.assertSame(grandChild, tree.getActiveNode());
        Assert.assertSame(root, tree.getRootNode());
    }

    @Test
    public void testFailedStepClearsActiveNode() {
        tree.stepToChild("child1");
        Assert.assertNull(tree.stepToChild("nonexistent"));
        Assert.assertNull(tree.getActiveNode());
        Assert.assertNull(tree.stepToChild("child1"));
        Assert.assertNull(tree.stepToChild("grandChild"));
        Assert.assertNull(tree.getActiveNode());
        tree.resetActiveNode();
        Assert.assertSame(root, tree.getActiveNode());
    }

    @Test
    public void testResetActiveNode() {
        tree.stepToChild("child1");
        tree.stepToChild("grandChild");
        tree.resetActiveNode();
        Assert.assertSame(root, tree.getActiveNode());
    }

    @Test
    public void testSetRootNode() {
        tree.stepToChild("child1");
        Node newRoot = new Node("newRoot");
        tree.setRootNode(newRoot);
        Assert.assertSame(newRoot, tree.getRootNode());
        Assert.assertSame(newRoot, tree.getActiveNode());
        Assert.assertFalse(tree.contains(child1));
        Assert.assertFalse(tree.contains(root));
        Assert.assertTrue(tree.contains(newRoot));
        Assert.assertThrows(NodeNotInTreeException.class, () -> tree.getPathKeys(grandChild));
    }

    @Test
    public void testPathKeysWithoutStopNodeIncludesTopmostAncestor() {
        Assert.assertEquals(Arrays.asList("root", "child1", "grandChild"), NodeTree.pathKeys(grandChild));
        Assert.assertEquals(Collections.singletonList("root"), NodeTree.pathKeys(root));
        Assert.assertEquals(Collections.singletonList("single"), NodeTree.pathKeys(new Node("single"), null));
    }

    @Test
    public void testPathKeysWithStopNode() {
        Assert.assertEquals(Arrays.asList("child1", "grandChild"), NodeTree.pathKeys(grandChild, root));
        Assert.assertEquals(Collections.singletonList("grandChild"), NodeTree.pathKeys(grandChild, child1));
        Assert.assertEquals(Collections.emptyList(), NodeTree.pathKeys(child1, child1));
    }

    @Test
    public void testPathKeysWithUnrelatedStopNode() {
        NodeNotInTreeException e = Assert.assertThrows(NodeNotInTreeException.class,
                () -> NodeTree.pathKeys(grandChild, new Node("outside")));
        Assert.assertTrue(e.getMessage(), e.getMessage().contains("is not under the specified stop node"));
        Assert.assertThrows(NodeNotInTreeException.class, () -> NodeTree.pathKeys(grandChild, child2));
    }

    @Test
    public void testGetPathKeys() {
        Assert.assertEquals(Collections.emptyList(), tree.getPathKeys(root));
        Assert.assertEquals(Collections.singletonList("child1"), tree.getPathKeys(child1));
        Assert.assertEquals(Arrays.asList("child1", "grandChild"), tree.getPathKeys(grandChild));
        Assert.assertThrows(NodeNotInTreeException.class, () -> tree.getPathKeys(new Node("outside")));
    }

    @Test
    public void testGetPathKeysFollowsLaterChanges() {
        Node newChild = new Node("newChild");
        grandChild.addChild(newChild);
        Assert.assertEquals(Arrays.asList("child1", "grandChild", "newChild"), tree.getPathKeys(newChild));

        child2.addChild(grandChild);
        Assert.assertEquals(Arrays.asList("child2", "grandChild", "newChild"), tree.getPathKeys(newChild));
    }

    @Test
    public void testPathKeysDescendBackToTheSameNode() {
        for (Node node : Arrays.asList(root, child1, child2, grandChild)) {
            List<String> keys = tree.getPathKeys(node);
            tree.resetActiveNode();
            Node reached = tree.getActiveNode();
            for (String key : keys) {
                reached = tree.stepToChild(key);
            }
            Assert.assertSame(node, reached);
            Assert.assertSame(node, tree.findNode(keys));
        }
    }

    @Test
    public void testFindNodeDoesNotMoveActiveNode() {
        tree.stepToChild("child2");
        Assert.assertSame(grandChild, tree.findNode(Arrays.asList("child1", "grandChild")));
        Assert.assertNull(tree.findNode(Arrays.asList("child1", "missing")));
        Assert.assertSame(child2, tree.getActiveNode());
    }

    @Test
    public void testContains() {
        Assert.assertTrue(tree.contains(root));
        Assert.assertTrue(tree.contains(child1));
        Assert.assertTrue(tree.contains(grandChild));
        Assert.assertFalse(tree.contains(new Node("outside")));
        Assert.assertFalse(tree.contains(null));

        child1.removeChild("grandChild");
        Assert.assertFalse(tree.contains(grandChild));
    }
}

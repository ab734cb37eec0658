package org.Aayush.labelmap.tree;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import org.Aayush.labelmap.core.CollisionStatistics;
import org.Aayush.labelmap.core.CoordinateBounds;
import org.Aayush.labelmap.core.Entry;
import org.Aayush.labelmap.core.MapStorage;
import org.Aayush.labelmap.core.SpatialKey;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Unbalanced binary search tree keyed by {@code x*x + y*y}.
 * <p>
 * The key is not injective, so every node owns a collision list of entries sharing its key,
 * disambiguated by exact {@code (x, y)} match. The tree is never rebalanced: sequential keys
 * degrade it to a linked list with O(n) depth. Every walk and removal is iterative, so such
 * chains cost time but never stack depth.
 * </p>
 * <p>
 * PERFORMANCE CHARACTERISTICS:
 * - add / get / remove: O(depth + k), k = collision list length.
 * - listAll: in-order traversal, ascending key order.
 * - getWithinRadius(radius): in-order traversal stopped at the first key reaching
 *   {@code radius^2}.
 * - getInRegion and center-based radius: full scan (predicates are not monotonic in the key).
 */
public final class BstMapStorage implements MapStorage {

    private static final class Node {
        long key;
        ObjectArrayList<Entry> entries;
        Node left;
        Node right;

        Node(long key, Entry first) {
            this.key = key;
            this.entries = new ObjectArrayList<>(1);
            this.entries.add(first);
        }
    }

    private final CoordinateBounds bounds;
    private Node root;
    private int count;
    private int nodeCount;

    public BstMapStorage() {
        this(CoordinateBounds.DEFAULT_MAX_COORDINATE);
    }

    /**
     * @param maxCoordinate exclusive upper bound of both axes.
     */
    public BstMapStorage(int maxCoordinate) {
        this.bounds = CoordinateBounds.of(maxCoordinate);
    }

    @Override
    public boolean add(Entry entry) {
        Objects.requireNonNull(entry, "entry");
        bounds.validatePoint(entry.x(), entry.y());

        long key = SpatialKey.distanceKey(entry.x(), entry.y());
        if (root == null) {
            root = new Node(key, entry);
            nodeCount++;
            count++;
            return true;
        }

        Node node = root;
        while (true) {
            if (key < node.key) {
                if (node.left == null) {
                    node.left = new Node(key, entry);
                    nodeCount++;
                    count++;
                    return true;
                }
                node = node.left;
            } else if (key > node.key) {
                if (node.right == null) {
                    node.right = new Node(key, entry);
                    nodeCount++;
                    count++;
                    return true;
                }
                node = node.right;
            } else {
                ObjectArrayList<Entry> entries = node.entries;
                for (int i = 0; i < entries.size(); i++) {
                    if (entries.get(i).isAt(entry.x(), entry.y())) {
                        entries.set(i, entry);
                        return false;
                    }
                }
                // Key collision: distinct coordinates share this node.
                entries.add(entry);
                count++;
                return true;
            }
        }
    }

    @Override
    public Entry get(int x, int y) {
        bounds.validatePoint(x, y);
        Node node = findNode(SpatialKey.distanceKey(x, y));
        if (node == null) {
            return null;
        }
        for (Entry entry : node.entries) {
            if (entry.isAt(x, y)) {
                return entry;
            }
        }
        return null;
    }

    private Node findNode(long key) {
        Node node = root;
        while (node != null) {
            if (key < node.key) {
                node = node.left;
            } else if (key > node.key) {
                node = node.right;
            } else {
                return node;
            }
        }
        return null;
    }

    @Override
    public boolean remove(int x, int y) {
        bounds.validatePoint(x, y);
        long key = SpatialKey.distanceKey(x, y);

        Node parent = null;
        Node node = root;
        while (node != null && node.key != key) {
            parent = node;
            node = key < node.key ? node.left : node.right;
        }
        if (node == null || !removeFromBucket(node.entries, x, y)) {
            return false;
        }
        count--;
        if (node.entries.isEmpty()) {
            unlink(parent, node);
            nodeCount--;
        }
        return true;
    }

    private static boolean removeFromBucket(ObjectArrayList<Entry> entries, int x, int y) {
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).isAt(x, y)) {
                entries.remove(i);
                return true;
            }
        }
        return false;
    }

    /**
     * Excises {@code node} (a child of {@code parent}, or the root when parent is null).
     * A two-child node takes over the key and bucket of its in-order successor, which is
     * then spliced out of the right subtree.
     */
    private void unlink(Node parent, Node node) {
        if (node.left != null && node.right != null) {
            Node successorParent = node;
            Node successor = node.right;
            while (successor.left != null) {
                successorParent = successor;
                successor = successor.left;
            }
            node.key = successor.key;
            node.entries = successor.entries;
            if (successorParent == node) {
                successorParent.right = successor.right;
            } else {
                successorParent.left = successor.right;
            }
            return;
        }

        Node child = node.left != null ? node.left : node.right;
        if (parent == null) {
            root = child;
        } else if (parent.left == node) {
            parent.left = child;
        } else {
            parent.right = child;
        }
    }

    @Override
    public boolean contains(int x, int y) {
        return get(x, y) != null;
    }

    /**
     * Returns entries in ascending key order; entries sharing a key keep insertion order.
     */
    @Override
    public List<Entry> listAll() {
        List<Entry> result = new ArrayList<>(count);
        InOrderCursor cursor = new InOrderCursor(root);
        for (Node node = cursor.next(); node != null; node = cursor.next()) {
            result.addAll(node.entries);
        }
        return result;
    }

    @Override
    public List<Entry> getInRegion(int minX, int minY, int maxX, int maxY) {
        bounds.validateRegion(minX, minY, maxX, maxY);
        List<Entry> result = new ArrayList<>();
        for (Entry entry : listAll()) {
            if (entry.x() >= minX && entry.x() <= maxX && entry.y() >= minY && entry.y() <= maxY) {
                result.add(entry);
            }
        }
        return result;
    }

    /**
     * In-order walk that stops at the first node whose key reaches {@code radius^2}:
     * every node visited after it has a larger key.
     */
    @Override
    public List<Entry> getWithinRadius(int radius) {
        CoordinateBounds.requireNonNegativeRadius(radius);
        long radiusSquared = (long) radius * radius;
        List<Entry> result = new ArrayList<>();
        InOrderCursor cursor = new InOrderCursor(root);
        for (Node node = cursor.next(); node != null && node.key < radiusSquared; node = cursor.next()) {
            result.addAll(node.entries);
        }
        return result;
    }

    @Override
    public List<Entry> getWithinRadius(int centerX, int centerY, int radius) {
        bounds.validateCircle(centerX, centerY, radius);
        long radiusSquared = (long) radius * radius;
        List<Entry> result = new ArrayList<>();
        for (Entry entry : listAll()) {
            if (SpatialKey.squaredDistance(entry.x(), entry.y(), centerX, centerY) <= radiusSquared) {
                result.add(entry);
            }
        }
        return result;
    }

    @Override
    public void clear() {
        root = null;
        count = 0;
        nodeCount = 0;
    }

    @Override
    public int size() {
        return count;
    }

    @Override
    public int maxCoordinate() {
        return bounds.maxCoordinate();
    }

    /**
     * Number of tree nodes, i.e. distinct keys.
     */
    public int nodeCount() {
        return nodeCount;
    }

    /**
     * Tree height; 0 for an empty tree, 1 for a single node. Computed level by level.
     */
    public int height() {
        int height = 0;
        ObjectArrayList<Node> level = new ObjectArrayList<>();
        ObjectArrayList<Node> nextLevel = new ObjectArrayList<>();
        if (root != null) {
            level.add(root);
        }
        while (!level.isEmpty()) {
            height++;
            for (Node node : level) {
                if (node.left != null) {
                    nextLevel.add(node.left);
                }
                if (node.right != null) {
                    nextLevel.add(node.right);
                }
            }
            ObjectArrayList<Node> swap = level;
            level = nextLevel;
            nextLevel = swap;
            nextLevel.clear();
        }
        return height;
    }

    /**
     * Collision statistics over all nodes.
     */
    public CollisionStatistics statistics() {
        IntArrayList bucketSizes = new IntArrayList(nodeCount);
        InOrderCursor cursor = new InOrderCursor(root);
        for (Node node = cursor.next(); node != null; node = cursor.next()) {
            bucketSizes.add(node.entries.size());
        }
        return CollisionStatistics.ofBucketSizes(bucketSizes.toIntArray());
    }

    /**
     * Ascending-key node iterator backed by an explicit stack, so degenerate trees of any
     * depth are walked without recursion.
     */
    private static final class InOrderCursor {
        private final ObjectArrayList<Node> stack = new ObjectArrayList<>();
        private Node pending;

        InOrderCursor(Node root) {
            this.pending = root;
        }

        /**
         * @return next node in key order, or null when exhausted.
         */
        Node next() {
            while (pending != null) {
                stack.push(pending);
                pending = pending.left;
            }
            if (stack.isEmpty()) {
                return null;
            }
            Node node = stack.pop();
            pending = node.right;
            return node;
        }
    }
}

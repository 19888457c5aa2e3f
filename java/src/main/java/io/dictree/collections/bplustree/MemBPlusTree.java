package io.dictree.collections.bplustree;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Consumer;

import static io.dictree.collections.bplustree.ArrayLike.empty;

/**
 * An in-memory B+ tree holding a sorted multiset of keys.
 *
 * <p>Leaves are split copy-up (the first key of the new right leaf is also copied into the parent) and
 * internal nodes push-up (the middle key moves to the parent). Removal never merges or borrows, so leaves
 * can underflow and routing keys can go stale without affecting lookups.
 *
 * <p>Not thread-safe; callers must serialize access.
 */
public class MemBPlusTree<K> {
    public static final int DEFAULT_MAX_KEYS = 4;
    public static final int MIN_MAX_KEYS = AbstractBPlusTree.MIN_MAX_KEYS;

    private final AbstractBPlusTree<K, NodeImpl<K>> tree;

    public MemBPlusTree(Comparator<? super K> comparator) {
        this(DEFAULT_MAX_KEYS, comparator);
    }

    /**
     * @param maxKeys the most keys a node holds before it is split; at least 2
     * @param comparator the total order over keys
     */
    public MemBPlusTree(int maxKeys, Comparator<? super K> comparator) {
        this.tree = new AbstractBPlusTree<>(maxKeys, new NodeImpl<K>(true, empty(), empty()), comparator);
    }

    public static <K extends Comparable<? super K>> MemBPlusTree<K> naturalOrder(int maxKeys) {
        return new MemBPlusTree<>(maxKeys, Comparator.<K>naturalOrder());
    }

    public int getMaxKeys() {
        return tree.getMaxKeys();
    }

    public int size() {
        return tree.size();
    }

    public boolean isEmpty() {
        return !cursor().inTree();
    }

    public int height() {
        return tree.height();
    }

    /**
     * Adds key. Equal keys are kept side by side.
     *
     * @throws NullPointerException if key is null
     * @throws ClassCastException if the comparator can't order key against the keys already present
     */
    public void insert(K key) {
        tree.insert(key);
    }

    public boolean contains(K key) {
        return tree.contains(key);
    }

    /**
     * Removes one occurrence of key.
     *
     * @return false, leaving the tree untouched, if key wasn't present
     */
    public boolean remove(K key) {
        return tree.remove(key);
    }

    public LeafCursor<K> cursor() {
        return tree.cursor();
    }

    public void forEach(Consumer<? super K> action) {
        tree.forEach(action);
    }

    public List<K> keys() {
        final List<K> keys = new ArrayList<>();
        tree.forEach(keys::add);
        return keys;
    }

    public String sketch() {
        final StringBuilder b = new StringBuilder();
        sketch(tree.getRoot(), b);
        return b.toString();
    }

    static <K> void sketch(NodeImpl<K> node, StringBuilder b) {
        b.append('(');
        final int n = node.getKeys().size();
        for (int i = 0; i < n; i++) {
            if (i > 0) {
                b.append(' ');
            }
            if (!node.isLeaf()) {
                sketch(node.getChildren().get(i), b);
                b.append(' ');
            }
            b.append(node.getKeys().get(i));
        }
        if (!node.isLeaf()) {
            if (n > 0) {
                b.append(' ');
            }
            sketch(node.getChildren().get(n), b);
        }
        b.append(')');
    }

    public void checkInvariants() {
        final NodeImpl<K> root = tree.getRoot();
        final Comparator<? super K> comparator = tree.getComparator();
        root.checkLeafDepth();
        root.checkKeyOrder(comparator, null, null);
        checkLeafChain(root, comparator);
    }

    private void checkLeafChain(NodeImpl<K> root, Comparator<? super K> comparator) {
        final List<NodeImpl<K>> leaves = new ArrayList<>();
        root.collectLeaves(leaves);
        NodeImpl<K> leaf = tree.leftmostLeaf();
        K previous = null;
        for (NodeImpl<K> expected : leaves) {
            if (leaf != expected) {
                throw new IllegalStateException("leaf chain doesn't match the leaves of the tree");
            }
            final int n = leaf.getKeys().size();
            for (int i = 0; i < n; i++) {
                final K key = leaf.getKeys().get(i);
                if (previous != null && comparator.compare(previous, key) > 0) {
                    throw new IllegalStateException("leaf chain isn't in ascending order");
                }
                previous = key;
            }
            leaf = leaf.getNext();
        }
        if (leaf != null) {
            throw new IllegalStateException("leaf chain runs past the last leaf");
        }
    }

    static class NodeImpl<K> implements Node<K, NodeImpl<K>> {
        final boolean leaf;
        ArrayLike<K> keys;
        ArrayLike<NodeImpl<K>> children;
        NodeImpl<K> next;

        NodeImpl(boolean leaf, ArrayLike<K> keys, ArrayLike<NodeImpl<K>> children) {
            this.leaf = leaf;
            this.keys = keys.copy();
            this.children = children.copy();
        }

        @Override
        public boolean isLeaf() {
            return leaf;
        }

        @Override
        public ArrayLike<K> getKeys() {
            return keys;
        }

        @Override
        public ArrayLike<NodeImpl<K>> getChildren() {
            return children;
        }

        @Override
        public NodeImpl<K> getNext() {
            return next;
        }

        @Override
        public void setNext(NodeImpl<K> next) {
            this.next = next;
        }

        @Override
        public void update(ArrayLike<K> newKeys, ArrayLike<NodeImpl<K>> newChildren) {
            keys = newKeys.copy();
            children = newChildren.copy();
        }

        @Override
        public NodeImpl<K> createNode(boolean leaf, ArrayLike<K> keys, ArrayLike<NodeImpl<K>> children) {
            return new NodeImpl<>(leaf, keys, children);
        }

        // every key k of a child between routing keys lb and ub satisfies lb <= k <= ub
        void checkKeyOrder(Comparator<? super K> comparator, K lb, K ub) {
            final int n = keys.size();
            for (int i = 0; i < n; i++) {
                final K key = keys.get(i);
                if ((lb != null && comparator.compare(key, lb) < 0)
                        || (ub != null && comparator.compare(key, ub) > 0)
                        || (i > 0 && comparator.compare(keys.get(i - 1), key) > 0)) {
                    throw new IllegalStateException("wrong order");
                }
            }
            if (leaf) {
                if (children.size() != 0) {
                    throw new IllegalStateException("a leaf can't have children");
                }
                return;
            }
            if (children.size() != n + 1) {
                throw new IllegalStateException("wrong number of children");
            }
            for (int i = 0; i <= n; i++) {
                children.get(i).checkKeyOrder(comparator, i > 0 ? keys.get(i - 1) : lb, i < n ? keys.get(i) : ub);
            }
        }

        int checkLeafDepth() {
            if (leaf) {
                return 0;
            }
            final int depth = children.get(0).checkLeafDepth();
            final int n = children.size();
            for (int i = 1; i < n; i++) {
                if (children.get(i).checkLeafDepth() != depth) {
                    throw new IllegalStateException("not all leaves are at the same depth");
                }
            }
            return depth + 1;
        }

        void collectLeaves(List<NodeImpl<K>> leaves) {
            if (leaf) {
                leaves.add(this);
                return;
            }
            final int n = children.size();
            for (int i = 0; i < n; i++) {
                children.get(i).collectLeaves(leaves);
            }
        }
    }
}

package io.dictree.collections.bplustree;

import java.util.Comparator;
import java.util.Objects;
import java.util.function.Consumer;

import static io.dictree.collections.bplustree.ArrayLike.empty;
import static io.dictree.collections.bplustree.ArrayLike.wrap;

class AbstractBPlusTree<K, N extends Node<K, N>> {
    // a split needs a key at index mid = (maxKeys + 1) / 2
    static final int MIN_MAX_KEYS = 2;

    private final int maxKeys;
    // split point for a full node: the left half keeps keys [0, mid)
    private final int mid;
    private final Comparator<? super K> comparator;
    private N root;

    AbstractBPlusTree(int maxKeys, N root, Comparator<? super K> comparator) {
        if (maxKeys < MIN_MAX_KEYS) {
            throw new IllegalArgumentException(
                    String.format("maxKeys must be at least %d, got %d", MIN_MAX_KEYS, maxKeys));
        }
        this.maxKeys = maxKeys;
        this.mid = (maxKeys + 1) / 2;
        this.root = Objects.requireNonNull(root, "root");
        this.comparator = Objects.requireNonNull(comparator, "comparator");
    }

    N getRoot() {
        return root;
    }

    int getMaxKeys() {
        return maxKeys;
    }

    Comparator<? super K> getComparator() {
        return comparator;
    }

    int height() {
        int height = 1;
        for (N node = root; !node.isLeaf(); node = node.getChildren().first()) {
            height++;
        }
        return height;
    }

    N leftmostLeaf() {
        N node = root;
        while (!node.isLeaf()) {
            node = node.getChildren().first();
        }
        return node;
    }

    int size() {
        int n = 0;
        for (N leaf = leftmostLeaf(); leaf != null; leaf = leaf.getNext()) {
            n += leaf.getKeys().size();
        }
        return n;
    }

    void forEach(Consumer<? super K> action) {
        for (N leaf = leftmostLeaf(); leaf != null; leaf = leaf.getNext()) {
            final ArrayLike<K> keys = leaf.getKeys();
            final int n = keys.size();
            for (int i = 0; i < n; i++) {
                action.accept(keys.get(i));
            }
        }
    }

    LeafCursor<K> cursor() {
        return new LeafCursor<>(leftmostLeaf());
    }

    // First copy of key in key order, or null. Only children whose routing keys admit key are visited. A
    // boundary key copied up on a leaf split routes to the left child but lives in the right one, so a tie
    // visits both; otherwise the search follows a single path.
    private Lub<K, N> find(N node, K key) {
        final ArrayLike<K> keys = node.getKeys();
        if (node.isLeaf()) {
            final int i = keys.lowerBound(key, comparator);
            if (i < keys.size() && comparator.compare(key, keys.get(i)) == 0) {
                return new Lub<>(node, i);
            }
            return null;
        }
        final int last = keys.upperBound(key, comparator);
        for (int i = keys.lowerBound(key, comparator); i <= last; i++) {
            final Lub<K, N> lub = find(node.getChildren().get(i), key);
            if (lub != null) {
                return lub;
            }
        }
        return null;
    }

    boolean contains(K key) {
        Objects.requireNonNull(key, "key");
        return find(root, key) != null;
    }

    boolean remove(K key) {
        Objects.requireNonNull(key, "key");
        final Lub<K, N> lub = find(root, key);
        if (lub == null) {
            return false;
        }
        // no merging or borrowing: the leaf may underflow and routing keys above it may go stale
        lub.leaf.update(lub.leaf.getKeys().spliceOut(lub.i), empty());
        return true;
    }

    void insert(K key) {
        Objects.requireNonNull(key, "key");
        checkComparable(key);
        if (!isFull(root)) {
            insertInto(root, key);
            return;
        }
        final N newRoot = root.createNode(false, empty(), wrap(root));
        splitChild(newRoot, 0);
        root = newRoot;
        insertInto(newRoot, key);
    }

    // an incomparable key has to fail here, before a split has reshaped anything
    private void checkComparable(K key) {
        final ArrayLike<K> keys = root.getKeys();
        if (!keys.isEmpty()) {
            comparator.compare(key, keys.first());
        }
    }

    private boolean isFull(N node) {
        return node.getKeys().size() >= maxKeys;
    }

    // node is never full on entry
    private void insertInto(N node, K key) {
        final ArrayLike<K> keys = node.getKeys();
        int i = keys.upperBound(key, comparator);
        if (node.isLeaf()) {
            node.update(keys.spliceIn(i, key), empty());
            checkSizes(node);
            return;
        }
        if (isFull(node.getChildren().get(i))) {
            splitChild(node, i);
            if (comparator.compare(key, node.getKeys().get(i)) >= 0) {
                i++;
            }
        }
        insertInto(node.getChildren().get(i), key);
    }

    //              parent                                   parent
    //           ... k_i-1 k_i ...                     ... k_i-1 c k_i ...
    //                   |             ------>                 /     \
    //              (a b c d)                           (a b)       (c d)     leaf: c is copied up
    //              (a b c d)                           (a b)       (d)       internal: c is pushed up
    private void splitChild(N parent, int index) {
        final N node = parent.getChildren().get(index);
        final ArrayLike<K> keys = node.getKeys();
        final K promoted = keys.get(mid);
        final N sibling;
        if (node.isLeaf()) {
            sibling = node.createNode(true, keys.sliceFrom(mid), empty());
            node.update(keys.sliceTo(mid), empty());
            sibling.setNext(node.getNext());
            node.setNext(sibling);
        } else {
            final ArrayLike<N> children = node.getChildren();
            sibling = node.createNode(false, keys.sliceFrom(mid + 1), children.sliceFrom(mid + 1));
            node.update(keys.sliceTo(mid), children.sliceTo(mid + 1));
        }
        parent.update(parent.getKeys().spliceIn(index, promoted), parent.getChildren().spliceIn(index + 1, sibling));
        checkSizes(node);
        checkSizes(sibling);
        checkSizes(parent);
    }

    private void checkSizes(N node) {
        final int keys = node.getKeys().size();
        final int children = node.getChildren().size();
        if (keys > maxKeys) {
            throw new IllegalStateException(
                    String.format("wrong number of keys: expected at most %d, got %d", maxKeys, keys));
        }
        if (node.isLeaf()) {
            if (children != 0) {
                throw new IllegalStateException("a leaf can't have children");
            }
        } else if (children != keys + 1) {
            throw new IllegalStateException(
                    String.format("wrong number of children: expected %d, got %d", keys + 1, children));
        }
    }

    private static class Lub<K, N extends Node<K, N>> {
        final N leaf;
        final int i;

        Lub(N leaf, int i) {
            this.leaf = leaf;
            this.i = i;
        }
    }
}

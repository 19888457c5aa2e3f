package io.dictree.collections.bplustree;

import java.util.NoSuchElementException;

/**
 * Walks the keys of a tree in ascending order by following the chain of leaves. Leaves left empty by
 * removals are skipped.
 */
public class LeafCursor<K> {
    private Node<K, ?> leaf;
    private int i;

    LeafCursor(Node<K, ?> leaf) {
        this.leaf = leaf;
        this.i = 0;
        skipExhaustedLeaves();
    }

    public K getKey() {
        if (leaf == null) {
            return null;
        } else {
            return leaf.getKeys().get(i);
        }
    }

    public void moveRight() {
        if (leaf == null) {
            throw new NoSuchElementException("cursor has moved past the last key");
        }
        i++;
        skipExhaustedLeaves();
    }

    public boolean inTree() {
        return leaf != null;
    }

    private void skipExhaustedLeaves() {
        while (leaf != null && i >= leaf.getKeys().size()) {
            leaf = leaf.getNext();
            i = 0;
        }
    }
}

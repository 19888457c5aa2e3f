package io.dictree.collections.bplustree;

interface Node<K, Self extends Node<K, Self>> {
    // fixed when the node is created
    boolean isLeaf();

    ArrayLike<K> getKeys();

    // always empty for a leaf
    ArrayLike<Self> getChildren();

    // the next leaf to the right, or null; not an ownership edge
    Self getNext();

    void setNext(Self next);

    void update(ArrayLike<K> newKeys, ArrayLike<Self> newChildren);

    Self createNode(boolean leaf, ArrayLike<K> keys, ArrayLike<Self> children);
}

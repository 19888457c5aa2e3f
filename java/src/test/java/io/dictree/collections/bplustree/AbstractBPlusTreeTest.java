package io.dictree.collections.bplustree;

import static io.dictree.collections.bplustree.ArrayLike.empty;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.Comparator;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.Test;

public class AbstractBPlusTreeTest {
    private static final int N = 5000;

    private final AtomicInteger visits = new AtomicInteger();

    private AbstractBPlusTree<Integer, CountingNode> hollowTree() {
        final AbstractBPlusTree<Integer, CountingNode> tree =
                new AbstractBPlusTree<>(4, new CountingNode(visits, true, empty(), empty()), Comparator.naturalOrder());
        for (int i = 0; i < N; i++) {
            tree.insert(i);
        }
        // every leaf but the last one ends up empty
        for (int i = 0; i < N - 1; i++) {
            assertThat(tree.remove(i)).isTrue();
        }
        return tree;
    }

    @Test
    public void testLookupsSkipEmptiedLeaves() {
        final AbstractBPlusTree<Integer, CountingNode> tree = hollowTree();
        final int bound = 2 * tree.height() + 2;

        visits.set(0);
        assertThat(tree.contains(5)).isFalse();
        assertThat(visits.get()).isLessThanOrEqualTo(bound);

        visits.set(0);
        assertThat(tree.remove(7)).isFalse();
        assertThat(visits.get()).isLessThanOrEqualTo(bound);

        visits.set(0);
        assertThat(tree.contains(N - 1)).isTrue();
        assertThat(visits.get()).isLessThanOrEqualTo(bound);

        assertThat(tree.size()).isEqualTo(1);
    }

    @Test
    public void testBoundaryKeyIsFoundAfterItsLeftNeighbourEmpties() {
        final AbstractBPlusTree<Integer, CountingNode> tree =
                new AbstractBPlusTree<>(4, new CountingNode(visits, true, empty(), empty()), Comparator.naturalOrder());
        for (int i = 1; i <= 5; i++) {
            tree.insert(i);
        }
        // ((1 2) 3 (3 4 5)): 3 routes left but lives in the right leaf
        assertThat(tree.remove(1)).isTrue();
        assertThat(tree.remove(2)).isTrue();
        assertThat(tree.contains(3)).isTrue();
        assertThat(tree.remove(3)).isTrue();
        assertThat(tree.contains(3)).isFalse();
        assertThat(tree.contains(4)).isTrue();
    }

    static class CountingNode implements Node<Integer, CountingNode> {
        private final AtomicInteger visits;
        private final boolean leaf;
        private ArrayLike<Integer> keys;
        private ArrayLike<CountingNode> children;
        private CountingNode next;

        CountingNode(AtomicInteger visits, boolean leaf, ArrayLike<Integer> keys, ArrayLike<CountingNode> children) {
            this.visits = visits;
            this.leaf = leaf;
            this.keys = keys.copy();
            this.children = children.copy();
        }

        @Override
        public boolean isLeaf() {
            return leaf;
        }

        @Override
        public ArrayLike<Integer> getKeys() {
            visits.incrementAndGet();
            return keys;
        }

        @Override
        public ArrayLike<CountingNode> getChildren() {
            return children;
        }

        @Override
        public CountingNode getNext() {
            return next;
        }

        @Override
        public void setNext(CountingNode next) {
            this.next = next;
        }

        @Override
        public void update(ArrayLike<Integer> newKeys, ArrayLike<CountingNode> newChildren) {
            keys = newKeys.copy();
            children = newChildren.copy();
        }

        @Override
        public CountingNode createNode(boolean leaf, ArrayLike<Integer> keys, ArrayLike<CountingNode> children) {
            return new CountingNode(visits, leaf, keys, children);
        }
    }
}

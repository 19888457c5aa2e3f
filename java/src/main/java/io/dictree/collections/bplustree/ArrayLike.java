package io.dictree.collections.bplustree;

import java.util.Comparator;

/**
 * A read-only view over a sequence. Transforms such as {@link #spliceIn} build lazy views over their
 * inputs, so a node that keeps one must {@link #copy()} it first.
 */
public interface ArrayLike<T> {
    int size();

    T get(int i);

    void copyTo(int srcPos, Object[] dst, int dstPos, int length);

    default boolean isEmpty() {
        return size() == 0;
    }

    default ArrayLike<T> copy() {
        final int n = size();
        final Object[] arr = new Object[n];
        copyTo(0, arr, 0, n);
        return new ArrayWrapper<>(arr);
    }

    default T first() {
        return get(0);
    }

    // searches; both are linear scans over a sorted array

    // index of the first element >= t, or size() if there is none
    default int lowerBound(T t, Comparator<? super T> comparator) {
        final int n = size();
        for (int i = 0; i < n; i++) {
            if (comparator.compare(t, get(i)) <= 0) {
                return i;
            }
        }
        return n;
    }

    // index of the first element > t, or size() if there is none
    default int upperBound(T t, Comparator<? super T> comparator) {
        final int n = size();
        for (int i = 0; i < n; i++) {
            if (comparator.compare(t, get(i)) < 0) {
                return i;
            }
        }
        return n;
    }

    // transforms

    default ArrayLike<T> sliceFrom(int i) {
        return new Slice<>(this, i, size());
    }

    default ArrayLike<T> sliceTo(int i) {
        return new Slice<>(this, 0, i);
    }

    default ArrayLike<T> spliceIn(int i, T t) {
        return sliceTo(i).concat(wrap(t)).concat(sliceFrom(i));
    }

    default ArrayLike<T> spliceOut(int i) {
        return sliceTo(i).concat(sliceFrom(i + 1));
    }

    default ArrayLike<T> concat(ArrayLike<T> other) {
        return new Concat<>(this, other);
    }

    // constructors

    @SafeVarargs  // ts may have run-time type Object[]
    static <T> ArrayLike<T> wrap(T... ts) {
        return new ArrayWrapper<>(ts);
    }

    static <T> ArrayLike<T> empty() {
        return wrap();
    }

    class Slice<T> implements ArrayLike<T> {
        final ArrayLike<T> delegate;
        final int from;
        final int to;

        public Slice(ArrayLike<T> delegate, int from, int to) {
            if (from < 0) {
                throw new IllegalArgumentException("negative slice start: " + from);
            }
            this.delegate = delegate;
            this.to = Math.min(to, delegate.size());
            this.from = Math.min(from, this.to);
        }

        @Override
        public int size() {
            return to - from;
        }

        @Override
        public T get(int i) {
            if (i >= 0 && from + i < to) {
                return delegate.get(from + i);
            }
            throw new IndexOutOfBoundsException("index " + i + " out of slice of size " + size());
        }

        @Override
        public void copyTo(int srcPos, Object[] dst, int dstPos, int length) {
            if (from + srcPos + length > to) {
                throw new IndexOutOfBoundsException();
            }
            delegate.copyTo(from + srcPos, dst, dstPos, length);
        }
    }

    class ArrayWrapper<T> implements ArrayLike<T> {
        final Object[] ts;  // see wrap for why this is Object[] not T[]

        ArrayWrapper(Object[] ts) {
            this.ts = ts;
        }

        @Override
        public int size() {
            return ts.length;
        }

        @SuppressWarnings("unchecked")
        @Override
        public T get(int i) {
            return (T) ts[i];
        }

        @Override
        public void copyTo(int srcPos, Object[] dst, int dstPos, int length) {
            System.arraycopy(ts, srcPos, dst, dstPos, length);
        }
    }

    class Concat<T> implements ArrayLike<T> {
        final ArrayLike<T> first;
        final ArrayLike<T> second;
        final int firstCount;
        final int secondCount;

        Concat(ArrayLike<T> first, ArrayLike<T> second) {
            this.first = first;
            this.second = second;
            this.firstCount = first.size();
            this.secondCount = second.size();
        }

        @Override
        public int size() {
            return firstCount + secondCount;
        }

        @Override
        public T get(int i) {
            if (i < firstCount) {
                return first.get(i);
            }
            return second.get(i - firstCount);
        }

        @Override
        public void copyTo(int srcPos, Object[] dst, int dstPos, int length) {
            if (srcPos >= firstCount) {
                second.copyTo(srcPos - firstCount, dst, dstPos, length);
                return;
            }
            final int inFirst = Math.min(firstCount - srcPos, length);
            first.copyTo(srcPos, dst, dstPos, inFirst);
            if (length > inFirst) {
                second.copyTo(0, dst, dstPos + inFirst, length - inFirst);
            }
        }
    }
}

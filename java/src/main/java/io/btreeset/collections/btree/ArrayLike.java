package io.btreeset.collections.btree;

import java.util.Comparator;
import java.util.function.BiFunction;

public interface ArrayLike<T> {
    int size();

    T get(int i);

    default ArrayLike<T> copy() {
        final int n = size();
        final Object[] arr = new Object[n];
        copyTo(0, arr, 0, n);
        return new ArrayWrapper<>(arr);
    }

    void copyTo(int srcPos, Object[] dst, int dstPos, int length);

    default <A> A fold(BiFunction<T, A, A> f, A a) {
        final int n = size();
        for (int i = 0; i < n; i++) {
            a = f.apply(get(i), a);
        }
        return a;
    }

    default T first() {
        return get(0);
    }

    // same contract as Collections.binarySearch
    default int binarySearch(T key, Comparator<? super T> comparator) {
        int lo = 0;
        int hi = size() - 1;
        while (lo <= hi) {
            final int mid = (lo + hi) >>> 1;
            final int c = comparator.compare(get(mid), key);
            if (c < 0) {
                lo = mid + 1;
            } else if (c > 0) {
                hi = mid - 1;
            } else {
                return mid;
            }
        }
        return -(lo + 1);
    }

    // transforms, lazy until copied

    default ArrayLike<T> sliceFrom(int i) {
        return new Slice<>(this, i, size());
    }

    default ArrayLike<T> sliceTo(int i) {
        return new Slice<>(this, 0, i);
    }

    default ArrayLike<T> spliceIn(int i, T t) {
        return sliceTo(i).concat(wrap(t)).concat(sliceFrom(i));
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
            throw new IndexOutOfBoundsException("index " + i + " outside slice of size " + size());
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
            if (srcPos + length > firstCount + secondCount) {
                throw new IndexOutOfBoundsException();
            }
            if (srcPos >= firstCount) {
                second.copyTo(srcPos - firstCount, dst, dstPos, length);
                return;
            }
            final int fromFirst = Math.min(firstCount - srcPos, length);
            first.copyTo(srcPos, dst, dstPos, fromFirst);
            if (length > fromFirst) {
                second.copyTo(0, dst, dstPos + fromFirst, length - fromFirst);
            }
        }
    }
}

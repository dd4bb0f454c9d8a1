package io.btreeset.collections.btree;

import java.util.Comparator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.btreeset.collections.btree.ArrayLike.empty;
import static io.btreeset.collections.btree.ArrayLike.wrap;

// a node splits its overflowing children but never itself; the root's overflow is left to BTree
final class Node<K> {
    private static final Logger logger = LoggerFactory.getLogger(Node.class);

    private final int order;
    private final NodeKind kind;
    private final Comparator<? super K> comparator;
    private ArrayLike<K> keys;
    private ArrayLike<Node<K>> children;

    Node(int order, NodeKind kind, Comparator<? super K> comparator, ArrayLike<K> keys, ArrayLike<Node<K>> children) {
        this.order = order;
        this.kind = kind;
        this.comparator = comparator;
        this.keys = keys.copy();
        this.children = children.copy();
    }

    static <K> Node<K> emptyRoot(int order, Comparator<? super K> comparator) {
        return new Node<>(order, NodeKind.ROOT, comparator, empty(), empty());
    }

    @SafeVarargs
    static <K> Node<K> leaf(int order, Comparator<? super K> comparator, K... keys) {
        return new Node<>(order, NodeKind.LEAF, comparator, wrap(keys), empty());
    }

    // the fewest children a non-root node may keep, ceil(order / 2)
    static int minChildren(int order) {
        return (order / 2) + (order % 2);
    }

    int getOrder() {
        return order;
    }

    Comparator<? super K> getComparator() {
        return comparator;
    }

    NodeKind getKind() {
        return kind;
    }

    ArrayLike<K> getKeys() {
        return keys;
    }

    ArrayLike<Node<K>> getChildren() {
        return children;
    }

    boolean isLeaf() {
        return children.size() == 0;
    }

    boolean isOverflow() {
        return keys.size() == order;
    }

    private void update(ArrayLike<K> newKeys, ArrayLike<Node<K>> newChildren) {
        keys = newKeys.copy();
        children = newChildren.copy();
    }

    private Lub findLub(K key) {
        final int i = keys.binarySearch(key, comparator);
        return i >= 0 ? new Lub(i, true) : new Lub(-(i + 1), false);
    }

    K get(K key) {
        final Lub lub = findLub(key);
        if (lub.exact) {
            return key;
        } else if (isLeaf()) {
            return null;
        } else {
            return children.get(lub.i).get(key);
        }
    }

    // false if an equal key was already present
    boolean insert(K key) {
        final Lub lub = findLub(key);
        if (lub.exact) {
            return false;
        }
        if (isLeaf()) {
            update(keys.spliceIn(lub.i, key), empty());
            return true;
        }
        final Node<K> child = children.get(lub.i);
        final boolean added = child.insert(key);
        if (child.isOverflow()) {
            splitChildren(lub.i);
        }
        return added;
    }

    void splitChildren(int index) {
        final Node<K> child = children.get(index);
        if (!child.isOverflow()) {
            throw new IllegalStateException(
                    String.format(
                            "child %d holds %d keys, a split needs %d", index, child.keys.size(), child.order));
        }
        final int splitAt = child.order / 2;
        final K median = child.keys.get(splitAt);
        final Node<K> sibling = child.upperHalf(splitAt, child.kind);
        child.update(child.keys.sliceTo(splitAt), child.isLeaf() ? empty() : child.children.sliceTo(splitAt + 1));
        update(keys.spliceIn(index, median), children.spliceIn(index + 1, sibling));
        logger.trace("split child {} around {}", index, median);
    }

    Node<K> lowerHalf(int splitAt, NodeKind halfKind) {
        return new Node<>(
                order, halfKind, comparator, keys.sliceTo(splitAt), isLeaf() ? empty() : children.sliceTo(splitAt + 1));
    }

    Node<K> upperHalf(int splitAt, NodeKind halfKind) {
        return new Node<>(
                order,
                halfKind,
                comparator,
                keys.sliceFrom(splitAt + 1),
                isLeaf() ? empty() : children.sliceFrom(splitAt + 1));
    }

    void traverse(List<K> out) {
        final int n = keys.size();
        for (int i = 0; i < n; i++) {
            if (!isLeaf()) {
                children.get(i).traverse(out);
            }
            out.add(keys.get(i));
        }
        if (!isLeaf()) {
            children.get(n).traverse(out);
        }
    }

    int size() {
        return children.fold((child, n) -> n + child.size(), keys.size());
    }

    int height() {
        return isLeaf() ? 1 : 1 + children.first().height();
    }

    void sketch(StringBuilder b) {
        b.append('(');
        final int n = keys.size();
        for (int i = 0; i < n; i++) {
            if (i > 0) {
                b.append(' ');
            }
            if (!isLeaf()) {
                children.get(i).sketch(b);
                b.append(' ');
            }
            b.append(keys.get(i));
        }
        if (!isLeaf()) {
            if (n > 0) {
                b.append(' ');
            }
            children.get(n).sketch(b);
        }
        b.append(')');
    }

    @Override
    public String toString() {
        final StringBuilder b = new StringBuilder();
        sketch(b);
        return b.toString();
    }

    void checkInvariants() {
        checkShape(order);
        checkLeafDepth();
        checkKeyOrder(null, null);
    }

    private void checkShape(int treeOrder) {
        if (order != treeOrder) {
            throw new IllegalStateException(String.format("node of order %d in a tree of order %d", order, treeOrder));
        }
        if (keys.size() >= order) {
            throw new IllegalStateException(
                    String.format("wrong number of keys: expected fewer than %d, got %d", order, keys.size()));
        }
        if (children.size() > order) {
            throw new IllegalStateException(
                    String.format("wrong number of children: expected at most %d, got %d", order, children.size()));
        }
        switch (kind) {
            case LEAF:
                if (children.size() != 0) {
                    throw new IllegalStateException("leaf with " + children.size() + " children");
                }
                break;
            case ROOT:
                if (children.size() == 1) {
                    throw new IllegalStateException("root with a single child");
                }
                break;
            case INTERNAL:
                if (children.size() < minChildren(order)) {
                    throw new IllegalStateException(
                            String.format(
                                    "wrong number of children: expected %d to %d, got %d",
                                    minChildren(order), order, children.size()));
                }
                break;
            default:
                throw new IllegalStateException("unknown node kind " + kind);
        }
        if (!isLeaf() && children.size() != keys.size() + 1) {
            throw new IllegalStateException(
                    String.format("%d keys need %d children, got %d", keys.size(), keys.size() + 1, children.size()));
        }
        final int n = children.size();
        for (int i = 0; i < n; i++) {
            final Node<K> child = children.get(i);
            if (child.kind == NodeKind.ROOT) {
                throw new IllegalStateException("root-kind node below the root");
            }
            child.checkShape(treeOrder);
        }
    }

    private int checkLeafDepth() {
        if (isLeaf()) {
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

    // every key must lie strictly between lb and ub; a null bound is open
    private void checkKeyOrder(K lb, K ub) {
        final int n = keys.size();
        for (int i = 0; i < n; i++) {
            final K k = keys.get(i);
            if ((lb != null && comparator.compare(k, lb) <= 0)
                    || (ub != null && comparator.compare(k, ub) >= 0)
                    || (i > 0 && comparator.compare(keys.get(i - 1), k) >= 0)) {
                throw new IllegalStateException("wrong order at key " + k);
            }
        }
        if (!isLeaf()) {
            for (int i = 0; i <= n; i++) {
                children.get(i).checkKeyOrder(i > 0 ? keys.get(i - 1) : lb, i < n ? keys.get(i) : ub);
            }
        }
    }

    private static class Lub {
        final int i;
        final boolean exact;

        Lub(int i, boolean exact) {
            this.i = i;
            this.exact = exact;
        }
    }
}

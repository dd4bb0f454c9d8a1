package io.btreeset.collections.btree;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.btreeset.collections.btree.ArrayLike.wrap;

public class BTree<K> implements Iterable<K> {
    private static final Logger logger = LoggerFactory.getLogger(BTree.class);

    private final int order;
    private final Comparator<? super K> comparator;
    private Node<K> root;
    private int modCount;

    public BTree(int order, Comparator<? super K> comparator) {
        if (order < 3) {
            throw new IllegalArgumentException("the minimum sensible order is 3, got " + order);
        }
        this.order = order;
        this.comparator = Objects.requireNonNull(comparator, "comparator");
        this.root = Node.emptyRoot(order, comparator);
    }

    public static <K extends Comparable<? super K>> BTree<K> naturalOrder(int order) {
        return new BTree<>(order, Comparator.naturalOrder());
    }

    // wraps an existing node structure, taking order and comparator from its root
    BTree(Node<K> root) {
        if (root.getKind() != NodeKind.ROOT) {
            throw new IllegalArgumentException("top node is a " + root.getKind() + ", not the root");
        }
        if (root.getOrder() < 3) {
            throw new IllegalArgumentException("the minimum sensible order is 3, got " + root.getOrder());
        }
        this.order = root.getOrder();
        this.comparator = Objects.requireNonNull(root.getComparator(), "comparator");
        this.root = root;
    }

    public int getOrder() {
        return order;
    }

    /**
     * Looks up {@code key}.
     *
     * @return the given key if an equal key is in the tree, otherwise null
     */
    public K get(K key) {
        return root.get(Objects.requireNonNull(key, "key"));
    }

    public boolean contains(K key) {
        return get(key) != null;
    }

    public void insert(K key) {
        Objects.requireNonNull(key, "key");
        if (!root.insert(key)) {
            return;
        }
        modCount++;
        if (root.isOverflow()) {
            splitRoot();
        }
    }

    // the root has no parent to take its median, so its halves go under a brand-new root
    private void splitRoot() {
        final int index = root.getOrder() / 2;
        final NodeKind halfKind = root.isLeaf() ? NodeKind.LEAF : NodeKind.INTERNAL;
        final K median = root.getKeys().get(index);
        final Node<K> left = root.lowerHalf(index, halfKind);
        final Node<K> right = root.upperHalf(index, halfKind);
        root = new Node<>(order, NodeKind.ROOT, comparator, wrap(median), wrap(left, right));
        logger.debug("root split around {}, height is now {}", median, root.height());
    }

    public List<K> traverse() {
        final List<K> keys = new ArrayList<>();
        root.traverse(keys);
        return keys;
    }

    @Override
    public Iterator<K> iterator() {
        return new Cursor<>(root, () -> modCount);
    }

    public int size() {
        return root.size();
    }

    public boolean isEmpty() {
        return root.getKeys().size() == 0;
    }

    public int height() {
        return root.height();
    }

    // e.g. ((1 2) 3 (4 5))
    public String sketch() {
        return root.toString();
    }

    /**
     * Validates the structure of the whole tree.
     *
     * @throws IllegalStateException describing the first violation found
     */
    public void checkInvariants() {
        if (root.getKind() != NodeKind.ROOT) {
            throw new IllegalStateException("top node is a " + root.getKind() + ", not the root");
        }
        root.checkInvariants();
    }

    Node<K> getRoot() {
        return root;
    }

    @Override
    public String toString() {
        return "BTree(order=" + order + ") " + sketch();
    }
}

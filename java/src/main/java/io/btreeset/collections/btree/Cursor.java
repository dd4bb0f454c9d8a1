package io.btreeset.collections.btree;

import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Stack;
import java.util.function.IntSupplier;

class Cursor<K> implements Iterator<K> {
    private final Stack<Frame<K>> stack = new Stack<>();
    private final IntSupplier modCount;
    private final int expectedModCount;

    Cursor(Node<K> root, IntSupplier modCount) {
        this.modCount = modCount;
        this.expectedModCount = modCount.getAsInt();
        if (root.getKeys().size() > 0) {
            stack.push(new Frame<>(root));
            descend();
        }
    }

    @Override
    public boolean hasNext() {
        checkForComodification();
        return !stack.isEmpty();
    }

    @Override
    public K next() {
        checkForComodification();
        if (stack.isEmpty()) {
            throw new NoSuchElementException();
        }
        final K key = stack.peek().getKey();
        moveRight();
        return key;
    }

    private void moveRight() {
        final Frame<K> f = stack.peek();
        if (f.canMoveRight()) {
            f.i++;
            descend();
        } else {
            while (!stack.isEmpty() && !stack.peek().canMoveRight()) {
                stack.pop();
            }
        }
    }

    private void descend() {
        while (!stack.peek().node.isLeaf()) {
            stack.push(stack.peek().getFrameBelow());
        }
    }

    private void checkForComodification() {
        if (modCount.getAsInt() != expectedModCount) {
            throw new ConcurrentModificationException();
        }
    }

    private static class Frame<K> {
        final Node<K> node;
        int i;

        Frame(Node<K> node) {
            this.node = node;
        }

        K getKey() {
            return node.getKeys().get(i);
        }

        // in a non-leaf frame i also names the child to the left of key i
        boolean canMoveRight() {
            return i < (node.isLeaf() ? node.getKeys() : node.getChildren()).size() - 1;
        }

        Frame<K> getFrameBelow() {
            return new Frame<>(node.getChildren().get(i));
        }
    }
}

package io.btreeset.collections.btree;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.junit.Test;

import static io.btreeset.collections.btree.ArrayLike.empty;
import static io.btreeset.collections.btree.ArrayLikes.copyOut;
import static io.btreeset.collections.btree.ArrayLike.wrap;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class NodeTest {
    private static final Comparator<Integer> NATURAL = Comparator.naturalOrder();

    private static Node<Integer> leaf(int order, Integer... keys) {
        return Node.leaf(order, NATURAL, keys);
    }

    @SafeVarargs
    private static Node<Integer> node(int order, NodeKind kind, Integer[] keys, Node<Integer>... children) {
        return new Node<>(order, kind, NATURAL, wrap(keys), wrap(children));
    }

    private static Integer[] keys(Integer... keys) {
        return keys;
    }

    @Test
    public void testSplitChildrenPromotesMedian() {
        final Node<Integer> node =
                node(3, NodeKind.INTERNAL, keys(2, 6), leaf(3, 1), leaf(3, 3, 4, 5), leaf(3, 7));
        node.splitChildren(1);
        assertThat(node.toString()).isEqualTo("((1) 2 (3) 4 (5) 6 (7))");
        assertThat(node.getChildren().size()).isEqualTo(4);
        for (int i = 0; i < 4; i++) {
            assertThat(node.getChildren().get(i).getKind()).isEqualTo(NodeKind.LEAF);
            assertThat(node.getChildren().get(i).getOrder()).isEqualTo(3);
        }
    }

    @Test
    public void testSplitChildrenMovesGrandchildren() {
        // order 4: the middle child holds four keys and five leaves
        final Node<Integer> middle = node(
                4,
                NodeKind.INTERNAL,
                keys(20, 30, 40, 50),
                leaf(4, 15),
                leaf(4, 25),
                leaf(4, 35),
                leaf(4, 45),
                leaf(4, 55));
        final Node<Integer> node = node(4, NodeKind.ROOT, keys(10, 60), node(4, NodeKind.INTERNAL, keys(5), leaf(4, 1), leaf(4, 7)), middle, node(4, NodeKind.INTERNAL, keys(70), leaf(4, 65), leaf(4, 75)));
        node.splitChildren(1);
        assertThat(node.toString())
                .isEqualTo("(((1) 5 (7)) 10 ((15) 20 (25) 30 (35)) 40 ((45) 50 (55)) 60 ((65) 70 (75)))");
        assertThat(node.getChildren().get(2).getKind()).isEqualTo(NodeKind.INTERNAL);
        node.checkInvariants();
    }

    @Test
    public void testSplitChildrenRejectsChildWithRoom() {
        final Node<Integer> node = node(3, NodeKind.ROOT, keys(2), leaf(3, 1), leaf(3, 3, 4));
        assertThatThrownBy(() -> node.splitChildren(1))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("a split needs 3");
        assertThat(node.toString()).isEqualTo("((1) 2 (3 4))");
    }

    @Test
    public void testInsertIntoLeafKeepsOrder() {
        final Node<Integer> node = leaf(5);
        assertThat(node.insert(30)).isTrue();
        assertThat(node.insert(10)).isTrue();
        assertThat(node.insert(20)).isTrue();
        assertThat(node.insert(20)).isFalse();
        assertThat(copyOut(node.getKeys(), Integer.class)).containsExactly(10, 20, 30);
    }

    @Test
    public void testInsertLeavesOwnOverflowToCaller() {
        final Node<Integer> node = leaf(3, 1, 2);
        assertThat(node.isOverflow()).isFalse();
        node.insert(3);
        assertThat(node.isOverflow()).isTrue();
        assertThat(node.toString()).isEqualTo("(1 2 3)");
    }

    @Test
    public void testInsertSplitsOverflowingChild() {
        final Node<Integer> node = node(3, NodeKind.ROOT, keys(10), leaf(3, 1, 2), leaf(3, 11));
        node.insert(3);
        assertThat(node.toString()).isEqualTo("((1) 2 (3) 10 (11))");
        node.checkInvariants();
    }

    @Test
    public void testGetDescendsToChild() {
        final Node<Integer> node = node(3, NodeKind.ROOT, keys(4), leaf(3, 1, 2), leaf(3, 6));
        final Integer probe = 6;
        assertThat(node.get(probe)).isSameAs(probe);
        assertThat(node.get(4)).isEqualTo(4);
        assertThat(node.get(5)).isNull();
        assertThat(node.get(0)).isNull();
    }

    @Test
    public void testTraverse() {
        final Node<Integer> node = node(3, NodeKind.ROOT, keys(4), leaf(3, 1, 2), leaf(3, 6));
        final List<Integer> out = new ArrayList<>();
        node.traverse(out);
        assertThat(out).containsExactly(1, 2, 4, 6);
    }

    @Test
    public void testValidLeaf() {
        leaf(3, 1, 2).checkInvariants();
    }

    @Test
    public void testInvalidLeaf() {
        assertThatThrownBy(() -> leaf(3, 1, 2, 3).checkInvariants())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("wrong number of keys");
    }

    @Test
    public void testValidTree() {
        final Node<Integer> tree = node(
                4,
                NodeKind.ROOT,
                keys(4),
                node(4, NodeKind.INTERNAL, keys(2), leaf(4, 1), leaf(4, 3)),
                node(4, NodeKind.INTERNAL, keys(6, 8), leaf(4, 5), leaf(4, 7), leaf(4, 9, 10)));
        tree.checkInvariants();
        assertThat(tree.height()).isEqualTo(3);
        assertThat(tree.size()).isEqualTo(10);
    }

    @Test
    public void testInternalNodeWithTooFewChildren() {
        final Node<Integer> tree = node(
                5,
                NodeKind.ROOT,
                keys(10),
                node(5, NodeKind.INTERNAL, keys(5), leaf(5, 1), leaf(5, 7)),
                node(5, NodeKind.INTERNAL, keys(20, 30), leaf(5, 15), leaf(5, 25), leaf(5, 35)));
        assertThatThrownBy(tree::checkInvariants)
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("wrong number of children: expected 3 to 5, got 2");
    }

    @Test
    public void testTooManyChildren() {
        final Node<Integer> tree = node(3, NodeKind.ROOT, keys(5), leaf(3, 1), leaf(3, 3), leaf(3, 7), leaf(3, 9));
        assertThatThrownBy(tree::checkInvariants)
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("wrong number of children: expected at most 3, got 4");
    }

    @Test
    public void testRootWithSingleChild() {
        final Node<Integer> tree = new Node<>(3, NodeKind.ROOT, NATURAL, empty(), wrap(leaf(3, 1)));
        assertThatThrownBy(tree::checkInvariants).isInstanceOf(IllegalStateException.class);
    }

    @Test
    public void testMixedOrders() {
        final Node<Integer> tree = node(3, NodeKind.ROOT, keys(2), leaf(3, 1), leaf(4, 3));
        assertThatThrownBy(tree::checkInvariants)
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("node of order 4 in a tree of order 3");
    }

    @Test
    public void testKeysOutOfOrder() {
        final Node<Integer> tree = node(3, NodeKind.ROOT, keys(2), leaf(3, 1), leaf(3, 0));
        assertThatThrownBy(tree::checkInvariants)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageStartingWith("wrong order");
    }

    @Test
    public void testLeavesAtDifferentDepths() {
        final Node<Integer> tree = node(
                3,
                NodeKind.ROOT,
                keys(5),
                node(3, NodeKind.INTERNAL, keys(2), leaf(3, 1), leaf(3, 3)),
                leaf(3, 7));
        assertThatThrownBy(tree::checkInvariants)
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("not all leaves are at the same depth");
    }

    @Test
    public void testMinChildren() {
        assertThat(Node.minChildren(3)).isEqualTo(2);
        assertThat(Node.minChildren(4)).isEqualTo(2);
        assertThat(Node.minChildren(5)).isEqualTo(3);
        assertThat(Node.minChildren(16)).isEqualTo(8);
    }
}

package com.yongkangl.nexus.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Works on {@code ((A:1,B:2)x:3,C)}.
 */
class TreeTest {

    private static Tree sample() {
        NodeBuilder x = new NodeBuilder().setLabel("x").setBranchLength(3)
                .addChild(new NodeBuilder().setTaxon("A", 0).setBranchLength(1))
                .addChild(new NodeBuilder().setTaxon("B", 1).setBranchLength(2));
        NodeBuilder root = new NodeBuilder().addChild(x).addChild(new NodeBuilder().setTaxon("C", 2));
        return new Tree("sample", Rooting.ROOTED, root);
    }

    private static List<String> labels(Iterable<TreeNode> nodes) {
        List<String> labels = new ArrayList<>();
        for (TreeNode node : nodes) {
            labels.add(node.isRoot() ? "root" : node.getLabel());
        }
        return labels;
    }

    private final Tree tree = sample();

    @Nested
    @DisplayName("traversal")
    class Traversal {

        @Test
        void preorderVisitsParentsFirst() {
            assertThat(labels(tree.preorder())).containsExactly("root", "x", "A", "B", "C");
        }

        @Test
        void postorderVisitsChildrenFirst() {
            assertThat(labels(tree.postorder())).containsExactly("A", "B", "x", "C", "root");
        }

        @Test
        void leavesInLeftToRightOrder() {
            assertThat(labels(tree.leaves())).containsExactly("A", "B", "C");
            assertThat(tree.getLeafCount()).isEqualTo(3);
        }

        @Test
        void traversalsCanBeRestarted() {
            Iterable<TreeNode> preorder = tree.preorder();
            assertThat(labels(preorder)).isEqualTo(labels(preorder));
        }

        @Test
        void exhaustedIteratorThrows() {
            Iterator<TreeNode> leaves = tree.leaves().iterator();
            leaves.next();
            leaves.next();
            leaves.next();
            assertThat(leaves.hasNext()).isFalse();
            assertThatThrownBy(leaves::next).isInstanceOf(NoSuchElementException.class);
        }

        @Test
        void singleLeafTree() {
            Tree lonely = new Tree(null, Rooting.UNSPECIFIED, new NodeBuilder().setTaxon("A", 0));
            assertThat(labels(lonely.postorder())).containsExactly("root");
            assertThat(lonely.getRoot().isLeaf()).isTrue();
            assertThat(lonely.getLeafCount()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("nodes")
    class Nodes {

        @Test
        void parentLinksAndDepth() {
            TreeNode a = tree.findLeaf("A");
            assertThat(a.getDepth()).isEqualTo(2);
            assertThat(a.getParent().getLabel()).isEqualTo("x");
            assertThat(a.getParent().getParent()).isSameAs(tree.getRoot());
            assertThat(tree.getRoot().isRoot()).isTrue();
        }

        @Test
        void internalNodesHaveNoTaxon() {
            TreeNode x = tree.getRoot().getChild(0);
            assertThat(x.getLabel()).isEqualTo("x");
            assertThatThrownBy(x::getTaxonName).isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(x::getTaxonIndex).isInstanceOf(IllegalStateException.class);
        }

        @Test
        void leafCarriesTaxonIndex() {
            assertThat(tree.findLeaf("B").getTaxonIndex()).isEqualTo(1);
            assertThat(tree.findLeaf("Z")).isNull();
        }

        @Test
        void childrenAreUnmodifiable() {
            List<TreeNode> children = tree.getRoot().getChildren();
            assertThatThrownBy(() -> children.remove(0)).isInstanceOf(UnsupportedOperationException.class);
            assertThatThrownBy(() -> tree.getAnnotations().put("k", "v"))
                    .isInstanceOf(UnsupportedOperationException.class);
        }

        @Test
        void laterBuilderChangesDoNotLeakIntoTheTree() {
            NodeBuilder leaf = new NodeBuilder().setTaxon("A", 0).putAnnotation("rate", "1");
            NodeBuilder root = new NodeBuilder().addChild(leaf).addChild(new NodeBuilder().setTaxon("B", 1));
            Tree frozen = new Tree(null, Rooting.UNROOTED, root);
            leaf.putAnnotation("rate", "2");
            root.addChild(new NodeBuilder().setTaxon("C", 2));
            assertThat(frozen.getLeafCount()).isEqualTo(2);
            assertThat(frozen.findLeaf("A").getAnnotations()).containsEntry("rate", "1");
        }

        @Test
        void leafWithoutTaxonIsRejected() {
            NodeBuilder root = new NodeBuilder().addChild(new NodeBuilder().setLabel("A"));
            assertThatThrownBy(() -> new Tree(null, Rooting.ROOTED, root))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("path length")
    class PathLength {

        @Test
        void sumsBranchLengthsBelowTheRoot() {
            assertThat(tree.pathLength(tree.findLeaf("A"))).isCloseTo(4.0, within(1e-12));
            assertThat(tree.pathLength(tree.findLeaf("B"))).isCloseTo(5.0, within(1e-12));
        }

        @Test
        void missingLengthsCountAsZero() {
            assertThat(tree.pathLength(tree.findLeaf("C"))).isZero();
            assertThat(tree.pathLength(tree.getRoot())).isZero();
        }

        @Test
        void rootLengthIsIgnored() {
            NodeBuilder root = new NodeBuilder().setBranchLength(100)
                    .addChild(new NodeBuilder().setTaxon("A", 0).setBranchLength(1))
                    .addChild(new NodeBuilder().setTaxon("B", 1).setBranchLength(1));
            Tree withRootLength = new Tree(null, Rooting.ROOTED, root);
            assertThat(withRootLength.pathLength(withRootLength.findLeaf("A"))).isEqualTo(1.0);
        }

        @Test
        void nodeFromAnotherTreeIsRejected() {
            TreeNode foreign = sample().findLeaf("A");
            assertThatThrownBy(() -> tree.pathLength(foreign)).isInstanceOf(IllegalArgumentException.class);
            assertThat(tree.contains(foreign)).isFalse();
        }
    }

    @Test
    void weightDefaultsToOne() {
        assertThat(tree.hasWeight()).isFalse();
        assertThat(tree.getWeight()).isEqualTo(1.0);
        Tree weighted = new Tree("w", Rooting.UNROOTED, 0.25, Collections.singletonMap("posterior", "0.9"),
                new NodeBuilder().setTaxon("A", 0));
        assertThat(weighted.hasWeight()).isTrue();
        assertThat(weighted.getWeight()).isEqualTo(0.25);
        assertThat(weighted.getAnnotations()).containsEntry("posterior", "0.9");
    }
}

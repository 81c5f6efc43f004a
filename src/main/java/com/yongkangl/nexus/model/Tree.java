package com.yongkangl.nexus.model;

import org.apache.commons.lang3.Validate;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * An immutable tree read from a TREE statement or a Newick string. Traversals are lazy and every
 * call to {@code iterator()} on them starts again from the root.
 */
public final class Tree {
    private final String name;
    private final Rooting rooting;
    private final Double weight;
    private final Map<String, String> annotations;
    private final TreeNode root;
    private final int leafCount;

    public Tree(String name, Rooting rooting, Double weight, Map<String, String> annotations, NodeBuilder root) {
        Validate.notNull(rooting, "Rooting must not be null, use UNSPECIFIED");
        Validate.notNull(root, "Tree needs a root");
        this.name = name;
        this.rooting = rooting;
        this.weight = weight;
        this.annotations = annotations == null || annotations.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(annotations));
        this.root = new TreeNode(null, root);
        int leaves = 0;
        for (TreeNode ignored : leaves()) {
            leaves++;
        }
        this.leafCount = leaves;
    }

    public Tree(String name, Rooting rooting, NodeBuilder root) {
        this(name, rooting, null, null, root);
    }

    public String getName() {
        return name;
    }

    public Rooting getRooting() {
        return rooting;
    }

    public boolean hasWeight() {
        return weight != null;
    }

    public double getWeight() {
        return weight == null ? 1.0 : weight;
    }

    public Map<String, String> getAnnotations() {
        return annotations;
    }

    public TreeNode getRoot() {
        return root;
    }

    public int getLeafCount() {
        return leafCount;
    }

    public Iterable<TreeNode> preorder() {
        return () -> new PreorderIterator(root);
    }

    public Iterable<TreeNode> postorder() {
        return () -> new PostorderIterator(root);
    }

    public Iterable<TreeNode> leaves() {
        return () -> new LeafIterator(root);
    }

    /**
     * Exact, case-sensitive match on the stored taxon name. Use
     * {@link #findLeaf(String, TaxonRegistry)} to look a name up the way the reader resolved it.
     */
    public TreeNode findLeaf(String taxonName) {
        for (TreeNode leaf : leaves()) {
            if (leaf.getTaxonName().equals(taxonName)) {
                return leaf;
            }
        }
        return null;
    }

    // Resolves the name with the registry's case policy, then matches on taxon index.
    public TreeNode findLeaf(String taxonName, TaxonRegistry taxa) {
        int index = taxa.indexOf(taxonName);
        if (index < 0) {
            return null;
        }
        for (TreeNode leaf : leaves()) {
            if (leaf.getTaxonIndex() == index) {
                return leaf;
            }
        }
        return null;
    }

    public boolean contains(TreeNode node) {
        TreeNode current = node;
        while (current.getParent() != null) {
            current = current.getParent();
        }
        return current == root;
    }

    /**
     * Sum of the branch lengths on the path from the root down to {@code node}. The root's own
     * branch length is not part of any path, and missing lengths count as zero.
     */
    public double pathLength(TreeNode node) {
        Validate.notNull(node, "Node must not be null");
        Validate.isTrue(contains(node), "Node does not belong to this tree");
        double sum = 0.0;
        for (TreeNode current = node; current.getParent() != null; current = current.getParent()) {
            if (current.hasBranchLength()) {
                sum += current.getBranchLength().getAsDouble();
            }
        }
        return sum;
    }

    @Override
    public String toString() {
        return "Tree[" + name + ", " + rooting + ", " + leafCount + " leaves]";
    }

    private static class PreorderIterator implements Iterator<TreeNode> {
        private final Deque<TreeNode> stack = new ArrayDeque<>();

        PreorderIterator(TreeNode root) {
            stack.push(root);
        }

        @Override
        public boolean hasNext() {
            return !stack.isEmpty();
        }

        @Override
        public TreeNode next() {
            if (stack.isEmpty()) {
                throw new NoSuchElementException();
            }
            TreeNode node = stack.pop();
            for (int i = node.getChildCount() - 1; i >= 0; i--) {
                stack.push(node.getChild(i));
            }
            return node;
        }
    }

    private static class PostorderIterator implements Iterator<TreeNode> {
        // Each frame is a node and the index of the next child to visit.
        private final Deque<TreeNode> nodes = new ArrayDeque<>();
        private final Deque<Integer> nextChild = new ArrayDeque<>();

        PostorderIterator(TreeNode root) {
            nodes.push(root);
            nextChild.push(0);
        }

        @Override
        public boolean hasNext() {
            return !nodes.isEmpty();
        }

        @Override
        public TreeNode next() {
            if (nodes.isEmpty()) {
                throw new NoSuchElementException();
            }
            while (true) {
                TreeNode node = nodes.peek();
                int child = nextChild.pop();
                if (child < node.getChildCount()) {
                    nextChild.push(child + 1);
                    nodes.push(node.getChild(child));
                    nextChild.push(0);
                } else {
                    nodes.pop();
                    return node;
                }
            }
        }
    }

    private static class LeafIterator implements Iterator<TreeNode> {
        private final PreorderIterator nodes;
        private TreeNode pending;

        LeafIterator(TreeNode root) {
            nodes = new PreorderIterator(root);
            advance();
        }

        private void advance() {
            pending = null;
            while (nodes.hasNext()) {
                TreeNode node = nodes.next();
                if (node.isLeaf()) {
                    pending = node;
                    return;
                }
            }
        }

        @Override
        public boolean hasNext() {
            return pending != null;
        }

        @Override
        public TreeNode next() {
            if (pending == null) {
                throw new NoSuchElementException();
            }
            TreeNode node = pending;
            advance();
            return node;
        }
    }
}

package com.yongkangl.nexus.model;

import org.apache.commons.lang3.Validate;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Leaf-set bitmasks over taxon registry indices. Trees that are not explicitly rooted have their
 * splits normalized so that the bit of the lowest-indexed taxon in the tree is clear, which makes
 * both sides of an edge produce the same bitmask.
 */
public final class TreeSplits {
    private final Tree tree;
    private final BitSet allLeaves;
    private final Map<TreeNode, BitSet> leafSets = new IdentityHashMap<>();

    public TreeSplits(Tree tree, TaxonRegistry taxa) {
        this.tree = tree;
        for (TreeNode node : tree.postorder()) {
            BitSet bits = new BitSet(taxa.size());
            if (node.isLeaf()) {
                int index = node.getTaxonIndex();
                Validate.isTrue(index < taxa.size(), "Taxon %s is not in the registry", node.getTaxonName());
                bits.set(index);
            } else {
                for (TreeNode child : node.getChildren()) {
                    bits.or(leafSets.get(child));
                }
            }
            leafSets.put(node, bits);
        }
        this.allLeaves = leafSets.get(tree.getRoot());
    }

    public BitSet leafSet(TreeNode node) {
        BitSet bits = leafSets.get(node);
        Validate.isTrue(bits != null, "Node does not belong to this tree");
        return (BitSet) bits.clone();
    }

    public boolean isRooted() {
        return tree.getRooting() == Rooting.ROOTED;
    }

    public BitSet split(TreeNode node) {
        BitSet bits = leafSet(node);
        return isRooted() ? bits : normalize(bits);
    }

    public BitSet normalize(BitSet bits) {
        BitSet normalized = (BitSet) bits.clone();
        if (normalized.get(allLeaves.nextSetBit(0))) {
            normalized.xor(allLeaves);
        }
        return normalized;
    }

    // Splits of internal edges; leaf edges and the root's full leaf set are trivial.
    public List<BitSet> nontrivialSplits() {
        int leafCount = allLeaves.cardinality();
        Set<BitSet> splits = new LinkedHashSet<>();
        for (TreeNode node : tree.preorder()) {
            if (node.isRoot() || node.isLeaf()) {
                continue;
            }
            BitSet split = split(node);
            int size = split.cardinality();
            if (size > 1 && size < leafCount - (isRooted() ? 0 : 1)) {
                splits.add(split);
            }
        }
        return new ArrayList<>(splits);
    }
}

package com.yongkangl.nexus.model;

import org.apache.commons.math3.util.Precision;

import java.util.Objects;

/**
 * Structural equality of trees: same rooting, same child order, same labels and branch lengths
 * equal within a tolerance. Names, weights and annotations are not compared.
 */
public class TreeComparator {
    private final double tolerance;

    public TreeComparator(double tolerance) {
        this.tolerance = tolerance;
    }

    public boolean equivalent(Tree a, Tree b) {
        return a.getRooting() == b.getRooting() && equivalent(a.getRoot(), b.getRoot());
    }

    public boolean equivalent(TreeNode a, TreeNode b) {
        if (a.getChildCount() != b.getChildCount() || !Objects.equals(a.getLabel(), b.getLabel())) {
            return false;
        }
        if (a.hasBranchLength() != b.hasBranchLength()) {
            return false;
        }
        if (a.hasBranchLength() && !Precision.equals(a.getBranchLength().getAsDouble(),
                b.getBranchLength().getAsDouble(), tolerance)) {
            return false;
        }
        for (int i = 0; i < a.getChildCount(); i++) {
            if (!equivalent(a.getChild(i), b.getChild(i))) {
                return false;
            }
        }
        return true;
    }
}

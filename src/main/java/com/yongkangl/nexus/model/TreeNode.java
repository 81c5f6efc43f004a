package com.yongkangl.nexus.model;

import org.apache.commons.lang3.Validate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

public final class TreeNode {
    private final TreeNode parent;
    private final String label;
    private final int taxonIndex;
    private final Double branchLength;
    private final Map<String, String> annotations;
    private final List<TreeNode> children;
    private final int depth;

    TreeNode(TreeNode parent, NodeBuilder source) {
        this.parent = parent;
        this.depth = parent == null ? 0 : parent.depth + 1;
        this.label = source.getLabel();
        this.branchLength = source.getBranchLength();
        this.annotations = source.getAnnotations().isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(source.getAnnotations()));
        if (source.isLeaf()) {
            Validate.isTrue(label != null && source.getTaxonIndex() >= 0,
                    "Leaf without a resolved taxon at depth %d", depth);
            this.taxonIndex = source.getTaxonIndex();
            this.children = Collections.emptyList();
        } else {
            this.taxonIndex = -1;
            List<TreeNode> built = new ArrayList<>(source.getChildren().size());
            for (NodeBuilder child : source.getChildren()) {
                built.add(new TreeNode(this, child));
            }
            this.children = Collections.unmodifiableList(built);
        }
    }

    public TreeNode getParent() {
        return parent;
    }

    public boolean isRoot() {
        return parent == null;
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    public List<TreeNode> getChildren() {
        return children;
    }

    public int getChildCount() {
        return children.size();
    }

    public TreeNode getChild(int i) {
        return children.get(i);
    }

    public String getTaxonName() {
        if (!isLeaf()) {
            throw new IllegalStateException("Internal nodes have no taxon");
        }
        return label;
    }

    public int getTaxonIndex() {
        if (!isLeaf()) {
            throw new IllegalStateException("Internal nodes have no taxon");
        }
        return taxonIndex;
    }

    // Taxon name of a leaf, or the optional label of an internal node.
    public String getLabel() {
        return label;
    }

    public OptionalDouble getBranchLength() {
        return branchLength == null ? OptionalDouble.empty() : OptionalDouble.of(branchLength);
    }

    public boolean hasBranchLength() {
        return branchLength != null;
    }

    public Map<String, String> getAnnotations() {
        return annotations;
    }

    public int getDepth() {
        return depth;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (isLeaf()) {
            sb.append(label);
        } else {
            sb.append("(").append(children.size()).append(" children)");
            if (label != null) {
                sb.append(label);
            }
        }
        if (branchLength != null) {
            sb.append(":").append(branchLength);
        }
        return sb.toString();
    }
}

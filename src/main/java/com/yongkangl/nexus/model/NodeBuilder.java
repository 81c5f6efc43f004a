package com.yongkangl.nexus.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable scaffolding for one node while a tree is being read. A finished builder graph is frozen
 * into {@link TreeNode}s by the {@link Tree} constructor.
 */
public class NodeBuilder {
    private String label;
    private int taxonIndex = -1;
    private Double branchLength;
    private final Map<String, String> annotations = new LinkedHashMap<>();
    private final List<NodeBuilder> children = new ArrayList<>();

    public NodeBuilder setLabel(String label) {
        this.label = label;
        return this;
    }

    public NodeBuilder setTaxon(String name, int taxonIndex) {
        this.label = name;
        this.taxonIndex = taxonIndex;
        return this;
    }

    public NodeBuilder setBranchLength(double branchLength) {
        this.branchLength = branchLength;
        return this;
    }

    public NodeBuilder putAnnotation(String key, String value) {
        annotations.put(key, value);
        return this;
    }

    public NodeBuilder addChild(NodeBuilder child) {
        children.add(child);
        return this;
    }

    public String getLabel() {
        return label;
    }

    public int getTaxonIndex() {
        return taxonIndex;
    }

    public Double getBranchLength() {
        return branchLength;
    }

    public Map<String, String> getAnnotations() {
        return annotations;
    }

    public List<NodeBuilder> getChildren() {
        return children;
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }
}

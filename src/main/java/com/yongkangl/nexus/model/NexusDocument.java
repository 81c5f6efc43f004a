package com.yongkangl.nexus.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class NexusDocument {
    private final TaxonRegistry taxa;
    private final boolean taxaDeclared;
    private final List<TranslateTable> translateTables;
    private final List<Tree> trees;

    public NexusDocument(TaxonRegistry taxa, boolean taxaDeclared, List<TranslateTable> translateTables, List<Tree> trees) {
        this.taxa = taxa;
        this.taxaDeclared = taxaDeclared;
        this.translateTables = Collections.unmodifiableList(new ArrayList<>(translateTables));
        this.trees = Collections.unmodifiableList(new ArrayList<>(trees));
    }

    public TaxonRegistry getTaxa() {
        return taxa;
    }

    // False when the registry was collected from TRANSLATE tables and tree leaves instead of a TAXA block.
    public boolean isTaxaDeclared() {
        return taxaDeclared;
    }

    public List<TranslateTable> getTranslateTables() {
        return translateTables;
    }

    public TranslateTable getTranslateTable() {
        return translateTables.isEmpty() ? TranslateTable.EMPTY : translateTables.get(0);
    }

    public List<Tree> getTrees() {
        return trees;
    }

    public int getTreeCount() {
        return trees.size();
    }

    public Tree getTree(int i) {
        return trees.get(i);
    }

    public Tree getTree(String name) {
        for (Tree tree : trees) {
            if (name.equals(tree.getName())) {
                return tree;
            }
        }
        return null;
    }
}

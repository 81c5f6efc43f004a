package com.yongkangl.nexus.io;

import com.yongkangl.nexus.model.TaxonRegistry;

/**
 * Maps taxon names to registry indices. With a declared TAXA block every name must already be
 * known; without one the registry grows as names are met.
 */
class TaxonResolver {
    private final TaxonRegistry declared;
    private final TaxonRegistry.Builder implicit;

    private TaxonResolver(TaxonRegistry declared, TaxonRegistry.Builder implicit) {
        this.declared = declared;
        this.implicit = implicit;
    }

    static TaxonResolver declared(TaxonRegistry taxa) {
        return new TaxonResolver(taxa, null);
    }

    static TaxonResolver implicit(boolean caseSensitive) {
        return new TaxonResolver(null, new TaxonRegistry.Builder(caseSensitive));
    }

    boolean isDeclared() {
        return declared != null;
    }

    boolean isEmpty() {
        return declared == null && implicit.size() == 0;
    }

    boolean contains(String name) {
        return declared != null ? declared.contains(name) : implicit.indexOf(name) >= 0;
    }

    int resolve(String name, SourcePosition position) {
        if (declared == null) {
            return implicit.addIfAbsent(name);
        }
        int index = declared.indexOf(name);
        if (index < 0) {
            throw new NexusReferenceException("Taxon '" + name + "' is not declared in the TAXA block", position);
        }
        return index;
    }

    String nameAt(int index) {
        return declared != null ? declared.get(index) : implicit.get(index);
    }

    TaxonRegistry registry() {
        return declared != null ? declared : implicit.build();
    }
}

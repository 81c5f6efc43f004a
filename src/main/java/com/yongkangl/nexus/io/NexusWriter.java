package com.yongkangl.nexus.io;

import com.yongkangl.nexus.model.NexusDocument;
import com.yongkangl.nexus.model.TaxonRegistry;
import com.yongkangl.nexus.model.TranslateTable;
import com.yongkangl.nexus.model.Tree;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes a document as a TAXA block and a TREES block whose TRANSLATE command numbers the taxa
 * from 1 in registry order.
 */
public class NexusWriter {
    private boolean useTranslate = true;
    private boolean writeAnnotations = false;

    public NexusWriter setUseTranslate(boolean useTranslate) {
        this.useTranslate = useTranslate;
        return this;
    }

    public NexusWriter setWriteAnnotations(boolean writeAnnotations) {
        this.writeAnnotations = writeAnnotations;
        return this;
    }

    public String write(NexusDocument document) {
        StringWriter out = new StringWriter();
        try {
            write(document, out);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }

    public void write(NexusDocument document, Writer out) throws IOException {
        TaxonRegistry taxa = document.getTaxa();
        out.write("#NEXUS\n");
        if (taxa.size() > 0) {
            out.write("\nBEGIN TAXA;\n");
            out.write("\tDIMENSIONS NTAX = " + taxa.size() + ";\n");
            out.write("\tTAXLABELS\n");
            for (String name : taxa.getNames()) {
                out.write("\t\t" + NewickWriter.quote(name) + "\n");
            }
            out.write("\t;\nEND;\n");
        }
        if (document.getTrees().isEmpty()) {
            return;
        }

        NewickWriter newick = new NewickWriter().setWriteAnnotations(writeAnnotations);
        out.write("\nBEGIN TREES;\n");
        if (useTranslate && taxa.size() > 0) {
            TranslateTable translate = numbered(taxa);
            out.write("\tTRANSLATE\n");
            for (int i = 0; i < taxa.size(); i++) {
                out.write("\t\t" + (i + 1) + "\t" + NewickWriter.quote(taxa.get(i)));
                out.write(i + 1 < taxa.size() ? ",\n" : "\n");
            }
            out.write("\t;\n");
            newick.setTranslate(translate);
        }
        int unnamed = 0;
        for (Tree tree : document.getTrees()) {
            String name = tree.getName() != null ? tree.getName() : "tree" + (++unnamed);
            out.write("\tTREE " + NewickWriter.quote(name) + " = ");
            if (tree.hasWeight()) {
                out.write("[&W " + tree.getWeight() + "] ");
            }
            if (!tree.getAnnotations().isEmpty()) {
                out.write(NewickWriter.annotationComment(tree.getAnnotations()) + " ");
            }
            out.write(newick.write(tree));
            out.write("\n");
        }
        out.write("END;\n");
    }

    private static TranslateTable numbered(TaxonRegistry taxa) {
        Map<Integer, String> entries = new LinkedHashMap<>();
        for (int i = 0; i < taxa.size(); i++) {
            entries.put(i + 1, taxa.get(i));
        }
        return new TranslateTable(entries);
    }
}

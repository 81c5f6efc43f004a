package com.yongkangl.nexus.io;

import com.yongkangl.nexus.model.Rooting;
import com.yongkangl.nexus.model.TranslateTable;
import com.yongkangl.nexus.model.Tree;
import com.yongkangl.nexus.model.TreeNode;
import org.apache.commons.lang3.StringUtils;

import java.util.Map;

public class NewickWriter {
    private static final String PUNCTUATION = "();,:=*[]'";

    private boolean writeBranchLengths = true;
    private boolean writeInternalLabels = true;
    private boolean writeAnnotations = false;
    private boolean writeRooting = true;
    private TranslateTable translate;

    public NewickWriter setWriteBranchLengths(boolean writeBranchLengths) {
        this.writeBranchLengths = writeBranchLengths;
        return this;
    }

    public NewickWriter setWriteInternalLabels(boolean writeInternalLabels) {
        this.writeInternalLabels = writeInternalLabels;
        return this;
    }

    public NewickWriter setWriteAnnotations(boolean writeAnnotations) {
        this.writeAnnotations = writeAnnotations;
        return this;
    }

    public NewickWriter setWriteRooting(boolean writeRooting) {
        this.writeRooting = writeRooting;
        return this;
    }

    // Leaves are written as their translate keys; every leaf must have one.
    public NewickWriter setTranslate(TranslateTable translate) {
        this.translate = translate;
        return this;
    }

    public String write(Tree tree) {
        StringBuilder sb = new StringBuilder();
        if (writeRooting && tree.getRooting() != Rooting.UNSPECIFIED) {
            sb.append("[").append(tree.getRooting().getCommand()).append("] ");
        }
        append(sb, tree.getRoot());
        sb.append(";");
        return sb.toString();
    }

    public String write(TreeNode node) {
        StringBuilder sb = new StringBuilder();
        append(sb, node);
        return sb.toString();
    }

    private void append(StringBuilder sb, TreeNode node) {
        if (node.isLeaf()) {
            sb.append(leafToken(node));
        } else {
            sb.append("(");
            for (int i = 0; i < node.getChildCount(); i++) {
                if (i > 0) sb.append(",");
                append(sb, node.getChild(i));
            }
            sb.append(")");
            if (writeInternalLabels && node.getLabel() != null) {
                sb.append(quote(node.getLabel()));
            }
        }
        if (writeBranchLengths && node.hasBranchLength()) {
            sb.append(":").append(formatLength(node.getBranchLength().getAsDouble()));
        }
        if (writeAnnotations && !node.getAnnotations().isEmpty()) {
            sb.append(annotationComment(node.getAnnotations()));
        }
    }

    private String leafToken(TreeNode leaf) {
        if (translate == null) {
            return quote(leaf.getTaxonName());
        }
        Integer key = translate.keyFor(leaf.getTaxonName());
        if (key == null) {
            throw new IllegalArgumentException("Taxon '" + leaf.getTaxonName() + "' has no translate key");
        }
        return String.valueOf(key);
    }

    static String annotationComment(Map<String, String> annotations) {
        StringBuilder sb = new StringBuilder("[&");
        boolean first = true;
        for (Map.Entry<String, String> entry : annotations.entrySet()) {
            if (!first) sb.append(",");
            sb.append(entry.getKey());
            if (!entry.getValue().isEmpty()) {
                sb.append("=").append(entry.getValue());
            }
            first = false;
        }
        return sb.append("]").toString();
    }

    // Underscores are quoted too, so a reader that turns them into spaces gets the label back unchanged.
    public static String quote(String label) {
        if (label.isEmpty() || StringUtils.containsAny(label, PUNCTUATION + "_")
                || StringUtils.containsWhitespace(label)) {
            return "'" + label.replace("'", "''") + "'";
        }
        return label;
    }

    // Shortest text that reads back as the same double; integral values lose their ".0".
    public static String formatLength(double length) {
        if (length == Math.rint(length) && Math.abs(length) < 1e15) {
            return String.valueOf((long) length);
        }
        return Double.toString(length);
    }
}

package com.yongkangl.nexus.io;

import com.yongkangl.nexus.model.NodeBuilder;
import com.yongkangl.nexus.model.TranslateTable;

import java.util.BitSet;

/**
 * Recursive-descent reader for one Newick tree expression. One token of lookahead decides between
 * a subtree ({@code (}) and a leaf label. Nesting is bounded by {@link ReaderConfig#getMaxTreeDepth()}.
 */
class NewickParser {
    private final NexusTokenizer tokenizer;
    private final TaxonResolver taxa;
    private final TranslateTable translate;
    private final int maxDepth;
    // Taxa already placed in the tree being parsed.
    private final BitSet placed = new BitSet();

    NewickParser(NexusTokenizer tokenizer, TaxonResolver taxa, TranslateTable translate, int maxDepth) {
        this.tokenizer = tokenizer;
        this.taxa = taxa;
        this.translate = translate;
        this.maxDepth = maxDepth;
    }

    // Parses a tree expression and its terminating ';'.
    NodeBuilder parseTree() {
        placed.clear();
        NodeBuilder root = parseSubtree(0);
        Token end = tokenizer.next();
        if (end.is(Token.Type.SEMICOLON)) {
            return root;
        }
        if (end.is(Token.Type.RPAREN)) {
            throw new NexusSyntaxException("Unbalanced parentheses: unexpected ')'", end.getPosition());
        }
        if (end.is(Token.Type.EOF)) {
            throw new NexusSyntaxException("Tree is missing its terminating ';'", end.getPosition());
        }
        throw new NexusSyntaxException("Unexpected " + end.describe() + " after the tree expression", end.getPosition());
    }

    private NodeBuilder parseSubtree(int depth) {
        Token token = tokenizer.peek();
        if (depth > maxDepth) {
            throw new NexusSyntaxException("Tree is nested deeper than " + maxDepth + " levels", token.getPosition());
        }
        NodeBuilder node = new NodeBuilder();
        if (token.is(Token.Type.LPAREN)) {
            Token open = tokenizer.next();
            if (tokenizer.peek().is(Token.Type.RPAREN)) {
                throw new NexusSyntaxException("Empty child list '()'", open.getPosition());
            }
            while (true) {
                node.addChild(parseSubtree(depth + 1));
                Token separator = tokenizer.next();
                if (separator.is(Token.Type.RPAREN)) {
                    break;
                }
                if (separator.is(Token.Type.SEMICOLON) || separator.is(Token.Type.EOF)) {
                    throw new NexusSyntaxException("Unbalanced parentheses: '(' is never closed", open.getPosition());
                }
                if (!separator.is(Token.Type.COMMA)) {
                    throw new NexusSyntaxException("Expected ',' or ')' but found " + separator.describe(),
                            separator.getPosition());
                }
            }
            if (tokenizer.peek().isLabel()) {
                node.setLabel(tokenizer.next().getText());
            }
        } else if (token.isLabel()) {
            resolveLeaf(node, tokenizer.next());
        } else if (token.is(Token.Type.EOF) || token.is(Token.Type.SEMICOLON)) {
            throw new NexusSyntaxException("Tree expression ends unexpectedly at " + token.describe(),
                    token.getPosition());
        } else {
            throw new NexusSyntaxException("Expected a taxon label or '(' but found " + token.describe(),
                    token.getPosition());
        }
        parseSuffix(node);
        return node;
    }

    private void parseSuffix(NodeBuilder node) {
        readAnnotations(node);
        if (tokenizer.peek().is(Token.Type.COLON)) {
            tokenizer.next();
            Token value = tokenizer.next();
            if (!value.is(Token.Type.NUMBER)) {
                throw new NexusSyntaxException("Branch length ':' must be followed by a number, found "
                        + value.describe(), value.getPosition());
            }
            double length = value.numberValue();
            if (!Double.isFinite(length)) {
                throw new NexusSyntaxException("Branch length " + value.describe() + " is out of range",
                        value.getPosition());
            }
            node.setBranchLength(length);
            readAnnotations(node);
        }
    }

    private void readAnnotations(NodeBuilder node) {
        while (tokenizer.peek().is(Token.Type.COMMENT)) {
            Annotations.parse(tokenizer.next().getText(), node.getAnnotations());
        }
    }

    private void resolveLeaf(NodeBuilder node, Token token) {
        String name = token.getText();
        if (!translate.isEmpty() && token.is(Token.Type.NUMBER) && isInteger(name)) {
            int key;
            try {
                key = Integer.parseInt(name);
            } catch (NumberFormatException e) {
                throw new NexusReferenceException("Translate key " + name + " is out of range", token.getPosition());
            }
            name = translate.get(key);
            if (name == null) {
                throw new NexusReferenceException("Translate key " + key + " has no TRANSLATE entry",
                        token.getPosition());
            }
        }
        int index = taxa.resolve(name, token.getPosition());
        if (placed.get(index)) {
            throw new NexusValidationException("Taxon '" + taxa.nameAt(index) + "' appears more than once in the tree",
                    token.getPosition());
        }
        placed.set(index);
        node.setTaxon(taxa.nameAt(index), index);
    }

    private static boolean isInteger(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!Character.isDigit(c) && !(i == 0 && (c == '+' || c == '-'))) {
                return false;
            }
        }
        return true;
    }
}

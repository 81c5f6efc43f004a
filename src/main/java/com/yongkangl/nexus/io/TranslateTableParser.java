package com.yongkangl.nexus.io;

import com.yongkangl.nexus.model.TranslateTable;

import java.util.LinkedHashMap;
import java.util.Map;

// Reads "k name, k name, ... ;" following a TRANSLATE keyword.
class TranslateTableParser {
    private final CommandReader reader;
    private final TaxonResolver taxa;

    TranslateTableParser(CommandReader reader, TaxonResolver taxa) {
        this.reader = reader;
        this.taxa = taxa;
    }

    TranslateTable parse(Token command) {
        Map<Integer, String> entries = new LinkedHashMap<>();
        Token key = reader.next();
        if (key.is(Token.Type.SEMICOLON)) {
            return new TranslateTable(entries);
        }
        while (true) {
            if (key.is(Token.Type.EOF)) {
                throw new NexusSyntaxException("TRANSLATE is missing its terminating ';'", command.getPosition());
            }
            int k = parseKey(key);
            Token name = reader.next();
            if (!name.isLabel()) {
                throw new NexusValidationException("Translate key " + k + " has no taxon name", name.getPosition());
            }
            if (entries.containsKey(k)) {
                throw new NexusValidationException("Duplicate translate key " + k, key.getPosition());
            }
            if (taxa.isDeclared() && !taxa.contains(name.getText())) {
                throw new NexusValidationException("Translate key " + k + " names '" + name.getText()
                        + "', which is not declared in the TAXA block", name.getPosition());
            }
            String resolved = taxa.nameAt(taxa.resolve(name.getText(), name.getPosition()));
            entries.put(k, resolved);

            Token separator = reader.next();
            if (separator.is(Token.Type.SEMICOLON)) {
                return new TranslateTable(entries);
            }
            if (!separator.is(Token.Type.COMMA)) {
                throw new NexusValidationException("Malformed translate entry for key " + k + ": expected ',' or ';'"
                        + " but found " + separator.describe(), separator.getPosition());
            }
            key = reader.next();
        }
    }

    private static int parseKey(Token key) {
        try {
            return Integer.parseInt(key.getText());
        } catch (NumberFormatException e) {
            throw new NexusValidationException("Translate key must be an integer, found " + key.describe(),
                    key.getPosition());
        }
    }
}

package com.yongkangl.nexus.io;

import com.yongkangl.nexus.model.TaxonRegistry;

/**
 * Reads the body of a TAXA block, from the token after {@code BEGIN TAXA;} through its
 * {@code END;}.
 */
class TaxaBlockParser {
    private final CommandReader reader;
    private final boolean caseSensitive;
    private int ntax = -1;
    private TaxonRegistry taxa;

    TaxaBlockParser(CommandReader reader, boolean caseSensitive) {
        this.reader = reader;
        this.caseSensitive = caseSensitive;
    }

    TaxonRegistry parse(Token blockName) {
        while (true) {
            Token command = reader.nextCommand();
            if (command.is(Token.Type.EOF)) {
                throw CommandReader.missingEnd(blockName);
            }
            if (CommandReader.isBlockEnd(command)) {
                reader.expect(Token.Type.SEMICOLON, "';' after " + command.getText());
                break;
            }
            if (command.isKeyword("DIMENSIONS")) {
                parseDimensions(command);
            } else if (command.isKeyword("TAXLABELS")) {
                parseTaxLabels(command);
            } else {
                reader.skipCommand(command);
            }
        }
        if (taxa == null) {
            throw new NexusValidationException("TAXA block declares no TAXLABELS", blockName.getPosition());
        }
        return taxa;
    }

    private void parseDimensions(Token command) {
        while (true) {
            Token key = reader.next();
            if (key.is(Token.Type.SEMICOLON)) {
                break;
            }
            if (key.is(Token.Type.EOF)) {
                throw new NexusSyntaxException("DIMENSIONS is missing its terminating ';'", command.getPosition());
            }
            if (!key.is(Token.Type.WORD)) {
                throw new NexusSyntaxException("Expected a DIMENSIONS subcommand but found " + key.describe(),
                        key.getPosition());
            }
            reader.expect(Token.Type.EQUALS, "'=' after " + key.getText());
            Token value = reader.next();
            if (!value.isLabel()) {
                throw new NexusSyntaxException("Expected a value for " + key.getText() + " but found " + value.describe(),
                        value.getPosition());
            }
            if (key.isKeyword("NTAX")) {
                ntax = parseNtax(value);
            }
        }
        if (ntax < 0) {
            throw new NexusSyntaxException("DIMENSIONS does not declare NTAX", command.getPosition());
        }
    }

    private static int parseNtax(Token value) {
        int n;
        try {
            n = Integer.parseInt(value.getText());
        } catch (NumberFormatException e) {
            throw new NexusValidationException("NTAX must be a positive integer, found " + value.describe(),
                    value.getPosition());
        }
        if (n <= 0) {
            throw new NexusValidationException("NTAX must be a positive integer, found " + n, value.getPosition());
        }
        return n;
    }

    private void parseTaxLabels(Token command) {
        if (ntax < 0) {
            throw new NexusValidationException("TAXLABELS appears before DIMENSIONS NTAX", command.getPosition());
        }
        if (taxa != null) {
            throw new NexusValidationException("TAXA block declares TAXLABELS twice", command.getPosition());
        }
        TaxonRegistry.Builder builder = new TaxonRegistry.Builder(caseSensitive);
        while (true) {
            Token token = reader.next();
            if (token.is(Token.Type.SEMICOLON)) {
                if (builder.size() != ntax) {
                    throw new NexusValidationException("NTAX declares " + ntax + " taxa but TAXLABELS lists "
                            + builder.size(), command.getPosition());
                }
                taxa = builder.build();
                return;
            }
            if (token.is(Token.Type.COMMA) || token.is(Token.Type.COMMENT)) {
                continue;
            }
            if (!token.isLabel()) {
                if (token.is(Token.Type.EOF)) {
                    throw new NexusSyntaxException("TAXLABELS is missing its terminating ';'", command.getPosition());
                }
                throw new NexusSyntaxException("Expected a taxon label but found " + token.describe(),
                        token.getPosition());
            }
            if (builder.indexOf(token.getText()) >= 0) {
                throw new NexusValidationException("Duplicate taxon label '" + token.getText() + "'",
                        token.getPosition());
            }
            builder.add(token.getText());
        }
    }
}

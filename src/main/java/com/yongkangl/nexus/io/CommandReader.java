package com.yongkangl.nexus.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// Command-level helpers shared by the block parsers.
class CommandReader {
    private static final Logger log = LoggerFactory.getLogger(CommandReader.class);

    private final NexusTokenizer tokenizer;

    CommandReader(NexusTokenizer tokenizer) {
        this.tokenizer = tokenizer;
    }

    NexusTokenizer tokenizer() {
        return tokenizer;
    }

    Token next() {
        return tokenizer.next();
    }

    Token peek() {
        return tokenizer.peek();
    }

    // First token of the next command; command comments between commands carry nothing for us.
    Token nextCommand() {
        Token token = tokenizer.next();
        while (token.is(Token.Type.COMMENT)) {
            token = tokenizer.next();
        }
        return token;
    }

    Token expect(Token.Type type, String what) {
        Token token = tokenizer.next();
        if (!token.is(type)) {
            throw new NexusSyntaxException("Expected " + what + " but found " + token.describe(), token.getPosition());
        }
        return token;
    }

    static boolean isBlockEnd(Token token) {
        return token.isKeyword("END") || token.isKeyword("ENDBLOCK");
    }

    void skipCommand(Token keyword) {
        log.debug("Skipping command {} at {}", keyword.getText(), keyword.getPosition());
        Token token = tokenizer.next();
        while (!token.is(Token.Type.SEMICOLON)) {
            if (token.is(Token.Type.EOF)) {
                throw new NexusSyntaxException("Command " + keyword.getText() + " is missing its terminating ';'",
                        keyword.getPosition());
            }
            token = tokenizer.next();
        }
    }

    void skipBlock(Token name) {
        log.debug("Skipping unsupported block {} at {}", name.getText(), name.getPosition());
        boolean commandStart = true;
        while (true) {
            Token token = tokenizer.next();
            if (token.is(Token.Type.EOF)) {
                throw missingEnd(name);
            }
            if (commandStart && isBlockEnd(token)) {
                expect(Token.Type.SEMICOLON, "';' after " + token.getText());
                return;
            }
            if (!token.is(Token.Type.COMMENT)) {
                commandStart = token.is(Token.Type.SEMICOLON);
            }
        }
    }

    static NexusSyntaxException missingEnd(Token blockName) {
        return new NexusSyntaxException("Block " + blockName.getText() + " is missing END;", blockName.getPosition());
    }
}

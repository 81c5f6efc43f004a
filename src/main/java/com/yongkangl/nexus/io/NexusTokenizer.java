package com.yongkangl.nexus.io;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.regex.Pattern;

/**
 * Splits NEXUS text into tokens on demand. Plain comments are dropped; command comments (those
 * starting with {@code &}) are handed out as {@link Token.Type#COMMENT} tokens because they carry
 * rooting, weights and node annotations.
 *
 * <p>The sequence can be restarted with {@link #reset()}, and every {@link #iterator()} walks the
 * whole input again from the first character.
 */
public class NexusTokenizer implements Iterable<Token> {
    private static final String PUNCTUATION = "();,:=*[]'";
    private static final Pattern NUMBER = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");
    private static final String HEADER = "#NEXUS";

    private final String input;
    private final boolean preserveUnderscores;
    private int position;
    private int line;
    private int column;
    private Token peeked;

    public NexusTokenizer(String input) {
        this(input, true);
    }

    public NexusTokenizer(String input, boolean preserveUnderscores) {
        this.input = input;
        this.preserveUnderscores = preserveUnderscores;
        reset();
    }

    public void reset() {
        position = 0;
        line = 1;
        column = 1;
        peeked = null;
    }

    public Token peek() {
        if (peeked == null) {
            peeked = scan();
        }
        return peeked;
    }

    public Token next() {
        Token token = peek();
        peeked = null;
        return token;
    }

    public boolean hasNext() {
        return !peek().is(Token.Type.EOF);
    }

    @Override
    public Iterator<Token> iterator() {
        NexusTokenizer fresh = new NexusTokenizer(input, preserveUnderscores);
        return new Iterator<Token>() {
            @Override
            public boolean hasNext() {
                return fresh.hasNext();
            }

            @Override
            public Token next() {
                if (!fresh.hasNext()) {
                    throw new NoSuchElementException();
                }
                return fresh.next();
            }
        };
    }

    private Token scan() {
        while (true) {
            skipWhitespace();
            if (position >= input.length()) {
                return new Token(Token.Type.EOF, "", here());
            }
            char current = input.charAt(position);
            if (current == '[') {
                Token comment = scanComment();
                if (comment != null) {
                    return comment;
                }
                continue;
            }
            if (current == ']') {
                throw new NexusLexException("Unexpected ']' outside of a comment", here());
            }
            if (current == '\'') {
                return scanQuoted();
            }
            Token.Type punctuation = punctuationType(current);
            if (punctuation != null) {
                SourcePosition start = here();
                advance();
                return new Token(punctuation, String.valueOf(current), start);
            }
            return scanWord();
        }
    }

    private Token scanComment() {
        SourcePosition start = here();
        advance(); // Skip '['
        int bodyStart = position;
        int depth = 1;
        while (depth > 0) {
            if (position >= input.length()) {
                throw new NexusLexException("Unterminated comment", start);
            }
            char current = advance();
            if (current == '[') {
                depth++;
            } else if (current == ']') {
                depth--;
            }
        }
        String body = input.substring(bodyStart, position - 1);
        if (body.startsWith("&")) {
            return new Token(Token.Type.COMMENT, body, start);
        }
        return null;
    }

    private Token scanQuoted() {
        SourcePosition start = here();
        advance(); // Skip opening quote
        StringBuilder sb = new StringBuilder();
        while (true) {
            if (position >= input.length()) {
                throw new NexusLexException("Unterminated quoted label", start);
            }
            char current = advance();
            if (current == '\'') {
                if (position < input.length() && input.charAt(position) == '\'') {
                    advance();
                    sb.append('\'');
                } else {
                    break;
                }
            } else {
                sb.append(current);
            }
        }
        return new Token(Token.Type.QUOTED, sb.toString(), start);
    }

    private Token scanWord() {
        SourcePosition start = here();
        int wordStart = position;
        while (position < input.length()) {
            char current = input.charAt(position);
            if (Character.isWhitespace(current) || PUNCTUATION.indexOf(current) >= 0) {
                break;
            }
            advance();
        }
        String word = input.substring(wordStart, position);
        if (word.equalsIgnoreCase(HEADER)) {
            return new Token(Token.Type.HEADER, word, start);
        }
        if (NUMBER.matcher(word).matches()) {
            return new Token(Token.Type.NUMBER, word, start);
        }
        if (!preserveUnderscores) {
            word = word.replace('_', ' ');
        }
        return new Token(Token.Type.WORD, word, start);
    }

    private static Token.Type punctuationType(char c) {
        switch (c) {
            case ';': return Token.Type.SEMICOLON;
            case '(': return Token.Type.LPAREN;
            case ')': return Token.Type.RPAREN;
            case ',': return Token.Type.COMMA;
            case ':': return Token.Type.COLON;
            case '=': return Token.Type.EQUALS;
            case '*': return Token.Type.STAR;
            default: return null;
        }
    }

    private void skipWhitespace() {
        while (position < input.length() && Character.isWhitespace(input.charAt(position))) {
            advance();
        }
    }

    private char advance() {
        char current = input.charAt(position++);
        if (current == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return current;
    }

    private SourcePosition here() {
        return new SourcePosition(line, column, position);
    }
}

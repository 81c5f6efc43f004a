package com.yongkangl.nexus.io;

public final class Token {
    public enum Type {
        HEADER,
        WORD,
        NUMBER,
        QUOTED,
        COMMENT,
        SEMICOLON,
        LPAREN,
        RPAREN,
        COMMA,
        COLON,
        EQUALS,
        STAR,
        EOF
    }

    private final Type type;
    private final String text;
    private final SourcePosition position;

    public Token(Type type, String text, SourcePosition position) {
        this.type = type;
        this.text = text;
        this.position = position;
    }

    public Type getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    public SourcePosition getPosition() {
        return position;
    }

    public boolean is(Type type) {
        return this.type == type;
    }

    // Keywords are only ever bare words; a quoted 'END' is a label.
    public boolean isKeyword(String keyword) {
        return type == Type.WORD && text.equalsIgnoreCase(keyword);
    }

    // Anything that may stand for a taxon or tree name.
    public boolean isLabel() {
        return type == Type.WORD || type == Type.NUMBER || type == Type.QUOTED;
    }

    public double numberValue() {
        return Double.parseDouble(text);
    }

    public String describe() {
        switch (type) {
            case EOF:
                return "end of input";
            case QUOTED:
                return "'" + text + "'";
            case COMMENT:
                return "[" + text + "]";
            default:
                return "'" + text + "'";
        }
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + position;
    }
}

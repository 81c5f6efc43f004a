package com.yongkangl.nexus.io;

public final class SourcePosition {
    private final int line;
    private final int column;
    private final int offset;

    public SourcePosition(int line, int column, int offset) {
        this.line = line;
        this.column = column;
        this.offset = offset;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getOffset() {
        return offset;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourcePosition)) return false;
        SourcePosition that = (SourcePosition) o;
        return line == that.line && column == that.column && offset == that.offset;
    }

    @Override
    public int hashCode() {
        return 31 * (31 * line + column) + offset;
    }

    @Override
    public String toString() {
        return "line " + line + ", column " + column;
    }
}

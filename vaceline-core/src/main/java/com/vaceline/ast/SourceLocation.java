package com.vaceline.ast;

/**
 * Source span of a node. Lines and columns are 1-based, offsets 0-based.
 */
public record SourceLocation(Position start, Position end) {

    public record Position(int offset, int line, int column) {}

    @Override
    public String toString() {
        return start.line() + ":" + start.column() + "-" + end.line() + ":" + end.column();
    }
}

package com.treegrep.tree;

public class TreeParseException extends RuntimeException {
    private final int position;

    public TreeParseException(String message, int position) {
        super("Tree parse error at position " + position + ": " + message);
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}

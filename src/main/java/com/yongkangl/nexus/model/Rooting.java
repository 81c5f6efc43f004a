package com.yongkangl.nexus.model;

public enum Rooting {
    ROOTED("&R"),
    UNROOTED("&U"),
    // No [&R] or [&U] was given; consumers decide what that means.
    UNSPECIFIED(null);

    private final String command;

    Rooting(String command) {
        this.command = command;
    }

    public String getCommand() {
        return command;
    }

    public static Rooting fromCommand(String comment) {
        if (comment == null) {
            return null;
        }
        String body = comment.trim();
        if (body.equalsIgnoreCase("&R")) {
            return ROOTED;
        }
        if (body.equalsIgnoreCase("&U")) {
            return UNROOTED;
        }
        return null;
    }
}

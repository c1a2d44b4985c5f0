package com.sparky.suppress.tool;

import java.util.Locale;

public enum Command {
    CHECK("Validates the format of a file, checking that email addresses are well-formed, but does not upload them."),
    RETRIEVE("Gets your current suppression-list contents back into a file."),
    UPDATE("Uploads file contents to the suppression list. Also verifies as \"check\" does."),
    DELETE("Removes the file's entries from the suppression list, one call per entry. Also verifies as \"check\" does.");

    private final String description;

    Command(String description) {
        this.description = description;
    }

    public String commandName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String description() {
        return description;
    }

    /**
     * @return the command, or null when the name is not a known command
     */
    public static Command fromName(String name) {
        if (name == null) {
            return null;
        }
        for (Command c : values()) {
            if (c.commandName().equals(name)) {
                return c;
            }
        }
        return null;
    }
}

package com.example.anchormud.net;

/**
 * Splits an input line into a canonical command name and its argument string.
 */
public final class CommandParser {

    private CommandParser() {
    }

    /**
     * @return the parsed command, or null for blank input or an unknown command
     */
    public static Command parse(String line) {
        if (line == null || line.isBlank()) return null;
        String[] parts = line.trim().split("\\s+", 2);
        String resolved = CommandRegistry.resolveCommand(parts[0].toLowerCase());
        if (resolved == null) return null;
        String args = parts.length > 1 ? parts[1].trim() : "";
        return new Command(resolved, args);
    }

    /**
     * A parsed command with name and argument string.
     */
    public static class Command {
        private final String name;
        private final String args;

        public Command(String name, String args) {
            this.name = name;
            this.args = args;
        }

        public String getName() { return name; }
        public String getArgs() { return args; }

        /** First word of the arguments, or empty. */
        public String firstArg() {
            if (args.isEmpty()) return "";
            int space = args.indexOf(' ');
            return space < 0 ? args : args.substring(0, space);
        }

        /** Arguments after the first word, or empty. */
        public String restArgs() {
            int space = args.indexOf(' ');
            return space < 0 ? "" : args.substring(space + 1).trim();
        }
    }
}

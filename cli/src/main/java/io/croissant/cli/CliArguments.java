package io.croissant.cli;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Parsed command line: a command followed by {@code --flag value} options.
 *
 * @param command    {@code validate} or {@code load}
 * @param file       the metadata document
 * @param recordSet  record set to load, {@code null} for {@code validate}
 * @param numRecords records to print, {@code -1} for all
 * @param debug      log the operation graph
 */
public record CliArguments(Command command, Path file, String recordSet, long numRecords, boolean debug) {

    static final String USAGE = String.join(
            "\n",
            "Usage:",
            "  croissant validate --file <metadata.json> [--config <croissant.yaml>] [--debug]",
            "  croissant load --file <metadata.json> --record-set <name> [--num-records <n>]"
                    + " [--config <croissant.yaml>] [--debug]");

    public enum Command {
        VALIDATE,
        LOAD
    }

    /**
     * @throws IllegalArgumentException if the command line is incomplete or has unknown options
     */
    public static CliArguments parse(String[] args) {
        if (args.length == 0) {
            throw new IllegalArgumentException("Missing command.\n" + USAGE);
        }
        Command command;
        try {
            command = Command.valueOf(args[0].toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown command '" + args[0] + "'.\n" + USAGE, e);
        }
        Path file = null;
        String recordSet = null;
        long numRecords = -1;
        boolean debug = false;
        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--file" -> file = Path.of(value(args, i++));
                case "--record-set" -> recordSet = value(args, i++);
                case "--num-records" -> numRecords = parseCount(value(args, i++));
                case "--config" -> value(args, i++);
                case "--debug" -> debug = true;
                default -> throw new IllegalArgumentException("Unknown option '" + args[i] + "'.\n" + USAGE);
            }
        }
        if (file == null) {
            throw new IllegalArgumentException("--file is required.\n" + USAGE);
        }
        if (command == Command.LOAD && recordSet == null) {
            throw new IllegalArgumentException("--record-set is required for load.\n" + USAGE);
        }
        return new CliArguments(command, file, recordSet, numRecords, debug);
    }

    private static String value(String[] args, int flag) {
        if (flag + 1 >= args.length) {
            throw new IllegalArgumentException(args[flag] + " requires a value.\n" + USAGE);
        }
        return args[flag + 1];
    }

    private static long parseCount(String value) {
        try {
            long count = Long.parseLong(value);
            if (count < -1) {
                throw new IllegalArgumentException("--num-records must be -1 or a non-negative number, got " + value);
            }
            return count;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--num-records must be a number, got '" + value + "'", e);
        }
    }
}

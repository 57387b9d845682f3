package io.numstab.standalone.app;

import io.numstab.core.model.DbgInfo;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Parsed command line: options start with {@code --}, everything else is an
 * infix expression.
 *
 * @param configPath  the {@code --config} file, or {@code null}
 * @param dbgInfo     provenance recorded for every expression of this run
 * @param expressions expressions given on the command line; empty means read
 *                    standard input
 */
public record Arguments(Path configPath, DbgInfo dbgInfo, List<String> expressions) {

    public Arguments {
        expressions = List.copyOf(expressions);
    }

    /**
     * @throws IllegalArgumentException on an unknown option or an option
     *                                  missing its value
     */
    public static Arguments parse(String[] args) {
        Path configPath = null;
        String module = null;
        String function = null;
        String type = null;
        String comment = null;
        List<String> expressions = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (!arg.startsWith("--")) {
                expressions.add(arg);
                continue;
            }
            if (i + 1 >= args.length) {
                throw new IllegalArgumentException(arg + " requires a value");
            }
            String value = args[++i];
            switch (arg) {
                case "--config" -> configPath = Path.of(value);
                case "--module" -> module = value;
                case "--function" -> function = value;
                case "--type" -> type = value;
                case "--comment" -> comment = value;
                default -> throw new IllegalArgumentException("Unknown option " + arg);
            }
        }
        return new Arguments(configPath, new DbgInfo(comment, module, function, type), expressions);
    }
}

package com.example.opcuaagent.tools;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.example.opcuaagent.config.MegolmSettings;
import com.example.opcuaagent.exceptions.PersistenceException;
import com.example.opcuaagent.store.FileRatchetStatePersistence;
import com.example.opcuaagent.store.RatchetSessionStore;

/**
 * Arguments shared by the offline tools.
 * <p>
 * The ratchet state directory is taken from {@code --state-dir}, then from the
 * {@value #STATE_DIR_ENV} environment variable, then the agent's default.
 */
final class ToolOptions {

    static final String STATE_DIR_ENV = "MEGOLM_STATE_DIR";

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private final Path stateDirectory;
    private final List<String> arguments;
    private final boolean help;

    private ToolOptions(Path stateDirectory, List<String> arguments, boolean help) {
        this.stateDirectory = stateDirectory;
        this.arguments = arguments;
        this.help = help;
    }

    /**
     * @throws IllegalArgumentException if an option is incomplete or unknown
     */
    static ToolOptions parse(String[] args, Map<String, String> env) {
        String directory = null;
        List<String> arguments = new ArrayList<>();
        boolean help = false;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--state-dir".equals(arg)) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--state-dir needs a directory");
                }
                directory = args[++i];
            } else if (arg.startsWith("--state-dir=")) {
                directory = arg.substring("--state-dir=".length());
            } else if ("-h".equals(arg) || "--help".equals(arg)) {
                help = true;
            } else if (arg.startsWith("--")) {
                throw new IllegalArgumentException("Unknown option " + arg);
            } else {
                arguments.add(arg);
            }
        }
        if (directory == null) {
            directory = env.get(STATE_DIR_ENV);
        }
        if (directory == null || directory.isBlank()) {
            directory = new MegolmSettings().getStateDirectory();
        }
        return new ToolOptions(Paths.get(directory), arguments, help);
    }

    RatchetSessionStore openStore() throws PersistenceException {
        return new RatchetSessionStore(new FileRatchetStatePersistence(stateDirectory));
    }

    Path getStateDirectory() {
        return stateDirectory;
    }

    List<String> getArguments() {
        return arguments;
    }

    boolean isHelp() {
        return help;
    }
}

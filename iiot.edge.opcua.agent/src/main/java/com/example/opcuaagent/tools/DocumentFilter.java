package com.example.opcuaagent.tools;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

import com.example.opcuaagent.codec.EnvelopeSerializer;
import com.example.opcuaagent.engine.MegolmEncryptionEngine;
import com.example.opcuaagent.exceptions.AgentException;
import com.example.opcuaagent.store.RatchetSessionStore;

/**
 * Skeleton of the encode and decode tools: every non-blank input line is one JSON document,
 * transformed into one output line. Input is a file argument or standard input. A line that
 * fails is reported on the error stream and processing goes on.
 */
abstract class DocumentFilter {

    private final String usage;

    DocumentFilter(String usage) {
        this.usage = usage;
    }

    /**
     * @return the output line of one input document
     */
    abstract String transform(MegolmEncryptionEngine engine, String document) throws AgentException;

    final int run(String[] args, Map<String, String> env, InputStream in, PrintStream out, PrintStream err) {
        ToolOptions options;
        try {
            options = ToolOptions.parse(args, env);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(usage);
            return ToolOptions.EXIT_USAGE;
        }
        if (options.isHelp()) {
            out.println(usage);
            return ToolOptions.EXIT_OK;
        }
        List<String> arguments = options.getArguments();
        if (arguments.size() > 1) {
            err.println(usage);
            return ToolOptions.EXIT_USAGE;
        }

        int failures = 0;
        try (RatchetSessionStore store = options.openStore();
             BufferedReader reader = arguments.isEmpty()
                ? new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))
                : Files.newBufferedReader(Paths.get(arguments.get(0)), StandardCharsets.UTF_8)) {
            MegolmEncryptionEngine engine = new MegolmEncryptionEngine(store, new EnvelopeSerializer());
            String line;
            int number = 0;
            while ((line = reader.readLine()) != null) {
                number++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    out.println(transform(engine, line.trim()));
                } catch (AgentException e) {
                    failures++;
                    err.println("Line " + number + ": " + e.getMessage());
                }
            }
        } catch (IOException e) {
            err.println("Cannot read input: " + e.getMessage());
            return ToolOptions.EXIT_FAILURE;
        } catch (AgentException e) {
            err.println(e.getMessage());
            return ToolOptions.EXIT_FAILURE;
        }
        return failures == 0 ? ToolOptions.EXIT_OK : ToolOptions.EXIT_FAILURE;
    }
}

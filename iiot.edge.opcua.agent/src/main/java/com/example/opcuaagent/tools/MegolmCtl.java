package com.example.opcuaagent.tools;

import java.io.PrintStream;
import java.util.List;
import java.util.Map;

import com.example.opcuaagent.exceptions.AgentException;
import com.example.opcuaagent.store.RatchetSessionStore;
import com.example.opcuaagent.store.SessionSummary;

/**
 * Manages the Megolm sessions of devices in a ratchet state directory.
 * <pre>
 * megolmctl [--state-dir DIR] create DEVICE
 * megolmctl [--state-dir DIR] rotate DEVICE
 * megolmctl [--state-dir DIR] export DEVICE
 * megolmctl [--state-dir DIR] import DEVICE SESSION_KEY
 * megolmctl [--state-dir DIR] show DEVICE
 * </pre>
 * Do not run it against the directory of a running agent: the agent keeps the state of its
 * devices in memory and would overwrite the changes.
 */
public final class MegolmCtl {

    private static final String USAGE = String.join(System.lineSeparator(),
            "Usage: megolmctl [--state-dir DIR] COMMAND DEVICE [SESSION_KEY]",
            "  create DEVICE              create the outbound session unless one exists",
            "  rotate DEVICE              replace the outbound session",
            "  export DEVICE              print the session key of the outbound session",
            "  import DEVICE SESSION_KEY  add an inbound session for decryption",
            "  show DEVICE                print the sessions and their indices",
            "The state directory defaults to $" + ToolOptions.STATE_DIR_ENV + ".");

    private MegolmCtl() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.getenv(), System.out, System.err));
    }

    static int run(String[] args, Map<String, String> env, PrintStream out, PrintStream err) {
        ToolOptions options;
        try {
            options = ToolOptions.parse(args, env);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return ToolOptions.EXIT_USAGE;
        }
        if (options.isHelp()) {
            out.println(USAGE);
            return ToolOptions.EXIT_OK;
        }

        List<String> arguments = options.getArguments();
        String command = arguments.isEmpty() ? "" : arguments.get(0);
        int expected = "import".equals(command) ? 3 : 2;
        if (arguments.size() != expected) {
            err.println(USAGE);
            return ToolOptions.EXIT_USAGE;
        }
        String device = arguments.get(1);

        try (RatchetSessionStore store = options.openStore()) {
            switch (command) {
                case "create":
                    out.println(store.createOutbound(device));
                    break;
                case "rotate":
                    out.println(store.rotateOutbound(device));
                    break;
                case "export":
                    out.println(store.exportSessionKey(device));
                    break;
                case "import":
                    out.println(store.importSessionKey(device, arguments.get(2)));
                    break;
                case "show":
                    print(store.describe(device), out);
                    break;
                default:
                    err.println("Unknown command " + command);
                    err.println(USAGE);
                    return ToolOptions.EXIT_USAGE;
            }
            return ToolOptions.EXIT_OK;
        } catch (AgentException e) {
            err.println(e.getMessage() + (e.getCause() == null ? "" : " " + e.getCause().getMessage()));
            return ToolOptions.EXIT_FAILURE;
        }
    }

    private static void print(SessionSummary summary, PrintStream out) {
        out.println("device:   " + summary.getDeviceId());
        if (summary.getOutboundSessionId() == null) {
            out.println("outbound: none");
        } else {
            out.println("outbound: " + summary.getOutboundSessionId() + " next index " + summary.getNextOutboundIndex());
        }
        for (SessionSummary.Inbound inbound : summary.getInbound()) {
            out.println("inbound:  " + inbound.getSessionId() + " next index " + inbound.getNextIndex()
                    + (inbound.getLastAcceptedIndex() == null ? "" : ", last accepted " + inbound.getLastAcceptedIndex()));
        }
    }
}

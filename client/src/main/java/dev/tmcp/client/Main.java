package dev.tmcp.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.tmcp.channel.WalletSecureChannelProvider;
import dev.tmcp.client.transport.ClientTransport;
import dev.tmcp.client.transport.SseClientTransport;
import dev.tmcp.client.transport.WebSocketClientTransport;
import dev.tmcp.directory.HttpDirectoryClient;
import dev.tmcp.identity.FileIdentityStore;
import dev.tmcp.identity.IdentityManager;
import dev.tmcp.identity.TmcpSettings;
import io.modelcontextprotocol.spec.McpSchema;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public final class Main {

    private static final Duration REQUEST_TIMEOUT = Duration.ofMinutes(5);

    private Main() {
    }

    public static void main(String[] args) throws Exception {
        List<String> arguments = new ArrayList<>(Arrays.asList(args));
        boolean verbose = arguments.remove("--verbose");
        String transportType = option(arguments, "--transport", "sse");
        String name = option(arguments, "--name", "Tmcp");
        String store = option(arguments, "--store", System.getenv("TMCP_STORE_DIR"));
        if (arguments.size() < 2) {
            printUsage();
            return;
        }
        String serverDid = arguments.remove(0);
        String command = arguments.remove(0);

        TmcpSettings settings = TmcpSettings.defaults().toBuilder().verbose(verbose).build();
        Path storeDir = store != null ? Path.of(store) : Path.of(System.getProperty("user.home"), ".tmcp");
        IdentityManager identityManager = new IdentityManager(
            new WalletSecureChannelProvider(new FileIdentityStore(storeDir),
                HttpDirectoryClient.create(settings, ClientTransportSettings.DEFAULT_TIMEOUT)),
            settings);
        identityManager.init(name + "TmcpClient");
        System.out.println("Client identity: " + identityManager.localDid());

        ClientTransportSettings transportSettings = ClientTransportSettings.defaults();
        ClientTransport transport = switch (transportType) {
            case "sse" -> new SseClientTransport(identityManager, transportSettings);
            case "websocket" -> new WebSocketClientTransport(identityManager, transportSettings);
            default -> throw new IllegalArgumentException("Unknown transport: " + transportType);
        };

        try (TmcpClientSession session = new TmcpClientSession(transport.connect(serverDid))) {
            switch (command) {
                case "ping" -> print(session.ping(REQUEST_TIMEOUT));
                case "call" -> handleCall(session, arguments);
                default -> {
                    System.err.println("Unknown command: " + command);
                    printUsage();
                }
            }
        }
    }

    private static void handleCall(TmcpClientSession session, List<String> arguments) throws Exception {
        if (arguments.isEmpty()) {
            throw new IllegalArgumentException("call requires a method argument");
        }
        String method = arguments.get(0);
        JsonNode params = arguments.size() > 1 ? new ObjectMapper().readTree(arguments.get(1)) : null;
        print(session.request(method, params, REQUEST_TIMEOUT));
    }

    private static void print(McpSchema.JSONRPCResponse response) throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        if (response.error() != null) {
            System.out.println("ERROR " + response.error().code() + ": " + response.error().message());
        } else {
            System.out.println("RESULT " + mapper.writeValueAsString(response.result()));
        }
    }

    private static String option(List<String> arguments, String flag, String defaultValue) {
        int index = arguments.indexOf(flag);
        if (index < 0) {
            return defaultValue;
        }
        if (index + 1 >= arguments.size()) {
            throw new IllegalArgumentException(flag + " requires a value");
        }
        arguments.remove(index);
        return arguments.remove(index);
    }

    private static void printUsage() {
        System.out.println("Usage: java -jar tmcp-client.jar [--transport sse|websocket] [--name NAME] "
            + "[--store DIR] [--verbose] <serverDid> <command> [args]\n"
            + "Commands:\n"
            + "  ping\n"
            + "  call <method> [jsonParams]");
    }
}

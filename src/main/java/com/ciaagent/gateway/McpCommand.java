package com.ciaagent.gateway;

import com.ciaagent.mcp.McpManager;
import com.ciaagent.mcp.auth.McpAuthService;
import com.ciaagent.observability.DoctorCommand;
import com.ciaagent.observability.MetricsConfig;
import com.ciaagent.shared.config.CiaConfig;
import com.ciaagent.shared.config.McpServerConfig;
import com.ciaagent.shared.errors.CliError;
import com.ciaagent.shared.errors.CommonErrors;
import com.ciaagent.shared.errors.ExitCode;
import com.ciaagent.tools.ToolContext;
import com.ciaagent.tools.ToolRegistry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * {@code cia mcp ...}: server status, tool listing, diagnostics, OAuth login and
 * one-off tool calls. Each invocation owns one {@link McpManager} for its lifetime
 * and registers a shutdown hook that tears the connections down on interrupt.
 */
@Command(name = "mcp", description = "Manage MCP tool servers.",
        subcommands = {
            McpCommand.Status.class, McpCommand.ListServers.class, McpCommand.Get.class,
            McpCommand.Tools.class, McpCommand.Doctor.class, McpCommand.Auth.class,
            McpCommand.Logout.class, McpCommand.Call.class
        })
public class McpCommand {

    private static final Logger log = LoggerFactory.getLogger(McpCommand.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @ParentCommand
    CiaAgentApp app;

    @Spec
    CommandSpec spec;

    PrintWriter out() { return spec.commandLine().getOut(); }
    PrintWriter err() { return spec.commandLine().getErr(); }

    int fail(CliError error) {
        error.print(err());
        return error.code().code();
    }

    McpAuthService authService(CiaConfig config) {
        return app.authServiceFactory.apply(config);
    }

    /** Runs {@code body} against a started manager connected to {@code servers}, then stops it. */
    int withManager(CiaConfig config, Map<String, McpServerConfig> servers, Function<McpManager, Integer> body) {
        var manager = app.managerFactory.create(authService(config), new MetricsConfig());
        var hook = new Thread(manager::cleanup, "mcp-cleanup");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            manager.start();
            manager.initialize(servers);
            return body.apply(manager);
        } finally {
            manager.stop();
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                log.debug("Shutdown already in progress");
            }
        }
    }

    McpServerConfig requireServer(CiaConfig config, String name) {
        var server = config.mcpServers().get(name);
        if (server == null) {
            fail(CommonErrors.invalidArgument(name, "one of " + config.mcpServers().keySet()));
        }
        return server;
    }

    @Command(name = "status", description = "Connect to every server and show its state.")
    static class Status implements Callable<Integer> {
        @ParentCommand McpCommand parent;

        @Override
        public Integer call() {
            var config = parent.app.loadConfig();
            if (config.mcpServers().isEmpty()) {
                parent.out().println("No MCP servers configured");
                return 0;
            }
            return parent.withManager(config, config.mcpServers(), manager -> {
                var report = manager.getDetailedStatus();
                for (var server : report.servers()) {
                    parent.out().printf("  %-20s %s%n", server.name(), server.status());
                }
                parent.out().printf("%d/%d servers connected, %d tools available%n",
                        report.connectedServers(), report.serverCount(), report.toolCount());
                return 0;
            });
        }
    }

    @Command(name = "list", description = "List configured servers without connecting.")
    static class ListServers implements Callable<Integer> {
        @ParentCommand McpCommand parent;

        @Override
        public Integer call() {
            var servers = parent.app.loadConfig().mcpServers();
            if (servers.isEmpty()) {
                parent.out().println("No MCP servers configured");
                return 0;
            }
            servers.forEach((name, server) -> parent.out().printf("  %-20s %-6s %s%s%n",
                    name, server.type().name().toLowerCase(), target(server),
                    server.enabled() ? "" : " (disabled)"));
            return 0;
        }
    }

    @Command(name = "get", description = "Connect to one server and show its details.")
    static class Get implements Callable<Integer> {
        @ParentCommand McpCommand parent;
        @Parameters(index = "0", description = "Server name") String name;

        @Override
        public Integer call() {
            var config = parent.app.loadConfig();
            var server = parent.requireServer(config, name);
            if (server == null) return ExitCode.INPUT_VALIDATION.code();
            return parent.withManager(config, Map.of(name, server), manager -> {
                var out = parent.out();
                var diag = manager.getConnectionDiagnostics(name).servers().get(0);
                out.println(name);
                out.println("  type:      " + server.type().name().toLowerCase());
                out.println("  target:    " + target(server));
                out.println("  status:    " + manager.getStatus(name));
                out.println("  transport: " + diag.transportType());
                out.println("  auth:      " + diag.authenticationStatus());
                for (var tool : manager.getTools()) {
                    out.println("  - " + tool.originalName() + ": " + tool.description());
                }
                return 0;
            });
        }
    }

    @Command(name = "tools", description = "List the tools of every connected server.")
    static class Tools implements Callable<Integer> {
        @ParentCommand McpCommand parent;

        @Override
        public Integer call() {
            var config = parent.app.loadConfig();
            return parent.withManager(config, config.mcpServers(), manager -> {
                var tools = manager.getTools();
                if (tools.isEmpty()) {
                    parent.out().println("No MCP tools available");
                }
                for (var tool : tools) {
                    parent.out().printf("  %-30s %s%n", tool.id(), tool.description());
                }
                return 0;
            });
        }
    }

    @Command(name = "doctor", description = "Diagnose MCP server connections.")
    static class Doctor implements Callable<Integer> {
        @ParentCommand McpCommand parent;

        @Override
        public Integer call() {
            var config = parent.app.loadConfig();
            return parent.withManager(config, config.mcpServers(), manager -> {
                parent.out().println(new DoctorCommand(manager).run());
                return 0;
            });
        }
    }

    @Command(name = "auth", description = "Run the OAuth login for a remote server.")
    static class Auth implements Callable<Integer> {
        @ParentCommand McpCommand parent;
        @Parameters(index = "0", description = "Server name") String name;

        @Override
        public Integer call() {
            var config = parent.app.loadConfig();
            var server = parent.requireServer(config, name);
            if (server == null) return ExitCode.INPUT_VALIDATION.code();
            if (!server.requiresAuth()) {
                return parent.fail(CommonErrors.invalidConfig("mcp." + name + ".oauth",
                        "server does not have OAuth configured"));
            }
            try {
                parent.out().println("Opening browser for OAuth authorization of " + name + "...");
                parent.out().flush();
                parent.authService(config).authorize(server).get(5, TimeUnit.MINUTES);
                parent.out().println("Successfully authenticated with " + name);
                return 0;
            } catch (ExecutionException e) {
                return parent.fail(CommonErrors.operationFailed("mcp auth " + name, e.getCause().getMessage()));
            } catch (TimeoutException e) {
                return parent.fail(new CliError(ExitCode.TIMEOUT, "Authorization timed out for " + name,
                        null, "Run: cia mcp auth " + name));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return parent.fail(CommonErrors.operationFailed("mcp auth " + name, "interrupted"));
            } catch (RuntimeException e) {
                return parent.fail(new CliError(ExitCode.AUTH_CONFIG, "Authentication failed for " + name,
                        e.getMessage(), "Check the server URL and oauth settings"));
            }
        }
    }

    @Command(name = "logout", description = "Delete stored OAuth tokens for a server.")
    static class Logout implements Callable<Integer> {
        @ParentCommand McpCommand parent;
        @Parameters(index = "0", description = "Server name") String name;

        @Override
        public Integer call() {
            var config = parent.app.loadConfig();
            boolean removed = parent.authService(config).logout(name);
            parent.out().println(removed ? "Cleared tokens for " + name : "No stored tokens for " + name);
            return 0;
        }
    }

    @Command(name = "call", description = "Call one MCP tool with JSON arguments.")
    static class Call implements Callable<Integer> {
        @ParentCommand McpCommand parent;
        @Parameters(index = "0", description = "Tool id (<server>_<tool>)") String toolId;
        @Parameters(index = "1", arity = "0..1", description = "Arguments as a JSON object") String json;

        @Override
        public Integer call() {
            JsonNode args;
            try {
                args = json != null ? MAPPER.readTree(json) : MAPPER.createObjectNode();
            } catch (JsonProcessingException e) {
                return parent.fail(CommonErrors.invalidArgument(json, "a JSON object"));
            }
            if (!args.isObject()) {
                return parent.fail(CommonErrors.invalidArgument(json, "a JSON object"));
            }
            var config = parent.app.loadConfig();
            return parent.withManager(config, config.mcpServers(), manager -> {
                var registry = new ToolRegistry();
                manager.registerTools(registry);
                var tool = registry.get(toolId);
                if (tool == null) {
                    return parent.fail(CommonErrors.invalidArgument(toolId, "a tool id from 'cia mcp tools'"));
                }
                var result = tool.execute(new ToolContext(System.getProperty("user.dir"), null), args);
                if (result.isError()) {
                    parent.err().println(result.output());
                    parent.err().flush();
                    return ExitCode.LLM_EXECUTION.code();
                }
                parent.out().println(result.output());
                return 0;
            });
        }
    }

    static String target(McpServerConfig server) {
        if (!server.isLocal()) return server.url();
        return server.args().isEmpty() ? server.command() : server.command() + " " + String.join(" ", server.args());
    }
}

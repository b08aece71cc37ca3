package com.ciaagent.gateway;

import com.ciaagent.mcp.McpManager;
import com.ciaagent.mcp.auth.McpAuthService;
import com.ciaagent.observability.MetricsConfig;
import com.ciaagent.shared.config.CiaConfig;
import com.ciaagent.shared.config.ConfigLoader;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.function.Function;

/** Root {@code cia} command. */
@Command(name = "cia", mixinStandardHelpOptions = true, version = "cia 0.1.0",
        description = "CLI agent with MCP tool servers.",
        subcommands = { McpCommand.class })
public class CiaAgentApp {

    @Option(names = { "-c", "--config" }, description = "Config file (default: ~/.cia/config.yaml)")
    Path configFile;

    @FunctionalInterface
    interface ManagerFactory {
        McpManager create(McpAuthService auth, MetricsConfig metrics);
    }

    ManagerFactory managerFactory = McpManager::create;
    Function<CiaConfig, McpAuthService> authServiceFactory = config -> new McpAuthService(config.oauth());

    CiaConfig loadConfig() {
        return configFile != null ? ConfigLoader.load(configFile) : ConfigLoader.load();
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new CiaAgentApp()).execute(args);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        return run(new CiaAgentApp(), args, out, err);
    }

    static int run(CiaAgentApp app, String[] args, PrintStream out, PrintStream err) {
        var cmd = new CommandLine(app);
        cmd.setOut(new PrintWriter(out, true, StandardCharsets.UTF_8));
        cmd.setErr(new PrintWriter(err, true, StandardCharsets.UTF_8));
        return cmd.execute(args);
    }
}

package io.sessioncast.cli;

import io.sessioncast.api.AgentSummary;
import io.sessioncast.api.ApiException;
import io.sessioncast.api.RemoteSession;
import io.sessioncast.api.SendKeysResult;
import io.sessioncast.api.SessionCastApiClient;
import io.sessioncast.config.AgentConfig;
import io.sessioncast.config.AgentConfigLoader;
import io.sessioncast.config.ConfigException;
import io.sessioncast.config.CredentialStore;
import io.sessioncast.runtime.AgentDaemon;
import io.sessioncast.security.SensitiveDataMasker;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Paths;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
        name = "sessioncast",
        mixinStandardHelpOptions = true,
        version = "sessioncast 0.1.0",
        description = "SessionCast CLI - Control your agents from anywhere",
        footer = {
                "",
                "Examples:",
                "  $ sessioncast login sk-xxx-xxx-xxx",
                "  $ sessioncast agents",
                "  $ sessioncast list macbook",
                "  $ sessioncast send macbook:dev \"ls -la\"",
                "  $ sessioncast send server:main:0 \"npm run build\"",
                "  $ sessioncast agent -c ~/.sessioncast.yml",
                "",
                "Target format:",
                "  <agent>:<session>          - Send to session",
                "  <agent>:<session>:<window> - Send to specific window"
        },
        subcommands = {
                SessionCastCommand.LoginCommand.class,
                SessionCastCommand.LogoutCommand.class,
                SessionCastCommand.StatusCommand.class,
                SessionCastCommand.AgentsCommand.class,
                SessionCastCommand.ListCommand.class,
                SessionCastCommand.SendCommand.class,
                SessionCastCommand.AgentCommand.class
        }
)
public final class SessionCastCommand implements Runnable {
    @Option(names = {"--credentials"}, hidden = true, description = "Credential file (default ~/.sessioncast/cli-config.json)")
    String credentialsFile;

    @Override
    public void run() {
        System.out.println(CliFormat.BANNER);
    }

    CredentialStore credentials() {
        if (credentialsFile == null || credentialsFile.isBlank()) {
            return CredentialStore.defaultStore();
        }
        return new CredentialStore(Paths.get(credentialsFile));
    }

    SessionCastApiClient api() {
        return new SessionCastApiClient(credentials());
    }

    private static int notLoggedIn() {
        System.out.println("Not logged in. Run: sessioncast login <api-key>");
        return 1;
    }

    @Command(name = "login", description = "Login with your API key")
    static final class LoginCommand implements Callable<Integer> {
        @ParentCommand
        SessionCastCommand parent;

        @Parameters(index = "0", paramLabel = "<api-key>", description = "API key (starts with sk-)")
        String apiKey;

        @Option(names = {"-u", "--url"}, description = "Custom API URL")
        String url;

        @Override
        public Integer call() {
            CredentialStore store = parent.credentials();
            if (url != null && !url.isBlank()) {
                store.setApiUrl(url.trim());
                System.out.println("API URL set to: " + url.trim());
            }
            if (!apiKey.startsWith("sk-")) {
                System.out.println("Invalid API key format. Key should start with \"sk-\"");
                return 1;
            }
            store.setApiKey(apiKey);
            System.out.println("Logged in successfully! (" + SensitiveDataMasker.maskKey(apiKey) + ")");
            System.out.println("Your API key has been saved.");
            return 0;
        }
    }

    @Command(name = "logout", description = "Clear stored credentials")
    static final class LogoutCommand implements Callable<Integer> {
        @ParentCommand
        SessionCastCommand parent;

        @Override
        public Integer call() {
            CredentialStore store = parent.credentials();
            if (!store.isLoggedIn()) {
                System.out.println("Not logged in.");
                return 0;
            }
            store.clearApiKey();
            System.out.println("Logged out successfully!");
            return 0;
        }
    }

    @Command(name = "status", description = "Check login status")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        SessionCastCommand parent;

        @Override
        public Integer call() {
            CredentialStore store = parent.credentials();
            Optional<String> key = store.apiKey();
            if (key.isPresent()) {
                System.out.println("Logged in (" + SensitiveDataMasker.maskKey(key.get()) + ")");
                System.out.println("API URL: " + store.apiUrl());
            } else {
                System.out.println("Not logged in");
                System.out.println("Run: sessioncast login <api-key>");
            }
            return 0;
        }
    }

    @Command(name = "agents", description = "List your agents")
    static final class AgentsCommand implements Callable<Integer> {
        @ParentCommand
        SessionCastCommand parent;

        @Override
        public Integer call() {
            if (!parent.credentials().isLoggedIn()) {
                return notLoggedIn();
            }
            List<AgentSummary> agents;
            try {
                agents = parent.api().listAgents();
            } catch (ApiException e) {
                System.out.println("Error: " + e.getMessage());
                return 1;
            }
            if (agents.isEmpty()) {
                System.out.println("No agents found.");
                System.out.println("Create an agent at https://account.sessioncast.io");
                return 0;
            }
            System.out.println();
            System.out.println("Your Agents:");
            System.out.println();
            System.out.println(CliFormat.padRight("NAME", 20)
                    + CliFormat.padRight("STATUS", 12)
                    + CliFormat.padRight("API", 8)
                    + CliFormat.padRight("LAST SEEN", 20)
                    + "ID");
            System.out.println(CliFormat.rule(80));
            Instant now = Instant.now();
            for (AgentSummary agent : agents) {
                String name = agent.label() != null ? agent.label() : agent.machineId() != null ? agent.machineId() : "unnamed";
                System.out.println(CliFormat.padRight(name, 20)
                        + CliFormat.padRight(agent.isActive() ? "* online" : "o offline", 12)
                        + CliFormat.padRight(agent.apiEnabled() ? "yes" : "no", 8)
                        + CliFormat.padRight(CliFormat.relativeTime(agent.lastConnectedAt(), now, ZoneId.systemDefault()), 20)
                        + agent.shortId());
            }
            System.out.println();
            return 0;
        }
    }

    @Command(name = "list", aliases = {"ls"}, description = "List tmux sessions on agents")
    static final class ListCommand implements Callable<Integer> {
        @ParentCommand
        SessionCastCommand parent;

        @Parameters(index = "0", arity = "0..1", paramLabel = "[agent]", description = "Agent label, machine id or id prefix")
        String agentName;

        @Override
        public Integer call() {
            if (!parent.credentials().isLoggedIn()) {
                return notLoggedIn();
            }
            SessionCastApiClient api = parent.api();
            List<AgentSummary> online = new ArrayList<>();
            try {
                for (AgentSummary agent : api.listAgents()) {
                    if (agent.isActive() && agent.apiEnabled()) {
                        online.add(agent);
                    }
                }
            } catch (ApiException e) {
                System.out.println("Error: " + e.getMessage());
                return 1;
            }
            if (online.isEmpty()) {
                System.out.println("No online agents with API enabled.");
                return 0;
            }
            List<AgentSummary> targets = online;
            if (agentName != null && !agentName.isBlank()) {
                Optional<AgentSummary> found = online.stream().filter(a -> a.matches(agentName, true)).findFirst();
                if (found.isEmpty()) {
                    System.out.println("Agent not found: " + agentName);
                    System.out.println("Run: sessioncast agents");
                    return 1;
                }
                targets = List.of(found.get());
            }

            List<String> rows = new ArrayList<>();
            for (AgentSummary agent : targets) {
                List<RemoteSession> sessions;
                try {
                    sessions = api.listSessions(agent.id());
                } catch (ApiException e) {
                    // One unreachable agent should not hide the others.
                    continue;
                }
                String name = agent.displayName();
                for (RemoteSession session : sessions) {
                    rows.add(CliFormat.padRight(name, 16)
                            + CliFormat.padRight(session.name(), 16)
                            + CliFormat.padRight(Integer.toString(session.windows()), 10)
                            + CliFormat.padRight(session.attached() ? "yes" : "no", 10)
                            + name + ":" + session.name());
                }
            }
            if (rows.isEmpty()) {
                System.out.println("No tmux sessions found.");
                return 0;
            }
            System.out.println();
            System.out.println("Tmux Sessions:");
            System.out.println();
            System.out.println(CliFormat.padRight("AGENT", 16)
                    + CliFormat.padRight("SESSION", 16)
                    + CliFormat.padRight("WINDOWS", 10)
                    + CliFormat.padRight("ATTACHED", 10)
                    + "TARGET");
            System.out.println(CliFormat.rule(70));
            rows.forEach(System.out::println);
            System.out.println();
            System.out.println("Use: sessioncast send <target> \"command\"");
            return 0;
        }
    }

    @Command(name = "send", aliases = {"sendkeys"}, description = "Send keys to a tmux session")
    static final class SendCommand implements Callable<Integer> {
        @ParentCommand
        SessionCastCommand parent;

        @Parameters(index = "0", paramLabel = "<target>", description = "agent:session or agent:session:window")
        String target;

        @Parameters(index = "1", paramLabel = "<keys>", description = "Keys to send")
        String keys;

        @Option(names = {"--no-enter"}, description = "Do not press Enter after keys")
        boolean noEnter;

        @Override
        public Integer call() {
            if (!parent.credentials().isLoggedIn()) {
                return notLoggedIn();
            }
            TargetParser.Target parsed;
            try {
                parsed = TargetParser.parse(target);
            } catch (IllegalArgumentException e) {
                System.out.println(e.getMessage());
                System.out.println("Expected: <agent>:<session> or <agent>:<session>:<window>");
                System.out.println("Example: macbook:dev or server:main:0");
                return 1;
            }
            SessionCastApiClient api = parent.api();
            try {
                Optional<AgentSummary> agent = api.findAgentByName(parsed.agentName());
                if (agent.isEmpty()) {
                    System.out.println("Agent not found: " + parsed.agentName());
                    System.out.println("Run: sessioncast agents");
                    return 1;
                }
                if (!agent.get().isActive()) {
                    System.out.println("Agent is offline: " + parsed.agentName());
                    return 1;
                }
                if (!agent.get().apiEnabled()) {
                    System.out.println("API is not enabled for agent: " + parsed.agentName());
                    System.out.println("Enable API in agent settings at https://account.sessioncast.io");
                    return 1;
                }
                SendKeysResult result = api.sendKeys(agent.get().id(), parsed.sessionTarget(), keys, !noEnter);
                if (!result.success()) {
                    System.out.println("Failed to send keys: " + (result.error() == null ? "Unknown error" : result.error()));
                    return 1;
                }
                System.out.println("Keys sent to " + target);
                if (!noEnter) {
                    System.out.println("(Enter key was pressed)");
                }
                return 0;
            } catch (ApiException e) {
                System.out.println("Error: " + e.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "agent", description = "Start the SessionCast agent")
    static final class AgentCommand implements Callable<Integer> {
        @Option(names = {"-c", "--config"}, description = "Path to config file")
        String configPath;

        @Override
        public Integer call() throws Exception {
            AgentConfig config;
            AgentDaemon daemon;
            try {
                config = new AgentConfigLoader().load(configPath);
                daemon = new AgentDaemon(config, System.out, System.err);
            } catch (ConfigException | IllegalStateException e) {
                System.err.println("Error: " + e.getMessage());
                return 1;
            }
            return daemon.run();
        }
    }
}

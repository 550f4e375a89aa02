package io.sessioncast.cli;

import io.sessioncast.config.CredentialStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionCastCommandTest {
    private final ByteArrayOutputStream captured = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private Path credentials;

    @BeforeEach
    void redirectOutput() throws Exception {
        credentials = Files.createTempDirectory("sessioncast-cli-test-").resolve("cli-config.json");
        originalOut = System.out;
        System.setOut(new PrintStream(captured, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreOutput() {
        System.setOut(originalOut);
    }

    @Test
    void loginShouldStoreKeyAndUrl() {
        int code = run("login", "sk-live-0123456789", "--url", "http://localhost:9000");

        assertEquals(0, code);
        CredentialStore store = new CredentialStore(credentials);
        assertEquals(Optional.of("sk-live-0123456789"), store.apiKey());
        assertEquals("http://localhost:9000", store.apiUrl());
        assertTrue(output().contains("Logged in successfully! (sk-liv...6789)"));
    }

    @Test
    void loginShouldRejectMalformedKey() {
        int code = run("login", "not-a-key");

        assertEquals(1, code);
        assertTrue(output().contains("Invalid API key format"));
        assertTrue(new CredentialStore(credentials).apiKey().isEmpty());
    }

    @Test
    void statusAndLogoutShouldReflectStoredKey() {
        run("login", "sk-live-0123456789");
        run("status");
        assertTrue(output().contains("Logged in (sk-liv...6789)"));
        assertTrue(output().contains("API URL: https://api.sessioncast.io"));

        assertEquals(0, run("logout"));
        assertTrue(output().contains("Logged out successfully!"));
        assertTrue(new CredentialStore(credentials).apiKey().isEmpty());

        assertEquals(0, run("logout"));
        assertTrue(output().endsWith("Not logged in." + System.lineSeparator()));
    }

    @Test
    void remoteCommandsShouldRequireLogin() {
        assertEquals(1, run("agents"));
        assertEquals(1, run("ls"));
        assertEquals(1, run("send", "laptop:dev", "ls"));
        assertTrue(output().contains("Not logged in. Run: sessioncast login <api-key>"));
    }

    @Test
    void sendShouldRejectBadTargetBeforeCallingApi() {
        run("login", "sk-live-0123456789", "--url", "http://127.0.0.1:9");

        assertEquals(1, run("sendkeys", "laptop", "ls", "--no-enter"));
        assertTrue(output().contains("Invalid target format."));
        assertTrue(output().contains("Expected: <agent>:<session> or <agent>:<session>:<window>"));
    }

    @Test
    void noSubcommandShouldPrintBanner() {
        assertEquals(0, run());
        assertTrue(output().contains("SessionCast CLI"));
    }

    private int run(String... args) {
        List<String> all = new ArrayList<>();
        all.add("--credentials");
        all.add(credentials.toString());
        all.addAll(List.of(args));
        return new CommandLine(new SessionCastCommand()).execute(all.toArray(new String[0]));
    }

    private String output() {
        return captured.toString(StandardCharsets.UTF_8);
    }
}

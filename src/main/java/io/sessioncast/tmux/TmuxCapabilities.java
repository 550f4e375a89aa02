package io.sessioncast.tmux;

import java.util.Locale;

public final class TmuxCapabilities {
    private TmuxCapabilities() {
    }

    public static boolean isWindows() {
        return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows");
    }

    public static String platformName() {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        if (os.startsWith("windows")) {
            return "Windows";
        }
        if (os.contains("mac")) {
            return "macOS";
        }
        return "Linux/Unix";
    }

    /**
     * Built once at startup and passed to every component that needs tmux.
     *
     * @throws IllegalStateException on Windows when no itmux bundle can be found
     */
    public static TmuxCapability forCurrentPlatform() {
        if (!isWindows()) {
            return new UnixTmuxExecutor();
        }
        return WindowsTmuxExecutor.findItmuxPath(System.getenv())
                .<TmuxCapability>map(WindowsTmuxExecutor::new)
                .orElseThrow(() -> new IllegalStateException(
                        "itmux not found. Please install itmux from https://github.com/itefixnet/itmux\n"
                                + "Set ITMUX_HOME environment variable or place itmux in a standard location."));
    }
}

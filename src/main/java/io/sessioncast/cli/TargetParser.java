package io.sessioncast.cli;

final class TargetParser {
    private TargetParser() {
    }

    record Target(String agentName, String sessionTarget) {
    }

    /**
     * Splits {@code agent:session} or {@code agent:session:window}; everything after the first
     * colon is the tmux target.
     *
     * @throws IllegalArgumentException when the agent or session part is missing
     */
    static Target parse(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Invalid target format.");
        }
        int colon = raw.indexOf(':');
        if (colon < 0) {
            throw new IllegalArgumentException("Invalid target format.");
        }
        String agent = raw.substring(0, colon).trim();
        String session = raw.substring(colon + 1).trim();
        if (agent.isEmpty() || session.isEmpty()) {
            throw new IllegalArgumentException("Invalid target format.");
        }
        return new Target(agent, session);
    }
}

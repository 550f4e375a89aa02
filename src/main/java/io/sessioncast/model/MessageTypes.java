package io.sessioncast.model;

/**
 * Known values of {@link RelayMessage#type()}. The set is open: unknown types are passed through.
 */
public final class MessageTypes {
    public static final String REGISTER = "register";
    public static final String KEYS = "keys";
    public static final String RESIZE = "resize";
    public static final String CREATE_SESSION = "createSession";
    public static final String KILL_SESSION = "killSession";
    public static final String SCREEN = "screen";
    public static final String SCREEN_GZ = "screenGz";
    public static final String ERROR = "error";

    public static final String EXEC = "exec";
    public static final String LLM_CHAT = "llm_chat";
    public static final String SEND_KEYS = "send_keys";
    public static final String LIST_SESSIONS = "list_sessions";
    public static final String API_RESPONSE = "api_response";

    public static final String ROLE_HOST = "host";

    public static final String ERROR_LIMIT_EXCEEDED = "LIMIT_EXCEEDED";

    private MessageTypes() {
    }
}

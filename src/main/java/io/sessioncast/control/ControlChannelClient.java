package io.sessioncast.control;

import io.sessioncast.config.AgentConfig;
import io.sessioncast.exec.CommandExecutionService;
import io.sessioncast.exec.ExecResult;
import io.sessioncast.llm.LlmService;
import io.sessioncast.model.MessageTypes;
import io.sessioncast.model.RelayMessage;
import io.sessioncast.relay.ReconnectingLink;
import io.sessioncast.relay.RelayTransport;
import io.sessioncast.security.SensitiveDataMasker;
import io.sessioncast.tmux.TmuxCapability;
import io.sessioncast.tmux.TmuxKeys;
import io.sessioncast.util.EventLoop;
import io.sessioncast.util.Jsons;
import io.sessioncast.util.TimerHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Request/response channel for remote API calls, independent of any tmux session.
 *
 * <p>Requests are correlated by {@code meta.requestId}; a request without one gets no reply.
 * Handlers run on the worker executor and the reply is posted back to the event loop, so a slow
 * command or model call never delays screen capture.
 */
public final class ControlChannelClient extends ReconnectingLink {
    private static final Logger LOGGER = LoggerFactory.getLogger(ControlChannelClient.class);
    static final int START_JITTER_MS = 2_000;
    static final String SESSION_PREFIX = "api-";

    private final AgentConfig config;
    private final TmuxCapability tmux;
    private final CommandExecutionService commands;
    private final LlmService llm;
    private final Executor workers;

    private TimerHandle startTimer = TimerHandle.NONE;
    private boolean started;

    public ControlChannelClient(
            AgentConfig config,
            RelayTransport transport,
            EventLoop loop,
            Random random,
            TmuxCapability tmux,
            CommandExecutionService commands,
            LlmService llm,
            Executor workers
    ) {
        super(config.relayUri(), transport, loop, random, "[API]");
        this.config = config;
        this.tmux = tmux;
        this.commands = commands;
        this.llm = llm;
        this.workers = workers;
    }

    public String sessionId() {
        return SESSION_PREFIX + config.control().agentId();
    }

    /**
     * Connects after a random delay of up to two seconds. No-op unless the {@code api} section is
     * enabled with an agent id.
     */
    public void start() {
        if (!config.control().active()) {
            LOGGER.info("[API] API client disabled or no agentId configured");
            return;
        }
        if (started || isDestroyed()) {
            return;
        }
        started = true;
        int jitter = random().nextInt(START_JITTER_MS);
        LOGGER.info("[API] Starting in {}ms", jitter);
        startTimer = loop().schedule(this::connect, jitter);
    }

    public void stop() {
        LOGGER.info("[API] Stopping");
        startTimer.cancel();
        startTimer = TimerHandle.NONE;
        destroy();
    }

    @Override
    protected RelayMessage registrationMessage() {
        Map<String, String> meta = new LinkedHashMap<>();
        meta.put("machineId", config.machineId());
        meta.put("agentId", config.control().agentId());
        if (config.authToken() != null) {
            meta.put("token", config.authToken());
        }
        return new RelayMessage(MessageTypes.REGISTER, MessageTypes.ROLE_HOST, sessionId(), null, meta);
    }

    @Override
    protected void onConnected() {
        LOGGER.info("[API] Connected to relay, registered as API agent: {}", config.control().agentId());
    }

    @Override
    protected void onDisconnected(int code, String reason) {
        LOGGER.info("[API] Disconnected: code={}, reason={}", code, reason);
    }

    @Override
    protected void handleMessage(RelayMessage message) {
        String requestId = message.metaValue("requestId");
        switch (message.type()) {
            case MessageTypes.EXEC -> {
                if (requestId != null) {
                    handleExec(requestId, message.metaValue("payload"));
                }
            }
            case MessageTypes.LLM_CHAT -> {
                if (requestId != null) {
                    handleLlmChat(requestId, message.metaValue("payload"));
                }
            }
            case MessageTypes.SEND_KEYS -> {
                if (requestId != null) {
                    handleSendKeys(requestId, message.metaValue("payload"));
                }
            }
            case MessageTypes.LIST_SESSIONS -> {
                if (requestId != null) {
                    handleListSessions(requestId);
                }
            }
            default -> LOGGER.debug("[API] Ignoring message type {}", message.type());
        }
    }

    private void handleExec(String requestId, String rawPayload) {
        LOGGER.info("[API] exec: {}", SensitiveDataMasker.forLog(rawPayload));
        Function<String, Object> onError = error -> ExecResult.failure("Error: " + error, 0L);
        ExecRequest request;
        try {
            request = Jsons.mapper().treeToValue(Jsons.readObjectOrEmpty(rawPayload), ExecRequest.class);
        } catch (Exception e) {
            reply(requestId, onError.apply(e.getMessage()));
            return;
        }
        offload(requestId, () -> commands.execute(request.command(), request.cwd(), request.timeout(), request.sessionId()), onError);
    }

    private void handleLlmChat(String requestId, String rawPayload) {
        Function<String, Object> onError = ControlResponses::chatFailure;
        LlmChatRequest request;
        try {
            request = Jsons.mapper().treeToValue(Jsons.readObjectOrEmpty(rawPayload), LlmChatRequest.class);
        } catch (Exception e) {
            reply(requestId, onError.apply(e.getMessage()));
            return;
        }
        LOGGER.info("[API] llm_chat: model={}, messages={}", request.model(), request.messages().size());
        offload(requestId,
                () -> llm.chat(request.model(), request.messages(), request.temperature(), request.maxTokens(), request.stream()),
                onError);
    }

    private void handleSendKeys(String requestId, String rawPayload) {
        Function<String, Object> onError = ControlResponses.SendKeysResponse::fail;
        SendKeysRequest request;
        try {
            request = Jsons.mapper().treeToValue(Jsons.readObjectOrEmpty(rawPayload), SendKeysRequest.class);
        } catch (Exception e) {
            reply(requestId, onError.apply(e.getMessage()));
            return;
        }
        if (!request.complete()) {
            reply(requestId, ControlResponses.SendKeysResponse.fail("target and keys are required"));
            return;
        }
        LOGGER.info("[API] send_keys: target={}, enter={}", request.target(), request.pressEnter());
        offload(requestId, () -> ControlResponses.SendKeysResponse.ok(
                TmuxKeys.deliver(tmux, request.target(), request.keys(), request.pressEnter()),
                request.target()
        ), onError);
    }

    private void handleListSessions(String requestId) {
        LOGGER.info("[API] list_sessions");
        offload(requestId, () -> ControlResponses.SessionListResponse.ok(tmux.listSessionDetails()),
                ControlResponses.SessionListResponse::fail);
    }

    private void offload(String requestId, Supplier<Object> work, Function<String, Object> onError) {
        try {
            workers.execute(() -> {
                Object response;
                try {
                    response = work.get();
                } catch (RuntimeException e) {
                    LOGGER.warn("[API] Request {} failed: {}", requestId, e.toString());
                    response = onError.apply(e.getMessage());
                }
                Object body = response;
                loop().execute(() -> reply(requestId, body));
            });
        } catch (RejectedExecutionException e) {
            LOGGER.warn("[API] Worker pool rejected request {}", requestId);
            reply(requestId, onError.apply("agent is shutting down"));
        }
    }

    private void reply(String requestId, Object body) {
        Map<String, String> meta = new LinkedHashMap<>();
        meta.put("requestId", requestId);
        meta.put("payload", Jsons.toJson(body));
        if (!send(new RelayMessage(MessageTypes.API_RESPONSE, null, null, null, meta))) {
            LOGGER.warn("[API] Response for {} dropped: not connected", requestId);
        }
    }
}

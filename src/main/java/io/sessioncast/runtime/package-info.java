/**
 * Agent runtime package.
 *
 * <p>{@link io.sessioncast.runtime.SessionOrchestrator} keeps one
 * {@link io.sessioncast.runtime.SessionHandler} per live tmux session and owns
 * shutdown. {@link io.sessioncast.runtime.AgentDaemon} wires the event loop,
 * transport, tmux capability and control channel together for the CLI.
 */
package io.sessioncast.runtime;

/**
 * SessionCast agent source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.sessioncast.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.sessioncast.cli.SessionCastCommand} maps commands to the REST client and the daemon.</li>
 *   <li>{@code io.sessioncast.runtime.SessionOrchestrator} tracks tmux sessions and owns shutdown.</li>
 *   <li>{@code io.sessioncast.relay.ReconnectingLink} is the relay socket with reconnect and circuit breaker.</li>
 * </ul>
 */
package io.sessioncast;

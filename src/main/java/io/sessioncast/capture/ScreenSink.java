package io.sessioncast.capture;

import io.sessioncast.model.RelayMessage;

public interface ScreenSink {
    boolean isConnected();

    boolean send(RelayMessage message);
}

package io.sessioncast.relay;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.sessioncast.model.RelayMessage;
import io.sessioncast.util.Jsons;

public final class RelayCodec {
    private RelayCodec() {
    }

    public static String encode(RelayMessage message) {
        return Jsons.toJson(message);
    }

    public static RelayMessage decode(String frame) throws RelayProtocolException {
        if (frame == null || frame.isBlank()) {
            throw new RelayProtocolException("empty frame");
        }
        try {
            RelayMessage message = Jsons.mapper().readValue(frame, RelayMessage.class);
            if (message == null || message.type() == null) {
                throw new RelayProtocolException("frame has no type");
            }
            return message;
        } catch (JsonProcessingException e) {
            throw new RelayProtocolException("malformed frame: " + e.getOriginalMessage(), e);
        }
    }
}

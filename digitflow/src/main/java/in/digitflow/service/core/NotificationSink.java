package in.digitflow.service.core;

import in.digitflow.domain.common.EngineEvent;

/**
 * Destination for engine events (push service, chat bot, log). Fire-and-forget:
 * implementations must not block the caller for long and may drop events.
 */
public interface NotificationSink {
    void publish(EngineEvent event);
}

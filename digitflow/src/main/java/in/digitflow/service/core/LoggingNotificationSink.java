package in.digitflow.service.core;

import in.digitflow.domain.common.EngineEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes events to the "digitflow.events" logger, one line per event.
 */
public final class LoggingNotificationSink implements NotificationSink {
    private static final Logger log = LoggerFactory.getLogger("digitflow.events");

    @Override
    public void publish(EngineEvent event) {
        log.info("{} session={} user={} {}", event.type(), event.sessionId(), event.userId(), event.payload());
    }
}

package in.digitflow.service.execution;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-blocking locks keyed {@code session:market:digit:side}.
 * A second execution of a candidate that is still being executed is refused, not queued.
 */
final class SignalLocks {

    private final Set<String> held = ConcurrentHashMap.newKeySet();

    boolean tryLock(String key) {
        return held.add(key);
    }

    void unlock(String key) {
        held.remove(key);
    }

    boolean isLocked(String key) {
        return held.contains(key);
    }

    int size() {
        return held.size();
    }
}

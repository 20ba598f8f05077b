package in.digitflow.domain.data;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Bounded ring buffer of the most recent ticks for one market.
 * Thread-safe: written by the stream's read loop, read by the scheduler.
 */
public final class TickWindow {

    public static final int DEFAULT_CAPACITY = 100;

    private final String market;
    private final Tick[] buffer;
    private int head = 0;   // next write position
    private int count = 0;

    public TickWindow(String market) {
        this(market, DEFAULT_CAPACITY);
    }

    public TickWindow(String market, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.market = market;
        this.buffer = new Tick[capacity];
    }

    public synchronized void add(Tick tick) {
        buffer[head] = tick;
        head = (head + 1) % buffer.length;
        if (count < buffer.length) {
            count++;
        }
    }

    public synchronized int size() {
        return count;
    }

    public synchronized void clear() {
        head = 0;
        count = 0;
        Arrays.fill(buffer, null);
    }

    public synchronized TickHistory snapshot() {
        List<Tick> ticks = new ArrayList<>(count);
        List<Integer> digits = new ArrayList<>(count);
        int start = (head - count + buffer.length) % buffer.length;
        for (int i = 0; i < count; i++) {
            Tick t = buffer[(start + i) % buffer.length];
            ticks.add(t);
            digits.add(t.digit());
        }
        return new TickHistory(market, ticks, digits);
    }

    public String market() {
        return market;
    }

    public int capacity() {
        return buffer.length;
    }
}

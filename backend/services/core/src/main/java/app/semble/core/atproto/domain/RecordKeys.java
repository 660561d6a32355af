package app.semble.core.atproto.domain;

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Timestamp identifiers (TIDs) used as record keys: 64 bits of microsecond time and a
 * clock id, written in sortable base32.
 */
public final class RecordKeys {

    private static final char[] ALPHABET = "234567abcdefghijklmnopqrstuvwxyz".toCharArray();
    private static final long CLOCK_ID = ThreadLocalRandom.current().nextLong(1024);
    private static final AtomicLong LAST = new AtomicLong();

    private RecordKeys() {
    }

    public static String next() {
        long micros = System.currentTimeMillis() * 1000;
        long timestamp = LAST.updateAndGet(previous -> Math.max(previous + 1, micros));
        long tid = (timestamp << 10 | CLOCK_ID) & Long.MAX_VALUE;
        char[] out = new char[13];
        for (int i = 12; i >= 0; i--) {
            out[i] = ALPHABET[(int) (tid & 31)];
            tid >>>= 5;
        }
        return new String(out);
    }
}

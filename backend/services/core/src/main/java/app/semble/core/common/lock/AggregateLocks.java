package app.semble.core.common.lock;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

@Component
public class AggregateLocks {

    private final ConcurrentMap<Object, Entry> locks = new ConcurrentHashMap<>();

    public <T> T withLock(Object aggregateId, Supplier<T> action) {
        Entry entry = locks.compute(aggregateId, (key, existing) -> {
            Entry e = existing == null ? new Entry() : existing;
            e.users++;
            return e;
        });
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            locks.computeIfPresent(aggregateId, (key, e) -> --e.users == 0 ? null : e);
        }
    }

    public void runWithLock(Object aggregateId, Runnable action) {
        withLock(aggregateId, () -> {
            action.run();
            return null;
        });
    }

    int activeLocks() {
        return locks.size();
    }

    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock();
        // guarded by the map's per-key compute
        private int users;
    }
}

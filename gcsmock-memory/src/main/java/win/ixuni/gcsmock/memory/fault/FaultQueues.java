package win.ixuni.gcsmock.memory.fault;

import win.ixuni.gcsmock.core.api.MockableMethod;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-method FIFO queues of errors waiting to be returned by the next calls
 * <p>
 * 每个文件实例持有一份，互不影响。
 */
public class FaultQueues {

    private final Map<MockableMethod, Deque<Throwable>> queues = new EnumMap<>(MockableMethod.class);

    public FaultQueues() {
        for (MockableMethod method : MockableMethod.values()) {
            queues.put(method, new ArrayDeque<>());
        }
    }

    /**
     * Queue an error for the next unserved call of the method
     */
    public synchronized void enqueue(MockableMethod method, Throwable error) {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(error, "error");
        queues.get(method).addLast(error);
    }

    /**
     * Take the next queued error
     *
     * @return the error, or {@code null} if none is queued
     */
    public synchronized Throwable poll(MockableMethod method) {
        return queues.get(method).pollFirst();
    }

    public synchronized void reset(MockableMethod method) {
        queues.get(method).clear();
    }

    public synchronized void reset() {
        queues.values().forEach(Deque::clear);
    }

    public synchronized int size(MockableMethod method) {
        return queues.get(method).size();
    }
}

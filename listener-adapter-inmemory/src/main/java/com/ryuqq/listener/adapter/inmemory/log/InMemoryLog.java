package com.ryuqq.listener.adapter.inmemory.log;

import com.ryuqq.listener.core.model.Message;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory partitioned append-only log shared by in-memory clients.
 *
 * <p>Simulates the broker side of a log system: topics split into partitions,
 * each partition an ordered list of messages addressed by offset, and committed
 * offsets tracked per consumer group.</p>
 *
 * <p><strong>Architecture:</strong></p>
 * <ul>
 *   <li><strong>Partitions:</strong> HashMap&lt;PartitionKey, List&lt;Message&gt;&gt; - offset equals list index</li>
 *   <li><strong>Committed Offsets:</strong> HashMap&lt;CommitKey, Long&gt; - next offset to read per group</li>
 *   <li><strong>Append Signal:</strong> Condition - wakes idle consumers in follow mode</li>
 * </ul>
 *
 * <p>All access is guarded by a single {@link ReentrantLock}.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryLog log = new InMemoryLog();
 * log.append("orders", 0, "order-1", "{\"id\":1}");
 * log.append("orders", 1, "order-2", "{\"id\":2}");
 *
 * LogClientFactory factory = new InMemoryLogClientFactory(log);
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryLog {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition appended = lock.newCondition();

    /**
     * Messages per topic partition. The offset of a message is its list index.
     */
    private final Map<PartitionKey, List<Message>> partitions = new HashMap<>();

    /**
     * Next offset to deliver per (group, topic, partition). Missing entries start at 0.
     */
    private final Map<CommitKey, Long> committed = new HashMap<>();

    /**
     * Appends a message to a topic partition.
     *
     * @param topic the topic name
     * @param partition the partition number (non-negative)
     * @param key the message key (nullable)
     * @param value the message payload
     * @return the offset assigned to the message
     * @throws IllegalArgumentException if topic is blank or partition is negative
     */
    public long append(String topic, int partition, String key, String value) {
        validateTopic(topic);
        if (partition < 0) {
            throw new IllegalArgumentException("partition must be non-negative (current: " + partition + ")");
        }

        lock.lock();
        try {
            List<Message> messages = partitions.computeIfAbsent(new PartitionKey(topic, partition), k -> new ArrayList<>());
            long offset = messages.size();
            messages.add(Message.of(key, value, offset, partition));
            appended.signalAll();
            return offset;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the partitions of a topic in ascending order.
     *
     * @param topic the topic name
     * @return partition numbers that hold at least one message
     */
    public List<Integer> partitions(String topic) {
        lock.lock();
        try {
            TreeSet<Integer> result = new TreeSet<>();
            for (PartitionKey key : partitions.keySet()) {
                if (key.topic().equals(topic)) {
                    result.add(key.partition());
                }
            }
            return new ArrayList<>(result);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Reads up to {@code maxMessages} messages starting at {@code fromOffset}.
     *
     * @param topic the topic name
     * @param partition the partition number
     * @param fromOffset the first offset to read
     * @param maxMessages maximum number of messages to return
     * @return a snapshot of the requested messages in offset order (empty if none)
     */
    public List<Message> read(String topic, int partition, long fromOffset, int maxMessages) {
        lock.lock();
        try {
            List<Message> messages = partitions.get(new PartitionKey(topic, partition));
            if (messages == null || fromOffset >= messages.size()) {
                return List.of();
            }
            int from = (int) fromOffset;
            int to = (int) Math.min(messages.size(), fromOffset + maxMessages);
            return List.copyOf(messages.subList(from, to));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the offset the next appended message of the partition will receive.
     *
     * @param topic the topic name
     * @param partition the partition number
     * @return the end offset (high-water mark)
     */
    public long endOffset(String topic, int partition) {
        lock.lock();
        try {
            List<Message> messages = partitions.get(new PartitionKey(topic, partition));
            return messages == null ? 0 : messages.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the next offset to deliver to a consumer group.
     *
     * @param groupId the consumer group
     * @param topic the topic name
     * @param partition the partition number
     * @return the committed offset (0 when the group never committed)
     */
    public long committed(String groupId, String topic, int partition) {
        lock.lock();
        try {
            return committed.getOrDefault(new CommitKey(groupId, topic, partition), 0L);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Commits the next offset to deliver to a consumer group.
     *
     * <p>Commits never move backwards.</p>
     *
     * @param groupId the consumer group
     * @param topic the topic name
     * @param partition the partition number
     * @param nextOffset the offset following the last processed message
     */
    public void commit(String groupId, String topic, int partition, long nextOffset) {
        lock.lock();
        try {
            committed.merge(new CommitKey(groupId, topic, partition), nextOffset, Math::max);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits until a message is appended or the timeout elapses.
     *
     * @param timeout maximum time to wait
     * @param unit time unit of the timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public void awaitAppend(long timeout, TimeUnit unit) throws InterruptedException {
        lock.lock();
        try {
            appended.await(timeout, unit);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wakes every consumer blocked in {@link #awaitAppend(long, TimeUnit)}.
     */
    public void wakeUp() {
        lock.lock();
        try {
            appended.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes all messages and committed offsets.
     */
    public void clear() {
        lock.lock();
        try {
            partitions.clear();
            committed.clear();
        } finally {
            lock.unlock();
        }
    }

    private static void validateTopic(String topic) {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic cannot be null or blank");
        }
    }

    private record PartitionKey(String topic, int partition) {
    }

    private record CommitKey(String groupId, String topic, int partition) {
    }
}

package com.ryuqq.gateway.core.spi;

import com.ryuqq.gateway.core.message.Message;

import java.util.Optional;

/**
 * Message Queue SPI feeding the worker pool.
 *
 * <p>This interface provides the producer/consumer hand-off used by the
 * MessageHandler worker pool and by any application code that submits work.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Accepting messages from producers (never blocking the producer)</li>
 *   <li>Handing each message to exactly one consumer, in FIFO order</li>
 *   <li>Blocking consumers until work arrives or the queue is stopped</li>
 *   <li>Drain-on-stop: after {@link #stop()} no new message is accepted,
 *       but already queued messages remain retrievable</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: All methods must be safely callable from multiple threads</li>
 *   <li>Idempotent: stop() may be called any number of times</li>
 *   <li>At-most-once: a dequeued message is never handed out again</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * queue.enqueue(message);
 *
 * // consumer thread
 * Optional&lt;Message&gt; next = queue.dequeue();   // blocks
 * next.ifPresent(Message::process);
 *
 * // shutdown
 * queue.stop();   // wakes every blocked consumer
 * </pre>
 *
 * @author Gateway Team
 * @since 1.0.0
 */
public interface MessageQueue {

    /**
     * Appends a message to the tail of the queue.
     *
     * <p>A {@code null} message, or any message offered after {@link #stop()},
     * is silently dropped. Wakes exactly one blocked consumer.</p>
     *
     * @param message the message to enqueue
     */
    void enqueue(Message message);

    /**
     * Removes the head message, blocking until one is available or the queue is stopped.
     *
     * <p>Returns a message even after {@link #stop()} as long as one is queued.
     * Returns empty only when the queue is stopped and empty, or when the
     * waiting thread is interrupted (the interrupt flag is restored).</p>
     *
     * @return the head message, or empty if stopped and drained
     */
    Optional<Message> dequeue();

    /**
     * Removes the head message without blocking.
     *
     * <p>Behaves the same whether the queue is stopped or not.</p>
     *
     * @return the head message, or empty if the queue is empty
     */
    Optional<Message> tryDequeue();

    /**
     * Returns the number of queued messages.
     *
     * @return snapshot of the queue size
     */
    int size();

    /**
     * Returns whether the queue holds no message.
     *
     * @return true if empty
     */
    boolean isEmpty();

    /**
     * Stops accepting new messages and wakes every blocked consumer.
     */
    void stop();

    /**
     * Returns whether {@link #stop()} has been called.
     *
     * @return true if stopped
     */
    boolean isStopped();

    /**
     * Discards every queued message without processing it.
     */
    void clear();
}

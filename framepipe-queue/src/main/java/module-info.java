/**
 * FramePipe Queue Module
 *
 * Drop-oldest bounded queues connecting the producer to the workers.
 *
 * Implementations:
 * - BoundedDropQueue: array deque behind one lock and condition, exact snapshots
 * - LockFreeDropQueue: JCTools MPMC ring buffer, lock only for parked consumers
 *
 * @since 0.1.0
 */
module com.framepipe.queue {
    requires transitive com.framepipe.core;
    requires org.jctools.core;
    requires org.slf4j;

    exports com.framepipe.queue;
    exports com.framepipe.queue.config;
}

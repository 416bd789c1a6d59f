package clipqueue.coordinator.util;

/** Handle returned by subscribe; closing it detaches the listener. */
@FunctionalInterface
public interface Subscription extends AutoCloseable {
    @Override
    void close();
}

package io.pgcom.listen;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Callbacks invoked by {@link Listener#poll}.
 *
 * <p>Only {@code onNotify} is required. When omitted, {@code onTimeout} and {@code onClose} do
 * nothing and {@code onError} logs the failure.
 *
 * <pre>{@code
 * ListenerCallbacks callbacks = ListenerCallbacks.builder()
 *     .onNotify(payload -> handle(payload))
 *     .onError(e -> alert(e))
 *     .build();
 * }</pre>
 */
public final class ListenerCallbacks {
    private static final Logger logger = Logger.getLogger(ListenerCallbacks.class.getName());

    private final Consumer<String> onNotify;
    private final Runnable onTimeout;
    private final Runnable onClose;
    private final Consumer<Exception> onError;

    private ListenerCallbacks(Builder builder) {
        this.onNotify = Objects.requireNonNull(builder.onNotify, "onNotify");
        this.onTimeout = builder.onTimeout != null ? builder.onTimeout : () -> { };
        this.onClose = builder.onClose != null ? builder.onClose : () -> { };
        this.onError = builder.onError != null ? builder.onError
                : e -> logger.log(Level.SEVERE, "Listener stopped on error", e);
    }

    public static Builder builder() {
        return new Builder();
    }

    void notify(String payload) {
        onNotify.accept(payload);
    }

    void timeout() {
        onTimeout.run();
    }

    void close() {
        onClose.run();
    }

    void error(Exception e) {
        onError.accept(e);
    }

    public static final class Builder {
        private Consumer<String> onNotify;
        private Runnable onTimeout;
        private Runnable onClose;
        private Consumer<Exception> onError;

        private Builder() {
        }

        /** Receives each notification payload. <b>Required.</b> */
        public Builder onNotify(Consumer<String> onNotify) {
            this.onNotify = onNotify;
            return this;
        }

        /** Runs when a wait expires without notifications. */
        public Builder onTimeout(Runnable onTimeout) {
            this.onTimeout = onTimeout;
            return this;
        }

        /** Runs once after a graceful stop. */
        public Builder onClose(Runnable onClose) {
            this.onClose = onClose;
            return this;
        }

        /** Receives the failure that ended the loop. */
        public Builder onError(Consumer<Exception> onError) {
            this.onError = onError;
            return this;
        }

        public ListenerCallbacks build() {
            return new ListenerCallbacks(this);
        }
    }
}

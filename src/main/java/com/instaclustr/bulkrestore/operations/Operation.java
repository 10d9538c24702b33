package com.instaclustr.bulkrestore.operations;

import java.io.Closeable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.lang.String.format;

/**
 * Unit of work submitted to {@link OperationsService}. One operation is created per request, it runs once
 * and records its own state, progress and errors so a caller can inspect the result after it reached
 * a terminal state.
 *
 * @param <RequestT> request this operation executes
 */
@SuppressWarnings("WeakerAccess")
public abstract class Operation<RequestT extends OperationRequest> implements Runnable, Closeable {

    private static final Logger logger = LoggerFactory.getLogger(Operation.class);

    @JsonIgnore
    private final AtomicBoolean shouldCancel = new AtomicBoolean(false);

    @JsonProperty
    public String type;

    public static class Error {

        public String source;
        public String message;

        @JsonIgnore
        public Throwable throwable;

        public Error() {

        }

        public Error(final Throwable throwable, final String message, final String source) {
            this.throwable = throwable;

            if (this.throwable != null && this.throwable.getCause() != null && this.throwable.getCause().getMessage() != null) {
                this.message = this.throwable.getCause().getMessage();
            } else {
                this.message = message;
            }

            this.source = source;
        }

        public static Error from(final String source, final Throwable t) {
            return new Error(t, t.getMessage(), source);
        }

        public static Error from(final String source, final String message) {
            return new Error(null, message, source);
        }

        public String getSource() {
            return source;
        }

        public String getMessage() {
            return message;
        }

        public Throwable getThrowable() {
            return throwable;
        }

        public void report() {
            if (throwable != null) {
                logger.error("Error in {}: {}", source, message, throwable);
            } else {
                logger.info(toString());
            }
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this)
                .add("source", source)
                .add("message", message)
                .add("throwable", throwable)
                .toString();
        }

        @Override
        public boolean equals(final Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            final Error error = (Error) o;
            return Objects.equals(source, error.source) &&
                Objects.equals(message, error.message) &&
                Objects.equals(throwable, error.throwable);
        }

        @Override
        public int hashCode() {
            return Objects.hash(source, message, throwable);
        }
    }

    public enum State {
        PENDING, RUNNING, COMPLETED, CANCELLED, FAILED;

        public static final Set<State> TERMINAL_STATES = EnumSet.of(COMPLETED, FAILED, CANCELLED);

        public boolean isTerminalState() {
            return TERMINAL_STATES.contains(this);
        }
    }

    public UUID id = UUID.randomUUID();
    public Instant creationTime = Instant.now();

    @JsonProperty
    public RequestT request;

    public volatile State state = State.PENDING;
    public List<Error> errors = new ArrayList<>();
    public float progress = 0;
    public Instant startTime, completionTime;

    public Operation(final RequestT request) {
        this.request = request;
    }

    @JsonIgnore
    public boolean hasErrors() {
        return this.errors != null && !this.errors.isEmpty();
    }

    @JsonIgnore
    public void addError(final Error error) {
        if (this.errors != null && error != null) {
            this.errors.add(error);
        }
    }

    @Override
    public final void run() {
        state = State.RUNNING;
        startTime = Instant.now();

        try {
            run0();
        } catch (final Throwable t) {
            if (shouldCancel.get()) {
                logger.warn("Operation {} was cancelled.", id);
            } else {
                logger.error(format("Operation %s of type %s has failed.", id, type), t);
            }

            addError(Error.from(type, t));
        } finally {
            progress = 1;
            completionTime = Instant.now();
        }

        if (hasErrors()) {
            logger.error("Reporting errors for operation {}", id);
            for (final Error error : errors) {
                error.report();
            }
            state = shouldCancel.get() ? State.CANCELLED : State.FAILED;
        } else {
            state = shouldCancel.get() ? State.CANCELLED : State.COMPLETED;
        }
    }

    protected abstract void run0() throws Exception;

    @Override
    public void close() {
        shouldCancel.set(true);
    }

    public AtomicBoolean getShouldCancel() {
        return shouldCancel;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("id", id)
            .add("type", type)
            .add("creationTime", creationTime)
            .add("request", request)
            .add("state", state)
            .add("progress", progress)
            .add("startTime", startTime)
            .add("completionTime", completionTime)
            .add("errors", errors)
            .add("shouldCancel", shouldCancel.get())
            .toString();
    }
}

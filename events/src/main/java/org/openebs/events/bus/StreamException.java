package org.openebs.events.bus;

/**
 * The stream could not be looked up or created within the retry limit.
 */
public class StreamException extends MessageBusException {

    private final String stream;

    public StreamException(String stream, Throwable cause) {
        super("Error while getting/creating stream '" + stream + "': " + describe(cause), cause);
        this.stream = stream;
    }

    public String getStream() {
        return stream;
    }

    static String describe(Throwable cause) {
        if (cause == null) return "unknown error";
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}

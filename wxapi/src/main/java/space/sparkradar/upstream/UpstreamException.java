package space.sparkradar.upstream;

/**
 * An upstream call that did not produce a usable JSON document.
 */
public class UpstreamException extends RuntimeException {
    private final String upstream;
    private final Integer status;
    private final boolean notJson;

    public UpstreamException(String upstream, Integer status, boolean notJson, String message, Throwable cause) {
        super(message, cause);
        this.upstream = upstream;
        this.status = status;
        this.notJson = notJson;
    }

    public String upstream() {
        return upstream;
    }

    /** HTTP status, or null when no response arrived. */
    public Integer status() {
        return status;
    }

    /**
     * True when the upstream answered 2xx but the body was not JSON. NWS does
     * this for points outside its coverage.
     */
    public boolean isNotJson() {
        return notJson;
    }
}

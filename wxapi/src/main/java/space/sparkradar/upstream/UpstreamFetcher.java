package space.sparkradar.upstream;

import com.fasterxml.jackson.databind.JsonNode;

import java.net.URI;

/**
 * Fetches one JSON document from a named upstream.
 */
@FunctionalInterface
public interface UpstreamFetcher {

    /**
     * @param upstream name used for metrics and error messages ("OWM", "NWS", ...)
     * @throws UpstreamException when no JSON document could be obtained
     */
    JsonNode fetch(String upstream, URI uri);
}

package space.sparkradar.spc;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * An active SPC mesoscale discussion whose area contains the query point.
 * {@code geometry} is passed through from the feed unchanged.
 */
public record MesoscaleDiscussion(
        @JsonProperty("geometry") JsonNode geometry,
        @JsonProperty("number") Integer number,
        @JsonProperty("issued") String issued,
        @JsonProperty("expires") String expires,
        @JsonProperty("url") String url,
        @JsonProperty("title") String title) {
}

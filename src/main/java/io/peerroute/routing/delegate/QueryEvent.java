package io.peerroute.routing.delegate;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;

/**
 * One line of the delegate's ndjson event stream, e.g.
 * <pre>
 * {"Extra":"","ID":"","Responses":[{"Addrs":["/ip4/127.0.0.1/tcp/4001"],"ID":"Qm..."}],"Type":2}
 * </pre>
 * Property names are matched case-insensitively by the mapper.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class QueryEvent {

    @JsonProperty("ID")
    private String id;

    @JsonProperty("Type")
    private int type;

    @JsonProperty("Responses")
    private List<PeerInfo> responses;

    @JsonProperty("Extra")
    private String extra;

    public QueryEventType eventType() {
        return QueryEventType.fromCode(type);
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PeerInfo {
        @JsonProperty("ID")
        private String id;

        @JsonProperty("Addrs")
        private List<String> addrs;
    }
}

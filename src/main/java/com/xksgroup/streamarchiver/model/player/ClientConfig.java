package com.xksgroup.streamarchiver.model.player;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Web client settings scraped from the upstream home page ({@code ytcfg}).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClientConfig {

    @JsonProperty("DELEGATED_SESSION_ID")
    private String delegatedSessionId;

    @JsonProperty("ID_TOKEN")
    private String idToken;

    @JsonProperty("HL")
    private String hl;

    @JsonProperty("INNERTUBE_API_KEY")
    private String apiKey;

    @JsonProperty("INNERTUBE_CLIENT_NAME")
    private String clientName;

    @JsonProperty("INNERTUBE_CLIENT_VERSION")
    private String clientVersion;

    @JsonProperty("INNERTUBE_CONTEXT_CLIENT_NAME")
    private Integer contextClientName;

    @JsonProperty("INNERTUBE_CONTEXT_CLIENT_VERSION")
    private String contextClientVersion;

    @JsonProperty("SESSION_INDEX")
    private String sessionIndex;

    @JsonProperty("VISITOR_DATA")
    private String visitorData;

    public Map<String, String> toHeaders() {
        Map<String, String> headers = new LinkedHashMap<>();
        if (contextClientName != null) {
            headers.put("X-YouTube-Client-Name", String.valueOf(contextClientName));
        }
        if (clientVersion != null) {
            headers.put("X-YouTube-Client-Version", clientVersion);
        }
        if (visitorData != null && !visitorData.isEmpty()) {
            headers.put("X-Goog-Visitor-Id", visitorData);
        }
        if (sessionIndex != null && !sessionIndex.isEmpty()) {
            headers.put("X-Goog-AuthUser", sessionIndex);
        }
        if (delegatedSessionId != null && !delegatedSessionId.isEmpty()) {
            headers.put("X-Goog-PageId", delegatedSessionId);
        }
        if (idToken != null && !idToken.isEmpty()) {
            headers.put("X-Youtube-Identity-Token", idToken);
        }
        return headers;
    }

    public Map<String, Object> toPostContext() {
        Map<String, Object> context = new LinkedHashMap<>();
        if (clientName != null) {
            context.put("clientName", clientName);
        }
        if (clientVersion != null) {
            context.put("clientVersion", clientVersion);
        }
        if (visitorData != null && !visitorData.isEmpty()) {
            context.put("visitorData", visitorData);
        }
        return context;
    }
}

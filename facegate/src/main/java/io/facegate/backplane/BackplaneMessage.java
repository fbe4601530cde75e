package io.facegate.backplane;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Wire form of an envelope travelling between instances.
 *
 * @param origin instance that published it; receivers drop their own messages
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BackplaneMessage(
    String origin,
    String type,
    String timestamp,
    String messageId,
    JsonNode data,
    Target target
) {
    /**
     * Serializable description of a broadcast target.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Target(String kind, List<String> userIds, String role) {}
}

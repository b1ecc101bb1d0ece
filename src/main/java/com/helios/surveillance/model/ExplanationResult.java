package com.helios.surveillance.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Node-by-node trace of a filter tree evaluated against one killmail.
 */
public record ExplanationResult(
        @JsonProperty("profile_id") String profileId,
        @JsonProperty("matched") boolean matched,
        @JsonProperty("root") Node root
) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Node(
            @JsonProperty("description") String description,
            @JsonProperty("matched") boolean matched,
            @JsonProperty("actual_value") Object actualValue,
            @JsonProperty("children") List<Node> children
    ) {
        public Node {
            children = children == null ? null : List.copyOf(children);
        }
    }
}

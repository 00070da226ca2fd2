package com.scanhub.pairing.model.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Point-in-time view of an identity context. Holds connection ids, never the connections.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IdentitySnapshotDTO {

    private String login;

    private Long id;

    @JsonProperty("fullname")
    private String fullName;

    @JsonProperty("input_count")
    private int inputCount;

    @JsonProperty("output_count")
    private int outputCount;

    @JsonProperty("current_platform")
    private Integer currentPlatform;

    @JsonProperty("input_ids")
    @Builder.Default
    private List<String> inputIds = List.of();

    @JsonProperty("output_ids")
    @Builder.Default
    private List<String> outputIds = List.of();
}

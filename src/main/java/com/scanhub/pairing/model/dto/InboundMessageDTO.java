package com.scanhub.pairing.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.scanhub.pairing.model.enums.ConnectionRole;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Message received from a scanner or dashboard.
 *
 * Only the fields relevant to {@link #event} are set:
 * - register: token or login, role (or the older is_input flag)
 * - new_pairing: platform, optional product
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class InboundMessageDTO {

    public static final String REGISTER = "register";
    public static final String NEW_PAIRING = "new_pairing";

    @NotBlank(message = "event is required")
    private String event;

    /**
     * HS256 bearer credential. Takes precedence over {@link #login}.
     */
    private String token;

    private String login;

    private ConnectionRole role;

    /**
     * Older clients send is_input instead of role: true for scanners, false for dashboards.
     */
    @JsonProperty("is_input")
    private Boolean isInput;

    /**
     * Platform id; numeric strings are accepted.
     */
    private Integer platform;

    private Long product;

    /**
     * Role requested by a register message. Absent role and flag means NONE.
     */
    public ConnectionRole requestedRole() {
        if (role != null) {
            return role;
        }
        if (isInput != null) {
            return isInput ? ConnectionRole.WRITER : ConnectionRole.READER;
        }
        return ConnectionRole.NONE;
    }
}

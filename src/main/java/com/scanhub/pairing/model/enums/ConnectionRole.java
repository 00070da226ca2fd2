package com.scanhub.pairing.model.enums;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * Capability set of a connection.
 *
 * READER receives events (dashboard), WRITER sends pairings (scanner).
 * Codes match the wire values 0..3.
 */
public enum ConnectionRole {

    NONE(0),
    READER(1),
    WRITER(2),
    READ_WRITER(3);

    private static final int READ_FLAG = 1;
    private static final int WRITE_FLAG = 2;

    private final int code;

    ConnectionRole(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public boolean canRead() {
        return (code & READ_FLAG) != 0;
    }

    public boolean canWrite() {
        return (code & WRITE_FLAG) != 0;
    }

    public static ConnectionRole fromCode(int code) {
        for (ConnectionRole role : values()) {
            if (role.code == code) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown connection role code: " + code);
    }

    /**
     * Accepts the enum name (case-insensitive, "ReadWriter" style included) or the numeric code.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ConnectionRole fromValue(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            return fromCode(((Number) value).intValue());
        }
        String text = value.toString().trim();
        if (text.chars().allMatch(Character::isDigit) && !text.isEmpty()) {
            return fromCode(Integer.parseInt(text));
        }
        String normalized = text.replace("_", "").replace("-", "").toUpperCase(Locale.ROOT);
        for (ConnectionRole role : values()) {
            if (role.name().replace("_", "").equals(normalized)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown connection role: " + text);
    }
}

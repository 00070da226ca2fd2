package com.scanhub.pairing.model;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.scanhub.pairing.model.enums.ConnectionRole;

class ConnectionRoleTest {

    @Test
    @DisplayName("Should derive capabilities from the role bits")
    void testCapabilities() {
        assertFalse(ConnectionRole.NONE.canRead());
        assertFalse(ConnectionRole.NONE.canWrite());
        assertTrue(ConnectionRole.READER.canRead());
        assertFalse(ConnectionRole.READER.canWrite());
        assertFalse(ConnectionRole.WRITER.canRead());
        assertTrue(ConnectionRole.WRITER.canWrite());
        assertTrue(ConnectionRole.READ_WRITER.canRead());
        assertTrue(ConnectionRole.READ_WRITER.canWrite());
    }

    @Test
    @DisplayName("Should parse names in any common spelling")
    void testNames() {
        assertEquals(ConnectionRole.READ_WRITER, ConnectionRole.fromValue("ReadWriter"));
        assertEquals(ConnectionRole.READ_WRITER, ConnectionRole.fromValue("read_writer"));
        assertEquals(ConnectionRole.READER, ConnectionRole.fromValue(" reader "));
        assertEquals(ConnectionRole.WRITER, ConnectionRole.fromValue("Writer"));
    }

    @Test
    @DisplayName("Should parse wire codes")
    void testCodes() {
        assertEquals(ConnectionRole.NONE, ConnectionRole.fromValue(0));
        assertEquals(ConnectionRole.WRITER, ConnectionRole.fromValue("2"));
        assertEquals(ConnectionRole.READ_WRITER, ConnectionRole.fromCode(3));
    }

    @Test
    @DisplayName("Should reject unknown roles")
    void testUnknown() {
        assertThrows(IllegalArgumentException.class, () -> ConnectionRole.fromValue("ADMIN"));
        assertThrows(IllegalArgumentException.class, () -> ConnectionRole.fromCode(4));
        assertNull(ConnectionRole.fromValue(null));
    }
}

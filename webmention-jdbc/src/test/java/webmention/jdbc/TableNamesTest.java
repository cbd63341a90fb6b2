package webmention.jdbc;

import org.junit.jupiter.api.Test;
import webmention.jdbc.store.H2WebmentionStore;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TableNamesTest {

    @Test
    void acceptsIdentifiers() {
        assertEquals("webmention", TableNames.validate("webmention"));
        assertEquals("_site_mentions2", TableNames.validate("_site_mentions2"));
    }

    @Test
    void rejectsInjection() {
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate("webmention; DROP TABLE x"));
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate("2mentions"));
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate(""));
        assertThrows(NullPointerException.class, () -> TableNames.validate(null));
    }

    @Test
    void storeConstructorValidates() {
        assertThrows(IllegalArgumentException.class, () -> new H2WebmentionStore("bad-name"));
    }
}

package work.signbox.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ch.qos.logback.classic.Level;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class LogSetupTest {
    @Test
    void mapsLevelsOntoLogback() {
        assertEquals(Level.TRACE, LogSetup.toLogback(LogLevel.TRACE));
        assertEquals(Level.WARN, LogSetup.toLogback(LogLevel.WARN));
        assertEquals(Level.OFF, LogSetup.toLogback(LogLevel.OFF));
    }

    @Test
    void parsesLevelNamesLeniently() {
        assertEquals(LogLevel.DEBUG, LogLevel.from(" Debug "));
        assertEquals(LogLevel.INFO, LogLevel.from(null));
        assertThrows(IllegalArgumentException.class, () -> LogLevel.from("chatty"));
    }

    @Test
    void mdcIsClearedAfterACall() {
        SigningMdc.set("dy", "sign_detail", "ctx-1");
        assertEquals("ctx-1", MDC.get("contextId"));
        SigningMdc.clear();
        assertNull(MDC.get("platform"));
        assertNull(MDC.get("contextId"));
    }
}

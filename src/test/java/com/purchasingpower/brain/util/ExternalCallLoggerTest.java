package com.purchasingpower.brain.util;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
@DisplayName("External Call Logger Tests")
class ExternalCallLoggerTest {

    @Test
    @DisplayName("Long text is cut and annotated with the dropped length")
    void truncates() {
        assertEquals("abc", ExternalCallLogger.truncate("abc", 5));
        assertEquals("ab... [+3 chars]", ExternalCallLogger.truncate("abcde", 2));
        assertEquals("(null)", ExternalCallLogger.truncate(null, 5));
    }

    @Test
    @DisplayName("Large maps are summarized by size")
    void formatsMaps() {
        Map<String, Integer> large = new LinkedHashMap<>();
        for (int i = 0; i < 6; i++) {
            large.put("k" + i, i);
        }

        assertEquals("{}", ExternalCallLogger.formatMap(Map.of()));
        assertEquals("{a=1}", ExternalCallLogger.formatMap(Map.of("a", 1)));
        assertEquals("{6 entries}", ExternalCallLogger.formatMap(large));
    }

    @Test
    @DisplayName("Each call gets a short id and keeps its service")
    void startsCalls() {
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.NEO4J, "GetEntity", log);
        ctx.logRequest("Fetching entity", "Id", "work-1");
        ctx.logResponse("Entity found");

        assertEquals(8, ctx.getCallId().length());
        assertEquals(ServiceType.NEO4J, ctx.getService());
        assertTrue(ctx.getElapsedMs() >= 0);
    }
}

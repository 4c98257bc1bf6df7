package io.linedecode.decode;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class JacksonRecordDecoderTest {
    public static class Point {
        public int x;
        public int y;
    }

    private static byte[] bytes(String s) { return s.getBytes(StandardCharsets.UTF_8); }

    @Test
    void populates_map_target_in_place_ignoring_trailing_newline() throws Exception {
        Map<String, Object> m = new HashMap<>();
        new JacksonRecordDecoder().decode(bytes("{\"a\":1,\"b\":\"two\"}\n"), m);
        assertEquals(1, m.get("a"));
        assertEquals("two", m.get("b"));
    }

    @Test
    void populates_bean_target() throws Exception {
        Point p = new Point();
        new JacksonRecordDecoder().decode(bytes("{\"x\":3,\"y\":4}\n"), p);
        assertEquals(3, p.x);
        assertEquals(4, p.y);
    }

    @Test
    void malformed_json_throws() {
        assertThrows(JsonProcessingException.class, () -> new JacksonRecordDecoder().decode(bytes("{bad\n"), new HashMap<>()));
    }

    @Test
    void custom_mapper_settings_apply() throws Exception {
        assertThrows(JsonProcessingException.class,
                () -> new JacksonRecordDecoder().decode(bytes("{\"x\":1,\"z\":9}\n"), new Point()));
        ObjectMapper lenient = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        Point p = new Point();
        new JacksonRecordDecoder(lenient).decode(bytes("{\"x\":1,\"z\":9}\n"), p);
        assertEquals(1, p.x);
    }
}

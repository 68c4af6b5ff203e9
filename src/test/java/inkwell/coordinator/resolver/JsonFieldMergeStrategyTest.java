package inkwell.coordinator.resolver;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonFieldMergeStrategyTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final JsonFieldMergeStrategy strategy = new JsonFieldMergeStrategy(mapper);

    @Test
    void unionOfDisjointFields() throws Exception {
        String merged = strategy.merge(List.of("{\"a\":1}", "{\"b\":[1,2]}")).orElseThrow();

        assertEquals(mapper.readTree("{\"a\":1,\"b\":[1,2]}"), mapper.readTree(merged));
    }

    @Test
    void identicalFieldsAgree() throws Exception {
        String merged = strategy.merge(List.of("{\"a\":{\"x\":true}}", "{\"a\":{\"x\":true}}")).orElseThrow();

        assertEquals(mapper.readTree("{\"a\":{\"x\":true}}"), mapper.readTree(merged));
    }

    @Test
    void contradictingFieldIsAConflict() {
        MergeConflictException e = assertThrows(MergeConflictException.class,
                () -> strategy.merge(List.of("{\"a\":1}", "{\"a\":2}")));
        assertTrue(e.getMessage().contains("'a'"));
    }

    @Test
    void nonObjectValuesCannotBeMerged() {
        assertThrows(MergeConflictException.class, () -> strategy.merge(List.of("plain prose", "{\"a\":1}")));
        assertThrows(MergeConflictException.class, () -> strategy.merge(List.of("[1]", "[2]")));
    }

    @Test
    void strategyLookupByName() throws Exception {
        assertSame(MergeStrategy.NONE, MergeStrategy.forName("none", mapper));
        assertSame(MergeStrategy.NONE, MergeStrategy.forName(null, mapper));
        assertEquals(JsonFieldMergeStrategy.NAME, MergeStrategy.forName("JSON-Fields", mapper).name());
        assertTrue(MergeStrategy.NONE.merge(List.of("x", "y")).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> MergeStrategy.forName("llm", mapper));
    }
}

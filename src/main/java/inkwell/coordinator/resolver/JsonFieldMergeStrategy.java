package inkwell.coordinator.resolver;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Union of the fields of JSON object values.
 * Two candidates setting the same field to different values is a contradiction.
 */
public class JsonFieldMergeStrategy implements MergeStrategy {

    public static final String NAME = "json-fields";

    private final ObjectMapper mapper;

    public JsonFieldMergeStrategy(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<String> merge(List<String> rankedValues) throws MergeConflictException {
        ObjectNode merged = mapper.createObjectNode();
        for (String value : rankedValues) {
            JsonNode node = parse(value);
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode existing = merged.get(field.getKey());
                if (existing != null && !existing.equals(field.getValue())) {
                    throw new MergeConflictException("Field '" + field.getKey() + "' has contradicting values");
                }
                merged.set(field.getKey(), field.getValue());
            }
        }
        try {
            return Optional.of(mapper.writeValueAsString(merged));
        } catch (JsonProcessingException e) {
            throw new MergeConflictException("Cannot serialize merged value", e);
        }
    }

    private JsonNode parse(String value) throws MergeConflictException {
        if (value == null) {
            throw new MergeConflictException("Candidate has no value");
        }
        try {
            JsonNode node = mapper.readTree(value);
            if (node == null || !node.isObject()) {
                throw new MergeConflictException("Candidate value is not a JSON object");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new MergeConflictException("Candidate value is not valid JSON", e);
        }
    }
}

package uk.gegc.livequiz.shared.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import org.springframework.util.StringUtils;

import java.util.Map;
import java.util.TreeMap;

/**
 * Stores option index to count maps as JSON objects, always ordered by option index.
 */
@Converter
public class OptionCountsConverter implements AttributeConverter<Map<Integer, Integer>, String> {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final TypeReference<TreeMap<Integer, Integer>> TYPE_REF = new TypeReference<>() {
    };

    @Override
    public String convertToDatabaseColumn(Map<Integer, Integer> attribute) {
        try {
            return OBJECT_MAPPER.writeValueAsString(attribute == null ? Map.of() : new TreeMap<>(attribute));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize option counts", e);
        }
    }

    @Override
    public Map<Integer, Integer> convertToEntityAttribute(String dbData) {
        if (!StringUtils.hasText(dbData)) {
            return new TreeMap<>();
        }
        try {
            TreeMap<Integer, Integer> parsed = OBJECT_MAPPER.readValue(dbData, TYPE_REF);
            return parsed != null ? parsed : new TreeMap<>();
        } catch (Exception e) {
            throw new IllegalArgumentException("Failed to deserialize option counts", e);
        }
    }
}

package uk.gegc.skillgrader.shared.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import org.springframework.util.StringUtils;

/**
 * Stores embedding vectors as a JSON array of numbers.
 */
@Converter
public class EmbeddingVectorConverter implements AttributeConverter<float[], String> {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper().findAndRegisterModules();

    @Override
    public String convertToDatabaseColumn(float[] attribute) {
        if (attribute == null) {
            return null;
        }
        try {
            return OBJECT_MAPPER.writeValueAsString(attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize embedding", e);
        }
    }

    @Override
    public float[] convertToEntityAttribute(String dbData) {
        if (!StringUtils.hasText(dbData)) {
            return null;
        }
        try {
            return OBJECT_MAPPER.readValue(dbData, float[].class);
        } catch (Exception e) {
            throw new IllegalArgumentException("Failed to deserialize embedding", e);
        }
    }
}

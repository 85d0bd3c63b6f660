package uk.gegc.clubaccess.features.ledger.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import org.springframework.util.StringUtils;
import uk.gegc.clubaccess.features.sync.domain.model.SyncResult;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stores the provider-name to {@link SyncResult} map as a JSON object.
 */
@Converter
public class SyncResultsConverter implements AttributeConverter<Map<String, SyncResult>, String> {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper().findAndRegisterModules();
    private static final TypeReference<LinkedHashMap<String, SyncResult>> TYPE_REF = new TypeReference<>() {
    };

    @Override
    public String convertToDatabaseColumn(Map<String, SyncResult> attribute) {
        try {
            return OBJECT_MAPPER.writeValueAsString(attribute == null ? Map.of() : attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize sync results", e);
        }
    }

    @Override
    public Map<String, SyncResult> convertToEntityAttribute(String dbData) {
        if (!StringUtils.hasText(dbData)) {
            return new LinkedHashMap<>();
        }
        try {
            Map<String, SyncResult> parsed = OBJECT_MAPPER.readValue(dbData, TYPE_REF);
            return parsed != null ? parsed : new LinkedHashMap<>();
        } catch (Exception e) {
            throw new IllegalArgumentException("Failed to deserialize sync results", e);
        }
    }
}

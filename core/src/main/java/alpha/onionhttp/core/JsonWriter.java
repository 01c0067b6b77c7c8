package alpha.onionhttp.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import static java.util.Objects.requireNonNull;

/**
 * Serializes response bodies as JSON.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class JsonWriter
{
    private final ObjectMapper mapper;
    
    JsonWriter() {
        this(new ObjectMapper());
    }
    
    JsonWriter(ObjectMapper mapper) {
        this.mapper = requireNonNull(mapper);
    }
    
    /**
     * Serializes the given value.
     * 
     * @param value to serialize
     * @return JSON, encoded using UTF-8
     * @throws JsonProcessingException if serialization fails
     */
    byte[] write(Object value) throws JsonProcessingException {
        return mapper.writeValueAsBytes(value);
    }
}

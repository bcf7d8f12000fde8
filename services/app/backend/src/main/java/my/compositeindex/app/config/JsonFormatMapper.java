package my.compositeindex.app.config;

import org.hibernate.type.format.AbstractJsonFormatMapper;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

import java.lang.reflect.Type;

/**
 * Hibernate JSON column mapping backed by Jackson 3, so that weight models, result sets and
 * dataset rows stored in jsonb columns use the same serialization rules as the REST layer.
 */
public final class JsonFormatMapper extends AbstractJsonFormatMapper {
	private final ObjectMapper objectMapper;

	public JsonFormatMapper() {
		this(JsonMapper.builder().build());
	}

	public JsonFormatMapper(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	@Override
	protected <T> T fromString(CharSequence charSequence, Type type) {
		try {
			return objectMapper.readValue(charSequence.toString(), objectMapper.constructType(type));
		} catch (JacksonException e) {
			throw new IllegalArgumentException("Could not read JSON column as " + type.getTypeName(), e);
		}
	}

	@Override
	protected <T> String toString(T value, Type type) {
		try {
			return objectMapper.writerFor(objectMapper.constructType(type)).writeValueAsString(value);
		} catch (JacksonException e) {
			throw new IllegalArgumentException("Could not write " + type.getTypeName() + " as JSON column", e);
		}
	}
}

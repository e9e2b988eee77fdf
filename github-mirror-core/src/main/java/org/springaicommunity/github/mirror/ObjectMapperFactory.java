package org.springaicommunity.github.mirror;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Factory for the {@link ObjectMapper} shared by the HTTP client, the persisters and the
 * publisher.
 *
 * <p>
 * Mirrored records are kept as {@code ObjectNode} trees exactly as GitHub returned them,
 * so no naming strategy is applied. Floating point values are read as {@code BigDecimal}
 * so stored documents round-trip unchanged.
 */
public final class ObjectMapperFactory {

	private ObjectMapperFactory() {
	}

	public static ObjectMapper create() {
		ObjectMapper mapper = new ObjectMapper();
		mapper.registerModule(new JavaTimeModule());
		mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
		mapper.enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
		return mapper;
	}

}

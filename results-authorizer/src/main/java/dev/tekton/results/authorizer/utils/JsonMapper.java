// (Copyright) [2019 - 2019] Confluent, Inc.

package dev.tekton.results.authorizer.utils;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import org.apache.kafka.common.errors.SerializationException;

/**
 * Shared mapper for authority requests and Results API messages. Unknown properties are
 * ignored since Kubernetes responses carry object metadata the entities do not model.
 */
public final class JsonMapper {
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
      .registerModule(new Jdk8Module())
      .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
      .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
      .setSerializationInclusion(JsonInclude.Include.NON_EMPTY);

  private JsonMapper() {
  }

  public static ObjectMapper objectMapper() {
    return OBJECT_MAPPER;
  }

  public static String toJson(Object value) {
    try {
      return OBJECT_MAPPER.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new SerializationException("Could not serialize " + value.getClass().getSimpleName(), e);
    }
  }
}

package it.unimib.datai.frontdoor.lambda.adapter;

import com.amazonaws.services.lambda.runtime.events.APIGatewayV2HTTPEvent;
import com.amazonaws.services.lambda.runtime.events.APIGatewayV2HTTPResponse;
import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;

/**
 * Converts between the untyped invocation map and the {@code aws-lambda-java-events}
 * HTTP API types.
 *
 * <p>The event classes are plain Lombok beans: the {@code isBase64Encoded} field gets a
 * bean property named {@code base64Encoded}, which does not match the wire name. The
 * mixin binds them through their fields instead, whose names are the wire names.
 */
final class LambdaEventMapper {
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    LambdaEventMapper() {
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .addMixIn(APIGatewayV2HTTPEvent.class, FieldBinding.class)
                .addMixIn(APIGatewayV2HTTPEvent.RequestContext.class, FieldBinding.class)
                .addMixIn(APIGatewayV2HTTPEvent.RequestContext.Http.class, FieldBinding.class)
                .addMixIn(APIGatewayV2HTTPResponse.class, FieldBinding.class);
    }

    APIGatewayV2HTTPEvent toEvent(Map<String, Object> event) {
        try {
            return objectMapper.convertValue(event, APIGatewayV2HTTPEvent.class);
        } catch (IllegalArgumentException ex) {
            throw new MalformedEventException("Event does not have the HTTP API shape: " + ex.getMessage(), ex);
        }
    }

    Map<String, Object> toMap(APIGatewayV2HTTPResponse response) {
        return objectMapper.convertValue(response, MAP_TYPE);
    }

    @JsonAutoDetect(
            fieldVisibility = Visibility.ANY,
            getterVisibility = Visibility.NONE,
            isGetterVisibility = Visibility.NONE,
            setterVisibility = Visibility.NONE)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private abstract static class FieldBinding {
    }
}

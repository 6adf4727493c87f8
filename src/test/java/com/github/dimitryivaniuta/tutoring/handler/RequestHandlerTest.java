package com.github.dimitryivaniuta.tutoring.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.tutoring.error.ConfigurationException;
import com.github.dimitryivaniuta.tutoring.error.NotFoundException;
import com.github.dimitryivaniuta.tutoring.error.ValidationException;
import com.github.dimitryivaniuta.tutoring.support.TestObjects;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DuplicateKeyException;

/**
 * Envelope behaviour shared by every handler.
 */
class RequestHandlerTest {

    private static final ObjectMapper OBJECT_MAPPER = TestObjects.objectMapper();

    @Test
    void optionsShortCircuitsWithCorsHeaders() throws Exception {
        StubHandler handler = new StubHandler(r -> {
            throw new AssertionError("must not be invoked");
        });

        ApiResponse response = handler.handle(new ApiRequest("OPTIONS", null, null));

        Assertions.assertEquals(200, response.statusCode());
        Assertions.assertEquals("CORS OK!", OBJECT_MAPPER.readTree(response.body()).get("message").asText());
        Assertions.assertEquals("*", response.headers().get("Access-Control-Allow-Origin"));
        Assertions.assertEquals("OPTIONS, GET", response.headers().get("Access-Control-Allow-Methods"));
        Assertions.assertEquals("Content-Type", response.headers().get("Access-Control-Allow-Headers"));
        Assertions.assertEquals("application/json", response.headers().get("Content-Type"));
    }

    @Test
    void successResponseCarriesSameHeaders() {
        StubHandler handler = new StubHandler(r -> null);

        ApiResponse response = handler.handle(ApiRequest.get(Map.of()));

        Assertions.assertEquals(200, response.statusCode());
        Assertions.assertEquals("[]", response.body());
        Assertions.assertEquals("OPTIONS, GET", response.headers().get("Access-Control-Allow-Methods"));
    }

    @Test
    void validationFailureBecomes400() throws Exception {
        ApiResponse response = new StubHandler(r -> {
            throw new ValidationException("Field 'nome' is required.");
        }).handle(ApiRequest.get(Map.of()));

        JsonNode body = OBJECT_MAPPER.readTree(response.body());
        Assertions.assertEquals(400, response.statusCode());
        Assertions.assertEquals("VALIDATION_ERROR", body.get("code").asText());
        Assertions.assertEquals("Field 'nome' is required.", body.get("error").asText());
        Assertions.assertTrue(body.hasNonNull("timestamp"));
    }

    @Test
    void notFoundBecomes404() {
        ApiResponse response = new StubHandler(r -> {
            throw new NotFoundException("Student not found.");
        }).handle(ApiRequest.get(Map.of()));

        Assertions.assertEquals(404, response.statusCode());
        Assertions.assertEquals("application/json", response.headers().get("Content-Type"));
    }

    @Test
    void configurationFailureBecomes500() throws Exception {
        ApiResponse response = new StubHandler(r -> {
            throw new ConfigurationException("Missing required configuration 'app.secret-id'");
        }).handle(ApiRequest.get(Map.of()));

        Assertions.assertEquals(500, response.statusCode());
        Assertions.assertEquals("CONFIGURATION_ERROR", OBJECT_MAPPER.readTree(response.body()).get("code").asText());
    }

    @Test
    void dataAccessFailureBecomesStorageErrorWithMostSpecificCause() throws Exception {
        ApiResponse response = new StubHandler(r -> {
            throw new DuplicateKeyException("statement failed",
                    new SQLException("duplicate key value violates unique constraint \"alunos_cpf_key\""));
        }).handle(ApiRequest.get(Map.of()));

        JsonNode body = OBJECT_MAPPER.readTree(response.body());
        Assertions.assertEquals(500, response.statusCode());
        Assertions.assertEquals("STORAGE_ERROR", body.get("code").asText());
        Assertions.assertTrue(body.get("error").asText().contains("alunos_cpf_key"));
    }

    @Test
    void unexpectedFailureBecomesInternalError() throws Exception {
        ApiResponse response = new StubHandler(r -> {
            throw new NullPointerException();
        }).handle(ApiRequest.get(Map.of()));

        JsonNode body = OBJECT_MAPPER.readTree(response.body());
        Assertions.assertEquals(500, response.statusCode());
        Assertions.assertEquals("INTERNAL_ERROR", body.get("code").asText());
        Assertions.assertEquals("NullPointerException", body.get("error").asText());
    }

    /**
     * Runs the given body; a null result becomes an empty 200 list.
     */
    private static final class StubHandler extends RequestHandler {

        private final Function<ApiRequest, ApiResponse> body;

        StubHandler(Function<ApiRequest, ApiResponse> body) {
            super(OBJECT_MAPPER, TestObjects.properties());
            this.body = body;
        }

        @Override
        protected ApiResponse doHandle(ApiRequest request) {
            ApiResponse response = body.apply(request);
            return response != null ? response : respond(200, List.of());
        }

        @Override
        protected String allowedMethods() {
            return "OPTIONS, GET";
        }
    }
}

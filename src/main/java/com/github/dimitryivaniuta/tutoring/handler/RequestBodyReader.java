package com.github.dimitryivaniuta.tutoring.handler;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.exc.InputCoercionException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.tutoring.error.ValidationException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Decodes a JSON request body into a request record and applies its Bean Validation constraints.
 *
 * <p>Every decoding or constraint failure becomes a {@link ValidationException} (400).</p>
 */
@Component
public class RequestBodyReader {

    private final ObjectMapper objectMapper;
    private final Validator validator;

    public RequestBodyReader(ObjectMapper objectMapper, Validator validator) {
        this.objectMapper = objectMapper;
        this.validator = validator;
    }

    /**
     * Reads and validates the body.
     *
     * @param request request carrying the body
     * @param type    request record type
     * @param <T>     request type
     * @return valid request
     */
    public <T> T read(ApiRequest request, Class<T> type) {
        if (!StringUtils.hasText(request.body())) {
            throw new ValidationException("Request body is empty.");
        }

        T value;
        try {
            value = objectMapper.readValue(request.body(), type);
        } catch (JsonMappingException e) {
            throw new ValidationException(describe(e), e);
        } catch (InputCoercionException e) {
            throw new ValidationException(describe(e), e);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Request body is not valid JSON.", e);
        }
        if (value == null) {
            throw new ValidationException("Request body must be a JSON object.");
        }

        Set<ConstraintViolation<T>> violations = validator.validate(value);
        if (!violations.isEmpty()) {
            throw new ValidationException(violations.stream()
                    .map(ConstraintViolation::getMessage)
                    .sorted()
                    .collect(Collectors.joining(" ")));
        }
        return value;
    }

    private static String describe(JsonMappingException e) {
        String field = e.getPath().stream()
                .map(JsonMappingException.Reference::getFieldName)
                .filter(StringUtils::hasText)
                .collect(Collectors.joining("."));
        if (field.isEmpty()) {
            return "Request body must be a JSON object.";
        }
        return invalidField(field);
    }

    // Numeric overflow is raised by the parser, before a field path is attached.
    private static String describe(InputCoercionException e) {
        JsonParser parser = e.getProcessor();
        String field = parser == null ? null : parser.currentName();
        return StringUtils.hasText(field) ? invalidField(field) : "Request body has an out-of-range number.";
    }

    private static String invalidField(String field) {
        return "Field '" + field + "' has an invalid value.";
    }
}

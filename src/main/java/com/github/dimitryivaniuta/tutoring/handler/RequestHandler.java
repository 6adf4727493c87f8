package com.github.dimitryivaniuta.tutoring.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.tutoring.config.AppProperties;
import com.github.dimitryivaniuta.tutoring.error.NotFoundException;
import com.github.dimitryivaniuta.tutoring.error.StorageException;
import com.github.dimitryivaniuta.tutoring.error.TutoringException;
import com.github.dimitryivaniuta.tutoring.error.ValidationException;
import com.github.dimitryivaniuta.tutoring.handler.dto.ErrorResponse;
import com.github.dimitryivaniuta.tutoring.handler.dto.MessageResponse;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

/**
 * Base class of the request handlers.
 *
 * <p>Owns the parts every handler shares:
 * <ul>
 *   <li>{@code OPTIONS} requests short-circuit to a fixed 200 response;</li>
 *   <li>every failure is caught here and converted to the response envelope, nothing escapes to the caller;</li>
 *   <li>every response carries the CORS headers and a JSON body.</li>
 * </ul>
 */
public abstract class RequestHandler {

    /** Body of the pre-flight response. */
    public static final String PREFLIGHT_MESSAGE = "CORS OK!";

    private final Logger log = LoggerFactory.getLogger(getClass());

    private final ObjectMapper objectMapper;
    private final AppProperties properties;

    protected RequestHandler(ObjectMapper objectMapper, AppProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * Handles one invocation.
     *
     * @param request inbound request
     * @return response envelope, never null
     */
    public final ApiResponse handle(ApiRequest request) {
        if (request.isPreflight()) {
            return respond(200, new MessageResponse(PREFLIGHT_MESSAGE));
        }
        try {
            return doHandle(request);
        } catch (ValidationException | NotFoundException e) {
            log.warn("Request rejected. status={} error={}", e.getHttpStatus(), e.getMessage());
            return failure(e);
        } catch (TutoringException e) {
            log.error("Request failed. code={} error={}", e.getCode(), e.getMessage(), e);
            return failure(e);
        } catch (DataAccessException e) {
            StorageException storage = new StorageException(e.getMostSpecificCause().getMessage(), e);
            log.error("Database statement failed. error={}", storage.getMessage(), e);
            return failure(storage);
        } catch (RuntimeException e) {
            log.error("Unexpected error", e);
            String msg = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return respond(500, new ErrorResponse("INTERNAL_ERROR", msg, Instant.now()));
        }
    }

    /**
     * Handler-specific work. May throw any {@link TutoringException}.
     *
     * @param request inbound (non pre-flight) request
     * @return success response
     */
    protected abstract ApiResponse doHandle(ApiRequest request);

    /**
     * Value of {@code Access-Control-Allow-Methods} for this handler's route.
     *
     * @return comma separated method list
     */
    protected abstract String allowedMethods();

    protected ApiResponse respond(int statusCode, Object body) {
        return new ApiResponse(statusCode, headers(), toJson(body));
    }

    private ApiResponse failure(TutoringException e) {
        return respond(e.getHttpStatus(), new ErrorResponse(e.getCode(), e.getMessage(), Instant.now()));
    }

    private Map<String, String> headers() {
        AppProperties.Cors cors = properties.getCors();
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Access-Control-Allow-Origin", cors.getAllowOrigin());
        headers.put("Access-Control-Allow-Methods", allowedMethods());
        headers.put("Access-Control-Allow-Headers", cors.getAllowHeaders());
        headers.put("Content-Type", "application/json");
        return headers;
    }

    private String toJson(Object o) {
        try {
            return objectMapper.writeValueAsString(o);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize response body", e);
        }
    }
}

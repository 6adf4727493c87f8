package com.github.dimitryivaniuta.tutoring.support;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.github.dimitryivaniuta.tutoring.config.AppProperties;
import com.github.dimitryivaniuta.tutoring.handler.RequestBodyReader;
import jakarta.validation.Validation;
import jakarta.validation.Validator;

/**
 * Collaborators configured the way the application context configures them.
 */
public final class TestObjects {

    private TestObjects() {
    }

    public static ObjectMapper objectMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT)
                .build();
    }

    public static Validator validator() {
        return Validation.buildDefaultValidatorFactory().getValidator();
    }

    public static RequestBodyReader bodyReader() {
        return new RequestBodyReader(objectMapper(), validator());
    }

    public static AppProperties properties() {
        AppProperties properties = new AppProperties();
        properties.setRegion("sa-east-1");
        properties.setSecretId("tutoring-db");
        properties.getDatabase().setProxyHost("proxy.internal");
        properties.getDatabase().setName("tutoring");
        properties.getSettlement().setTopic("tutoring.settlement-requests");
        return properties;
    }
}

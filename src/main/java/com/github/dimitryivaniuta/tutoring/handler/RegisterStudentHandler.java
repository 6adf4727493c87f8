package com.github.dimitryivaniuta.tutoring.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.tutoring.config.AppProperties;
import com.github.dimitryivaniuta.tutoring.credentials.CredentialProvider;
import com.github.dimitryivaniuta.tutoring.db.DatabaseGateway;
import com.github.dimitryivaniuta.tutoring.db.DatabaseSession;
import com.github.dimitryivaniuta.tutoring.handler.dto.MessageResponse;
import com.github.dimitryivaniuta.tutoring.handler.dto.RegisterStudentRequest;
import com.github.dimitryivaniuta.tutoring.repo.StudentRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * {@code POST /api/students}: registers a student.
 *
 * <p>No duplicate pre-check: a second registration with the same CPF fails on the unique constraint.</p>
 */
@Slf4j
@Component
public class RegisterStudentHandler extends RequestHandler {

    static final String CREATED_MESSAGE = "Student registered successfully.";

    private final CredentialProvider credentialProvider;
    private final DatabaseGateway databaseGateway;
    private final StudentRepository studentRepository;
    private final RequestBodyReader bodyReader;
    private final Counter insertCounter;

    public RegisterStudentHandler(
            CredentialProvider credentialProvider,
            DatabaseGateway databaseGateway,
            StudentRepository studentRepository,
            RequestBodyReader bodyReader,
            ObjectMapper objectMapper,
            AppProperties properties,
            MeterRegistry meterRegistry
    ) {
        super(objectMapper, properties);
        this.credentialProvider = credentialProvider;
        this.databaseGateway = databaseGateway;
        this.studentRepository = studentRepository;
        this.bodyReader = bodyReader;
        this.insertCounter = Counter.builder("tutoring.db.inserts").tag("table", "students").register(meterRegistry);
    }

    @Override
    protected ApiResponse doHandle(ApiRequest request) {
        RegisterStudentRequest body = bodyReader.read(request, RegisterStudentRequest.class);

        try (DatabaseSession session = databaseGateway.open(credentialProvider.fetch())) {
            studentRepository.insert(session, body.name().trim(), body.nationalId().trim());
            session.commit();
        }
        insertCounter.increment();

        log.info("Student registered");
        return respond(201, new MessageResponse(CREATED_MESSAGE));
    }

    @Override
    protected String allowedMethods() {
        return "OPTIONS, POST, PUT";
    }
}

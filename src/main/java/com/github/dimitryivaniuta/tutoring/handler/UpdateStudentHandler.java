package com.github.dimitryivaniuta.tutoring.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.tutoring.config.AppProperties;
import com.github.dimitryivaniuta.tutoring.credentials.CredentialProvider;
import com.github.dimitryivaniuta.tutoring.db.DatabaseGateway;
import com.github.dimitryivaniuta.tutoring.db.DatabaseSession;
import com.github.dimitryivaniuta.tutoring.error.NotFoundException;
import com.github.dimitryivaniuta.tutoring.error.ValidationException;
import com.github.dimitryivaniuta.tutoring.handler.dto.MessageResponse;
import com.github.dimitryivaniuta.tutoring.handler.dto.UpdateStudentRequest;
import com.github.dimitryivaniuta.tutoring.repo.StudentRepository;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * {@code PUT /api/students}: updates the supplied fields of a student identified by CPF.
 */
@Slf4j
@Component
public class UpdateStudentHandler extends RequestHandler {

    static final String UPDATED_MESSAGE = "Student updated successfully.";

    private final CredentialProvider credentialProvider;
    private final DatabaseGateway databaseGateway;
    private final StudentRepository studentRepository;
    private final RequestBodyReader bodyReader;

    public UpdateStudentHandler(
            CredentialProvider credentialProvider,
            DatabaseGateway databaseGateway,
            StudentRepository studentRepository,
            RequestBodyReader bodyReader,
            ObjectMapper objectMapper,
            AppProperties properties
    ) {
        super(objectMapper, properties);
        this.credentialProvider = credentialProvider;
        this.databaseGateway = databaseGateway;
        this.studentRepository = studentRepository;
        this.bodyReader = bodyReader;
    }

    @Override
    protected ApiResponse doHandle(ApiRequest request) {
        UpdateStudentRequest body = bodyReader.read(request, UpdateStudentRequest.class);
        String nationalId = body.nationalId().trim();

        Map<String, Object> fields = new LinkedHashMap<>();
        if (StringUtils.hasText(body.name())) {
            fields.put(StudentRepository.NAME_COLUMN, body.name().trim());
        }
        if (fields.isEmpty()) {
            throw new ValidationException("No updatable field supplied; expected 'nome'.");
        }

        try (DatabaseSession session = databaseGateway.open(credentialProvider.fetch())) {
            if (!studentRepository.existsByNationalId(session, nationalId)) {
                throw new NotFoundException("Student not found.");
            }
            studentRepository.updateByNationalId(session, nationalId, fields);
            session.commit();
        }

        log.info("Student updated. fields={}", fields.keySet());
        return respond(200, new MessageResponse(UPDATED_MESSAGE));
    }

    @Override
    protected String allowedMethods() {
        return "OPTIONS, POST, PUT";
    }
}

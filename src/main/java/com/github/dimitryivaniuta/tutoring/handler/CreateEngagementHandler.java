package com.github.dimitryivaniuta.tutoring.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.tutoring.config.AppProperties;
import com.github.dimitryivaniuta.tutoring.credentials.CredentialProvider;
import com.github.dimitryivaniuta.tutoring.db.DatabaseGateway;
import com.github.dimitryivaniuta.tutoring.db.DatabaseSession;
import com.github.dimitryivaniuta.tutoring.handler.dto.CreateEngagementRequest;
import com.github.dimitryivaniuta.tutoring.handler.dto.EngagementCreatedResponse;
import com.github.dimitryivaniuta.tutoring.repo.EngagementRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * {@code POST /api/engagements}: contracts hours of a tutor for a subject on behalf of a student.
 */
@Slf4j
@Component
public class CreateEngagementHandler extends RequestHandler {

    static final String CREATED_MESSAGE = "Engagement created successfully!";

    private final CredentialProvider credentialProvider;
    private final DatabaseGateway databaseGateway;
    private final EngagementRepository engagementRepository;
    private final RequestBodyReader bodyReader;
    private final Counter insertCounter;

    public CreateEngagementHandler(
            CredentialProvider credentialProvider,
            DatabaseGateway databaseGateway,
            EngagementRepository engagementRepository,
            RequestBodyReader bodyReader,
            ObjectMapper objectMapper,
            AppProperties properties,
            MeterRegistry meterRegistry
    ) {
        super(objectMapper, properties);
        this.credentialProvider = credentialProvider;
        this.databaseGateway = databaseGateway;
        this.engagementRepository = engagementRepository;
        this.bodyReader = bodyReader;
        this.insertCounter = Counter.builder("tutoring.db.inserts").tag("table", "engagements").register(meterRegistry);
    }

    @Override
    protected ApiResponse doHandle(ApiRequest request) {
        CreateEngagementRequest body = bodyReader.read(request, CreateEngagementRequest.class);

        long engagementId;
        try (DatabaseSession session = databaseGateway.open(credentialProvider.fetch())) {
            engagementId = engagementRepository.insertActive(session,
                    body.tutorId(), body.studentId(), body.subjectId(), body.contractedHours());
            session.commit();
        }
        insertCounter.increment();

        log.info("Engagement created. id_conexao={} id_aluno={} id_professor={}",
                engagementId, body.studentId(), body.tutorId());
        return respond(201, new EngagementCreatedResponse(CREATED_MESSAGE, engagementId));
    }

    @Override
    protected String allowedMethods() {
        return "OPTIONS, GET, POST";
    }
}

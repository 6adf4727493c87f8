package com.github.dimitryivaniuta.tutoring.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.tutoring.config.AppProperties;
import com.github.dimitryivaniuta.tutoring.credentials.CredentialProvider;
import com.github.dimitryivaniuta.tutoring.db.DatabaseGateway;
import com.github.dimitryivaniuta.tutoring.db.DatabaseSession;
import com.github.dimitryivaniuta.tutoring.domain.EngagementSummary;
import com.github.dimitryivaniuta.tutoring.repo.EngagementRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * {@code GET /api/engagements?id_aluno=}: lists a student's engagements.
 */
@Component
public class StudentEngagementsHandler extends RequestHandler {

    static final String STUDENT_PARAM = "id_aluno";

    private final CredentialProvider credentialProvider;
    private final DatabaseGateway databaseGateway;
    private final EngagementRepository engagementRepository;
    private final Counter readCounter;

    public StudentEngagementsHandler(
            CredentialProvider credentialProvider,
            DatabaseGateway databaseGateway,
            EngagementRepository engagementRepository,
            ObjectMapper objectMapper,
            AppProperties properties,
            MeterRegistry meterRegistry
    ) {
        super(objectMapper, properties);
        this.credentialProvider = credentialProvider;
        this.databaseGateway = databaseGateway;
        this.engagementRepository = engagementRepository;
        this.readCounter = Counter.builder("tutoring.db.reads").tag("query", "engagements").register(meterRegistry);
    }

    @Override
    protected ApiResponse doHandle(ApiRequest request) {
        long studentId = RequestParameters.requirePositiveLong(request, STUDENT_PARAM);

        List<EngagementSummary> engagements;
        try (DatabaseSession session = databaseGateway.open(credentialProvider.fetch())) {
            engagements = engagementRepository.findByStudent(session, studentId);
        }
        readCounter.increment();
        return respond(200, engagements);
    }

    @Override
    protected String allowedMethods() {
        // answers OPTIONS for the whole route, which also accepts POST
        return "OPTIONS, GET, POST";
    }
}

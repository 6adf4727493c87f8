package com.github.dimitryivaniuta.tutoring.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.tutoring.config.AppProperties;
import com.github.dimitryivaniuta.tutoring.credentials.CredentialProvider;
import com.github.dimitryivaniuta.tutoring.db.DatabaseGateway;
import com.github.dimitryivaniuta.tutoring.db.DatabaseSession;
import com.github.dimitryivaniuta.tutoring.domain.TutorSubject;
import com.github.dimitryivaniuta.tutoring.repo.TutorRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * {@code GET /api/tutors?materia=}: lists tutors with the subjects they teach.
 */
@Slf4j
@Component
public class SearchTutorsHandler extends RequestHandler {

    static final String SUBJECT_PARAM = "materia";

    private final CredentialProvider credentialProvider;
    private final DatabaseGateway databaseGateway;
    private final TutorRepository tutorRepository;
    private final Counter readCounter;

    public SearchTutorsHandler(
            CredentialProvider credentialProvider,
            DatabaseGateway databaseGateway,
            TutorRepository tutorRepository,
            ObjectMapper objectMapper,
            AppProperties properties,
            MeterRegistry meterRegistry
    ) {
        super(objectMapper, properties);
        this.credentialProvider = credentialProvider;
        this.databaseGateway = databaseGateway;
        this.tutorRepository = tutorRepository;
        this.readCounter = Counter.builder("tutoring.db.reads").tag("query", "tutors").register(meterRegistry);
    }

    @Override
    protected ApiResponse doHandle(ApiRequest request) {
        Optional<String> subject = request.queryParameter(SUBJECT_PARAM);

        List<TutorSubject> tutors;
        try (DatabaseSession session = databaseGateway.open(credentialProvider.fetch())) {
            tutors = tutorRepository.search(session, subject);
        }
        readCounter.increment();

        log.info("Tutor search returned {} rows. materia={}", tutors.size(), subject.orElse("<any>"));
        return respond(200, tutors);
    }

    @Override
    protected String allowedMethods() {
        return "OPTIONS, GET";
    }
}

package com.github.dimitryivaniuta.tutoring.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.tutoring.config.AppProperties;
import com.github.dimitryivaniuta.tutoring.credentials.CredentialProvider;
import com.github.dimitryivaniuta.tutoring.db.DatabaseGateway;
import com.github.dimitryivaniuta.tutoring.db.DatabaseSession;
import com.github.dimitryivaniuta.tutoring.domain.PaymentSummary;
import com.github.dimitryivaniuta.tutoring.repo.PaymentRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * {@code GET /api/payments?id_aluno=}: lists the payments made on a student's engagements.
 */
@Component
public class StudentPaymentsHandler extends RequestHandler {

    static final String STUDENT_PARAM = "id_aluno";

    private final CredentialProvider credentialProvider;
    private final DatabaseGateway databaseGateway;
    private final PaymentRepository paymentRepository;
    private final Counter readCounter;

    public StudentPaymentsHandler(
            CredentialProvider credentialProvider,
            DatabaseGateway databaseGateway,
            PaymentRepository paymentRepository,
            ObjectMapper objectMapper,
            AppProperties properties,
            MeterRegistry meterRegistry
    ) {
        super(objectMapper, properties);
        this.credentialProvider = credentialProvider;
        this.databaseGateway = databaseGateway;
        this.paymentRepository = paymentRepository;
        this.readCounter = Counter.builder("tutoring.db.reads").tag("query", "payments").register(meterRegistry);
    }

    @Override
    protected ApiResponse doHandle(ApiRequest request) {
        long studentId = RequestParameters.requirePositiveLong(request, STUDENT_PARAM);

        List<PaymentSummary> payments;
        try (DatabaseSession session = databaseGateway.open(credentialProvider.fetch())) {
            payments = paymentRepository.findByStudent(session, studentId);
        }
        readCounter.increment();
        return respond(200, payments);
    }

    @Override
    protected String allowedMethods() {
        // answers OPTIONS for the whole route, which also accepts POST
        return "OPTIONS, GET, POST";
    }
}

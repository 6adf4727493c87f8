package com.github.dimitryivaniuta.tutoring.repo;

import com.github.dimitryivaniuta.tutoring.db.DatabaseSession;
import com.github.dimitryivaniuta.tutoring.domain.Money;
import com.github.dimitryivaniuta.tutoring.domain.PaymentStatus;
import com.github.dimitryivaniuta.tutoring.domain.PaymentSummary;
import java.math.BigDecimal;
import java.util.List;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

/**
 * Statements over {@code Pagamentos}.
 */
@Repository
public class PaymentRepository {

    static final String INSERT_SQL = """
            INSERT INTO Pagamentos (id_conexao, valor, forma_pagamento, status_pagamento)
            VALUES (?, ?, ?, ?)
            """;

    static final String UPDATE_STATUS_SQL = "UPDATE Pagamentos SET status_pagamento = ? WHERE id_pagamento = ?";

    static final String BY_STUDENT_SQL = """
            SELECT P.id_pagamento, P.id_conexao, P.valor, P.forma_pagamento, P.status_pagamento
            FROM Pagamentos P
            JOIN Conexoes_Aluno_Prof C ON P.id_conexao = C.id_conexao
            WHERE C.id_aluno = ?
            ORDER BY P.id_pagamento
            """;

    private static final RowMapper<PaymentSummary> ROW_MAPPER = (rs, rowNum) -> new PaymentSummary(
            rs.getLong("id_pagamento"),
            rs.getLong("id_conexao"),
            Money.toDouble(rs.getBigDecimal("valor")),
            rs.getString("forma_pagamento"),
            rs.getString("status_pagamento")
    );

    /**
     * Inserts a {@code Pending} payment.
     *
     * @return generated payment id
     */
    public long insertPending(DatabaseSession session, long engagementId, BigDecimal amount, String paymentMethod) {
        return GeneratedKeys.insert(session, INSERT_SQL, "id_pagamento",
                engagementId, amount, paymentMethod, PaymentStatus.PENDING.label());
    }

    /**
     * Overwrites the status of a payment.
     *
     * <p>Unconditional: the current status is not re-checked, so a redelivered settlement simply writes its
     * outcome again.</p>
     *
     * @param session   open session
     * @param paymentId payment id
     * @param status    new status
     * @return affected rows (0 when the payment does not exist)
     */
    public int updateStatus(DatabaseSession session, long paymentId, PaymentStatus status) {
        return session.jdbc().update(UPDATE_STATUS_SQL, status.label(), paymentId);
    }

    /**
     * Lists the payments made on any engagement of a student.
     *
     * @param session   open session
     * @param studentId student id
     * @return payments, possibly empty
     */
    public List<PaymentSummary> findByStudent(DatabaseSession session, long studentId) {
        return session.jdbc().query(BY_STUDENT_SQL, ROW_MAPPER, studentId);
    }
}

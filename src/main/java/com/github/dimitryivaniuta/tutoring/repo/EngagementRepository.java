package com.github.dimitryivaniuta.tutoring.repo;

import com.github.dimitryivaniuta.tutoring.db.DatabaseSession;
import com.github.dimitryivaniuta.tutoring.domain.EngagementStatus;
import com.github.dimitryivaniuta.tutoring.domain.EngagementSummary;
import java.util.List;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

/**
 * Statements over {@code Conexoes_Aluno_Prof} (student/tutor engagements).
 */
@Repository
public class EngagementRepository {

    static final String INSERT_SQL = """
            INSERT INTO Conexoes_Aluno_Prof (id_professor, id_aluno, id_materia, horas_contratadas, status)
            VALUES (?, ?, ?, ?, ?)
            """;

    static final String BY_STUDENT_SQL = """
            SELECT C.id_conexao, P.nome AS professor, M.nome_materia, C.horas_contratadas, C.status
            FROM Conexoes_Aluno_Prof C
            JOIN Professores P ON C.id_professor = P.id_professor
            JOIN Materias M ON C.id_materia = M.id_materia
            WHERE C.id_aluno = ?
            ORDER BY C.id_conexao
            """;

    private static final RowMapper<EngagementSummary> ROW_MAPPER = (rs, rowNum) -> new EngagementSummary(
            rs.getLong("id_conexao"),
            rs.getString("professor"),
            rs.getString("nome_materia"),
            rs.getInt("horas_contratadas"),
            rs.getString("status")
    );

    /**
     * Inserts an {@code Active} engagement.
     *
     * @return generated engagement id
     */
    public long insertActive(DatabaseSession session, long tutorId, long studentId, long subjectId, int contractedHours) {
        return GeneratedKeys.insert(session, INSERT_SQL, "id_conexao",
                tutorId, studentId, subjectId, contractedHours, EngagementStatus.ACTIVE.label());
    }

    /**
     * Lists the engagements of a student.
     *
     * @param session   open session
     * @param studentId student id
     * @return engagements, possibly empty
     */
    public List<EngagementSummary> findByStudent(DatabaseSession session, long studentId) {
        return session.jdbc().query(BY_STUDENT_SQL, ROW_MAPPER, studentId);
    }
}

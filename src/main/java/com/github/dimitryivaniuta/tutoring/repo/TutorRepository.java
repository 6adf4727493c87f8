package com.github.dimitryivaniuta.tutoring.repo;

import com.github.dimitryivaniuta.tutoring.db.DatabaseSession;
import com.github.dimitryivaniuta.tutoring.domain.Money;
import com.github.dimitryivaniuta.tutoring.domain.TutorSubject;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

/**
 * Read-only queries over tutors and the subjects they teach.
 */
@Repository
public class TutorRepository {

    static final String SEARCH_SQL = """
            SELECT P.id_professor, P.nome, P.valor_hora, M.nome_materia
            FROM Professores P
            JOIN Conexao_Prof_Materias CPM ON P.id_professor = CPM.id_professor
            JOIN Materias M ON CPM.id_materia = M.id_materia
            WHERE 1=1
            """;

    static final String SUBJECT_FILTER = " AND M.nome_materia = ?";

    private static final RowMapper<TutorSubject> ROW_MAPPER = (rs, rowNum) -> new TutorSubject(
            rs.getLong("id_professor"),
            rs.getString("nome"),
            Money.toDouble(rs.getBigDecimal("valor_hora")),
            rs.getString("nome_materia")
    );

    /**
     * Lists tutor/subject pairs, optionally restricted to one subject name.
     *
     * @param session     open session
     * @param subjectName exact subject name; empty for all pairs
     * @return one entry per tutor/subject pair
     */
    public List<TutorSubject> search(DatabaseSession session, Optional<String> subjectName) {
        StringBuilder sql = new StringBuilder(SEARCH_SQL);
        List<Object> args = new ArrayList<>();
        subjectName.ifPresent(name -> {
            sql.append(SUBJECT_FILTER);
            args.add(name);
        });
        sql.append(" ORDER BY P.id_professor, M.nome_materia");
        return session.jdbc().query(sql.toString(), ROW_MAPPER, args.toArray());
    }
}

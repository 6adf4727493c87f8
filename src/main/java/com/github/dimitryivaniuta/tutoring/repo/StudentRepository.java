package com.github.dimitryivaniuta.tutoring.repo;

import com.github.dimitryivaniuta.tutoring.db.DatabaseSession;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Repository;

/**
 * Statements over {@code Alunos}.
 */
@Repository
public class StudentRepository {

    /** Column holding the student name. */
    public static final String NAME_COLUMN = "nome";

    private static final Set<String> UPDATABLE_COLUMNS = Set.of(NAME_COLUMN);

    /**
     * Inserts a student. Uniqueness of the national id is left to the database.
     *
     * @param session    open session
     * @param name       student name
     * @param nationalId national id (CPF)
     */
    public void insert(DatabaseSession session, String name, String nationalId) {
        session.jdbc().update("INSERT INTO Alunos (nome, cpf) VALUES (?, ?)", name, nationalId);
    }

    /**
     * Checks whether a student with the given national id exists.
     *
     * @param session    open session
     * @param nationalId national id (CPF)
     * @return true if found
     */
    public boolean existsByNationalId(DatabaseSession session, String nationalId) {
        Integer count = session.jdbc().queryForObject(
                "SELECT COUNT(*) FROM Alunos WHERE cpf = ?", Integer.class, nationalId);
        return count != null && count > 0;
    }

    /**
     * Updates the supplied columns of the student identified by national id.
     *
     * @param session    open session
     * @param nationalId national id (CPF)
     * @param fields     column to new value, insertion ordered; must not be empty
     * @return affected rows
     */
    public int updateByNationalId(DatabaseSession session, String nationalId, Map<String, Object> fields) {
        if (fields.isEmpty()) {
            throw new IllegalArgumentException("At least one field is required for an update");
        }
        List<String> assignments = new ArrayList<>();
        List<Object> args = new ArrayList<>();
        fields.forEach((column, value) -> {
            if (!UPDATABLE_COLUMNS.contains(column)) {
                throw new IllegalArgumentException("Column '" + column + "' is not updatable");
            }
            assignments.add(column + " = ?");
            args.add(value);
        });
        args.add(nationalId);
        String sql = "UPDATE Alunos SET " + String.join(", ", assignments) + " WHERE cpf = ?";
        return session.jdbc().update(sql, args.toArray());
    }
}

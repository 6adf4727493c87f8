package com.github.dimitryivaniuta.tutoring.repo;

import com.github.dimitryivaniuta.tutoring.db.DatabaseSession;
import java.sql.PreparedStatement;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;

/**
 * Runs an insert and returns the generated identity column.
 */
final class GeneratedKeys {

    private GeneratedKeys() {
    }

    static long insert(DatabaseSession session, String sql, String keyColumn, Object... args) {
        KeyHolder keys = new GeneratedKeyHolder();
        session.jdbc().update(con -> {
            PreparedStatement ps = con.prepareStatement(sql, new String[]{keyColumn});
            for (int i = 0; i < args.length; i++) {
                ps.setObject(i + 1, args[i]);
            }
            return ps;
        }, keys);
        Number key = keys.getKey();
        if (key == null) {
            throw new DataRetrievalFailureException("No generated key returned for " + keyColumn);
        }
        return key.longValue();
    }
}

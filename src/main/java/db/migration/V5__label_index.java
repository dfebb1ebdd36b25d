package db.migration;

import java.sql.Connection;

import org.flywaydb.core.api.migration.BaseJavaMigration;
import org.flywaydb.core.api.migration.Context;

/** Stable label ordinal per volume, plus the discovered counter. */
public final class V5__label_index extends BaseJavaMigration {

    @Override
    public void migrate(Context context) throws Exception {
        Connection conn = context.getConnection();
        MigrationSupport.addColumnIfMissing(conn, "volumes", "label_index", "INTEGER");
        MigrationSupport.addColumnIfMissing(conn, "volumes", "discovered_count", "INTEGER NOT NULL DEFAULT 0");

        // existing volumes get ordinals in creation order
        MigrationSupport.execAll(conn,
                """
                UPDATE volumes
                   SET label_index = (
                       SELECT COUNT(*) FROM volumes v2 WHERE v2.rowid <= volumes.rowid
                   )
                 WHERE label_index IS NULL
                """,
                """
                UPDATE volumes
                   SET discovered_count = (
                       SELECT COUNT(*) FROM events e
                        WHERE e.volume_id = volumes.volume_id AND e.event_type = 'discovered'
                   )
                """,
                "CREATE UNIQUE INDEX IF NOT EXISTS idx_volumes_label_index ON volumes(label_index)");
    }
}

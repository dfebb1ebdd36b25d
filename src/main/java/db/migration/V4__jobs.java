package db.migration;

import org.flywaydb.core.api.migration.BaseJavaMigration;
import org.flywaydb.core.api.migration.Context;

public final class V4__jobs extends BaseJavaMigration {

    @Override
    public void migrate(Context context) throws Exception {
        MigrationSupport.execAll(context.getConnection(),
                """
                CREATE TABLE IF NOT EXISTS jobs (
                    job_id TEXT PRIMARY KEY,
                    job_type TEXT NOT NULL,
                    path TEXT NOT NULL,
                    volume_id TEXT,
                    status TEXT NOT NULL,
                    progress_json TEXT,
                    owner_pid INTEGER,
                    owner_host TEXT,
                    error_message TEXT,
                    started_at TEXT NOT NULL,
                    updated_at TEXT NOT NULL,
                    completed_at TEXT
                )
                """,
                "CREATE INDEX IF NOT EXISTS idx_jobs_status ON jobs(status)",
                "CREATE INDEX IF NOT EXISTS idx_jobs_volume ON jobs(volume_id)");
    }
}

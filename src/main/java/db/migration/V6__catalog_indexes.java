package db.migration;

import org.flywaydb.core.api.migration.BaseJavaMigration;
import org.flywaydb.core.api.migration.Context;

public final class V6__catalog_indexes extends BaseJavaMigration {

    @Override
    public void migrate(Context context) throws Exception {
        MigrationSupport.execAll(context.getConnection(),
                "CREATE INDEX IF NOT EXISTS idx_events_volume_path ON events(volume_id, path)",
                "CREATE INDEX IF NOT EXISTS idx_files_last_event_timestamp ON files(last_event_timestamp)",
                "CREATE INDEX IF NOT EXISTS idx_volumes_last_event_timestamp ON volumes(last_event_timestamp)");
    }
}

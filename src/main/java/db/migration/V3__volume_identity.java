package db.migration;

import java.sql.Connection;

import org.flywaydb.core.api.migration.BaseJavaMigration;
import org.flywaydb.core.api.migration.Context;

/** Identity snapshot columns captured from the mount table and lsblk. */
public final class V3__volume_identity extends BaseJavaMigration {

    private static final String[] TEXT_COLUMNS = {
            "mount_device", "mount_point", "mount_fstype", "mount_uuid", "mount_label", "mount_volume_id",
            "lsblk_name", "lsblk_path", "lsblk_model", "lsblk_serial", "lsblk_vendor", "lsblk_size",
            "lsblk_fsver", "lsblk_pttype", "lsblk_ptuuid", "lsblk_parttype", "lsblk_partuuid",
            "lsblk_parttypename", "lsblk_wwn", "lsblk_maj_min", "lsblk_json",
            "identity_source", "identity_refreshed_at"
    };

    @Override
    public void migrate(Context context) throws Exception {
        Connection conn = context.getConnection();
        for (String column : TEXT_COLUMNS) {
            MigrationSupport.addColumnIfMissing(conn, "volumes", column, "TEXT");
        }
    }
}

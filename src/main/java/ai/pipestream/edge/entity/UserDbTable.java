package ai.pipestream.edge.entity;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;

/**
 * A tenant-declared JSON document table.
 * <p>
 * {@code pkPath} and {@code tsPath} are fixed at creation. Documents and index entries are keyed
 * by {@code phyTable}, never by the logical name, so the logical name can change without moving
 * stored data.
 * <p>
 * Database Table: {@code userdb_tables}
 */
@Entity
@Table(name = "userdb_tables", uniqueConstraints = {
    @UniqueConstraint(name = "uniq_user_tbl", columnNames = {"user_id", "table_name"}),
    @UniqueConstraint(name = "uniq_phy_table", columnNames = {"phy_table"})
})
public class UserDbTable extends PanacheEntityBase {

    public static final String DEFAULT_TS_PATH = "$.updated_at";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    public Long id;

    @Column(name = "user_id", nullable = false)
    public String userId;

    @Column(name = "table_name", nullable = false)
    public String tableName;

    /**
     * Physical storage identifier; see {@code PhysicalTableNames}.
     */
    @Column(name = "phy_table", nullable = false, length = 64)
    public String phyTable;

    @Column(name = "pk_path", nullable = false, updatable = false)
    public String pkPath;

    @Column(name = "ts_path", nullable = false, updatable = false)
    public String tsPath = DEFAULT_TS_PATH;

    /**
     * Creation time, epoch seconds.
     */
    @Column(name = "created_at", nullable = false)
    public Long createdAt;

    public UserDbTable() {}

    public UserDbTable(String userId, String tableName, String phyTable,
                       String pkPath, String tsPath, long createdAt) {
        this.userId = userId;
        this.tableName = tableName;
        this.phyTable = phyTable;
        this.pkPath = pkPath;
        this.tsPath = tsPath != null ? tsPath : DEFAULT_TS_PATH;
        this.createdAt = createdAt;
    }
}

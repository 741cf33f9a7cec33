package ai.pipestream.edge.entity;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;

/**
 * One entry of a typed secondary index: the value a document carries at the index's JSON path.
 * <p>
 * Only the value column matching the index's {@link ColumnType} is populated:
 * {@code stringValue} for strings, {@code numberValue} for numbers, {@code longValue} for
 * integers and datetimes (epoch millis), {@code booleanValue} for booleans. Documents with no
 * value at the path have no entry.
 * <p>
 * Database Table: {@code userdb_index_entries}
 */
@Entity
@Table(name = "userdb_index_entries",
    uniqueConstraints = {
        @UniqueConstraint(name = "uniq_entry", columnNames = {"phy_table", "col_name", "pk"})
    },
    indexes = {
        @Index(name = "idx_entry_string", columnList = "phy_table, col_name, string_value"),
        @Index(name = "idx_entry_number", columnList = "phy_table, col_name, number_value"),
        @Index(name = "idx_entry_long", columnList = "phy_table, col_name, long_value"),
        @Index(name = "idx_entry_boolean", columnList = "phy_table, col_name, boolean_value")
    })
public class UserDocumentIndexEntry extends PanacheEntityBase {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    public Long id;

    @Column(name = "phy_table", nullable = false, length = 64)
    public String phyTable;

    @Column(name = "col_name", nullable = false, length = 64)
    public String colName;

    @Column(name = "pk", nullable = false, length = 191)
    public String pk;

    @Column(name = "string_value")
    public String stringValue;

    @Column(name = "number_value")
    public Double numberValue;

    @Column(name = "long_value")
    public Long longValue;

    @Column(name = "boolean_value")
    public Boolean booleanValue;

    public UserDocumentIndexEntry() {}
}

package ai.pipestream.edge.entity;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;

/**
 * A typed secondary index declared over a JSON path of a {@link UserDbTable}.
 * <p>
 * Database Table: {@code userdb_table_indexes}
 */
@Entity
@Table(name = "userdb_table_indexes", uniqueConstraints = {
    @UniqueConstraint(name = "uniq_idx", columnNames = {"user_id", "table_name", "col_name"})
})
public class UserDbTableIndex extends PanacheEntityBase {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    public Long id;

    @Column(name = "user_id", nullable = false)
    public String userId;

    @Column(name = "table_name", nullable = false)
    public String tableName;

    @Column(name = "col_name", nullable = false, length = 64)
    public String colName;

    @Column(name = "json_path", nullable = false)
    public String jsonPath;

    @Convert(converter = ColumnTypeConverter.class)
    @Column(name = "col_type", nullable = false, length = 16)
    public ColumnType colType = ColumnType.STRING;

    public UserDbTableIndex() {}

    public UserDbTableIndex(String userId, String tableName, String colName,
                            String jsonPath, ColumnType colType) {
        this.userId = userId;
        this.tableName = tableName;
        this.colName = colName;
        this.jsonPath = jsonPath;
        this.colType = colType;
    }
}

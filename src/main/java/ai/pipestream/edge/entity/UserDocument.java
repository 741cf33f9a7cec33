package ai.pipestream.edge.entity;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;
import org.hibernate.Length;

/**
 * A document stored in a UserDB table.
 * <p>
 * All UserDB tables share this generic document table; {@code phyTable} scopes a document to its
 * owning table and {@code pk} is the primary-key value extracted from the document, rendered as
 * text. {@code ts} is the extracted timestamp, in epoch milliseconds, used for last-writer-wins.
 * <p>
 * Database Table: {@code userdb_documents}
 */
@Entity
@Table(name = "userdb_documents",
    uniqueConstraints = {
        @UniqueConstraint(name = "uniq_phy_pk", columnNames = {"phy_table", "pk"})
    },
    indexes = {
        @Index(name = "idx_phy_ts", columnList = "phy_table, ts")
    })
public class UserDocument extends PanacheEntityBase {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    public Long id;

    @Column(name = "phy_table", nullable = false, length = 64)
    public String phyTable;

    @Column(name = "pk", nullable = false, length = 191)
    public String pk;

    @Column(name = "item", nullable = false, length = Length.LONG32)
    public String item;

    @Column(name = "ts", nullable = false)
    public Long ts;

    public UserDocument() {}

    public UserDocument(String phyTable, String pk, String item, long ts) {
        this.phyTable = phyTable;
        this.pk = pk;
        this.item = item;
        this.ts = ts;
    }
}

package ai.pipestream.edge.entity;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;
import org.hibernate.Length;

/**
 * One item of a dataset version. Rows are written in the same transaction as their
 * {@link GlobalMirrorVersion} and never mutated afterwards; {@code id} preserves insertion order.
 * <p>
 * Database Table: {@code global_rows}
 */
@Entity
@Table(name = "global_rows", indexes = {
    @Index(name = "idx_dataset_version", columnList = "dataset_id, version")
})
public class GlobalRow extends PanacheEntityBase {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    public Long id;

    @Column(name = "dataset_id", nullable = false)
    public String datasetId;

    @Column(name = "version", nullable = false)
    public String version;

    /**
     * Item as JSON text.
     */
    @Column(name = "item", nullable = false, length = Length.LONG32)
    public String item;

    public GlobalRow() {}

    public GlobalRow(String datasetId, String version, String item) {
        this.datasetId = datasetId;
        this.version = version;
        this.item = item;
    }
}

package ai.pipestream.edge.entity;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;
import org.hibernate.Length;

/**
 * One materialized item of a tenant's view log.
 * <p>
 * The log is append-only and carries no uniqueness constraint: each materialization run appends
 * a fresh set of rows. Readers that need the latest value per key derive it from {@code ts}.
 * <p>
 * Database Table: {@code user_views}
 */
@Entity
@Table(name = "user_views", indexes = {
    @Index(name = "idx_user_dataset_version", columnList = "user_id, dataset_id, version")
})
public class UserView extends PanacheEntityBase {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    public Long id;

    @Column(name = "user_id", nullable = false)
    public String userId;

    @Column(name = "dataset_id", nullable = false)
    public String datasetId;

    @Column(name = "version", nullable = false)
    public String version;

    @Column(name = "item", nullable = false, length = Length.LONG32)
    public String item;

    @Column(name = "ts", nullable = false)
    public Long ts;

    public UserView() {}

    public UserView(String userId, String datasetId, String version, String item, long ts) {
        this.userId = userId;
        this.datasetId = datasetId;
        this.version = version;
        this.item = item;
        this.ts = ts;
    }
}

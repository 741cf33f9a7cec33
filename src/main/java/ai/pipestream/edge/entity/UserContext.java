package ai.pipestream.edge.entity;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;
import org.hibernate.Length;

/**
 * Per-tenant personalization input for a dataset. Exactly one row per (user, dataset),
 * overwritten in place; no history is kept.
 * <p>
 * Database Table: {@code user_contexts}
 */
@Entity
@Table(name = "user_contexts", uniqueConstraints = {
    @UniqueConstraint(name = "uniq_user_dataset", columnNames = {"user_id", "dataset_id"})
})
public class UserContext extends PanacheEntityBase {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    public Long id;

    @Column(name = "user_id", nullable = false)
    public String userId;

    @Column(name = "dataset_id", nullable = false)
    public String datasetId;

    /**
     * Context document as JSON text.
     */
    @Column(name = "ctx", nullable = false, length = Length.LONG32)
    public String ctx;

    @Column(name = "ts", nullable = false)
    public Long ts;

    public UserContext() {}

    public UserContext(String userId, String datasetId, String ctx, long ts) {
        this.userId = userId;
        this.datasetId = datasetId;
        this.ctx = ctx;
        this.ts = ts;
    }
}

package ai.pipestream.edge.entity;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;

/**
 * One published snapshot of a global dataset.
 * <p>
 * The checksum is fixed once the version exists; a republish with a different checksum is
 * rejected rather than applied. The "latest" version is never stored as a pointer: it is derived
 * from {@code ts}, with {@code id} (insertion order) breaking ties.
 * <p>
 * Database Table: {@code global_mirror_versions}
 */
@Entity
@Table(name = "global_mirror_versions", uniqueConstraints = {
    @UniqueConstraint(name = "uniq_dataset_version", columnNames = {"dataset_id", "version"})
})
public class GlobalMirrorVersion extends PanacheEntityBase {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    public Long id;

    @Column(name = "dataset_id", nullable = false)
    public String datasetId;

    @Column(name = "version", nullable = false)
    public String version;

    /**
     * Checksum supplied by the publishing authority (hex, at most 64 chars).
     */
    @Column(name = "checksum", nullable = false, length = 64, updatable = false)
    public String checksum;

    /**
     * Publication timestamp, epoch seconds.
     */
    @Column(name = "ts", nullable = false)
    public Long ts;

    /**
     * Default constructor for JPA.
     */
    public GlobalMirrorVersion() {}

    public GlobalMirrorVersion(String datasetId, String version, String checksum, long ts) {
        this.datasetId = datasetId;
        this.version = version;
        this.checksum = checksum;
        this.ts = ts;
    }
}

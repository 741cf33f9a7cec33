package ai.pipestream.edge.entity;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;

import java.time.OffsetDateTime;

/**
 * Process-wide readiness marker. A single row with id 1 exists once schema provisioning has
 * completed.
 * <p>
 * Database Table: {@code init_complete}
 */
@Entity
@Table(name = "init_complete")
public class InitMarker extends PanacheEntityBase {

    public static final int MARKER_ID = 1;

    @Id
    @Column(name = "id")
    public Integer id = MARKER_ID;

    @Column(name = "completed_at", nullable = false)
    public OffsetDateTime completedAt;

    public InitMarker() {}
}

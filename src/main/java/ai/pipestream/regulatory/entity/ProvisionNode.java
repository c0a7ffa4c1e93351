package ai.pipestream.regulatory.entity;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;

import java.util.List;
import java.util.UUID;

/**
 * Node of the provision tree of a {@link ParsedDocument}.
 * <p>
 * {@link #path} is unique within the document and always has the parent's path
 * as prefix, e.g. {@code /clanak:28/stavak:1/tocka:a}. {@link #sortKey} orders
 * nodes in document order.
 */
@Entity
@Table(name = "provision_nodes", uniqueConstraints = {
        @UniqueConstraint(name = "uq_provision_node_path", columnNames = {"parsed_document_id", "path"})
})
public class ProvisionNode extends PanacheEntityBase {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    public UUID id;

    @Column(name = "parsed_document_id", nullable = false)
    public UUID parsedDocumentId;

    @Column(name = "parent_id")
    public UUID parentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "node_type", nullable = false, length = 32)
    public ProvisionNodeType nodeType;

    @Column(nullable = false, length = 1024)
    public String path;

    @Column(name = "sort_key", nullable = false, length = 512)
    public String sortKey;

    @Column(length = 128)
    public String label;

    @Column(name = "order_index", nullable = false)
    public int orderIndex;

    @Column(nullable = false)
    public int depth;

    @Column(name = "raw_text", columnDefinition = "text")
    public String rawText;

    @Column(name = "normalized_text", columnDefinition = "text")
    public String normalizedText;

    @Column(name = "start_offset", nullable = false)
    public int startOffset;

    @Column(name = "end_offset", nullable = false)
    public int endOffset;

    public static List<ProvisionNode> listForDocument(UUID parsedDocumentId) {
        return list("parsedDocumentId = ?1 order by sortKey", parsedDocumentId);
    }
}

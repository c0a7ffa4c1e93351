package ai.pipestream.regulatory.parser;

import ai.pipestream.regulatory.config.PipelineConfiguration;
import ai.pipestream.regulatory.entity.ArtifactKind;
import ai.pipestream.regulatory.entity.ContentClass;
import ai.pipestream.regulatory.entity.Evidence;
import ai.pipestream.regulatory.entity.EvidenceArtifact;
import ai.pipestream.regulatory.entity.ParseStatus;
import ai.pipestream.regulatory.entity.ParsedDocument;
import ai.pipestream.regulatory.entity.OcrStatus;
import ai.pipestream.regulatory.entity.ProvisionNode;
import ai.pipestream.regulatory.evidence.EvidenceStore;
import ai.pipestream.regulatory.exception.EntityNotFoundException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs the structural parser over an evidence row and keeps exactly one latest parse per evidence.
 */
@ApplicationScoped
public class ParsedDocumentService {

    private static final Logger LOG = Logger.getLogger(ParsedDocumentService.class);

    @Inject
    StructuralParser parser;

    @Inject
    EvidenceStore evidenceStore;

    @Inject
    PipelineConfiguration config;

    @Inject
    ObjectMapper objectMapper;

    /**
     * Live evidence without a latest parse. Scanned PDFs only qualify once OCR completed.
     */
    @Transactional
    public List<UUID> findUnparsedEvidence(int limit) {
        return Evidence.getEntityManager().createQuery("""
                        select e.id from Evidence e
                        where e.deletedAt is null
                          and (e.contentClass <> :scanned or e.ocrStatus = :ocrDone)
                          and not exists (select d.id from ParsedDocument d where d.evidenceId = e.id and d.latest = true)
                        order by e.fetchedAt""", UUID.class)
                .setParameter("scanned", ContentClass.PDF_SCANNED)
                .setParameter("ocrDone", OcrStatus.COMPLETED)
                .setMaxResults(limit)
                .getResultList();
    }

    /**
     * Parses the evidence and makes the result its latest parse.
     * <p>
     * Flipping the previous latest row and inserting the new one happen in one
     * transaction. Re-parsing with the same parser identity and the same text
     * returns the current latest row.
     *
     * @return the latest parse, or empty when a scanned PDF has no OCR text yet
     */
    @Transactional
    public Optional<ParsedDocument> parseLatest(UUID evidenceId) {
        Evidence evidence = Evidence.findLive(evidenceId)
                .orElseThrow(() -> EntityNotFoundException.evidence(evidenceId));

        Optional<EvidenceArtifact> artifact = sourceArtifact(evidence);
        if (evidence.contentClass == ContentClass.PDF_SCANNED && artifact.isEmpty()) {
            LOG.debugf("Skipping parse, OCR text not available: evidenceId=%s", evidenceId);
            return Optional.empty();
        }
        String content = artifact.map(a -> a.content).orElse(evidence.rawContent);

        String parserId = config.parser().id();
        String parserVersion = config.parser().version();
        String configHash = parser.configHash();
        ParseResult result = parser.parse(content);

        Optional<ParsedDocument> current = ParsedDocument.findLatest(evidenceId);
        if (current.isPresent() && sameParse(current.get(), parserId, parserVersion, configHash, result)) {
            LOG.debugf("Parse unchanged: evidenceId=%s, parsedDocumentId=%s", evidenceId, current.get().id);
            return current;
        }

        current.ifPresent(previous -> {
            previous.latest = false;
            ParsedDocument.flush();
        });

        ParsedDocument document = new ParsedDocument();
        document.evidenceId = evidenceId;
        document.artifactId = artifact.map(a -> a.id).orElse(null);
        document.parserId = parserId;
        document.parserVersion = parserVersion;
        document.parseConfigHash = configHash;
        document.status = result.status();
        document.cleanText = result.cleanText();
        document.cleanTextHash = result.cleanTextHash();
        document.coveragePercent = result.coveragePercent();
        document.nodeCount = result.nodeCount();
        document.nodeTypeCounts = toJson(result.nodeCounts());
        document.warnings = toJson(result.warnings());
        document.latest = true;
        document.createdAt = Instant.now();
        document.persist();

        current.ifPresent(previous -> previous.supersededById = document.id);

        Map<String, UUID> idsByPath = new HashMap<>();
        for (ParsedNode parsed : result.nodes()) {
            ProvisionNode node = new ProvisionNode();
            node.parsedDocumentId = document.id;
            node.parentId = parsed.parentPath() == null ? null : idsByPath.get(parsed.parentPath());
            node.nodeType = parsed.type();
            node.path = parsed.path();
            node.sortKey = parsed.sortKey();
            node.label = parsed.label();
            node.orderIndex = parsed.orderIndex();
            node.depth = parsed.depth();
            node.rawText = parsed.rawText();
            node.normalizedText = parsed.normalizedText();
            node.startOffset = parsed.startOffset();
            node.endOffset = parsed.endOffset();
            node.persist();
            idsByPath.put(node.path, node.id);
        }

        if (result.status() != ParseStatus.FAILED) {
            evidenceStore.addArtifact(evidenceId, ArtifactKind.PARSED_CLEAN_TEXT, result.cleanText(), null);
        }

        LOG.infof("Parsed evidence: evidenceId=%s, parsedDocumentId=%s, status=%s, nodes=%d, coverage=%.2f%%, supersedes=%s",
                evidenceId, document.id, result.status(), result.nodeCount(), result.coveragePercent(),
                current.map(p -> p.id).orElse(null));
        if (!result.warnings().isEmpty()) {
            LOG.warnf("Parser warnings for evidenceId=%s: %s", evidenceId, result.warnings());
        }
        return Optional.of(document);
    }

    private static Optional<EvidenceArtifact> sourceArtifact(Evidence evidence) {
        if (evidence.contentClass == ContentClass.PDF_SCANNED) {
            return EvidenceArtifact.findLatest(evidence.id, ArtifactKind.OCR_TEXT);
        }
        return EvidenceArtifact.findLatest(evidence.id, ArtifactKind.CLEAN_TEXT);
    }

    private static boolean sameParse(ParsedDocument current, String parserId, String parserVersion,
                                     String configHash, ParseResult result) {
        return current.parserId.equals(parserId)
                && current.parserVersion.equals(parserVersion)
                && current.parseConfigHash.equals(configHash)
                && current.cleanTextHash.equals(result.cleanTextHash());
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize parse statistics", e);
        }
    }
}

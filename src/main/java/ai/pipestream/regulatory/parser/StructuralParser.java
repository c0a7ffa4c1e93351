package ai.pipestream.regulatory.parser;

import ai.pipestream.regulatory.entity.EvidenceArtifact;

/**
 * Parses source text into a provision tree.
 */
public interface StructuralParser {

    ParseResult parse(String content);

    default ParseResult parse(EvidenceArtifact artifact) {
        return parse(artifact.content);
    }

    /**
     * Hash of everything that changes parser output besides its id and version.
     */
    String configHash();
}

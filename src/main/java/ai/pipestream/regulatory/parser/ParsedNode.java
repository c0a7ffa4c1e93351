package ai.pipestream.regulatory.parser;

import ai.pipestream.regulatory.entity.ProvisionNodeType;

/**
 * Parser output for one provision node. {@code parentPath} is null only for the root.
 */
public record ParsedNode(ProvisionNodeType type,
                         String path,
                         String parentPath,
                         String label,
                         int orderIndex,
                         int depth,
                         String sortKey,
                         String rawText,
                         String normalizedText,
                         int startOffset,
                         int endOffset) {
}

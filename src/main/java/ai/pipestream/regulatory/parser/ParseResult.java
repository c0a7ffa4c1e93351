package ai.pipestream.regulatory.parser;

import ai.pipestream.regulatory.entity.ParseStatus;
import ai.pipestream.regulatory.entity.ProvisionNodeType;

import java.util.List;
import java.util.Map;

/**
 * Result of a structural parse.
 *
 * @param nodes          nodes ordered by depth, then document order
 * @param coveragePercent share of clean-text characters that belong to a structural node, 0..100
 */
public record ParseResult(List<ParsedNode> nodes,
                          String cleanText,
                          String cleanTextHash,
                          double coveragePercent,
                          Map<ProvisionNodeType, Integer> nodeCounts,
                          List<String> warnings,
                          ParseStatus status) {

    public int nodeCount() {
        return nodes.size();
    }
}

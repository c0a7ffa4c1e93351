package ai.pipestream.regulatory.evidence;

import ai.pipestream.regulatory.entity.Evidence;

import java.util.Optional;

/**
 * Resolves soft evidence references. An empty result means the pointer is orphaned.
 */
public interface EvidenceLookup {

    Optional<Evidence> resolve(EvidenceRef ref);

    /**
     * Text that quotes from this evidence are checked against, if any is available yet.
     */
    Optional<String> groundingText(Evidence evidence);
}

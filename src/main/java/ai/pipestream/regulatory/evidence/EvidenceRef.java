package ai.pipestream.regulatory.evidence;

import java.util.Objects;
import java.util.UUID;

/**
 * Typed id of an evidence row held outside the rule store.
 * <p>
 * There is no foreign key behind this reference. The row may have been merged
 * or never existed, so every dereference goes through {@link EvidenceLookup}
 * and has to handle the empty case.
 */
public record EvidenceRef(UUID id) {

    public EvidenceRef {
        Objects.requireNonNull(id, "evidence id");
    }
}

package ai.pipestream.regulatory.util;

import com.google.common.base.Joiner;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;

/**
 * SHA-256 helpers. All hashes are lower-case hex.
 */
public final class ContentHashing {

    private static final Joiner PIPE = Joiner.on('|').useForNull("");

    private ContentHashing() {
    }

    public static String sha256Hex(String content) {
        return Hashing.sha256().hashString(content, StandardCharsets.UTF_8).toString();
    }

    public static String sha256Hex(byte[] content) {
        return Hashing.sha256().hashBytes(content).toString();
    }

    /**
     * Hash of a composite key whose parts are joined with {@code |}. Null parts hash as empty.
     */
    public static String compositeKeyHash(Object... parts) {
        return sha256Hex(PIPE.join(parts));
    }
}

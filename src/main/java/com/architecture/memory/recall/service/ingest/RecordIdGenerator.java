package com.architecture.memory.recall.service.ingest;

import com.architecture.memory.recall.model.RetrievalUnit;
import com.architecture.memory.recall.model.UnitType;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.UUID;

/**
 * Generates stable record ids for retrieval units.
 * <p>
 * The id is a name-based UUID (version 5, SHA-1) in the URL namespace over the key
 * {@code file::type::symbol::name::start-end}. It depends on content identity only, so
 * re-ingesting unchanged content overwrites the same records.
 */
@Component
public class RecordIdGenerator {

    static final UUID NAMESPACE_URL = UUID.fromString("6ba7b811-9dad-11d1-80b4-00c04fd430c8");

    public String generate(String file, RetrievalUnit unit) {
        return generate(file, UnitType.labelOf(unit.getType()), unit.getSymbol(), unit.getName(),
                unit.getStartLine(), unit.getEndLine());
    }

    public String generate(String file, String type, String symbol, String name, int startLine, int endLine) {
        String key = String.format("%s::%s::%s::%s::%d-%d",
                file, type, symbol == null ? "" : symbol, name == null ? "" : name, startLine, endLine);
        return nameBasedSha1(NAMESPACE_URL, key).toString();
    }

    static UUID nameBasedSha1(UUID namespace, String name) {
        MessageDigest sha1;
        try {
            sha1 = MessageDigest.getInstance("SHA-1");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
        sha1.update(ByteBuffer.allocate(16)
                .putLong(namespace.getMostSignificantBits())
                .putLong(namespace.getLeastSignificantBits())
                .array());
        byte[] hash = sha1.digest(name.getBytes(StandardCharsets.UTF_8));

        hash[6] &= 0x0f;
        hash[6] |= 0x50;  // version 5
        hash[8] &= 0x3f;
        hash[8] |= (byte) 0x80;  // IETF variant

        ByteBuffer buffer = ByteBuffer.wrap(hash, 0, 16);
        return new UUID(buffer.getLong(), buffer.getLong());
    }
}

package com.controlsdashboard.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;
import java.util.UUID;

/**
 * Generates primary keys for part, prop and link rows.
 *
 * <p>In {@code deterministic} mode the key is a name-based UUID over the owning control id, the
 * satellite kind and the element's structural path below the control, so re-ingesting an unchanged
 * catalog writes the same keys again. {@code random} mode issues a fresh UUID per occurrence.
 */
@Service
public class SatelliteKeyService {

    private static final Logger logger = LoggerFactory.getLogger(SatelliteKeyService.class);

    public enum Strategy { DETERMINISTIC, RANDOM }

    private final MessageDigest digest;
    private final Strategy strategy;

    @Autowired
    public SatelliteKeyService(@Value("${app.catalog.satellite-ids:deterministic}") String strategy) {
        this(Strategy.valueOf(strategy.trim().toUpperCase(Locale.ROOT)));
    }

    public SatelliteKeyService(Strategy strategy) {
        try {
            this.digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            logger.error("Could not initialize SHA-256 MessageDigest", e);
            throw new RuntimeException("Failed to initialize satellite key service", e);
        }
        this.strategy = strategy;
    }

    Strategy getStrategy() {
        return strategy;
    }

    /**
     * Key for one satellite row.
     *
     * @param controlId      owning control
     * @param kind           {@code part}, {@code prop} or {@code link}
     * @param structuralPath element path below the control, see {@code OscalXml.elementPath}
     */
    public String satelliteId(String controlId, String kind, String structuralPath) {
        if (strategy == Strategy.RANDOM) {
            return UUID.randomUUID().toString();
        }
        return nameUuid(controlId + "|" + kind + "|" + structuralPath).toString();
    }

    private synchronized byte[] sha256(String content) {
        return digest.digest(content.getBytes(StandardCharsets.UTF_8));
    }

    // Version-5 style layout over the first 16 digest bytes
    private UUID nameUuid(String name) {
        byte[] hash = sha256(name);
        hash[6] &= 0x0f;
        hash[6] |= 0x50;
        hash[8] &= 0x3f;
        hash[8] |= (byte) 0x80;
        ByteBuffer buffer = ByteBuffer.wrap(hash, 0, 16);
        return new UUID(buffer.getLong(), buffer.getLong());
    }
}

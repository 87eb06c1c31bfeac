package com.investbyyourself.etl.service;

import com.investbyyourself.etl.model.TransformedRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * SHA-256 checksums for records and order-independent version ids for record sets.
 */
@Service
public class ContentHashingService {

    private static final Logger logger = LoggerFactory.getLogger(ContentHashingService.class);

    private final MessageDigest digest;
    private final RecordJsonCodec codec;

    public ContentHashingService(RecordJsonCodec codec) {
        this.codec = codec;
        try {
            this.digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            logger.error("Could not initialize SHA-256 MessageDigest", e);
            throw new IllegalStateException("Failed to initialize hashing service", e);
        }
    }

    public synchronized String hash(String content) {
        if (content == null) {
            return null;
        }
        byte[] encodedhash = digest.digest(content.getBytes(StandardCharsets.UTF_8));
        return bytesToHex(encodedhash);
    }

    /**
     * Checksum of the record's canonical JSON.
     */
    public String recordChecksum(TransformedRecord record) {
        return hash(codec.toJson(record));
    }

    /**
     * Version id of a record set given its record checksums. Checksums are sorted first,
     * so the id does not depend on order; duplicates count.
     */
    public String versionId(Collection<String> recordChecksums) {
        List<String> sorted = new ArrayList<>(recordChecksums);
        Collections.sort(sorted);
        return hash(String.join("\n", sorted));
    }

    private String bytesToHex(byte[] hash) {
        StringBuilder hexString = new StringBuilder(2 * hash.length);
        for (byte b : hash) {
            String hex = Integer.toHexString(0xff & b);
            if (hex.length() == 1) {
                hexString.append('0');
            }
            hexString.append(hex);
        }
        return hexString.toString();
    }
}

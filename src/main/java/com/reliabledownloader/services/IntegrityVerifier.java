package com.reliabledownloader.services;

import com.reliabledownloader.models.ServerCapabilities;
import com.reliabledownloader.models.TransferOutcome;
import com.reliabledownloader.utils.DestinationFiles;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

@Component
@Slf4j
public class IntegrityVerifier {

    public static final String ALGORITHM = "MD5";

    public static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " is not available", e);
        }
    }

    /**
     * Accepts the file when the server declared no hash. On mismatch the file is deleted.
     */
    public TransferOutcome verify(byte[] computedHash, ServerCapabilities capabilities, Path destination) {
        if (!capabilities.hasDeclaredHash()) {
            log.debug("No declared content hash for {}, accepting without verification", destination);
            return TransferOutcome.SUCCESS;
        }

        byte[] declared = capabilities.declaredContentHash();
        if (MessageDigest.isEqual(declared, computedHash)) {
            log.info("Integrity verified for {}", destination);
            return TransferOutcome.SUCCESS;
        }

        log.warn("Integrity check failed for {}: declared {} but computed {}", destination,
                HexFormat.of().formatHex(declared), HexFormat.of().formatHex(computedHash));
        DestinationFiles.deleteQuietly(destination);
        return TransferOutcome.INTEGRITY_FAILURE;
    }
}

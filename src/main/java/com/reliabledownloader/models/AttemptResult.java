package com.reliabledownloader.models;

// AttemptResult.java
public record AttemptResult(
        TransferOutcome outcome,
        long bytesTransferred,
        byte[] computedHash,
        int probeStatus,
        String message
) {
    public static AttemptResult success(long bytes, byte[] hash) {
        return new AttemptResult(TransferOutcome.SUCCESS, bytes, hash, 0, null);
    }

    public static AttemptResult integrityFailure(long bytes, byte[] hash) {
        return new AttemptResult(TransferOutcome.INTEGRITY_FAILURE, bytes, hash, 0,
                "Content hash does not match the declared hash");
    }

    public static AttemptResult transportFailure(long bytes, String message) {
        return new AttemptResult(TransferOutcome.TRANSPORT_FAILURE, bytes, null, 0, message);
    }

    public static AttemptResult probeFailure(int status) {
        return new AttemptResult(TransferOutcome.TRANSPORT_FAILURE, 0, null, status,
                "Capability probe returned status " + status);
    }

    public static AttemptResult cancelled(long bytes) {
        return new AttemptResult(TransferOutcome.CANCELLED, bytes, null, 0, "Download cancelled");
    }

    public boolean isSuccess() {
        return outcome == TransferOutcome.SUCCESS;
    }

    public boolean isProbeFailure() {
        return probeStatus != 0;
    }
}

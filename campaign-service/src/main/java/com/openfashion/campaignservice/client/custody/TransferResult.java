package com.openfashion.campaignservice.client.custody;

public record TransferResult(
        boolean success,
        String transactionId,
        String reason
) {
    public static TransferResult succeeded(String transactionId) {
        return new TransferResult(true, transactionId, null);
    }

    public static TransferResult failed(String reason) {
        return new TransferResult(false, null, reason);
    }
}

package io.vigil.model;

public record EmitReceipt(String entryId, String executionId, long sequence, long committedAtMs) {
}

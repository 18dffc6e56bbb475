package org.gudu0.whitelistbot.ledger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Blockchain a guild collects addresses for. Stored and typed by users as its short code.
 */
public enum LedgerType {
    ETH("eth"),
    SOL("sol");

    private final String code;

    LedgerType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /** Exact (case-sensitive) code lookup. */
    public static Optional<LedgerType> fromCode(String code) {
        if (code == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(t -> t.code.equals(code))
                .findFirst();
    }

    @JsonCreator
    public static LedgerType fromJson(String code) {
        return fromCode(code).orElse(null);
    }
}

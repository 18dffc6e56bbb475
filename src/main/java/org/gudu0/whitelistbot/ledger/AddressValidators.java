package org.gudu0.whitelistbot.ledger;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Maps a {@link LedgerType} to the predicate that decides whether a submitted text looks like an
 * address on that chain. Shape only: no checksum or decoding.
 */
public final class AddressValidators {

    private static final Pattern EVM_ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");
    /** Solana Base58: 32-44 chars. */
    private static final Pattern SOLANA_ADDRESS = Pattern.compile("^[1-9A-HJ-NP-Za-km-z]{32,44}$");

    private final Map<LedgerType, Predicate<String>> validators = new EnumMap<>(LedgerType.class);

    private AddressValidators() {}

    /** Registry with the built-in eth and sol validators. */
    public static AddressValidators defaults() {
        AddressValidators v = new AddressValidators();
        v.register(LedgerType.ETH, s -> EVM_ADDRESS.matcher(s).matches());
        v.register(LedgerType.SOL, s -> SOLANA_ADDRESS.matcher(s).matches());
        return v;
    }

    public synchronized AddressValidators register(LedgerType type, Predicate<String> predicate) {
        validators.put(Objects.requireNonNull(type, "type"), Objects.requireNonNull(predicate, "predicate"));
        return this;
    }

    /**
     * False for a null/unset ledger type, a type with no predicate, null text, or text the predicate rejects.
     * A predicate that throws counts as a rejection.
     */
    public boolean validate(LedgerType type, String rawText) {
        if (type == null || rawText == null) return false;

        Predicate<String> p;
        synchronized (this) {
            p = validators.get(type);
        }
        if (p == null) return false;

        try {
            return p.test(rawText);
        } catch (RuntimeException e) {
            return false;
        }
    }
}

package org.flowxmi.activity.conversion;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.UUID;

/**
 * Hands out identifiers in the Enterprise Architect style ({@code EAID_XXXXXXXX_XXXX_...}).
 * Ids are name-based UUIDs derived from a seed and a running counter, so the same
 * seed and the same sequence of requests always produce the same ids.
 */
public class IdAllocator {
    public static final String ELEMENT_PREFIX = "EAID_";
    public static final String PACKAGE_PREFIX = "EAPK_";

    private final String seed;
    private long counter;

    public IdAllocator(String seed) {
        this.seed = seed == null ? "" : seed;
    }

    /** Next id for a model element (node, edge, partition, guard, diagram). */
    public String nextElementId() {
        return next(ELEMENT_PREFIX);
    }

    public String nextPackageId() {
        return next(PACKAGE_PREFIX);
    }

    public long issuedCount() {
        return counter;
    }

    private String next(String prefix) {
        counter++;
        UUID uuid = UUID.nameUUIDFromBytes((seed + ":" + prefix + counter).getBytes(StandardCharsets.UTF_8));
        return prefix + uuid.toString().toUpperCase(Locale.ROOT).replace('-', '_');
    }
}

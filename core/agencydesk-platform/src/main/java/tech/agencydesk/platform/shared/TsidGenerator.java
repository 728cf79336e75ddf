package tech.agencydesk.platform.shared;

import com.github.f4b6a3.tsid.TsidCreator;

/**
 * Centralized TSID generation for documents owned by the platform core.
 * TSIDs sort by creation time, which keeps entries written in the same
 * millisecond in a stable order.
 */
public class TsidGenerator {

    /**
     * Generate a new TSID in its 13 character Crockford base32 form.
     */
    public static String generate() {
        return TsidCreator.getTsid().toString();
    }

    private TsidGenerator() {
        // Utility class
    }
}

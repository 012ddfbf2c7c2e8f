package com.williamcallahan.skillcatalog.service.ingestion;

import com.williamcallahan.skillcatalog.domain.DuplicateCandidate;
import com.williamcallahan.skillcatalog.domain.SkillRecord;

/**
 * Outcome of the duplicate-content check for a new record.
 *
 * @param decision what ingestion should do
 * @param protectedOriginal the established record a low-star copy duplicates, for rejections
 * @param privateOriginal the submitted record being converted, or already converted by an earlier run
 */
public record DuplicateVerdict(Decision decision, DuplicateCandidate protectedOriginal, SkillRecord privateOriginal) {

    /** Guard decisions. */
    public enum Decision {
        ACCEPT,
        REJECT,
        CONVERT_PRIVATE,
        ALREADY_CONVERTED
    }

    public static DuplicateVerdict accept() {
        return new DuplicateVerdict(Decision.ACCEPT, null, null);
    }

    public static DuplicateVerdict reject(DuplicateCandidate original) {
        return new DuplicateVerdict(Decision.REJECT, original, null);
    }

    public static DuplicateVerdict convertPrivate(SkillRecord original) {
        return new DuplicateVerdict(Decision.CONVERT_PRIVATE, null, original);
    }

    public static DuplicateVerdict alreadyConverted(SkillRecord original) {
        return new DuplicateVerdict(Decision.ALREADY_CONVERTED, null, original);
    }
}

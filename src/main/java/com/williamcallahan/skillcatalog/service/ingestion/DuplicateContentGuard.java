package com.williamcallahan.skillcatalog.service.ingestion;

import com.williamcallahan.skillcatalog.config.AppProperties;
import com.williamcallahan.skillcatalog.domain.ContentFingerprint;
import com.williamcallahan.skillcatalog.domain.DuplicateCandidate;
import com.williamcallahan.skillcatalog.domain.HashType;
import com.williamcallahan.skillcatalog.domain.SkillRecord;
import com.williamcallahan.skillcatalog.domain.Visibility;
import com.williamcallahan.skillcatalog.store.SkillStore;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decides whether a new skill's marker content may enter the catalog.
 *
 * <p>A low-star copy of an established public skill is rejected. Public content that matches a
 * private submission byte for byte converts the private record instead of creating a second one.
 * A record converted by an earlier attempt still matches, so a redelivered message lands on it
 * again. Records with at least the trusted star count are never rejected.</p>
 */
@Component
public class DuplicateContentGuard {
    private static final Logger log = LoggerFactory.getLogger(DuplicateContentGuard.class);

    private final SkillStore skillStore;
    private final AppProperties appProperties;

    public DuplicateContentGuard(SkillStore skillStore, AppProperties appProperties) {
        this.skillStore = skillStore;
        this.appProperties = appProperties;
    }

    /**
     * Checks the fingerprints of a record that does not exist yet.
     *
     * @param fingerprints full and normalized hashes of the marker content
     * @param stars stars of the incoming repository
     * @return the verdict
     */
    public DuplicateVerdict check(List<ContentFingerprint> fingerprints, int stars) {
        AppProperties.Ingestion thresholds = appProperties.getIngestion();
        if (stars < thresholds.getTrustedStarThreshold()) {
            Optional<DuplicateCandidate> original = hashOf(fingerprints, HashType.NORMALIZED)
                    .flatMap(hash -> skillStore.findPublicDuplicate(hash, thresholds.getProtectedStarThreshold(), null));
            if (original.isPresent()) {
                log.info("Rejecting {}-star copy of {} ({} stars)",
                        stars, original.get().slug(), original.get().stars());
                return DuplicateVerdict.reject(original.get());
            }
        }
        Optional<SkillRecord> submitted = hashOf(fingerprints, HashType.FULL)
                .flatMap(skillStore::findCurationMatchByFullHash);
        if (submitted.isEmpty()) {
            return DuplicateVerdict.accept();
        }
        return submitted.get().visibility() == Visibility.PRIVATE
                ? DuplicateVerdict.convertPrivate(submitted.get())
                : DuplicateVerdict.alreadyConverted(submitted.get());
    }

    private static Optional<String> hashOf(List<ContentFingerprint> fingerprints, HashType hashType) {
        return fingerprints.stream()
                .filter(fingerprint -> fingerprint.hashType() == hashType)
                .map(ContentFingerprint::hashValue)
                .findFirst();
    }
}

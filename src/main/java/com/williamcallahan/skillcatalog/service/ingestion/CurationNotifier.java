package com.williamcallahan.skillcatalog.service.ingestion;

import com.williamcallahan.skillcatalog.domain.Notification;
import com.williamcallahan.skillcatalog.domain.SkillRecord;
import com.williamcallahan.skillcatalog.store.SkillStore;
import java.time.Instant;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Publishes a private submission whose content turned up in a public repository and tells its owner.
 */
@Component
public class CurationNotifier {
    private static final Logger log = LoggerFactory.getLogger(CurationNotifier.class);

    static final String TYPE = "skill_curated";
    static final String TITLE = "Your skill has been curated!";

    private final SkillStore skillStore;

    public CurationNotifier(SkillStore skillStore) {
        this.skillStore = skillStore;
    }

    /**
     * Converts the record to public and stores at most one curation notification for its owner,
     * both in the same store unit.
     *
     * @return true when a new notification was stored
     */
    public boolean convertAndNotify(SkillRecord privateRecord, Instant now) {
        Notification notification = privateRecord.ownerUserId() == null ? null : new Notification(
                UUID.randomUUID().toString(),
                privateRecord.ownerUserId(),
                privateRecord.id(),
                TYPE,
                TITLE,
                "\"" + privateRecord.name() + "\" was found in a public repository and is now listed in the catalog.",
                now);
        boolean notified = skillStore.convertToPublic(privateRecord.id(), notification, now);
        if (notified) {
            log.info("Notified {} that {} was curated", privateRecord.ownerUserId(), privateRecord.slug());
        }
        return notified;
    }
}

package com.williamcallahan.skillcatalog.service.ingestion;

import com.williamcallahan.skillcatalog.config.AppProperties;
import com.williamcallahan.skillcatalog.domain.RepositoryIdentity;
import com.williamcallahan.skillcatalog.domain.ingestion.RepositoryFile;
import com.williamcallahan.skillcatalog.service.github.RepositoryMetadataClient;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Finds the marker file of a skill, trying the canonical upper-case name first.
 */
@Component
public class MarkerFileLocator {
    private static final Logger log = LoggerFactory.getLogger(MarkerFileLocator.class);

    /** Marker file names in lookup order. */
    public static final List<String> MARKER_FILE_NAMES = List.of("SKILL.md", "skill.md");

    private final RepositoryMetadataClient metadataClient;
    private final AppProperties appProperties;

    public MarkerFileLocator(RepositoryMetadataClient metadataClient, AppProperties appProperties) {
        this.metadataClient = metadataClient;
        this.appProperties = appProperties;
    }

    /**
     * Fetches the marker file for a skill.
     *
     * <p>Skills inside a hidden directory are only accepted from repositories with at least the
     * configured star allowance.</p>
     *
     * @param identity skill identity
     * @param stars current repository stars
     * @return the marker file with its text, or empty when there is none to ingest
     */
    public Optional<RepositoryFile> locate(RepositoryIdentity identity, int stars) {
        if (isHiddenSkillPath(identity) && stars < appProperties.getIngestion().getDotFolderStarAllowance()) {
            log.info("Skipping hidden-directory skill {} with {} stars", identity.displayKey(), stars);
            return Optional.empty();
        }
        for (String markerName : MARKER_FILE_NAMES) {
            Optional<RepositoryFile> marker = metadataClient
                    .fetchFile(identity.owner(), identity.name(), identity.markerBasePath() + markerName)
                    .filter(RepositoryFile::hasText);
            if (marker.isPresent()) {
                return marker;
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the marker file name of a located marker, relative to the skill directory.
     */
    public static String markerFileName(RepositoryFile marker) {
        return marker.path().substring(marker.path().lastIndexOf('/') + 1);
    }

    private static boolean isHiddenSkillPath(RepositoryIdentity identity) {
        return identity.hasSkillPath() && TextFileDetector.isUnderHiddenDirectory(identity.markerBasePath() + "x");
    }
}

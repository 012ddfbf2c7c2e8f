package com.williamcallahan.skillcatalog.service.ingestion;

import com.williamcallahan.skillcatalog.config.AppProperties;
import com.williamcallahan.skillcatalog.domain.RepositoryIdentity;
import com.williamcallahan.skillcatalog.domain.RepositoryMetadata;
import com.williamcallahan.skillcatalog.domain.ingestion.RepositoryFile;
import com.williamcallahan.skillcatalog.domain.ingestion.RepositoryTreeEntry;
import com.williamcallahan.skillcatalog.domain.ingestion.SkillFile;
import com.williamcallahan.skillcatalog.service.github.GitHubApiException;
import com.williamcallahan.skillcatalog.service.github.RepositoryMetadataClient;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Collects the files that make up a skill directory within the configured limits.
 *
 * <p>Text files are fetched and cached; oversized or binary files are recorded with their size
 * only. Once the cumulative text budget is spent, remaining files are recorded without content.
 * The marker file is always part of the result.</p>
 */
@Component
public class SkillFileTreeCollector {
    private static final Logger log = LoggerFactory.getLogger(SkillFileTreeCollector.class);
    private static final String DEFAULT_REF = "HEAD";

    private final RepositoryMetadataClient metadataClient;
    private final AppProperties appProperties;

    public SkillFileTreeCollector(RepositoryMetadataClient metadataClient, AppProperties appProperties) {
        this.metadataClient = metadataClient;
        this.appProperties = appProperties;
    }

    /**
     * Lists and fetches the skill's files.
     *
     * @param identity skill identity
     * @param metadata repository metadata, used for the ref and the hidden-folder allowance
     * @param marker already fetched marker file
     * @return files relative to the skill directory, marker first
     */
    public List<SkillFile> collect(RepositoryIdentity identity, RepositoryMetadata metadata, RepositoryFile marker) {
        AppProperties.Ingestion limits = appProperties.getIngestion();
        String basePath = identity.markerBasePath();
        String markerName = MarkerFileLocator.markerFileName(marker);
        boolean hiddenAllowed = metadata.stars() >= limits.getDotFolderStarAllowance();

        List<SkillFile> files = new ArrayList<>();
        files.add(new SkillFile(markerName, marker.size(), marker.text()));
        long textBytes = marker.text().length();

        for (RepositoryTreeEntry entry : listTree(identity, metadata)) {
            if (files.size() >= limits.getMaxFiles()) {
                log.info("File cap of {} reached for {}", limits.getMaxFiles(), identity.displayKey());
                break;
            }
            if (!entry.path().startsWith(basePath)) {
                continue;
            }
            String relativePath = entry.path().substring(basePath.length());
            if (relativePath.isEmpty() || relativePath.equals(markerName)) {
                continue;
            }
            if (!hiddenAllowed && TextFileDetector.isUnderHiddenDirectory(relativePath)) {
                continue;
            }
            boolean fetchable = TextFileDetector.isTextFile(relativePath)
                    && entry.size() <= limits.getMaxFileBytes()
                    && textBytes + entry.size() <= limits.getMaxTotalBytes();
            if (!fetchable) {
                files.add(new SkillFile(relativePath, entry.size(), null));
                continue;
            }
            Optional<RepositoryFile> fetched = metadataClient.fetchFile(identity.owner(), identity.name(), entry.path());
            String text = fetched.filter(RepositoryFile::hasText).map(RepositoryFile::text).orElse(null);
            if (text != null) {
                textBytes += text.length();
            }
            files.add(new SkillFile(relativePath, entry.size(), text));
        }
        return files;
    }

    private List<RepositoryTreeEntry> listTree(RepositoryIdentity identity, RepositoryMetadata metadata) {
        String ref = metadata.defaultBranch() == null || metadata.defaultBranch().isBlank()
                ? DEFAULT_REF
                : metadata.defaultBranch();
        try {
            List<RepositoryTreeEntry> tree = new ArrayList<>(metadataClient.fetchTree(identity.owner(), identity.name(), ref));
            tree.sort(Comparator.comparing(RepositoryTreeEntry::path));
            return tree;
        } catch (GitHubApiException treeFailure) {
            if (treeFailure.isTransient()) {
                throw treeFailure;
            }
            log.warn("Tree listing unavailable for {}, caching marker only: {}",
                    identity.displayKey(), treeFailure.getMessage());
            return List.of();
        }
    }
}

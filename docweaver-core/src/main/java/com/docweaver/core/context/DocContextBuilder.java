package com.docweaver.core.context;

import com.docweaver.core.config.ProjectConfig;
import com.docweaver.core.model.ApiModel;
import com.docweaver.core.model.ApiModelReader;
import com.docweaver.core.model.TopicModel;
import com.docweaver.core.theme.Theme;
import com.docweaver.core.topic.FileTopicCollector;
import com.docweaver.core.util.FileGlobFilter;
import com.docweaver.core.util.FileTransferFilter;
import com.docweaver.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Assembles a {@link DocContext} from a project configuration and a resolved theme.
 *
 * <p>Reads the API model, collects the topics and lists the assets: theme assets keep
 * their path relative to the theme directory, configured assets are placed flat into
 * their target directory.
 */
public class DocContextBuilder {

    private static final Logger log = LoggerFactory.getLogger(DocContextBuilder.class);

    /**
     * Builds the context.
     *
     * @param config resolved project configuration
     * @param theme resolved theme
     * @return documentation context
     * @throws com.docweaver.core.validation.ValidationException if the API model is invalid
     * @throws IllegalStateException if topic or asset files cannot be enumerated
     */
    public DocContext build(ProjectConfig config, Theme theme) {
        Path baseDirectory = config.baseDirectoryPath().toAbsolutePath().normalize();

        ApiModel apiModel = ApiModel.empty();
        if (config.apiModel() != null) {
            log.info("Reading API model: {}", config.apiModel());
            apiModel = ApiModelReader.read(Path.of(config.apiModel()));
        }

        List<TopicModel> topics = List.of();
        if (!config.topics().isEmpty()) {
            log.info("Collecting topics in {}", baseDirectory);
            topics = new FileTopicCollector(baseDirectory, config.convention())
                .collect(new FileGlobFilter(config.topics()), config.topicOrder(), config.topicHierarchy());
        }

        List<AssetReference> assets = collectAssets(config, theme, baseDirectory);
        log.info("Context: {} namespaces, {} top-level topics, {} assets",
            apiModel.namespaces().size(), topics.size(), assets.size());
        return new DocContext(config.convention(), config.baseUri(), apiModel, topics, assets);
    }

    private static List<AssetReference> collectAssets(ProjectConfig config, Theme theme, Path baseDirectory) {
        List<AssetReference> assets = new ArrayList<>();
        for (Map.Entry<String, Path> asset : theme.getAssets().entrySet()) {
            assets.add(new AssetReference(asset.getValue(), asset.getKey()));
        }

        for (FileTransferFilter filter : config.assets()) {
            String target = trimSlashes(filter.targetPath().replace('\\', '/'));
            List<Path> files;
            try {
                files = filter.sourceFilter().findMatchingFiles(baseDirectory, null);
            } catch (IOException e) {
                throw new IllegalStateException("Failed to find asset files in " + baseDirectory, e);
            }
            for (Path file : files) {
                String name = file.getFileName().toString();
                assets.add(new AssetReference(file, target.isEmpty() ? name : target + "/" + name));
            }
        }
        log.debug("Collected {} asset files", assets.size());
        return assets;
    }

    private static String trimSlashes(String path) {
        String trimmed = FileUtils.toUnixPath(Path.of(path.isEmpty() ? "." : path).normalize());
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}

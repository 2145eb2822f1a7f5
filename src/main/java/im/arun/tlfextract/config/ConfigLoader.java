package im.arun.tlfextract.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    private static final String CLASSPATH_CONFIG = "config.yaml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final ExtractorConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private ExtractorConfig loadDefaultConfig(String configPath) {
        try {
            // An explicit file beats the bundled defaults
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    return yamlMapper.readValue(path.toFile(), ExtractorConfig.class);
                }
                logger.warn("Config file {} not found, falling back to bundled configuration", configPath);
            }

            try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream(CLASSPATH_CONFIG)) {
                if (resourceStream != null) {
                    return yamlMapper.readValue(resourceStream, ExtractorConfig.class);
                }
            }

            logger.debug("No {} found, using default configuration", CLASSPATH_CONFIG);
            return new ExtractorConfig();
        } catch (IOException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new ExtractorConfig();
        }
    }

    public ExtractorConfig load(Map<String, Object> userOptions) {
        ExtractorConfig config = copyConfig(defaultConfig);

        if (userOptions == null || userOptions.isEmpty()) {
            return config;
        }

        userOptions.forEach((key, value) -> {
            switch (key) {
                case "narrative_page_count":
                case "narrativePageCount":
                    if (value instanceof Integer) config.setNarrativePageCount((Integer) value);
                    break;
                case "heading_scan_lines":
                case "headingScanLines":
                    if (value instanceof Integer) config.setHeadingScanLines((Integer) value);
                    break;
                case "footer_scan_lines":
                case "footerScanLines":
                    if (value instanceof Integer) config.setFooterScanLines((Integer) value);
                    break;
                case "termination_scan_lines":
                case "terminationScanLines":
                    if (value instanceof Integer) config.setTerminationScanLines((Integer) value);
                    break;
                case "write_text":
                case "writeText":
                    config.setWriteText(parseBoolean(value));
                    break;
                default:
                    logger.warn("Unknown configuration key: {}", key);
            }
        });

        return config;
    }

    private boolean parseBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return "yes".equalsIgnoreCase((String) value) || "true".equalsIgnoreCase((String) value);
        }
        return false;
    }

    private ExtractorConfig copyConfig(ExtractorConfig source) {
        ExtractorConfig copy = new ExtractorConfig();
        copy.setNarrativePageCount(source.getNarrativePageCount());
        copy.setHeadingScanLines(source.getHeadingScanLines());
        copy.setFooterScanLines(source.getFooterScanLines());
        copy.setTerminationScanLines(source.getTerminationScanLines());
        copy.setWriteText(source.isWriteText());
        return copy;
    }
}

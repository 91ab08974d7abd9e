package org.dumpsieve.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dumpsieve.options.SieveOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

public class ConfigurationLoader {

    private static final Logger logger = LoggerFactory.getLogger(ConfigurationLoader.class);

    private static final String CONFIG_FILE_NAME = SieveOptions.Profile.CONFIG_FILE;
    private static final String DEFAULT_PROFILE = SieveOptions.Profile.DEFAULT;
    private static final String PROFILE_ENV_VAR = SieveOptions.Profile.ENV_VAR;

    private final ObjectMapper yamlMapper;
    private final Path startDirectory;

    public ConfigurationLoader() {
        this(Paths.get("").toAbsolutePath());
    }

    public ConfigurationLoader(Path startDirectory) {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.startDirectory = startDirectory;
    }

    /**
     * 설정을 로드하고 지정된 프로파일을 적용
     *
     * 우선순위: CLI 프로파일 > 환경변수 > 기본값(dev)
     *
     * @param cliProfile CLI에서 지정된 프로파일 (null 가능)
     * @return 해석된 설정 맵
     */
    public Map<String, String> loadConfiguration(String cliProfile) {
        String activeProfile = resolveActiveProfile(cliProfile);

        Optional<SieveConfiguration> config = findAndLoadConfiguration();
        if (config.isEmpty()) {
            return createDefaultConfiguration();
        }

        return extractConfigurationForProfile(config.get(), activeProfile);
    }

    private String resolveActiveProfile(String cliProfile) {
        if (cliProfile != null && !cliProfile.trim().isEmpty()) {
            return cliProfile;
        }

        String envProfile = System.getenv(PROFILE_ENV_VAR);
        if (envProfile != null && !envProfile.trim().isEmpty()) {
            return envProfile;
        }

        return DEFAULT_PROFILE;
    }

    /**
     * 시작 디렉토리부터 상위 디렉토리로 올라가며 dumpsieve.yaml을 찾습니다.
     */
    private Optional<SieveConfiguration> findAndLoadConfiguration() {
        Path currentDir = startDirectory;

        while (currentDir != null) {
            Path configFile = currentDir.resolve(CONFIG_FILE_NAME);
            if (Files.exists(configFile)) {
                try {
                    return Optional.of(yamlMapper.readValue(configFile.toFile(), SieveConfiguration.class));
                } catch (IOException e) {
                    logger.warn("Failed to parse {}: {}", configFile, e.getMessage());
                    return Optional.empty();
                }
            }
            currentDir = currentDir.getParent();
        }

        return Optional.empty();
    }

    private Map<String, String> extractConfigurationForProfile(SieveConfiguration config, String profile) {
        var profileConfig = config.getProfiles().get(profile);
        if (profileConfig == null) {
            logger.warn("Profile '{}' not found in configuration. Using defaults.", profile);
            return createDefaultConfiguration();
        }

        var configMap = new HashMap<>(createDefaultConfiguration());

        var defer = profileConfig.getDefer();
        if (defer != null && defer.getConstraints() != null) {
            configMap.put(SieveOptions.Defer.CONSTRAINTS_KEY, String.valueOf(defer.getConstraints()));
        }

        var output = profileConfig.getOutput();
        if (output != null) {
            if (output.getDirectory() != null) {
                configMap.put(SieveOptions.Output.DIRECTORY_KEY, output.getDirectory());
            }
            if (output.getCharset() != null) {
                configMap.put(SieveOptions.Output.CHARSET_KEY, output.getCharset());
            }
        }

        return configMap;
    }

    private Map<String, String> createDefaultConfiguration() {
        return Map.of(
                SieveOptions.Defer.CONSTRAINTS_KEY, String.valueOf(SieveOptions.Defer.CONSTRAINTS_DEFAULT),
                SieveOptions.Output.CHARSET_KEY, SieveOptions.Output.CHARSET_DEFAULT
        );
    }
}

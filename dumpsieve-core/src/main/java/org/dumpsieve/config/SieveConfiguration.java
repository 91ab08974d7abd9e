package org.dumpsieve.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.HashMap;
import java.util.Map;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class SieveConfiguration {

    /**
     * 프로파일별 설정 맵
     */
    @JsonProperty("profiles")
    private Map<String, ProfileConfiguration> profiles = new HashMap<>();

    /**
     * 개별 프로파일 설정
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ProfileConfiguration {

        @JsonProperty("defer")
        private DeferConfiguration defer;

        @JsonProperty("output")
        private OutputConfiguration output;
    }

    /**
     * 인덱스/제약조건 지연 설정
     */
    @Data
    public static class DeferConfiguration {

        @JsonProperty("constraints")
        private Boolean constraints;
    }

    /**
     * 출력 관련 설정
     */
    @Data
    public static class OutputConfiguration {

        @JsonProperty("directory")
        private String directory;

        @JsonProperty("charset")
        private String charset;
    }
}

package com.deepansh.coderflow.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Arrays;
import java.util.List;

/**
 * Strongly-typed configuration for all tools.
 * Bound from application.yml under the "tools" prefix.
 */
@ConfigurationProperties(prefix = "tools")
@Data
public class ToolProperties {

    private FileOps fileOps = new FileOps();
    private Gateway gateway = new Gateway();

    @Data
    public static class FileOps {
        private String baseDirectory = "./workspace";
        private int maxFileSizeKb = 512;
        private String allowedExtensions = "txt,md,json,csv,yaml,yml,log,java,py,js,ts,xml,html,css,properties,gradle,sh";

        public List<String> getAllowedExtensionList() {
            return Arrays.stream(allowedExtensions.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isBlank())
                    .toList();
        }
    }

    @Data
    public static class Gateway {
        /** Off by default; when on, tools listed by the gateway are registered at startup */
        private boolean enabled = false;
        private String baseUrl = "http://localhost:8808";
        private int connectTimeoutMs = 5000;
        private int readTimeoutMs = 60000;
    }
}

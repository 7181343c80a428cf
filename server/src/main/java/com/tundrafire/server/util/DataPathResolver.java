package com.tundrafire.server.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;

public class DataPathResolver {

    private static final Logger logger = LoggerFactory.getLogger(DataPathResolver.class);

    public static final String DATA_DIR_PROPERTY = "tundrafire.data.dir";

    public static String resolveDataDirectory() {
        // 1. Check System Property
        String sysProp = System.getProperty(DATA_DIR_PROPERTY);
        if (sysProp != null && !sysProp.isEmpty()) {
            return sysProp;
        }

        // 2. Check Config File
        try {
            ObjectMapper mapper = new ObjectMapper();
            try (InputStream is = DataPathResolver.class.getResourceAsStream("/fire_config.json")) {
                if (is != null) {
                    JsonNode root = mapper.readTree(is);
                    if (root.has("tundrafire_data_directory")) {
                        String configDir = root.get("tundrafire_data_directory").asText();
                        if (configDir != null && !configDir.isEmpty()) {
                            return configDir;
                        }
                    }
                }
            }
        } catch (Exception e) {
            logger.warn("Failed to read tundrafire_data_directory from config: {}", e.getMessage());
        }

        // 3. Default
        return ".";
    }
}

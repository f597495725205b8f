package com.cloudimages;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.io.File;

@SpringBootApplication
public class CloudImagesApplication {

    private static final Logger log = LoggerFactory.getLogger(CloudImagesApplication.class);

    public static void main(String[] args) {
        // The file-based H2 database needs its directory before the context loads
        ensureDirectories();
        SpringApplication.run(CloudImagesApplication.class, args);
        log.info("==========================================================");
        log.info("  CloudImages is running.");
        log.info("  Register a storage provider under /api/providers first.");
        log.info("==========================================================");
    }

    private static void ensureDirectories() {
        String[] dirs = { "./data", "./data/db" };
        for (String dir : dirs) {
            File f = new File(dir);
            if (!f.exists()) {
                f.mkdirs();
            }
        }
    }
}

package com.yongkangl.nexus.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

public class ReaderConfig {
    private static final Logger log = LoggerFactory.getLogger(ReaderConfig.class);
    public static final String DEFAULT_RESOURCE = "/nexus-reader.json";

    private boolean caseSensitiveTaxonLabels = false;
    private boolean preserveUnderscores = true;
    private RootingInterpretation rootingInterpretation = RootingInterpretation.AS_GIVEN;
    private int maxTreeDepth = 2048;
    private boolean storeTreeWeights = true;

    public static ReaderConfig defaults() {
        try {
            return fromClasspath(DEFAULT_RESOURCE);
        } catch (FileNotFoundException e) {
            log.debug("{}, using built-in reader defaults", e.getMessage());
            return new ReaderConfig();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static ReaderConfig load(InputStream in) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        ReaderConfig config = mapper.readValue(in, ReaderConfig.class);
        config.validate();
        return config;
    }

    public static ReaderConfig fromFile(String filePath) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        ReaderConfig config = mapper.readValue(new File(filePath), ReaderConfig.class);
        config.validate();
        return config;
    }

    public static ReaderConfig fromClasspath(String resource) throws IOException {
        try (InputStream in = ReaderConfig.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new FileNotFoundException("No classpath resource " + resource);
            }
            log.debug("Loading reader configuration from {}", resource);
            return load(in);
        }
    }

    private void validate() {
        Validate.isTrue(maxTreeDepth > 0, "maxTreeDepth must be positive, got %d", maxTreeDepth);
        Validate.notNull(rootingInterpretation, "rootingInterpretation must not be null");
    }

    public boolean isCaseSensitiveTaxonLabels() {
        return caseSensitiveTaxonLabels;
    }

    public void setCaseSensitiveTaxonLabels(boolean caseSensitiveTaxonLabels) {
        this.caseSensitiveTaxonLabels = caseSensitiveTaxonLabels;
    }

    public boolean isPreserveUnderscores() {
        return preserveUnderscores;
    }

    public void setPreserveUnderscores(boolean preserveUnderscores) {
        this.preserveUnderscores = preserveUnderscores;
    }

    public RootingInterpretation getRootingInterpretation() {
        return rootingInterpretation;
    }

    public void setRootingInterpretation(RootingInterpretation rootingInterpretation) {
        this.rootingInterpretation = rootingInterpretation;
    }

    public int getMaxTreeDepth() {
        return maxTreeDepth;
    }

    public void setMaxTreeDepth(int maxTreeDepth) {
        this.maxTreeDepth = maxTreeDepth;
    }

    public boolean isStoreTreeWeights() {
        return storeTreeWeights;
    }

    public void setStoreTreeWeights(boolean storeTreeWeights) {
        this.storeTreeWeights = storeTreeWeights;
    }
}

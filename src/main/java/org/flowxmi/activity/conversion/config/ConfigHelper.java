package org.flowxmi.activity.conversion.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.flowxmi.activity.conversion.config.models.ConverterConfig;
import org.flowxmi.activity.conversion.config.models.LayoutConfig;
import org.flowxmi.activity.conversion.layout.models.LayoutSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

public class ConfigHelper {
    private static final Logger log = LoggerFactory.getLogger(ConfigHelper.class);

    public static final String DEFAULT_CONFIG_RESOURCE = "converter-config.json";

    private static final ObjectMapper mapper = new ObjectMapper();

    /**
     * Loads the configuration bundled on the classpath.
     *
     * @return the default configuration
     * @throws IllegalStateException if the bundled resource is missing
     * @throws RuntimeException      if the resource cannot be parsed
     */
    public static ConverterConfig loadDefaultConfig() {
        ClassLoader cl = ConfigHelper.class.getClassLoader();
        try (InputStream in = cl.getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Config resource not found: " + DEFAULT_CONFIG_RESOURCE);
            }
            ConverterConfig config = normalize(mapper.readValue(in, ConverterConfig.class));
            log.debug("Loaded default converter config from classpath");
            return config;
        } catch (IOException e) {
            throw new RuntimeException("Failed to load config resource: " + DEFAULT_CONFIG_RESOURCE, e);
        }
    }

    /**
     * Loads a configuration file from disk. Sections missing from the file keep their defaults.
     *
     * @param configFilePath path to the JSON config file
     * @return the loaded configuration
     */
    public static ConverterConfig loadConfigFile(String configFilePath) {
        try {
            ConverterConfig config = normalize(mapper.readValue(new File(configFilePath), ConverterConfig.class));
            log.info("Loaded converter config from {}", configFilePath);
            return config;
        } catch (IOException e) {
            throw new RuntimeException("Failed to load config file: " + configFilePath, e);
        }
    }

    /**
     * Turns the layout section of the config into layout settings; unset values take the defaults.
     */
    public static LayoutSettings toLayoutSettings(LayoutConfig layout) {
        if (layout == null) {
            return LayoutSettings.defaults();
        }
        return LayoutSettings.builder()
                .canvasWidth(layout.canvasWidth)
                .canvasHeight(layout.canvasHeight)
                .marginX(layout.marginX)
                .marginY(layout.marginY)
                .columnSpacingFactor(layout.columnSpacingFactor)
                .rowSpacingFactor(layout.rowSpacingFactor)
                .laneMarginX(layout.laneMarginX)
                .laneMarginTop(layout.laneMarginTop)
                .laneMarginBottom(layout.laneMarginBottom)
                .overlapIterationCap(layout.overlapIterationCap)
                .levelingPassCap(layout.levelingPassCap)
                .crossingReductionSweeps(layout.crossingReductionSweeps)
                .finalsOnLastLayer(layout.finalsOnLastLayer)
                .build();
    }

    // explicit nulls in the JSON replace the field initializers
    private static ConverterConfig normalize(ConverterConfig config) {
        ConverterConfig defaults = new ConverterConfig();
        if (config.diagram == null) {
            config.diagram = defaults.diagram;
        }
        if (config.layout == null) {
            config.layout = defaults.layout;
        }
        if (config.repair == null) {
            config.repair = defaults.repair;
        }
        return config;
    }
}

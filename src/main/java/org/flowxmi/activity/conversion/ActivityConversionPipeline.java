package org.flowxmi.activity.conversion;

import org.flowxmi.activity.conversion.config.ConfigHelper;
import org.flowxmi.activity.conversion.config.models.ConverterConfig;
import org.flowxmi.activity.conversion.graph.GraphBuilder;
import org.flowxmi.activity.conversion.graph.models.ActivityGraph;
import org.flowxmi.activity.conversion.input.ActivityInputHelper;
import org.flowxmi.activity.conversion.input.models.ActivityInput;
import org.flowxmi.activity.conversion.layout.DimensionCalculator;
import org.flowxmi.activity.conversion.layout.LayoutEngine;
import org.flowxmi.activity.conversion.layout.OverlapResolver;
import org.flowxmi.activity.conversion.layout.models.DiagramLayout;
import org.flowxmi.activity.conversion.layout.models.LayoutSettings;
import org.flowxmi.activity.conversion.layout.models.Size;
import org.flowxmi.activity.conversion.repair.BranchClassifier;
import org.flowxmi.activity.conversion.repair.KeywordMissingBranchStrategy;
import org.flowxmi.activity.conversion.repair.MissingBranchStrategy;
import org.flowxmi.activity.conversion.repair.RepairSummary;
import org.flowxmi.activity.conversion.repair.StructuralRepairValidator;
import org.flowxmi.activity.conversion.xmi.XmiActivitySerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Converts an activity description into an XMI document:
 * graph building, sizing, layout, overlap resolution, structural repair, swimlane bounds and serialization.
 * <p>
 * The pipeline itself holds only configuration. Each call to {@link #convert} creates its own
 * {@link ConversionContext}, so one instance may serve concurrent conversions.
 */
public class ActivityConversionPipeline {
    private static final Logger log = LoggerFactory.getLogger(ActivityConversionPipeline.class);

    private final ConverterConfig config;
    private final LayoutSettings layoutSettings;
    private final BranchClassifier classifier;
    private final MissingBranchStrategy missingBranchStrategy;
    private final String timestamp;

    public ActivityConversionPipeline(ConverterConfig config, MissingBranchStrategy missingBranchStrategy, String timestamp) {
        this.config = config;
        this.layoutSettings = ConfigHelper.toLayoutSettings(config.layout);
        this.classifier = new BranchClassifier(config.repair.successKeywords, config.repair.failureKeywords);
        this.missingBranchStrategy = missingBranchStrategy != null ? missingBranchStrategy
                : config.repair.suggestMissingBranches ? new KeywordMissingBranchStrategy(classifier)
                : MissingBranchStrategy.none();
        this.timestamp = timestamp;
    }

    public ActivityConversionPipeline(ConverterConfig config) {
        this(config, null, null);
    }

    /** Pipeline over the bundled default configuration. */
    public static ActivityConversionPipeline withDefaults() {
        return new ActivityConversionPipeline(ConfigHelper.loadDefaultConfig());
    }

    /**
     * Parses and converts a JSON activity description.
     *
     * @throws org.flowxmi.activity.conversion.input.ParseInputException if the input is malformed
     */
    public ConversionResult convertJson(String json) {
        return convert(ActivityInputHelper.parseInput(json));
    }

    /**
     * Runs the full conversion.
     *
     * @throws org.flowxmi.activity.conversion.input.ParseInputException if the input is structurally invalid
     * @throws org.flowxmi.activity.conversion.xmi.SerializationException if no document could be written at all
     */
    public ConversionResult convert(ActivityInput input) {
        ConversionContext context = new ConversionContext(input == null ? null : input.diagramName);

        ActivityGraph graph = GraphBuilder.build(input, context);

        Map<String, Size> sizes = DimensionCalculator.sizeAll(graph);
        LayoutEngine layoutEngine = new LayoutEngine(layoutSettings);
        DiagramLayout layout = layoutEngine.layout(graph, sizes, context);

        int passes = new OverlapResolver(layoutSettings).resolve(layout, context.diagnostics());
        log.debug("Overlap resolution for '{}' used {} passes", graph.name(), passes);

        RepairSummary repair = new StructuralRepairValidator(missingBranchStrategy, classifier)
                .repair(graph, layout, context);
        // bounds include nodes created by repair
        int added = layoutEngine.placeAddedNodes(graph, layout);
        if (added > 0) {
            log.debug("Placed {} node(s) added by repair", added);
        }
        layoutEngine.computeSwimlaneBounds(graph, layout);

        String xmi = new XmiActivitySerializer(config.diagram, classifier, timestamp)
                .serialize(graph, layout, context);

        ConversionResult result = new ConversionResult(xmi, context.diagnostics().all(), graph, layout, repair);
        log.info("Converted '{}' with {} warnings and {} errors",
                graph.name(), result.warningCount(), result.errorCount());
        return result;
    }
}

package org.flowxmi.activity.conversion.report;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;
import org.flowxmi.activity.conversion.ConversionResult;
import org.flowxmi.activity.conversion.diagnostics.Diagnostic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Renders a plain-text summary of a conversion (counts and every diagnostic) from
 * the {@code templates/diagnostics-report.ftl} template.
 */
public class DiagnosticsReportRenderer {
    private static final Logger log = LoggerFactory.getLogger(DiagnosticsReportRenderer.class);

    public static final String TEMPLATE_PATH = "templates/diagnostics-report.ftl";

    private final Template template;

    public DiagnosticsReportRenderer() {
        ClassLoader cl = DiagnosticsReportRenderer.class.getClassLoader();

        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);

        try (Reader templateReader = new InputStreamReader(
                Objects.requireNonNull(cl.getResourceAsStream(TEMPLATE_PATH), "Template not found: " + TEMPLATE_PATH),
                StandardCharsets.UTF_8)) {
            template = new Template("diagnostics-report.ftl", templateReader, cfg);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load report template: " + TEMPLATE_PATH, e);
        }
    }

    public String render(String diagramName, ConversionResult result) {
        Map<String, Object> model = new HashMap<>();
        model.put("diagramName", diagramName);
        model.put("nodeCount", result.graph().nodeCount());
        model.put("edgeCount", result.graph().edgeCount());
        model.put("swimlaneCount", result.graph().swimlanes().size());
        model.put("warningCount", result.warningCount());
        model.put("errorCount", result.errorCount());
        model.put("repairChanged", result.repair().changedGraph());

        // plain maps: the template sees simple hashes instead of record accessors
        List<Map<String, String>> entries = new ArrayList<>();
        for (Diagnostic diagnostic : result.diagnostics()) {
            Map<String, String> entry = new LinkedHashMap<>();
            entry.put("severity", diagnostic.severity().name());
            entry.put("code", diagnostic.code().code());
            entry.put("elementId", diagnostic.elementId() == null ? "" : diagnostic.elementId());
            entry.put("message", diagnostic.message());
            entries.add(entry);
        }
        model.put("diagnostics", entries);

        try (StringWriter out = new StringWriter()) {
            template.process(model, out);
            return out.toString();
        } catch (TemplateException | IOException e) {
            log.error("Report template failed: {}", e.getMessage());
            throw new RuntimeException("Failed to render diagnostics report for " + diagramName, e);
        }
    }
}

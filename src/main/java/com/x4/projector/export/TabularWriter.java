package com.x4.projector.export;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

import com.x4.projector.definition.ObjectKind;
import com.x4.projector.resolver.model.ResolvedRecord;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders records of one category as CSV or Markdown through the classpath
 * templates under {@code /templates}.
 */
class TabularWriter {

    private final Configuration freemarkerConfig;

    TabularWriter() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    String render(ExportFormat format, ObjectKind kind, List<ResolvedRecord> records) throws IOException {
        Map<String, Object> model = new HashMap<>();
        List<List<String>> rows = new ArrayList<>();

        switch (format) {
            case CSV -> {
                rows.add(escape(ColumnLayout.header(kind), TabularWriter::csvCell));
                records.forEach(r -> rows.add(escape(ColumnLayout.row(kind, r), TabularWriter::csvCell)));
                model.put("rows", rows);
            }
            case MARKDOWN -> {
                records.forEach(r -> rows.add(escape(ColumnLayout.row(kind, r), TabularWriter::markdownCell)));
                model.put("title", kind.getCliName());
                model.put("header", ColumnLayout.header(kind));
                model.put("rows", rows);
            }
            default -> throw new IllegalArgumentException(format + " is not a tabular format");
        }

        Template template = freemarkerConfig.getTemplate(format.getCliName() + ".ftl");
        StringWriter out = new StringWriter();
        try {
            template.process(model, out);
        } catch (TemplateException e) {
            throw new IllegalStateException("Template " + template.getName() + " failed", e);
        }
        return out.toString();
    }

    /**
     * Quotes a cell when it holds a separator, a quote or a line break.
     */
    static String csvCell(String value) {
        if (value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }

    static String markdownCell(String value) {
        return value.replace("|", "\\|").replace("\r", " ").replace("\n", " ");
    }

    private static List<String> escape(List<String> cells, UnaryOperator<String> escaper) {
        return cells.stream().map(escaper).toList();
    }
}

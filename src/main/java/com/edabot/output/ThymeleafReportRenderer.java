package com.edabot.output;

import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.ClassLoaderTemplateResolver;

import java.util.Locale;
import java.util.Map;

/**
 * Renders Markdown from TEXT-mode Thymeleaf templates under
 * {@code templates/} on the classpath, then tidies the blank lines that
 * skipped conditional blocks leave behind.
 */
public final class ThymeleafReportRenderer {
    static final String REPORT_TEMPLATE = "eda/eda_report";

    private final TemplateEngine templateEngine;
    private final String templateName;

    public ThymeleafReportRenderer() {
        this(REPORT_TEMPLATE);
    }

    ThymeleafReportRenderer(String templateName) {
        ClassLoaderTemplateResolver resolver = new ClassLoaderTemplateResolver();
        resolver.setPrefix("templates/");
        resolver.setSuffix(".md");
        resolver.setTemplateMode(TemplateMode.TEXT);
        resolver.setCharacterEncoding("UTF-8");
        resolver.setCacheable(true);

        this.templateEngine = new TemplateEngine();
        this.templateEngine.setTemplateResolver(resolver);
        this.templateName = templateName;
    }

    public String renderReport(Map<String, Object> variables) {
        Context context = new Context(Locale.ROOT);
        if (variables != null && !variables.isEmpty()) {
            variables.forEach(context::setVariable);
        }
        return tidy(templateEngine.process(templateName, context));
    }

    // Unix line endings, at most one blank line in a row, one trailing newline.
    static String tidy(String markdown) {
        String text = markdown.replace("\r\n", "\n").replace('\r', '\n');
        StringBuilder out = new StringBuilder(text.length());
        int blankRun = 0;
        for (String line : text.split("\n", -1)) {
            String trimmedRight = line.replaceAll("\\s+$", "");
            if (trimmedRight.isEmpty()) {
                blankRun++;
                if (blankRun > 1) {
                    continue;
                }
            } else {
                blankRun = 0;
            }
            out.append(trimmedRight).append('\n');
        }
        int end = out.length();
        while (end > 0 && out.charAt(end - 1) == '\n') {
            end--;
        }
        out.setLength(end);
        return out.append('\n').toString();
    }
}

package com.sol2clarity.generate;

import java.io.IOException;
import java.io.StringWriter;
import java.util.HashMap;
import java.util.Map;

import com.sol2clarity.config.TranspilerConfig;
import com.sol2clarity.model.target.ClarityContract;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders the comment block at the top of every generated unit from
 * {@code templates/contract-header.ftl}.
 */
public class HeaderRenderer {

    static final String TEMPLATE_NAME = "contract-header.ftl";

    private final Configuration freemarkerConfig;

    public HeaderRenderer() {
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

    public String render(ClarityContract contract, TranspilerConfig config) {
        Map<String, Object> model = new HashMap<>();
        model.put("contractName", contract.getSourceName());
        model.put("sourceName", config.getSourceName());
        model.put("toolName", config.getToolName());
        model.put("toolVersion", config.getToolVersion());

        try {
            Template template = freemarkerConfig.getTemplate(TEMPLATE_NAME);
            StringWriter out = new StringWriter();
            template.process(model, out);
            return out.toString();
        } catch (IOException | TemplateException e) {
            throw new IllegalStateException("Failed to render " + TEMPLATE_NAME + " for " + contract.getSourceName(), e);
        }
    }
}

package com.monitoralert.evaluator.infrastructure.script;

import com.monitoralert.common.exceptions.InvalidConfigException;
import com.monitoralert.common.model.Script;
import com.monitoralert.evaluator.domain.execution.TemplateRenderer;
import com.samskivert.mustache.Mustache;
import com.samskivert.mustache.Template;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Mustache rendering of action templates. Missing variables render as empty strings,
 * values are not HTML-escaped. Compiled templates are cached by source.
 */
@Component
public class MustacheTemplateRenderer implements TemplateRenderer {

    private final Mustache.Compiler compiler = Mustache.compiler().defaultValue("").escapeHTML(false);
    private final Map<String, Template> templates = new ConcurrentHashMap<>();

    @Override
    public String render(Script template, Map<String, Object> args) {
        if (!template.isLang(Script.MUSTACHE)) {
            throw InvalidConfigException.wrongLanguage("template", Script.MUSTACHE, template.lang());
        }
        return templates.computeIfAbsent(template.source(), compiler::compile).execute(args);
    }
}

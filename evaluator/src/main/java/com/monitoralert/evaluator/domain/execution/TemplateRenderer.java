package com.monitoralert.evaluator.domain.execution;

import com.monitoralert.common.model.Script;
import java.util.Map;

public interface TemplateRenderer {

    String render(Script template, Map<String, Object> args);
}

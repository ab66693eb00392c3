package com.monitoralert.common.document;

import static com.monitoralert.common.document.DocumentFields.required;

import com.monitoralert.common.model.Script;

public record ScriptDocument(String source, String lang) {

    static ScriptDocument from(Script script) {
        return script == null ? null : new ScriptDocument(script.source(), script.lang());
    }

    Script toScript(String defaultLang) {
        return new Script(lang == null ? defaultLang : lang, required(source, "source", "script"));
    }
}

package com.monitoralert.common.model;

import com.monitoralert.common.codec.RecordInput;
import com.monitoralert.common.codec.RecordOutput;
import com.monitoralert.common.codec.Writeable;
import com.monitoralert.common.exceptions.InvalidConfigException;
import java.io.IOException;

/**
 * Source text tagged with the language that interprets it: mustache for action
 * templates, spel for trigger conditions.
 */
public record Script(String lang, String source) implements Writeable {

    public static final String MUSTACHE = "mustache";
    public static final String SPEL = "spel";

    public Script {
        if (lang == null || lang.isBlank()) {
            throw InvalidConfigException.of("Script lang is required");
        }
        if (source == null) {
            throw InvalidConfigException.of("Script source is required");
        }
    }

    public static Script mustache(String source) {
        return new Script(MUSTACHE, source);
    }

    public static Script spel(String source) {
        return new Script(SPEL, source);
    }

    public boolean isLang(String expected) {
        return expected.equals(lang);
    }

    @Override
    public void writeTo(RecordOutput out) throws IOException {
        out.writeString(lang);
        out.writeString(source);
    }

    public static Script readFrom(RecordInput in) throws IOException {
        return new Script(in.readString(), in.readString());
    }
}

package com.monitoralert.common.model;

import static com.monitoralert.common.test.fixtures.MonitorFixtures.throttledActionBuilder;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.monitoralert.common.codec.RecordInput;
import com.monitoralert.common.codec.RecordOutput;
import com.monitoralert.common.exceptions.InvalidConfigException;
import com.monitoralert.common.exceptions.ParseException;
import java.io.IOException;
import org.junit.jupiter.api.Test;

class ActionDefinitionTest {

    @Test
    void binaryRoundTripPreservesEveryField() throws IOException {
        var action = throttledActionBuilder().build();

        assertThat(roundTrip(action)).isEqualTo(action);
    }

    @Test
    void binaryRoundTripWithoutSubjectOrThrottle() throws IOException {
        var action = throttledActionBuilder()
                .subjectTemplate(null)
                .throttleEnabled(false)
                .throttle(null)
                .build();

        var decoded = roundTrip(action);

        assertThat(decoded).isEqualTo(action);
        assertThat(decoded.subjectTemplate()).isNull();
        assertThat(decoded.throttle()).isNull();
    }

    @Test
    void binaryLayoutStartsWithNameAndEndsWithId() throws IOException {
        var action = throttledActionBuilder().subjectTemplate(null).throttle(null).throttleEnabled(false).build();
        var out = new RecordOutput();
        action.writeTo(out);

        var in = new RecordInput(out.toByteArray());
        assertThat(in.readString()).isEqualTo(action.name());
        assertThat(in.readString()).isEqualTo(action.destinationId());
        assertThat(in.readBoolean()).isFalse();
        assertThat(Script.readFrom(in)).isEqualTo(action.messageTemplate());
        assertThat(in.readBoolean()).isFalse();
        assertThat(in.readBoolean()).isFalse();
        assertThat(in.readString()).isEqualTo(action.id());
    }

    @Test
    void throttleEnabledWithoutThrottleIsInvalidConfig() {
        assertThatThrownBy(() -> throttledActionBuilder().throttle(null).build())
                .isInstanceOf(InvalidConfigException.class)
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("throttle enabled but not configured");
    }

    @Test
    void nonMustacheMessageTemplateIsRejected() {
        assertThatThrownBy(() -> throttledActionBuilder().messageTemplate(new Script("painless", "return 1")).build())
                .isInstanceOf(InvalidConfigException.class)
                .hasMessageContaining("message_template");
    }

    @Test
    void nonMustacheSubjectTemplateIsRejected() {
        assertThatThrownBy(() -> throttledActionBuilder().subjectTemplate(Script.spel("#x")).build())
                .isInstanceOf(InvalidConfigException.class)
                .hasMessageContaining("subject_template");
    }

    @Test
    void templateLanguageIsCheckedBeforeThrottle() {
        assertThatThrownBy(() -> throttledActionBuilder()
                        .messageTemplate(new Script("painless", "x"))
                        .throttle(null)
                        .build())
                .hasMessageContaining("message_template");
    }

    @Test
    void binaryDecoderAppliesTheSameValidation() throws IOException {
        var out = new RecordOutput();
        out.writeString("page");
        out.writeString("dest");
        out.writeBoolean(false);
        Script.mustache("body").writeTo(out);
        out.writeBoolean(true);
        out.writeBoolean(false);
        out.writeString("act_1");

        var in = new RecordInput(out.toByteArray());
        assertThatThrownBy(() -> ActionDefinition.readFrom(in))
                .isInstanceOf(InvalidConfigException.class)
                .hasMessageContaining("throttle enabled but not configured");
    }

    @Test
    void binaryDecoderReportsTemplateLanguageBeforeAnInvalidThrottle() throws IOException {
        var out = new RecordOutput();
        out.writeString("page");
        out.writeString("dest");
        out.writeBoolean(false);
        new Script("painless", "body").writeTo(out);
        out.writeBoolean(true);
        out.writeBoolean(true);
        out.writeInt(0);
        out.writeString("MINUTES");
        out.writeString("act_1");

        var in = new RecordInput(out.toByteArray());
        assertThatThrownBy(() -> ActionDefinition.readFrom(in))
                .isInstanceOf(InvalidConfigException.class)
                .hasMessageContaining("message_template must be a mustache script");
    }

    @Test
    void templateArgumentExposesTheName() {
        assertThat(throttledActionBuilder().build().asTemplateArg()).containsEntry("name", "page on-call");
    }

    private static ActionDefinition roundTrip(ActionDefinition action) throws IOException {
        var out = new RecordOutput();
        action.writeTo(out);
        return ActionDefinition.readFrom(new RecordInput(out.toByteArray()));
    }
}

package com.enterprise.sqlbind.sql;

import com.enterprise.sqlbind.sql.param.BindType;
import com.enterprise.sqlbind.sql.param.MalformedParameterNameException;
import com.enterprise.sqlbind.sql.param.ParameterKey;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ParameterKeyTest {

    @Test
    void bareName() {
        assertThat(ParameterKey.parse("id")).isEqualTo(new ParameterKey("id", BindType.STRING, false));
    }

    @Test
    void leadingColonIsOptional() {
        assertThat(ParameterKey.parse(":id")).isEqualTo(ParameterKey.parse("id"));
    }

    @Test
    void angleSuffix() {
        assertThat(ParameterKey.parse("id<i>")).isEqualTo(new ParameterKey("id", BindType.INT, false));
        assertThat(ParameterKey.parse(":ok<b>")).isEqualTo(new ParameterKey("ok", BindType.BOOL, false));
        assertThat(ParameterKey.parse(":n<s>")).isEqualTo(new ParameterKey("n", BindType.STRING, false));
    }

    @Test
    void squareSuffix() {
        assertThat(ParameterKey.parse(":id[i]")).isEqualTo(new ParameterKey("id", BindType.INT, true));
        assertThat(ParameterKey.parse("flags[b]")).isEqualTo(new ParameterKey("flags", BindType.BOOL, true));
    }

    @Test
    void emptySuffixDefaultsToString() {
        assertThat(ParameterKey.parse("id<>")).isEqualTo(new ParameterKey("id", BindType.STRING, false));
        assertThat(ParameterKey.parse("id[]")).isEqualTo(new ParameterKey("id", BindType.STRING, true));
    }

    @Test
    void typeLetterIsCaseSensitive() {
        assertThat(ParameterKey.parse("id<I>").type()).isEqualTo(BindType.STRING);
    }

    @Test
    void digitsAndUnderscoresInName() {
        assertThat(ParameterKey.parse(":id_2[i]").name()).isEqualTo("id_2");
        assertThat(ParameterKey.parse("name1").name()).isEqualTo("name1");
    }

    @Test
    void token() {
        assertThat(ParameterKey.parse("id<i>").token()).isEqualTo(":id");
    }

    @Test
    void invalidKeys() {
        for (String key : new String[] {"", ":", "::id", "id x", "id-x", "id<i", "id<i>x", "<i>", "id{i}", "id<ab>"}) {
            assertThatThrownBy(() -> ParameterKey.parse(key))
                    .as(key)
                    .isInstanceOf(MalformedParameterNameException.class)
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    void nullKeyThrows() {
        assertThatThrownBy(() -> ParameterKey.parse(null))
                .isInstanceOf(MalformedParameterNameException.class);
    }
}

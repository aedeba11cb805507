package com.enterprise.sqlbind.sql;

import com.enterprise.sqlbind.sql.param.BindInstruction;
import com.enterprise.sqlbind.sql.param.BindType;
import com.enterprise.sqlbind.sql.param.MalformedParameterNameException;
import com.enterprise.sqlbind.sql.param.ParameterParser;
import com.enterprise.sqlbind.sql.param.Params;
import com.enterprise.sqlbind.sql.param.ParsedQuery;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;

import static com.enterprise.sqlbind.sql.param.BindType.BOOL;
import static com.enterprise.sqlbind.sql.param.BindType.INT;
import static com.enterprise.sqlbind.sql.param.BindType.STRING;
import static org.assertj.core.api.Assertions.*;

class ParameterParserTest {

    private final ParameterParser parser = new ParameterParser();

    // ==================== No parameters ====================

    @Test
    void noPlaceholders() {
        ParsedQuery r = parser.parse("SELECT * FROM tbl");
        assertThat(r.sql()).isEqualTo("SELECT * FROM tbl");
        assertThat(r.binds()).isEmpty();
    }

    @Test
    void questionMarkParamUnset() {
        ParsedQuery r = parser.parse("SELECT * FROM tbl WHERE id = ?", null);
        assertThat(r.sql()).isEqualTo("SELECT * FROM tbl WHERE id = ?");
        assertThat(r.binds()).isEmpty();
    }

    @Test
    void namedParamsUnset() {
        ParsedQuery r = parser.parse("SELECT * FROM tbl WHERE id = :id", Params.named());
        assertThat(r.sql()).isEqualTo("SELECT * FROM tbl WHERE id = :id");
        assertThat(r.binds()).isEmpty();
    }

    @Test
    void emptyPositionalList() {
        ParsedQuery r = parser.parse("SELECT * FROM tbl WHERE id = ?", Params.none());
        assertThat(r.binds()).isEmpty();
    }

    // ==================== Positional ====================

    @Test
    void questionMarkParamsBindAsStrings() {
        ParsedQuery r = parser.parse("SELECT * FROM tbl WHERE id = ? AND name > ?",
                Params.positional(5, "Jon"));
        assertThat(r.sql()).isEqualTo("SELECT * FROM tbl WHERE id = ? AND name > ?");
        assertThat(r.binds()).containsExactly(
                BindInstruction.positional(1, 5),
                BindInstruction.positional(2, "Jon"));
        assertThat(r.binds()).extracting(BindInstruction::type).containsOnly(STRING);
    }

    @Test
    void positionalListIsNeverFlattened() {
        List<Integer> ids = List.of(1, 2);
        ParsedQuery r = parser.parse("SELECT * FROM tbl WHERE id IN(?)", Params.positional(List.of(ids)));
        assertThat(r.sql()).isEqualTo("SELECT * FROM tbl WHERE id IN(?)");
        assertThat(r.binds()).containsExactly(BindInstruction.positional(1, ids));
    }

    @Test
    void positionalCountIsNotValidated() {
        ParsedQuery r = parser.parse("SELECT * FROM tbl WHERE id = ?", Params.positional(1, 2, 3));
        assertThat(r.binds()).hasSize(3);
    }

    @Test
    void positionalNullValue() {
        ParsedQuery r = parser.parse("UPDATE tbl SET name = ?", Params.positional((Object) null));
        assertThat(r.binds()).containsExactly(BindInstruction.positional(1, null));
    }

    // ==================== Named ====================

    @Test
    void namedParamsSimple() {
        ParsedQuery r = parser.parse(
                "SELECT * FROM tbl WHERE id = :id AND name > :name AND active = :active",
                Params.named().with(":id", 1).with("name", "Jon").with("active", 1));
        assertThat(r.sql()).isEqualTo("SELECT * FROM tbl WHERE id = :id AND name > :name AND active = :active");
        assertThat(r.binds()).containsExactly(
                BindInstruction.named("id", 1, STRING),
                BindInstruction.named("name", "Jon", STRING),
                BindInstruction.named("active", 1, STRING));
    }

    @Test
    void namedParamsWithTypes() {
        ParsedQuery r = parser.parse(
                "SELECT * FROM tbl WHERE id = :id AND name > :name AND active = :active",
                Params.named().with("id<i>", 1).with(":name<s>", "Jon").with(":active<b>", 0));
        assertThat(r.binds()).containsExactly(
                BindInstruction.named("id", 1, INT),
                BindInstruction.named("name", "Jon", STRING),
                BindInstruction.named("active", 0, BOOL));
    }

    @Test
    void namedParamsWithTypesAndArrays() {
        ParsedQuery r = parser.parse(
                "SELECT * FROM tbl WHERE id IN(:id) AND name > :name AND active = :active",
                Params.named()
                        .with(":id[i]", List.of(1, 5, 15))
                        .with(":name<>", "Jon")
                        .with(":active<b>", null));
        assertThat(r.sql())
                .isEqualTo("SELECT * FROM tbl WHERE id IN(:id0,:id1,:id2) AND name > :name AND active = :active");
        assertThat(r.binds()).containsExactly(
                BindInstruction.named("id0", 1, INT),
                BindInstruction.named("id1", 5, INT),
                BindInstruction.named("id2", 15, INT),
                BindInstruction.named("name", "Jon", STRING),
                BindInstruction.named("active", null, BOOL));
    }

    @Test
    void namedParamsWithSamePrefix() {
        ParsedQuery r = parser.parse(
                "SELECT * FROM tbl WHERE id IN(:id) AND id2 IN(:id_2)",
                Params.named().with(":id[i]", List.of(1, 2)).with(":id_2[i]", List.of(2, 3)));
        assertThat(r.sql()).isEqualTo("SELECT * FROM tbl WHERE id IN(:id0,:id1) AND id2 IN(:id_20,:id_21)");
        assertThat(r.binds()).containsExactly(
                BindInstruction.named("id0", 1, INT),
                BindInstruction.named("id1", 2, INT),
                BindInstruction.named("id_20", 2, INT),
                BindInstruction.named("id_21", 3, INT));
    }

    @Test
    void longerNameFirstDoesNotMatter() {
        ParsedQuery r = parser.parse(
                "SELECT * FROM tbl WHERE id IN(:id) AND id2 IN(:id_2)",
                Params.named().with(":id_2[i]", List.of(2, 3)).with(":id[i]", List.of(1, 2)));
        assertThat(r.sql()).isEqualTo("SELECT * FROM tbl WHERE id IN(:id0,:id1) AND id2 IN(:id_20,:id_21)");
    }

    @Test
    void generatedTokensAreNotRewrittenAgain() {
        ParsedQuery r = parser.parse(
                "SELECT * FROM tbl WHERE a IN(:id) AND b IN(:id0)",
                Params.named().with(":id[i]", List.of(1, 2)).with(":id0[i]", List.of(7)));
        assertThat(r.sql()).isEqualTo("SELECT * FROM tbl WHERE a IN(:id0,:id1) AND b IN(:id00)");
    }

    @Test
    void everyOccurrenceIsRewritten() {
        ParsedQuery r = parser.parse(
                "SELECT * FROM a WHERE x IN(:ids) UNION SELECT * FROM b WHERE y IN(:ids)",
                Params.named(":ids[s]", List.of("p", "q")));
        assertThat(r.sql())
                .isEqualTo("SELECT * FROM a WHERE x IN(:ids0,:ids1) UNION SELECT * FROM b WHERE y IN(:ids0,:ids1)");
        assertThat(r.binds()).hasSize(2);
    }

    @Test
    void arrayElementsKeepIterationOrder() {
        ParsedQuery r = parser.parse("SELECT * FROM tbl WHERE name IN(:n)",
                Params.named(":n[s]", new LinkedHashSet<>(Arrays.asList("c", "a", "b"))));
        assertThat(r.binds()).extracting(BindInstruction::value).containsExactly("c", "a", "b");
    }

    @Test
    void javaArraysAreFlattened() {
        ParsedQuery r = parser.parse("SELECT * FROM tbl WHERE id IN(:id)",
                Params.named(":id[i]", new int[] {4, 8}));
        assertThat(r.sql()).isEqualTo("SELECT * FROM tbl WHERE id IN(:id0,:id1)");
        assertThat(r.binds()).containsExactly(
                BindInstruction.named("id0", 4, INT),
                BindInstruction.named("id1", 8, INT));
    }

    @Test
    void arrayUnderAngleSuffixBindsAsSingleValue() {
        List<Integer> ids = List.of(1, 2);
        ParsedQuery r = parser.parse("SELECT * FROM tbl WHERE id IN(:id)", Params.named(":id<i>", ids));
        assertThat(r.sql()).isEqualTo("SELECT * FROM tbl WHERE id IN(:id)");
        assertThat(r.binds()).containsExactly(BindInstruction.named("id", ids, INT));
    }

    @Test
    void scalarUnderSquareSuffixBindsAsSingleValue() {
        ParsedQuery r = parser.parse("SELECT * FROM tbl WHERE id = :id", Params.named(":id[i]", 3));
        assertThat(r.sql()).isEqualTo("SELECT * FROM tbl WHERE id = :id");
        assertThat(r.binds()).containsExactly(BindInstruction.named("id", 3, INT));
    }

    @Test
    void emptyArrayBindsNothingAndKeepsPlaceholder() {
        ParsedQuery r = parser.parse("SELECT * FROM tbl WHERE id IN(:id)", Params.named(":id[i]", List.of()));
        assertThat(r.sql()).isEqualTo("SELECT * FROM tbl WHERE id IN(:id)");
        assertThat(r.binds()).isEmpty();
    }

    @Test
    void unknownTypeLetterDefaultsToString() {
        ParsedQuery r = parser.parse("SELECT * FROM tbl WHERE id = :id", Params.named("id<x>", 1));
        assertThat(r.binds()).containsExactly(BindInstruction.named("id", 1, BindType.STRING));
    }

    @Test
    void placeholderInsideLiteralIsLeftAlone() {
        ParsedQuery r = parser.parse("SELECT ':id' AS label FROM tbl WHERE id IN(:id)",
                Params.named(":id[i]", List.of(1, 2)));
        assertThat(r.sql()).isEqualTo("SELECT ':id' AS label FROM tbl WHERE id IN(:id0,:id1)");
    }

    @Test
    void apostropheInCommentDoesNotHideLaterPlaceholders() {
        ParsedQuery r = parser.parse("SELECT * FROM tbl -- user's ids\nWHERE id IN(:id)",
                Params.named(":id[i]", List.of(1, 2)));
        assertThat(r.sql()).isEqualTo("SELECT * FROM tbl -- user's ids\nWHERE id IN(:id0,:id1)");
        assertThat(r.binds()).containsExactly(
                BindInstruction.named("id0", 1, INT),
                BindInstruction.named("id1", 2, INT));
    }

    @Test
    void placeholderInsideBlockCommentIsLeftAlone() {
        ParsedQuery r = parser.parse("SELECT * FROM tbl /* IN(:id) */ WHERE id IN(:id)",
                Params.named(":id[i]", List.of(1, 2)));
        assertThat(r.sql()).isEqualTo("SELECT * FROM tbl /* IN(:id) */ WHERE id IN(:id0,:id1)");
    }

    // ==================== Malformed keys ====================

    @Test
    void keyWithSpaceThrows() {
        assertThatThrownBy(() -> parser.parse("SELECT * FROM tbl WHERE id = :id",
                Params.named("id x", 1)))
                .isInstanceOf(MalformedParameterNameException.class)
                .hasMessageContaining("id x");
    }

    @Test
    void malformedKeyAfterValidOnesProducesNothing() {
        Params.Named params = Params.named()
                .with(":id[i]", List.of(1, 2))
                .with(":name{s}", "Jon");
        String query = "SELECT * FROM tbl WHERE id IN(:id) AND name = :name";

        assertThatThrownBy(() -> parser.parse(query, params))
                .isInstanceOf(MalformedParameterNameException.class)
                .satisfies(e -> assertThat(((MalformedParameterNameException) e).getParameterName())
                        .isEqualTo(":name{s}"));
        assertThat(query).isEqualTo("SELECT * FROM tbl WHERE id IN(:id) AND name = :name");
        assertThat(params.values()).containsOnlyKeys(":id[i]", ":name{s}");
    }

    @Test
    void mismatchedBracketsThrow() {
        assertThatThrownBy(() -> parser.parse("SELECT 1", Params.named(":id<i]", 1)))
                .isInstanceOf(MalformedParameterNameException.class);
        assertThatThrownBy(() -> parser.parse("SELECT 1", Params.named(":id[i>", 1)))
                .isInstanceOf(MalformedParameterNameException.class);
    }

    @Test
    void twoLetterSuffixThrows() {
        assertThatThrownBy(() -> parser.parse("SELECT 1", Params.named(":id<ii>", 1)))
                .isInstanceOf(MalformedParameterNameException.class);
    }
}

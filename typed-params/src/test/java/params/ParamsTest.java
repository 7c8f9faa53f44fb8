package params;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.assertj.core.api.Assertions.tuple;
import static org.junit.jupiter.api.Assertions.assertAll;
import static params.TypeDescriptor.any;
import static params.TypeDescriptor.decimal;
import static params.TypeDescriptor.integer;
import static params.TypeDescriptor.listOf;
import static params.TypeDescriptor.mapOf;
import static params.TypeDescriptor.string;
import static params.TypeDescriptor.union;

import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.IntStream;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import params.publication.PublicationParams;
import params.publication.RowNames;
import params.publication.Section;

class ParamsTest {

    record RowNamesParams(RowNames ROW_NAMES) {}

    record RowOrderParams(List<String> PUBLICATION_ROW_ORDER) {}

    record MockSubObject(String STRING_1) {}

    record MockParams(
            String TEST_STRING,
            int TEST_INT,
            Map<String, Object> TEST_DICT,
            List<Object> TEST_LIST,
            MockSubObject TEST_SUBOBJECT) {}

    record Footnote(Optional<String> NOTE) {}

    record Threshold(Object LIMIT) {}

    record Level3(String VALUE) {}

    record Level2(Level3 C) {}

    record Level1(Level2 B) {}

    record Level0(Level1 A) {}

    record Positive(int VALUE) {
        Positive {
            if (VALUE <= 0) throw new IllegalArgumentException("VALUE must be positive");
        }
    }

    static Path testData(String name) throws Exception {
        return Path.of(ParamsTest.class.getResource("/test_data/" + name).toURI());
    }

    static Params.ValidationException validationFailure(ThrowingCallable call) {
        var thrown = catchThrowable(call);
        assertThat(thrown).isInstanceOf(Params.ValidationException.class);
        return (Params.ValidationException) thrown;
    }

    @Nested
    class ConstructTests {

        @Test
        void nestedSchemaFieldsAreAttributeAccessible() {
            var raw = Map.of("ROW_NAMES", Map.of("TOTAL_ROW", "total_row_name", "QUESTION_ROW", "question_row_name"));

            var params = Params.construct(Schema.of(RowNamesParams.class), raw);

            assertThat(params.ROW_NAMES().TOTAL_ROW()).isEqualTo("total_row_name");
            assertThat(params.ROW_NAMES().QUESTION_ROW()).isEqualTo("question_row_name");
        }

        @Test
        void sequenceKeepsOrder() {
            var raw = Map.of("PUBLICATION_ROW_ORDER", List.of("ROW_1", "ROW_2", "ROW_3"));

            var params = Params.construct(RowOrderParams.class, raw);

            assertThat(params.PUBLICATION_ROW_ORDER()).containsExactly("ROW_1", "ROW_2", "ROW_3");
        }

        @Test
        void loadPublicationParams() throws Exception {
            var params = Params.load(Schema.of(PublicationParams.class), testData("publication_2024.json"));

            assertThat(params.PUBLICATION_YEAR()).isEqualTo(2024);
            assertThat(params.ROW_NAMES()).isEqualTo(new RowNames("total_row_name", "question_row_name"));
            assertThat(params.PUBLICATION_ROW_ORDER()).containsExactly("ROW_1", "ROW_2", "ROW_3");
            assertThat(params.SUPPRESSION_THRESHOLD()).isEqualTo(10L);
            assertThat(params.SECTIONS())
                    .containsExactly(
                            new Section("Overview", List.of("ROW_1"), Optional.empty()),
                            new Section("Detail", List.of("ROW_2", "ROW_3"), Optional.of("Provisional")));
            assertThat(params.SHEET_NAMES())
                    .containsExactly(Map.entry("summary", "Summary"), Map.entry("detail", "Detail tables"));
        }

        @Test
        void untypedListsAndDictsKeepRawValues() throws Exception {
            var params = Params.load(Schema.of(MockParams.class), testData("mock_params.json"));

            assertThat(params.TEST_STRING()).isEqualTo("TEST_STRING");
            assertThat(params.TEST_INT()).isEqualTo(7);
            assertThat(params.TEST_DICT()).isEqualTo(Map.of("TEST_DICT_1", "1"));
            assertThat(params.TEST_LIST()).isEqualTo(List.of("1", "2", "3"));
            assertThat(params.TEST_SUBOBJECT()).isEqualTo(new MockSubObject("some_string"));
        }

        @Test
        void acceptsParsedTreeAndPlainJava() {
            var schema = Schema.of(RowOrderParams.class);
            var fromTree = Params.construct(schema, Params.parse("{\"PUBLICATION_ROW_ORDER\":[\"A\",\"B\"]}"));
            var fromJava = Params.construct(schema, Map.of("PUBLICATION_ROW_ORDER", List.of("A", "B")));

            assertThat(fromTree).isEqualTo(fromJava);
        }

        @Test
        void constructIsDeterministic() throws Exception {
            var schema = Schema.of(PublicationParams.class);
            var raw = Params.read(testData("publication_2024.json"));

            assertThat(Params.construct(schema, raw)).isEqualTo(Params.construct(schema, raw));
        }

        @Test
        void roundTripThroughRawValue() throws Exception {
            var schema = Schema.of(PublicationParams.class);
            var params = Params.load(schema, testData("publication_2024.json"));

            var raw = Params.toRaw(params);

            assertThat(Params.construct(schema, raw)).isEqualTo(params);
            assertThat(Params.construct(schema, raw.toJava())).isEqualTo(params);
        }
    }

    @Nested
    class OptionalAndUnionTests {

        @Test
        void optionalAcceptsAbsentNullAndValue() {
            var schema = Schema.of(Footnote.class);
            var withNull = new LinkedHashMap<String, Object>();
            withNull.put("NOTE", null);

            assertThat(Params.construct(schema, Map.of()).NOTE()).isEmpty();
            assertThat(Params.construct(schema, withNull).NOTE()).isEmpty();
            assertThat(Params.construct(schema, Map.of("NOTE", "see above")).NOTE()).contains("see above");
        }

        @Test
        void optionalStillChecksPresentValue() {
            var e = validationFailure(() -> Params.construct(Footnote.class, Map.of("NOTE", 3)));

            assertThat(e.getErrors()).singleElement().satisfies(error -> {
                assertThat(error.path()).isEqualTo(FieldPath.of("NOTE"));
                assertThat(error.code()).isEqualTo(ValidationError.Code.TYPE_MISMATCH);
            });
        }

        @Test
        void unionTakesFirstMatchingAlternative() {
            var schema = Schema.forRecord(Threshold.class).field("LIMIT", union(integer(), string())).build();

            assertThat(Params.construct(schema, Map.of("LIMIT", 5)).LIMIT()).isEqualTo(5);
            assertThat(Params.construct(schema, Map.of("LIMIT", "none")).LIMIT()).isEqualTo("none");

            var decimalFirst = Schema.forRecord(Threshold.class).field("LIMIT", union(decimal(), integer())).build();
            assertThat(Params.construct(decimalFirst, Map.of("LIMIT", 5)).LIMIT()).isEqualTo(new BigDecimal("5"));
        }

        @Test
        void unionReportsEveryRejectedAlternative() {
            var schema = Schema.forRecord(Threshold.class).field("LIMIT", union(integer(), string())).build();

            var e = validationFailure(() -> Params.construct(schema, Map.of("LIMIT", true)));

            assertThat(e.getErrors())
                    .extracting(ValidationError::code)
                    .containsExactly(
                            ValidationError.Code.NO_UNION_MATCH,
                            ValidationError.Code.TYPE_MISMATCH,
                            ValidationError.Code.TYPE_MISMATCH);
            assertThat(e.getErrors()).allSatisfy(error -> assertThat(error.path()).isEqualTo(FieldPath.of("LIMIT")));
            assertThat(e.getErrors().get(1).expected()).isEqualTo(integer());
            assertThat(e.getErrors().get(2).expected()).isEqualTo(string());
        }
    }

    @Nested
    class FailureTests {

        @Test
        void missingRequiredField() {
            var e = validationFailure(() -> Params.construct(RowNames.class, Map.of("TOTAL_ROW", "total")));

            assertThat(e.getErrors()).singleElement().satisfies(error -> {
                assertThat(error.path()).isEqualTo(FieldPath.of("QUESTION_ROW"));
                assertThat(error.code()).isEqualTo(ValidationError.Code.MISSING_FIELD);
                assertThat(error.actual()).isNull();
            });
        }

        @Test
        void reportsEveryIndependentError() throws Exception {
            var e = validationFailure(() ->
                    Params.load(Schema.of(PublicationParams.class), testData("publication_2024_broken.json")));

            assertThat(e.getErrors())
                    .extracting(ValidationError::path)
                    .containsExactly(
                            FieldPath.of("PUBLICATION_YEAR"),
                            FieldPath.of("ROW_NAMES", "TOTAL_ROW"),
                            FieldPath.of("ROW_NAMES", "QUESTION_ROW"),
                            FieldPath.of("PUBLICATION_ROW_ORDER").index(1),
                            FieldPath.of("SHEET_NAMES").key("detail"));
            assertThat(e.getErrors())
                    .extracting(ValidationError::code)
                    .containsExactly(
                            ValidationError.Code.TYPE_MISMATCH,
                            ValidationError.Code.TYPE_MISMATCH,
                            ValidationError.Code.MISSING_FIELD,
                            ValidationError.Code.TYPE_MISMATCH,
                            ValidationError.Code.TYPE_MISMATCH);
            assertThat(e.getSchemaName()).isEqualTo("PublicationParams");
            assertThat(e.getMessage())
                    .startsWith("5 validation errors building PublicationParams:")
                    .contains("PUBLICATION_ROW_ORDER[1]: expected a string but got number (expected string, got number 2)")
                    .contains("SHEET_NAMES[\"detail\"]: expected a string but got null");
        }

        @Test
        void rootMustBeAnObject() {
            var e = validationFailure(() -> Params.construct(RowNames.class, List.of("TOTAL_ROW")));

            assertThat(e.getErrors()).singleElement().satisfies(error -> {
                assertThat(error.path().isRoot()).isTrue();
                assertThat(error.message()).isEqualTo("expected a RowNames but got array");
            });
            assertThat(validationFailure(() -> Params.construct(RowNames.class, null)).getErrors())
                    .singleElement()
                    .satisfies(error -> assertThat(error.actual()).isEqualTo(new JsonNull()));
        }

        @Test
        void unknownKeysIgnoredByDefault() {
            var raw = Map.of("TOTAL_ROW", "t", "QUESTION_ROW", "q", "TOTAL_ROWS", "typo");

            assertThat(Params.construct(RowNames.class, raw)).isEqualTo(new RowNames("t", "q"));
        }

        @Test
        void unknownKeysRejectedWhenConfigured() {
            var options = Params.options().toBuilder().unknownKeys(Params.UnknownKeys.REJECT).build();
            var raw = new LinkedHashMap<String, Object>();
            raw.put("TOTAL_ROW", "t");
            raw.put("TOTAL_ROWS", "typo");

            var e = validationFailure(() -> Params.construct(Schema.of(RowNames.class), raw, options));

            assertThat(e.getErrors())
                    .extracting(ValidationError::code, ValidationError::path)
                    .containsExactly(
                            tuple(ValidationError.Code.MISSING_FIELD, FieldPath.of("QUESTION_ROW")),
                            tuple(ValidationError.Code.UNKNOWN_FIELD, FieldPath.of("TOTAL_ROWS")));
        }

        @Test
        void nestingDepthIsBounded() {
            var options = Params.options().toBuilder().maxDepth(2).build();
            var raw = Map.of("A", Map.of("B", Map.of("C", Map.of("VALUE", "deep"))));

            var e = validationFailure(() -> Params.construct(Schema.of(Level0.class), raw, options));

            assertThat(e.getErrors()).singleElement().satisfies(error -> {
                assertThat(error.code()).isEqualTo(ValidationError.Code.DEPTH_EXCEEDED);
                assertThat(error.path()).isEqualTo(FieldPath.of("A", "B", "C"));
            });
            assertThat(Params.construct(Schema.of(Level0.class), raw).A().B().C().VALUE()).isEqualTo("deep");
        }

        @Test
        void deepPlainJavaValueIsADepthError() {
            Object value = "leaf";
            for (int i = 0; i < 200_000; i++) value = List.of(value);
            var schema = Schema.builder("Deep").field("A", any()).build();
            var raw = Map.of("A", value);

            var e = validationFailure(() -> Params.construct(schema, raw));

            assertThat(e.getErrors()).singleElement().satisfies(error -> {
                assertThat(error.code()).isEqualTo(ValidationError.Code.DEPTH_EXCEEDED);
                assertThat(error.path().depth()).isEqualTo(Params.DEFAULT_MAX_DEPTH + 1);
                assertThat(error.path().segments().get(0)).isEqualTo(new FieldPath.Segment.Field("A"));
            });
        }

        @Test
        void selfContainingValueIsADepthError() {
            var rows = new ArrayList<Object>();
            rows.add(rows);
            var schema = Schema.builder("Rows").field("ROWS", listOf(any())).build();

            var e = validationFailure(() -> Params.construct(schema, Map.of("ROWS", rows)));

            assertThat(e.getErrors())
                    .singleElement()
                    .extracting(ValidationError::code)
                    .isEqualTo(ValidationError.Code.DEPTH_EXCEEDED);
            assertThatCode(() -> Params.toRaw(rows)).isInstanceOf(Params.DepthExceededException.class);
        }

        @Test
        void deepJsonTreeIsADepthError() {
            JsonValue value = new JsonString("leaf");
            for (int i = 0; i < 200_000; i++) value = new JsonArray(List.of(value));
            var deep = value;

            // @spotless:off
            var table = new Object[][] {
                    {Schema.builder("Deep").field("A", any()).build(), ValidationError.Code.DEPTH_EXCEEDED},
                    {Schema.builder("Deep").field("A", listOf(any())).build(), ValidationError.Code.DEPTH_EXCEEDED},
                    {Schema.builder("Deep").field("A", mapOf(any())).build(), ValidationError.Code.TYPE_MISMATCH},
                    {Schema.builder("Deep").field("A", listOf(listOf(listOf(string())))).build(), ValidationError.Code.TYPE_MISMATCH},
                    {Schema.builder("Deep").field("A", string()).build(), ValidationError.Code.TYPE_MISMATCH},
            };
            // @spotless:on

            assertAll(IntStream.range(0, table.length).mapToObj(i -> () -> {
                @SuppressWarnings("unchecked")
                var schema = (Schema<ParamsObject>) table[i][0];
                var raw = new JsonObject(Map.of("A", deep));
                var e = validationFailure(() -> Params.construct(schema, raw));
                assertThat(e.getErrors())
                        .as("Case %d: schema=%s", i, schema)
                        .singleElement()
                        .extracting(ValidationError::code)
                        .isEqualTo(table[i][1]);
                assertThat(e.getMessage()).as("Case %d: schema=%s", i, schema).hasSizeLessThan(16_000);
            }));
        }

        @Test
        void deepValueUnderUnknownKeyIsReportedBriefly() {
            var options = Params.options().toBuilder().unknownKeys(Params.UnknownKeys.REJECT).build();
            JsonValue value = new JsonNull();
            for (int i = 0; i < 200_000; i++) value = new JsonObject(Map.of("X", value));
            var raw = new JsonObject(Map.of("TOTAL_ROW", new JsonString("t"), "QUESTION_ROW", new JsonString("q"), "EXTRA", value));

            var e = validationFailure(() -> Params.construct(Schema.of(RowNames.class), raw, options));

            assertThat(e.getErrors()).singleElement().satisfies(error -> {
                assertThat(error.code()).isEqualTo(ValidationError.Code.UNKNOWN_FIELD);
                assertThat(error.render()).contains("{\"X\":{\"X\":").endsWith("...)");
            });
        }

        @Test
        void maxDepthMustBePositive() {
            var options = Params.options().toBuilder().maxDepth(0).build();

            assertThatCode(() -> Params.construct(Schema.of(RowNames.class), Map.of(), options))
                    .isInstanceOf(Params.ConfigurationException.class)
                    .hasMessageContaining("maxDepth");
        }

        @Test
        void recordConstructorRejection() {
            var e = validationFailure(() -> Params.construct(Positive.class, Map.of("VALUE", -1)));

            assertThat(e.getErrors()).singleElement().satisfies(error -> {
                assertThat(error.code()).isEqualTo(ValidationError.Code.REJECTED);
                assertThat(error.message()).contains("VALUE must be positive");
            });
        }
    }

    @Nested
    class ReadTests {

        @Test
        void missingFile(@TempDir Path dir) {
            assertThatCode(() -> Params.read(dir.resolve("params_1999.json")))
                    .isInstanceOf(Params.ReadException.class)
                    .hasMessageContaining("params_1999.json");
        }

        @Test
        void malformedFile(@TempDir Path dir) throws Exception {
            var file = Files.writeString(dir.resolve("params.json"), "{\"TOTAL_ROW\": \"t\",\n \"QUESTION_ROW\" \"q\"}");

            assertThatCode(() -> Params.load(Schema.of(RowNames.class), file))
                    .isInstanceOf(Params.SyntaxException.class)
                    .hasMessageContaining("line 2");
        }

        @Test
        void pathIsNotARawValue() throws Exception {
            var file = testData("mock_params.json");

            assertThatCode(() -> Params.construct(Schema.of(MockParams.class), file))
                    .isInstanceOf(Params.ConversionException.class);
        }
    }
}

package protojson;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.junit.jupiter.api.Assertions.assertAll;
import static protojson.TestSchemas.NODE;
import static protojson.TestSchemas.PALETTE;
import static protojson.TestSchemas.enumValue;
import static protojson.TestSchemas.field;

import com.google.protobuf.Descriptors.EnumValueDescriptor;
import java.util.List;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class EnumResolverTest {

    @Nested
    class FromJsonTests {

        @Test
        void messageTypeScope() {
            // @spotless:off
            var table = new Object[][] {
                    {"shade", "\"DARK\"", "DARK"},
                    {"shade", "\"LIGHT\"", "LIGHT"},
                    // names of any enum declared on the message resolve by number
                    {"shade", "\"HIGH\"", "DARK"},
                    {"color", "\"LIGHT\"", "RED"},
                    {"shade", "1", "DARK"},
                    {"color", "2", "BLUE"},
                    {"color", "\"2\"", null},
            };
            // @spotless:on

            assertAll(IntStream.range(0, table.length).mapToObj(i -> () -> {
                var row = table[i];
                var name = (String) row[0];
                var input = (String) row[1];
                var expected = (String) row[2];
                if (expected == null) {
                    assertThatCode(() -> resolve(name, input, EnumLookupScope.MESSAGE_TYPE))
                            .as("Case %d: %s <- %s", i, name, input)
                            .isInstanceOf(ProtoJsonException.ProtoEnumValueNotFoundException.class);
                    return;
                }
                var actual = resolve(name, input, EnumLookupScope.MESSAGE_TYPE);
                assertThat(actual.getName()).as("Case %d: %s <- %s", i, name, input).isEqualTo(expected);
                assertThat(actual.getType()).isEqualTo(field(PALETTE, name).getEnumType());
            }));
        }

        @Test
        void topLevelEnumIsNotFoundInMessageTypeScope() {
            assertThatCode(() -> resolve("color", "\"GREEN\"", EnumLookupScope.MESSAGE_TYPE))
                    .isInstanceOf(ProtoJsonException.ProtoEnumValueNotFoundException.class)
                    .hasMessageContaining("GREEN")
                    .extracting(e -> ((ProtoJsonException.ProtoEnumValueNotFoundException) e).getValue())
                    .isEqualTo("GREEN");
        }

        @Test
        void fieldTypeScope() {
            assertThat(resolve("color", "\"GREEN\"", EnumLookupScope.FIELD_TYPE))
                    .isEqualTo(enumValue(PALETTE, "color", "GREEN"));
            assertThat(resolve("shade", "\"DARK\"", EnumLookupScope.FIELD_TYPE))
                    .isEqualTo(enumValue(PALETTE, "shade", "DARK"));
            assertThatCode(() -> resolve("shade", "\"HIGH\"", EnumLookupScope.FIELD_TYPE))
                    .isInstanceOf(ProtoJsonException.ProtoEnumValueNotFoundException.class)
                    .hasMessageContaining("HIGH");
        }

        @Test
        void unknownNumber() {
            assertThatCode(() -> resolve("shade", "5", EnumLookupScope.MESSAGE_TYPE))
                    .isInstanceOf(ProtoJsonException.ProtoEnumValueNotFoundException.class)
                    .extracting(e -> ((ProtoJsonException.ProtoEnumValueNotFoundException) e).getValue())
                    .isEqualTo(5);
        }

        @Test
        void wrongKind() {
            // @spotless:off
            var table = new String[] {"null", "true", "[]", "{}"};
            // @spotless:on

            assertAll(IntStream.range(0, table.length).mapToObj(i -> () -> assertThatCode(
                            () -> resolve("shade", table[i], EnumLookupScope.MESSAGE_TYPE))
                    .as("Case %d: input=%s", i, table[i])
                    .isInstanceOf(ProtoJsonException.FieldValueConversionException.class)
                    .hasMessageContaining("to enum testdata.Palette.Shade")));
        }

        @Test
        void scopeThroughConverter() {
            var fieldScoped = ProtoJson.Converter.builder()
                    .enumLookupScope(EnumLookupScope.FIELD_TYPE)
                    .build();

            var palette = fieldScoped.decode("{\"color\":\"GREEN\",\"shades\":[\"DARK\",\"LIGHT\"]}", PALETTE);

            assertThat(palette.getField(field(PALETTE, "color"))).isEqualTo(enumValue(PALETTE, "color", "GREEN"));
            assertThat(palette.getField(field(PALETTE, "shades")))
                    .isEqualTo(List.of(enumValue(PALETTE, "shade", "DARK"), enumValue(PALETTE, "shade", "LIGHT")));
            assertThat(fieldScoped.toBuilder().build().enumLookupScope()).isEqualTo(EnumLookupScope.FIELD_TYPE);
            assertThat(ProtoJson.Converter.builder().build().enumLookupScope())
                    .isEqualTo(EnumLookupScope.MESSAGE_TYPE);
            assertThatCode(() -> ProtoJson.decode("{\"color\":\"GREEN\"}", PALETTE))
                    .isInstanceOf(ProtoJsonException.ProtoEnumValueNotFoundException.class);
        }

        private static EnumValueDescriptor resolve(String name, String json, EnumLookupScope scope) {
            return EnumResolver.fromJson(field(PALETTE, name), Json.parse(json), PALETTE, scope);
        }
    }

    @Nested
    class NameOfTests {

        @Test
        void nameOf() {
            var state = field(NODE, "state");

            assertThat(EnumResolver.nameOf(state, enumValue(NODE, "state", "UNAVAILABLE")))
                    .isEqualTo("UNAVAILABLE");
            assertThat(EnumResolver.nameOf(state, 1)).isEqualTo("AVAILABLE");
        }

        @Test
        void unknownNumber() {
            assertThatCode(() -> EnumResolver.nameOf(field(NODE, "state"), 7))
                    .isInstanceOf(ProtoJsonException.ProtoEnumValueNotFoundException.class)
                    .hasMessageContaining("Enum does not have a value 7 (field: state)");
        }
    }
}

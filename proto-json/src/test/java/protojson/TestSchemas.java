package protojson;

import com.google.protobuf.DescriptorProtos.DescriptorProto;
import com.google.protobuf.DescriptorProtos.EnumDescriptorProto;
import com.google.protobuf.DescriptorProtos.EnumValueDescriptorProto;
import com.google.protobuf.DescriptorProtos.FieldDescriptorProto;
import com.google.protobuf.DescriptorProtos.FieldDescriptorProto.Label;
import com.google.protobuf.DescriptorProtos.FieldDescriptorProto.Type;
import com.google.protobuf.DescriptorProtos.FileDescriptorProto;
import com.google.protobuf.DescriptorProtos.MessageOptions;
import com.google.protobuf.Descriptors;
import com.google.protobuf.DynamicMessage;

/**
 * Message types used across the tests, built from descriptor protos instead of generated code.
 *
 * <pre>
 * // testdata/schemas.proto (proto2)
 * message Node {
 *   enum State { PLANNED = 0; AVAILABLE = 1; UNAVAILABLE = 2; }
 *   optional State state = 1 [default = PLANNED];
 *   required string nodeid = 2;
 * }
 * message Notes { repeated string notes = 1; }
 * message Inner { optional string test = 1 [default = "test"]; }
 * message Embedded { optional Inner testmessage = 1; }
 * message Scalars { optional bool b = 1; ... repeated int32 numbers = 16; }
 * message Tree { optional string name = 1; optional Tree child = 2; repeated Tree children = 3; }
 * enum Color { RED = 0; GREEN = 1; BLUE = 2; }
 * message Palette {
 *   enum Shade { LIGHT = 0; DARK = 1; }
 *   enum Level { LOW = 0; HIGH = 1; }
 *   optional Color color = 1;
 *   optional Shade shade = 2;
 *   repeated Shade shades = 3;
 * }
 * message Counts { map&lt;string, int32&gt; counts = 1; }
 * message Settings {
 *   required int32 retries = 1 [default = 3];
 *   optional string owner = 2;
 *   optional double ratio = 3 [default = 0.5];
 * }
 *
 * // testdata/open.proto (proto3)
 * message Light { enum Phase { PHASE_UNSPECIFIED = 0; ON = 1; } Phase phase = 1; string label = 2; }
 * </pre>
 */
final class TestSchemas {

    static final Descriptors.FileDescriptor SCHEMAS = build(schemasProto());
    static final Descriptors.FileDescriptor OPEN = build(openProto());

    static final Descriptors.Descriptor NODE = SCHEMAS.findMessageTypeByName("Node");
    static final Descriptors.Descriptor NOTES = SCHEMAS.findMessageTypeByName("Notes");
    static final Descriptors.Descriptor INNER = SCHEMAS.findMessageTypeByName("Inner");
    static final Descriptors.Descriptor EMBEDDED = SCHEMAS.findMessageTypeByName("Embedded");
    static final Descriptors.Descriptor SCALARS = SCHEMAS.findMessageTypeByName("Scalars");
    static final Descriptors.Descriptor TREE = SCHEMAS.findMessageTypeByName("Tree");
    static final Descriptors.Descriptor PALETTE = SCHEMAS.findMessageTypeByName("Palette");
    static final Descriptors.Descriptor COUNTS = SCHEMAS.findMessageTypeByName("Counts");
    static final Descriptors.Descriptor SETTINGS = SCHEMAS.findMessageTypeByName("Settings");
    static final Descriptors.Descriptor LIGHT = OPEN.findMessageTypeByName("Light");

    private TestSchemas() {}

    static Descriptors.FieldDescriptor field(Descriptors.Descriptor type, String name) {
        return type.findFieldByName(name);
    }

    static Descriptors.EnumValueDescriptor enumValue(Descriptors.Descriptor type, String field, String name) {
        return field(type, field).getEnumType().findValueByName(name);
    }

    static DynamicMessage node(String nodeid, String state) {
        return DynamicMessage.newBuilder(NODE)
                .setField(field(NODE, "nodeid"), nodeid)
                .setField(field(NODE, "state"), enumValue(NODE, "state", state))
                .build();
    }

    static Descriptors.FileDescriptor build(FileDescriptorProto proto) {
        try {
            return Descriptors.FileDescriptor.buildFrom(proto, new Descriptors.FileDescriptor[0]);
        } catch (Descriptors.DescriptorValidationException e) {
            throw new IllegalStateException("Invalid test schema " + proto.getName(), e);
        }
    }

    static FieldDescriptorProto.Builder scalar(String name, int number, Type type) {
        return FieldDescriptorProto.newBuilder()
                .setName(name)
                .setNumber(number)
                .setLabel(Label.LABEL_OPTIONAL)
                .setType(type);
    }

    static FieldDescriptorProto.Builder typed(String name, int number, Type type, String typeName) {
        return scalar(name, number, type).setTypeName(typeName);
    }

    static EnumDescriptorProto enumType(String name, String... values) {
        var builder = EnumDescriptorProto.newBuilder().setName(name);
        for (int i = 0; i < values.length; i++) {
            builder.addValue(EnumValueDescriptorProto.newBuilder().setName(values[i]).setNumber(i));
        }
        return builder.build();
    }

    private static FileDescriptorProto schemasProto() {
        var node = DescriptorProto.newBuilder()
                .setName("Node")
                .addEnumType(enumType("State", "PLANNED", "AVAILABLE", "UNAVAILABLE"))
                .addField(typed("state", 1, Type.TYPE_ENUM, ".testdata.Node.State").setDefaultValue("PLANNED"))
                .addField(scalar("nodeid", 2, Type.TYPE_STRING).setLabel(Label.LABEL_REQUIRED));

        var notes = DescriptorProto.newBuilder()
                .setName("Notes")
                .addField(scalar("notes", 1, Type.TYPE_STRING).setLabel(Label.LABEL_REPEATED));

        var inner = DescriptorProto.newBuilder()
                .setName("Inner")
                .addField(scalar("test", 1, Type.TYPE_STRING).setDefaultValue("test"));

        var embedded = DescriptorProto.newBuilder()
                .setName("Embedded")
                .addField(typed("testmessage", 1, Type.TYPE_MESSAGE, ".testdata.Inner"));

        var scalars = DescriptorProto.newBuilder()
                .setName("Scalars")
                .addField(scalar("b", 1, Type.TYPE_BOOL))
                .addField(scalar("f", 2, Type.TYPE_FLOAT))
                .addField(scalar("d", 3, Type.TYPE_DOUBLE))
                .addField(scalar("i32", 4, Type.TYPE_INT32))
                .addField(scalar("i64", 5, Type.TYPE_INT64))
                .addField(scalar("u32", 6, Type.TYPE_UINT32))
                .addField(scalar("u64", 7, Type.TYPE_UINT64))
                .addField(scalar("s32", 8, Type.TYPE_SINT32))
                .addField(scalar("s64", 9, Type.TYPE_SINT64))
                .addField(scalar("f32", 10, Type.TYPE_FIXED32))
                .addField(scalar("f64", 11, Type.TYPE_FIXED64))
                .addField(scalar("sf32", 12, Type.TYPE_SFIXED32))
                .addField(scalar("sf64", 13, Type.TYPE_SFIXED64))
                .addField(scalar("s", 14, Type.TYPE_STRING))
                .addField(scalar("by", 15, Type.TYPE_BYTES))
                .addField(scalar("numbers", 16, Type.TYPE_INT32).setLabel(Label.LABEL_REPEATED));

        var tree = DescriptorProto.newBuilder()
                .setName("Tree")
                .addField(scalar("name", 1, Type.TYPE_STRING))
                .addField(typed("child", 2, Type.TYPE_MESSAGE, ".testdata.Tree"))
                .addField(typed("children", 3, Type.TYPE_MESSAGE, ".testdata.Tree").setLabel(Label.LABEL_REPEATED));

        var palette = DescriptorProto.newBuilder()
                .setName("Palette")
                .addEnumType(enumType("Shade", "LIGHT", "DARK"))
                .addEnumType(enumType("Level", "LOW", "HIGH"))
                .addField(typed("color", 1, Type.TYPE_ENUM, ".testdata.Color"))
                .addField(typed("shade", 2, Type.TYPE_ENUM, ".testdata.Palette.Shade"))
                .addField(typed("shades", 3, Type.TYPE_ENUM, ".testdata.Palette.Shade").setLabel(Label.LABEL_REPEATED));

        var counts = DescriptorProto.newBuilder()
                .setName("Counts")
                .addNestedType(DescriptorProto.newBuilder()
                        .setName("CountsEntry")
                        .setOptions(MessageOptions.newBuilder().setMapEntry(true))
                        .addField(scalar("key", 1, Type.TYPE_STRING))
                        .addField(scalar("value", 2, Type.TYPE_INT32)))
                .addField(typed("counts", 1, Type.TYPE_MESSAGE, ".testdata.Counts.CountsEntry")
                        .setLabel(Label.LABEL_REPEATED));

        var settings = DescriptorProto.newBuilder()
                .setName("Settings")
                .addField(scalar("retries", 1, Type.TYPE_INT32).setLabel(Label.LABEL_REQUIRED).setDefaultValue("3"))
                .addField(scalar("owner", 2, Type.TYPE_STRING))
                .addField(scalar("ratio", 3, Type.TYPE_DOUBLE).setDefaultValue("0.5"));

        return FileDescriptorProto.newBuilder()
                .setName("testdata/schemas.proto")
                .setPackage("testdata")
                .setSyntax("proto2")
                .addMessageType(node)
                .addMessageType(notes)
                .addMessageType(inner)
                .addMessageType(embedded)
                .addMessageType(scalars)
                .addMessageType(tree)
                .addEnumType(enumType("Color", "RED", "GREEN", "BLUE"))
                .addMessageType(palette)
                .addMessageType(counts)
                .addMessageType(settings)
                .build();
    }

    private static FileDescriptorProto openProto() {
        var light = DescriptorProto.newBuilder()
                .setName("Light")
                .addEnumType(enumType("Phase", "PHASE_UNSPECIFIED", "ON"))
                .addField(typed("phase", 1, Type.TYPE_ENUM, ".testdata.open.Light.Phase"))
                .addField(scalar("label", 2, Type.TYPE_STRING));

        return FileDescriptorProto.newBuilder()
                .setName("testdata/open.proto")
                .setPackage("testdata.open")
                .setSyntax("proto3")
                .addMessageType(light)
                .build();
    }
}

package com.scipatom.atomizer.index;

import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.util.Map;

/**
 * Reads a SCIP symbol kind written either as its enum number or as its enum
 * name. Unknown names map to 0 (UnspecifiedKind).
 */
public class ScipKindAdapter extends TypeAdapter<Integer> {

    static final Map<String, Integer> KINDS_BY_NAME = Map.ofEntries(
        Map.entry("UnspecifiedKind", 0),
        Map.entry("AssociatedType", 3),
        Map.entry("Class", 7),
        Map.entry("Constant", 8),
        Map.entry("Constructor", 9),
        Map.entry("Enum", 11),
        Map.entry("EnumMember", 12),
        Map.entry("Field", 15),
        Map.entry("File", 16),
        Map.entry("Function", 17),
        Map.entry("Interface", 21),
        Map.entry("Macro", 25),
        Map.entry("Method", 26),
        Map.entry("Module", 29),
        Map.entry("Namespace", 30),
        Map.entry("Package", 35),
        Map.entry("Parameter", 37),
        Map.entry("SelfParameter", 44),
        Map.entry("Struct", 49),
        Map.entry("Trait", 53),
        Map.entry("Type", 54),
        Map.entry("TypeAlias", 55),
        Map.entry("TypeParameter", 58),
        Map.entry("Union", 59),
        Map.entry("Variable", 61),
        Map.entry("Library", 64),
        Map.entry("AbstractMethod", 66),
        Map.entry("MethodSpecification", 67),
        Map.entry("TraitMethod", 70),
        Map.entry("StaticMethod", 80)
    );

    @Override
    public void write(JsonWriter out, Integer value) throws IOException {
        if (value == null) {
            out.nullValue();
        } else {
            out.value(value);
        }
    }

    @Override
    public Integer read(JsonReader in) throws IOException {
        JsonToken token = in.peek();
        if (token == JsonToken.NULL) {
            in.nextNull();
            return null;
        }
        if (token == JsonToken.NUMBER) {
            return in.nextInt();
        }
        String name = in.nextString();
        return KINDS_BY_NAME.getOrDefault(name, 0);
    }
}

package work.lcod.cond.loader;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.lcod.cond.dict.AttributeDef;
import work.lcod.cond.dict.Dictionary;
import work.lcod.cond.value.DataType;

/**
 * Reads attribute dictionaries from TOML.
 *
 * <pre>
 * [attributes.Service-Type]
 * type = "uint32"
 *
 * [attributes.Service-Type.values]
 * Login-User = 1
 * Framed-User = 2
 *
 * [attributes.Prefix]
 * type = "string"
 * virtual = true
 * </pre>
 */
public final class DictionaryLoader {
    private DictionaryLoader() {}

    public static Dictionary load(Path path) {
        try {
            return parse(Files.readString(path), path.toString());
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read dictionary: " + path, ex);
        }
    }

    public static Dictionary parse(String text, String origin) {
        TomlParseResult result = Toml.parse(text);
        if (result.hasErrors()) {
            throw new IllegalArgumentException("Invalid dictionary " + origin + ": " + result.errors().get(0));
        }
        var dictionary = new Dictionary();
        TomlTable attributes = result.getTable("attributes");
        if (attributes == null) {
            return dictionary;
        }
        for (var name : attributes.keySet()) {
            var path = List.of(name);
            if (!attributes.isTable(path)) {
                throw new IllegalArgumentException("Attribute " + name + " in " + origin + " must be a table");
            }
            dictionary.register(attribute(name, attributes.getTable(path), origin));
        }
        return dictionary;
    }

    private static AttributeDef attribute(String name, TomlTable table, String origin) {
        var typeName = table.getString("type");
        if (typeName == null) {
            throw new IllegalArgumentException("Attribute " + name + " in " + origin + " has no type");
        }
        DataType type;
        try {
            type = DataType.fromName(typeName);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Attribute " + name + " in " + origin + ": " + ex.getMessage(), ex);
        }
        boolean virtual = Boolean.TRUE.equals(table.getBoolean("virtual"));
        var values = new LinkedHashMap<String, Long>();
        var valueTable = table.getTable("values");
        if (valueTable != null) {
            if (!type.isInteger()) {
                throw new IllegalArgumentException("Attribute " + name + " in " + origin + " is not an integer but declares values");
            }
            for (var valueName : valueTable.keySet()) {
                var valuePath = List.of(valueName);
                if (!valueTable.isLong(valuePath)) {
                    throw new IllegalArgumentException("Value " + valueName + " of " + name + " in " + origin + " must be an integer");
                }
                values.put(valueName, valueTable.getLong(valuePath));
            }
        }
        return new AttributeDef(name, type, virtual, values);
    }
}

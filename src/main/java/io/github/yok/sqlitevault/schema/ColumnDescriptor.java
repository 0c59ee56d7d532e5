package io.github.yok.sqlitevault.schema;

import io.github.yok.sqlitevault.type.TypeKind;
import lombok.Value;

/**
 * One column of a table as reported by the engine's metadata.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class ColumnDescriptor {

    // Zero-based position in the table definition
    int position;
    // Column name
    String name;
    // Declared type, null for untyped columns
    String declaredType;
    // NOT NULL constraint
    boolean notNull;
    // Default value expression, null when absent
    String defaultValue;
    // Part of the primary key
    boolean primaryKey;

    /**
     * Returns the kind implied by the declared type.
     *
     * @return kind, {@link TypeKind#OPAQUE} for untyped columns
     */
    public TypeKind getKind() {
        return TypeKind.classify(declaredType);
    }

    /**
     * Returns the declared type, or {@code BLOB} for untyped columns, as shown in listings.
     *
     * @return display type
     */
    public String getDisplayType() {
        return declaredType == null ? "BLOB" : declaredType;
    }
}

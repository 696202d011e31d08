package me.synapsed.alerts.config;

import java.util.Objects;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.Getter;

/**
 * An entry of an alarm list: either the bare name of a definition, or an inline object
 * that is merged over the definition it names (if any).
 */
@Getter
@JsonDeserialize(using = AlarmReferenceDeserializer.class)
public final class AlarmReference {

    public enum Kind {
        NAMED,
        INLINE
    }

    private final Kind kind;
    private final String name;
    private final ObjectNode fields;

    private AlarmReference(Kind kind, String name, ObjectNode fields) {
        this.kind = kind;
        this.name = name;
        this.fields = fields;
    }

    public static AlarmReference named(String name) {
        return new AlarmReference(Kind.NAMED, Objects.requireNonNull(name, "name"), null);
    }

    public static AlarmReference inline(ObjectNode fields) {
        Objects.requireNonNull(fields, "fields");
        String name = fields.hasNonNull("name") ? fields.get("name").asText() : null;
        return new AlarmReference(Kind.INLINE, name, fields.deepCopy());
    }

    public boolean isNamed() {
        return kind == Kind.NAMED;
    }

    /**
     * Named references are equal by name; inline references are only equal to themselves.
     */
    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof AlarmReference)) {
            return false;
        }
        AlarmReference that = (AlarmReference) other;
        return isNamed() && that.isNamed() && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return isNamed() ? name.hashCode() : System.identityHashCode(this);
    }

    @Override
    public String toString() {
        return isNamed() ? name : "inline(" + fields + ")";
    }
}

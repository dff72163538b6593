package io.github.crmrecords.schema;

import io.github.crmrecords.util.Checker;

/**
 * Declaration of one field of a record type: its name, value type, whether it is required on create,
 * and for ID fields the record type it links to.
 */
public class FieldDefinition {

    final String name;

    final FieldType type;

    boolean required = false;

    /**
     * api name of the link target. only for ID fields.
     */
    String linkTarget;

    FieldDefinition(String name, FieldType type) {
        this.name = Checker.checkNotBlank(name, "name");
        this.type = Checker.checkNotNull(type, "type");
    }

    public static FieldDefinition of(String name, FieldType type) {
        return new FieldDefinition(name, type);
    }

    /**
     * Declare a link field referencing records of the target type
     *
     * @param name          field name
     * @param targetApiName api name of the target type. e.g. "Account"
     * @return field definition
     */
    public static FieldDefinition link(String name, String targetApiName) {
        var def = new FieldDefinition(name, FieldType.ID);
        def.linkTarget = Checker.checkNotBlank(targetApiName, "targetApiName");
        return def;
    }

    /**
     * Mark the field as required on create
     *
     * @return this
     */
    public FieldDefinition required() {
        this.required = true;
        return this;
    }

    public String getName() {
        return name;
    }

    public FieldType getType() {
        return type;
    }

    public boolean isRequired() {
        return required;
    }

    public boolean isLink() {
        return linkTarget != null;
    }

    /**
     * Get the record type this link field references
     *
     * @return target type, or null if not a link field
     */
    public RecordType getLinkTarget() {
        return linkTarget == null ? null : RecordType.fromApiName(linkTarget);
    }

    @Override
    public String toString() {
        return name + ":" + type + (required ? "(required)" : "") + (linkTarget != null ? "->" + linkTarget : "");
    }
}

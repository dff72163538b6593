package io.github.crmrecords.schema;

import static io.github.crmrecords.schema.FieldDefinition.link;
import static io.github.crmrecords.schema.FieldDefinition.of;
import static io.github.crmrecords.schema.FieldType.DATE;
import static io.github.crmrecords.schema.FieldType.NUMBER;
import static io.github.crmrecords.schema.FieldType.STRING;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import io.github.crmrecords.RecordException;
import org.apache.commons.lang3.StringUtils;

/**
 * The record types supported, each with its declared schema.
 *
 * <p>
 * A record may only hold the fields declared by its type. The natural key is the field used to look up an existing
 * record by a business name (e.g. Account.Name), which is distinct from the system id.
 * </p>
 */
public enum RecordType {

    ACCOUNT("Account", "001", "Name",
            of("Name", STRING).required(),
            of("Phone", STRING),
            of("Industry", STRING),
            of("Website", STRING),
            of("Type", STRING),
            of("Rating", STRING),
            of("BillingCity", STRING),
            of("NumberOfEmployees", NUMBER),
            of("AnnualRevenue", NUMBER),
            link("ParentId", "Account")),

    CONTACT("Contact", "003", "LastName",
            of("FirstName", STRING),
            of("LastName", STRING).required(),
            of("Email", STRING),
            of("Phone", STRING),
            of("Title", STRING),
            of("Department", STRING),
            of("Birthdate", DATE),
            link("AccountId", "Account")),

    OPPORTUNITY("Opportunity", "006", "Name",
            of("Name", STRING).required(),
            of("StageName", STRING).required(),
            of("CloseDate", DATE).required(),
            of("Amount", NUMBER),
            of("Probability", NUMBER),
            of("Description", STRING),
            of("LeadSource", STRING),
            link("AccountId", "Account")),

    LEAD("Lead", "00Q", "LastName",
            of("FirstName", STRING),
            of("LastName", STRING).required(),
            of("Company", STRING).required(),
            of("Email", STRING),
            of("Phone", STRING),
            of("Status", STRING),
            of("LeadSource", STRING),
            of("Industry", STRING),
            of("AnnualRevenue", NUMBER),
            of("NumberOfEmployees", NUMBER)),

    CASE("Case", "500", "Subject",
            of("Subject", STRING),
            of("Status", STRING),
            of("Priority", STRING),
            of("Origin", STRING),
            of("Description", STRING),
            link("AccountId", "Account"),
            link("ContactId", "Contact"));

    /**
     * Name of the system id field. It is not part of any type's field map.
     */
    public static final String ID_FIELD = "Id";

    final String apiName;

    final String keyPrefix;

    final String naturalKey;

    final Map<String, FieldDefinition> fields;

    RecordType(String apiName, String keyPrefix, String naturalKey, FieldDefinition... fields) {
        this.apiName = apiName;
        this.keyPrefix = keyPrefix;
        this.naturalKey = naturalKey;

        var map = new LinkedHashMap<String, FieldDefinition>();
        for (var field : fields) {
            map.put(field.getName(), field);
        }
        this.fields = Collections.unmodifiableMap(map);
    }

    public String getApiName() {
        return apiName;
    }

    /**
     * Get the 3-character id prefix of this type. e.g. "001" for Account
     *
     * @return key prefix
     */
    public String getKeyPrefix() {
        return keyPrefix;
    }

    /**
     * Get the natural key field name. e.g. "Name" for Account, "LastName" for Contact
     *
     * @return natural key field name
     */
    public String getNaturalKey() {
        return naturalKey;
    }

    public Map<String, FieldDefinition> getFields() {
        return fields;
    }

    public boolean hasField(String name) {
        return fields.containsKey(name);
    }

    /**
     * Get the definition of a field
     *
     * @param name field name
     * @return field definition
     * @throws RecordException ValidationError if the field is not declared for this type
     */
    public FieldDefinition getField(String name) {
        var def = fields.get(name);
        if (def == null) {
            throw RecordException.validationError(
                    String.format("No such field %s on %s. Available fields: %s", name, apiName, fields.keySet()));
        }
        return def;
    }

    public List<FieldDefinition> getRequiredFields() {
        return fields.values().stream().filter(FieldDefinition::isRequired).collect(Collectors.toList());
    }

    public List<FieldDefinition> getLinkFields() {
        return fields.values().stream().filter(FieldDefinition::isLink).collect(Collectors.toList());
    }

    /**
     * Find the record type by api name. Case-insensitive.
     *
     * @param apiName e.g. "Account"
     * @return record type
     * @throws IllegalArgumentException if not supported
     */
    public static RecordType fromApiName(String apiName) {
        for (var type : values()) {
            if (StringUtils.equalsIgnoreCase(type.apiName, apiName)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Not supported record type: " + apiName);
    }
}

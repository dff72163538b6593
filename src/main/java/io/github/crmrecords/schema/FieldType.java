package io.github.crmrecords.schema;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

import io.github.crmrecords.RecordException;
import io.github.crmrecords.util.IdUtil;
import io.github.crmrecords.util.NumberUtil;

/**
 * Value type of a record field.
 *
 * <p>
 * {@link #convert(String, Object)} checks a value against the type and returns the value to store.
 * A value of a wrong type causes a ValidationError. null is always accepted and means "clear the field".
 * </p>
 */
public enum FieldType {

    /**
     * Text value. Any CharSequence is accepted and stored as String.
     */
    STRING {
        @Override
        Object doConvert(String field, Object value) {
            if (value instanceof CharSequence) {
                return value.toString();
            }
            throw mismatch(field, value);
        }
    },

    /**
     * Numeric value. Integral values fitting in an int are stored as Integer. NaN and infinities are rejected.
     */
    NUMBER {
        @Override
        Object doConvert(String field, Object value) {
            if (value instanceof Number number) {
                if (!NumberUtil.isFinite(number)) {
                    throw RecordException.validationError(
                            String.format("field %s expects a finite number, provided: %s", field, number));
                }
                return NumberUtil.convertNumberToIntIfCompatible(number);
            }
            throw mismatch(field, value);
        }
    },

    /**
     * Date value. LocalDate or an ISO-8601 string like "2024-12-31".
     */
    DATE {
        @Override
        Object doConvert(String field, Object value) {
            if (value instanceof LocalDate) {
                return value;
            }
            if (value instanceof CharSequence) {
                try {
                    return LocalDate.parse(value.toString());
                } catch (DateTimeParseException e) {
                    throw RecordException.validationError(
                            String.format("field %s expects an ISO date(yyyy-MM-dd), provided: %s", field, value));
                }
            }
            throw mismatch(field, value);
        }
    },

    /**
     * Record id, used by link fields.
     */
    ID {
        @Override
        Object doConvert(String field, Object value) {
            if (value instanceof CharSequence) {
                var id = value.toString();
                if (IdUtil.typeOf(id) == null) {
                    throw RecordException.validationError(
                            String.format("field %s expects a record id, provided: %s", field, id));
                }
                return id;
            }
            throw mismatch(field, value);
        }
    };

    abstract Object doConvert(String field, Object value);

    /**
     * Check the value against this type and convert it to the stored form
     *
     * @param field field name (for error messages)
     * @param value value to convert. null is allowed
     * @return converted value
     * @throws RecordException ValidationError if the value does not match this type
     */
    public Object convert(String field, Object value) {
        if (value == null) {
            return null;
        }
        return doConvert(field, value);
    }

    RecordException mismatch(String field, Object value) {
        return RecordException.validationError(String.format("field %s expects %s, provided: %s(%s)",
                field, this.name(), value, value.getClass().getSimpleName()));
    }
}

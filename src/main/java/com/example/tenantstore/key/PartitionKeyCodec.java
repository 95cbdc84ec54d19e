package com.example.tenantstore.key;

import com.example.tenantstore.exception.InvalidIdentityException;
import com.example.tenantstore.exception.MalformedKeyException;
import com.example.tenantstore.exception.PartitionMismatchException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Builds and parses hierarchical partition keys of the form {@code tag/field1/field2[/field3]}.
 * Identity values may not contain the delimiter, so the encoding is injective per family.
 */
public class PartitionKeyCodec {

    public static final String DELIMITER = "/";

    private static final Pattern IDENTITY = Pattern.compile("^[a-z0-9](?:[a-z0-9-]{0,61}[a-z0-9])?$");

    public String build(EntityFamily family, String... fields) {
        if (fields == null || fields.length != family.arity()) {
            throw new PartitionMismatchException(String.format(
                    "%s keys take %d fields %s, got %d",
                    family, family.arity(), family.getKeyFields(), fields == null ? 0 : fields.length));
        }
        StringBuilder key = new StringBuilder(family.getTag());
        for (int i = 0; i < fields.length; i++) {
            String name = family.getKeyFields().get(i);
            validateIdentity(name, fields[i]);
            key.append(DELIMITER).append(fields[i]);
        }
        return key.toString();
    }

    public List<String> parse(EntityFamily family, String key) {
        if (key == null || key.isEmpty()) {
            throw new MalformedKeyException("Partition key is empty");
        }
        String[] parts = key.split(DELIMITER, -1);
        if (!family.getTag().equals(parts[0])) {
            throw new MalformedKeyException(String.format("Key '%s' was not built for %s", key, family));
        }
        if (parts.length - 1 != family.arity()) {
            throw new MalformedKeyException(String.format(
                    "Key '%s' has %d fields, %s expects %d", key, parts.length - 1, family, family.arity()));
        }
        List<String> fields = new ArrayList<>(Arrays.asList(parts).subList(1, parts.length));
        for (String field : fields) {
            if (!isValidIdentity(field)) {
                throw new MalformedKeyException(String.format("Key '%s' contains invalid segment '%s'", key, field));
            }
        }
        return List.copyOf(fields);
    }

    public void validateIdentity(String fieldName, String value) {
        if (value == null || value.isEmpty()) {
            throw new InvalidIdentityException(fieldName, fieldName + " must not be empty");
        }
        if (!IDENTITY.matcher(value).matches()) {
            throw new InvalidIdentityException(fieldName, String.format(
                    "%s '%s' must be 1-63 lowercase letters, digits or inner hyphens", fieldName, value));
        }
    }

    public boolean isValidIdentity(String value) {
        return value != null && IDENTITY.matcher(value).matches();
    }
}

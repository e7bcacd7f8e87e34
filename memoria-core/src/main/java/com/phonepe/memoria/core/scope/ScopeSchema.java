package com.phonepe.memoria.core.scope;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.phonepe.memoria.core.utils.TextUtils;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * The tenant identity schema of a deployment: an ordered list of typed fields. Fixed at provisioning time.
 * Field names double as column and document field names in the storage backends, so they are restricted to
 * lower snake case.
 */
@Value
public class ScopeSchema {
    public static final int DEFAULT_VERSION = 1;
    private static final Pattern FIELD_NAME = Pattern.compile("[a-z][a-z0-9_]{0,62}");

    List<ScopeField> fields;

    int version;

    @Builder
    @Jacksonized
    public ScopeSchema(@Singular List<ScopeField> fields, int version) {
        Preconditions.checkArgument(fields != null && !fields.isEmpty(), "Scope schema needs at least one field");
        final var seen = new HashSet<String>();
        for (var field : fields) {
            Preconditions.checkArgument(FIELD_NAME.matcher(field.getName()).matches(),
                                        "Invalid scope field name: %s", field.getName());
            Preconditions.checkArgument(seen.add(field.getName()), "Duplicate scope field: %s", field.getName());
        }
        this.fields = List.copyOf(fields);
        this.version = version <= 0 ? DEFAULT_VERSION : version;
    }

    public static ScopeSchema of(ScopeField... fields) {
        return new ScopeSchema(List.of(fields), DEFAULT_VERSION);
    }

    /**
     * Parses a compact description like <code>project_id:string, agent_id:string</code>.
     */
    public static ScopeSchema parse(String description) {
        final var fields = Splitter.on(',')
                .trimResults()
                .omitEmptyStrings()
                .splitToStream(description)
                .map(part -> {
                    final var pieces = Splitter.on(':').trimResults().splitToList(part);
                    Preconditions.checkArgument(pieces.size() == 2, "Invalid scope field description: %s", part);
                    return ScopeField.of(pieces.get(0),
                                         ScopeFieldType.valueOf(pieces.get(1).toUpperCase(Locale.ROOT)));
                })
                .toList();
        return new ScopeSchema(fields, DEFAULT_VERSION);
    }

    @JsonIgnore
    public List<String> fieldNames() {
        return fields.stream().map(ScopeField::getName).toList();
    }

    public Optional<ScopeField> field(String name) {
        return fields.stream().filter(f -> f.getName().equals(name)).findFirst();
    }

    /**
     * Stable hash of the schema shape (names, order and types). The version is not part of it.
     */
    @JsonIgnore
    public String fingerprint() {
        return TextUtils.sha256(fields.stream()
                                        .map(f -> f.getName() + ":" + f.getType().name())
                                        .collect(Collectors.joining("|")));
    }
}

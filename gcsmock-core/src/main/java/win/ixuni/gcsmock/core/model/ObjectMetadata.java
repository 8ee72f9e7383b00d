package win.ixuni.gcsmock.core.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import win.ixuni.gcsmock.core.util.JsonUtils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Object metadata
 * <p>
 * Mirrors the resource shape of the real service: arbitrary top-level fields
 * ({@code contentType}, {@code cacheControl}, ...) plus the nested custom metadata map
 * stored under the {@code metadata} key.
 * <p>
 * Instances are immutable. In an update the custom map may be left unspecified ({@code null}),
 * which is different from specifying an empty map.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class ObjectMetadata {

    /**
     * Key of the nested custom metadata map in the wire form
     */
    public static final String CUSTOM_METADATA_KEY = "metadata";

    private static final ObjectMetadata EMPTY = new ObjectMetadata(Map.of(), Map.of());

    /**
     * Top-level fields, in insertion order
     */
    private final Map<String, Object> fields;

    /**
     * Custom metadata, {@code null} when unspecified
     */
    private final Map<String, String> metadata;

    private ObjectMetadata(Map<String, Object> fields, Map<String, String> metadata) {
        for (String key : fields.keySet()) {
            if (CUSTOM_METADATA_KEY.equals(key)) {
                throw new IllegalArgumentException(
                        "'" + CUSTOM_METADATA_KEY + "' is reserved for custom metadata, use withCustomMetadata()");
            }
        }
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        this.metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : null;
    }

    /**
     * Default metadata of a fresh object: {@code {metadata: {}}}
     */
    public static ObjectMetadata empty() {
        return EMPTY;
    }

    /**
     * Metadata with a single top-level field and unspecified custom metadata
     */
    public static ObjectMetadata of(String key, Object value) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(key, value);
        return new ObjectMetadata(fields, null);
    }

    public static ObjectMetadata ofCustom(Map<String, String> customMetadata) {
        return new ObjectMetadata(Map.of(), customMetadata);
    }

    /**
     * 从 wire 格式解析：{@code metadata} 键下的 Map 作为自定义元数据，其余键作为顶层字段
     *
     * @param map wire form, e.g. {@code {contentType: "text/plain", metadata: {a: "1"}}}
     * @return parsed metadata
     */
    public static ObjectMetadata fromMap(Map<String, ?> map) {
        Map<String, Object> fields = new LinkedHashMap<>();
        Map<String, String> custom = null;
        for (Map.Entry<String, ?> entry : map.entrySet()) {
            if (!CUSTOM_METADATA_KEY.equals(entry.getKey())) {
                fields.put(entry.getKey(), entry.getValue());
                continue;
            }
            Object value = entry.getValue();
            if (value == null) {
                continue;
            }
            if (!(value instanceof Map)) {
                throw new IllegalArgumentException("Custom metadata must be a map but was: "
                        + value.getClass().getSimpleName());
            }
            custom = new LinkedHashMap<>();
            for (Map.Entry<?, ?> customEntry : ((Map<?, ?>) value).entrySet()) {
                Object customValue = customEntry.getValue();
                custom.put(String.valueOf(customEntry.getKey()),
                        customValue != null ? String.valueOf(customValue) : null);
            }
        }
        return new ObjectMetadata(fields, custom);
    }

    public static ObjectMetadata fromJson(String json) {
        return fromMap(JsonUtils.toMap(json));
    }

    public ObjectMetadata withField(String key, Object value) {
        Map<String, Object> newFields = new LinkedHashMap<>(fields);
        newFields.put(key, value);
        return new ObjectMetadata(newFields, metadata);
    }

    public ObjectMetadata withCustom(String key, String value) {
        Map<String, String> newCustom = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
        newCustom.put(key, value);
        return new ObjectMetadata(fields, newCustom);
    }

    public ObjectMetadata withCustomMetadata(Map<String, String> customMetadata) {
        return new ObjectMetadata(fields, customMetadata);
    }

    public Object get(String key) {
        return fields.get(key);
    }

    public String getContentType() {
        Object value = fields.get("contentType");
        return value != null ? value.toString() : null;
    }

    public boolean hasCustomMetadata() {
        return metadata != null;
    }

    /**
     * {@code setMetadata} merge: top-level fields of {@code update} overwrite ours, custom
     * metadata is merged key by key (keys only present here are preserved).
     *
     * @param update incoming metadata
     * @return merged metadata, custom map always specified
     */
    public ObjectMetadata merge(ObjectMetadata update) {
        Map<String, Object> mergedFields = new LinkedHashMap<>(fields);
        mergedFields.putAll(update.fields);

        Map<String, String> mergedCustom = new LinkedHashMap<>();
        if (metadata != null) {
            mergedCustom.putAll(metadata);
        }
        if (update.metadata != null) {
            mergedCustom.putAll(update.metadata);
        }
        return new ObjectMetadata(mergedFields, mergedCustom);
    }

    /**
     * Shallow overlay used by copy: top-level fields of {@code update} overwrite ours and its
     * custom map, when specified, replaces ours as a whole.
     *
     * @param update overriding metadata, may be {@code null}
     * @return overlaid metadata
     */
    public ObjectMetadata overlay(ObjectMetadata update) {
        if (update == null) {
            return this;
        }
        Map<String, Object> overlaidFields = new LinkedHashMap<>(fields);
        overlaidFields.putAll(update.fields);
        return new ObjectMetadata(overlaidFields, update.metadata != null ? update.metadata : metadata);
    }

    /**
     * Form in which metadata is stored: unspecified custom metadata becomes an empty map
     */
    public ObjectMetadata normalized() {
        return metadata != null ? this : new ObjectMetadata(fields, Map.of());
    }

    /**
     * Wire form, custom metadata under the {@code metadata} key when specified
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>(fields);
        if (metadata != null) {
            map.put(CUSTOM_METADATA_KEY, new LinkedHashMap<>(metadata));
        }
        return map;
    }

    public String toJson() {
        return JsonUtils.toJson(toMap());
    }
}

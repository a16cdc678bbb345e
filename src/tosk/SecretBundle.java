package tosk;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * SecretBundle
 * ------------
 * The named operational secrets kept behind the master password:
 *   GITHUB_TOKEN, ENCRYPTION_PASSPHRASE, GITHUB_OWNER, GITHUB_REPO
 *
 * Serialized as a flat JSON object with keys in sorted order so the same bundle always
 * produces the same bytes before sealing. Keys this version does not know are kept as-is.
 */
public final class SecretBundle {

    public static final String GITHUB_TOKEN = "GITHUB_TOKEN";
    public static final String ENCRYPTION_PASSPHRASE = "ENCRYPTION_PASSPHRASE";
    public static final String GITHUB_OWNER = "GITHUB_OWNER";
    public static final String GITHUB_REPO = "GITHUB_REPO";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private final Map<String, String> values = new TreeMap<>();

    public SecretBundle() {}

    public SecretBundle(Map<String, String> initial) {
        if (initial != null) {
            initial.forEach((k, v) -> values.put(k, v == null ? "" : v));
        }
    }

    public static SecretBundle empty() { return new SecretBundle(); }

    /** @return the stored value, or null when the key is absent */
    public String get(String name) {
        return values.get(name);
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    /** True when the key is absent or holds only whitespace. */
    public boolean isBlank(String name) {
        String v = values.get(name);
        return v == null || v.isBlank();
    }

    public void put(String name, String value) {
        values.put(name, value == null ? "" : value);
    }

    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(values);
    }

    /** Canonical UTF-8 JSON encoding (sorted keys, no whitespace). */
    public byte[] toJsonBytes() {
        try {
            return MAPPER.writeValueAsBytes(values);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to encode secret bundle", e);
        }
    }

    public static SecretBundle fromJsonBytes(byte[] json) throws IOException {
        Map<String, String> parsed = MAPPER.readValue(json, new TypeReference<Map<String, String>>() {});
        return new SecretBundle(parsed);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SecretBundle)) return false;
        return values.equals(((SecretBundle) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    /** Key names only; values are secrets. */
    @Override
    public String toString() {
        return "SecretBundle" + values.keySet();
    }
}

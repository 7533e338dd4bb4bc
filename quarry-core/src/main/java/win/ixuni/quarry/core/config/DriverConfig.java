package win.ixuni.quarry.core.config;

import lombok.Data;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * One {@code quarry.drivers[]} entry
 * <p>
 * {@link #properties} is free-form; each driver type reads the keys it understands. Values arrive from YAML
 * either typed or as strings, so the accessors accept both.
 */
@Data
public class DriverConfig {

    /**
     * Instance name, referenced by routing rules
     */
    private String name;

    /**
     * memory | local
     */
    private String type;

    private boolean enabled = true;

    private Map<String, Object> properties = new HashMap<>();

    public String getString(String key, String defaultValue) {
        return property(key, Object::toString, defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        return property(key, value -> value instanceof Number n ? n.intValue() : Integer.parseInt(value.toString()),
                defaultValue);
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        return property(key, value -> value instanceof Boolean b ? b : Boolean.parseBoolean(value.toString()),
                defaultValue);
    }

    private <T> T property(String key, Function<Object, T> converter, T defaultValue) {
        Object value = properties.get(key);
        return value == null ? defaultValue : converter.apply(value);
    }

    /**
     * 开启后覆盖写入保留旧版本，可按 versionId 读取
     */
    public boolean isVersioningEnabled() {
        return getBoolean("versioning", false);
    }

    /**
     * Chunk size when streaming content out of the store
     */
    public int getReadBufferSize() {
        return getInt("read-buffer-size", 64 * 1024);
    }
}

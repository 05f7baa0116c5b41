package alertflow.config;

import alertflow.exception.AlertFlowException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.apache.commons.lang3.StringUtils;

import java.io.File;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.ZoneId;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * alertflow.yml 配置访问器,支持 a.b.c 形式的层级key
 */
public class AlertFlowConfig {
    private static final String CLASSPATH_PREFIX = "classpath:";
    private static final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    private final Map<String, Object> config;

    private AlertFlowConfig(Map<String, Object> config) {
        this.config = config;
    }

    /**
     * 加载配置文件,路径以 classpath: 开头时从类路径读取
     */
    @SuppressWarnings("unchecked")
    public static AlertFlowConfig load(String configPath) {
        try {
            Map<String, Object> config;
            if (configPath.startsWith(CLASSPATH_PREFIX)) {
                String resource = configPath.substring(CLASSPATH_PREFIX.length());
                try (InputStream in = AlertFlowConfig.class.getClassLoader().getResourceAsStream(resource)) {
                    if (in == null) {
                        throw new AlertFlowException("配置文件不存在: " + configPath);
                    }
                    config = yamlMapper.readValue(in, Map.class);
                }
            } else {
                Path path = Paths.get(configPath);
                config = yamlMapper.readValue(new File(path.toAbsolutePath().toString()), Map.class);
            }
            return new AlertFlowConfig(config == null ? new HashMap<>() : config);
        } catch (AlertFlowException e) {
            throw e;
        } catch (Exception e) {
            throw new AlertFlowException("加载配置文件失败: " + configPath, e);
        }
    }

    public static AlertFlowConfig of(Map<String, Object> config) {
        return new AlertFlowConfig(config);
    }

    /**
     * 空配置,所有取值走默认值
     */
    public static AlertFlowConfig defaults() {
        return new AlertFlowConfig(Collections.emptyMap());
    }

    public String getString(String key) {
        return getString(key, null);
    }

    public String getString(String key, String defaultValue) {
        Object value = getValue(key);
        return value != null ? value.toString() : defaultValue;
    }

    public int getInt(String key) {
        return getInt(key, 0);
    }

    public int getInt(String key, int defaultValue) {
        Object value = getValue(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt((String) value);
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    /**
     * 获取列表配置,未配置时返回默认列表
     */
    public List<String> getStringList(String key, List<String> defaultValue) {
        Object value = getValue(key);
        if (value instanceof List) {
            return ((List<?>) value).stream().map(String::valueOf).collect(Collectors.toList());
        }
        return defaultValue;
    }

    /**
     * 获取子配置
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> getSubConfig(String key) {
        Object value = getValue(key);
        if (value instanceof Map) {
            return (Map<String, Object>) value;
        }
        return Collections.emptyMap();
    }

    public ZoneId getZone() {
        return ZoneId.of(getString("timezone", "UTC"));
    }

    @SuppressWarnings("unchecked")
    private Object getValue(String key) {
        if (StringUtils.isEmpty(key)) {
            return null;
        }

        String[] parts = key.split("\\.");
        Map<String, Object> current = config;

        for (int i = 0; i < parts.length - 1; i++) {
            Object value = current.get(parts[i]);
            if (!(value instanceof Map)) {
                return null;
            }
            current = (Map<String, Object>) value;
        }

        return current.get(parts[parts.length - 1]);
    }

    /**
     * 验证配置
     */
    public void validate() {
        if (getInt("history.limit", 100) <= 0) {
            throw new IllegalArgumentException("history.limit 必须大于0");
        }
        if (getInt("dispatch.max-attempts", 3) <= 0) {
            throw new IllegalArgumentException("dispatch.max-attempts 必须大于0");
        }
        getZone();
    }
}

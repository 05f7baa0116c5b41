package alertflow.rule;

import alertflow.blackout.Blackout;
import alertflow.dispatch.NotificationChannel;
import alertflow.exception.ValidationException;
import alertflow.oncall.NotificationGroup;
import alertflow.oncall.OnCall;
import alertflow.store.ConfigStore;
import alertflow.utils.Durations;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 规则文件加载器 - 加载规则目录下的 YAML 文件,按 schemaVersion 归一化后写入配置存储。
 * 定期重新扫描,文件 MD5 变化时重新加载,文件删除时移除其配置
 */
public class RuleFileLoader {
    private static final Logger logger = LoggerFactory.getLogger(RuleFileLoader.class);

    static final int CURRENT_SCHEMA_VERSION = 2;
    private static final List<String> DURATION_FIELDS = Arrays.asList("delayTime", "time", "duration");

    private final Path rulesDirectory;
    private final ConfigStore configStore;
    private final RuleValidator validator;
    private final ObjectMapper yamlMapper;
    private final Map<String, String> fileHashes = new ConcurrentHashMap<>();

    public RuleFileLoader(Path rulesDirectory, ConfigStore configStore, RuleValidator validator) {
        this.rulesDirectory = rulesDirectory;
        this.configStore = configStore;
        this.validator = validator;
        this.yamlMapper = new ObjectMapper(new YAMLFactory())
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * 加载所有规则文件,单个文件失败不影响其他文件
     */
    public synchronized int loadAll() {
        fileHashes.clear();
        return rescan();
    }

    /**
     * 重新扫描规则目录,返回重新加载或移除的文件数
     */
    public synchronized int rescan() {
        if (!Files.isDirectory(rulesDirectory)) {
            logger.warn("规则目录不存在: {}", rulesDirectory);
            return 0;
        }

        int changed = 0;
        Set<String> currentFiles = new HashSet<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(rulesDirectory, "*.{yaml,yml}")) {
            for (Path path : stream) {
                if (!Files.isRegularFile(path)) {
                    continue;
                }
                String pathStr = path.toString();
                currentFiles.add(pathStr);
                try {
                    String hash = calculateFileHash(path);
                    if (hash.equals(fileHashes.get(pathStr))) {
                        continue;
                    }
                    fileHashes.put(pathStr, hash);
                    loadFile(path);
                    changed++;
                } catch (Exception e) {
                    logger.error("加载规则文件失败: {}", path, e);
                }
            }
        } catch (IOException e) {
            logger.error("扫描规则目录失败: {}", rulesDirectory, e);
            return changed;
        }

        Set<String> deletedFiles = new HashSet<>(fileHashes.keySet());
        deletedFiles.removeAll(currentFiles);
        for (String deletedFile : deletedFiles) {
            fileHashes.remove(deletedFile);
            int removed = configStore.deleteBySource(deletedFile);
            logger.info("规则文件已删除: {}, 移除配置 {} 条", deletedFile, removed);
            changed++;
        }
        return changed;
    }

    /**
     * 解析并校验整个文件,全部合法后替换该文件之前加载的配置
     */
    @SuppressWarnings("unchecked")
    void loadFile(Path path) throws IOException {
        logger.debug("加载规则文件: {}", path);
        Map<String, Object> document = yamlMapper.readValue(path.toFile(), Map.class);
        if (document == null) {
            document = Collections.emptyMap();
        }
        String source = path.toString();
        int schemaVersion = schemaVersion(document, source);

        RuleDocument parsed = new RuleDocument();
        parsed.groups = convertList(document, "notificationGroups", NotificationGroup.class, schemaVersion, source);
        parsed.channels = convertList(document, "notificationChannels", NotificationChannel.class, schemaVersion, source);
        parsed.notificationRules = convertList(document, "notificationRules", NotificationRule.class, schemaVersion, source);
        parsed.escalationRules = convertList(document, "escalationRules", EscalationRule.class, schemaVersion, source);
        parsed.blackouts = convertList(document, "blackouts", Blackout.class, schemaVersion, source);
        parsed.onCalls = convertList(document, "onCalls", OnCall.class, schemaVersion, source);

        String fileName = path.getFileName().toString();
        assignRuleIds(parsed.notificationRules, fileName, "notification", source);
        assignRuleIds(parsed.escalationRules, fileName, "escalation", source);
        for (int i = 0; i < parsed.blackouts.size(); i++) {
            Blackout blackout = parsed.blackouts.get(i);
            blackout.setSourcePath(source);
            if (StringUtils.isBlank(blackout.getId())) {
                blackout.setId(fileName + "#blackout-" + i);
            }
        }
        for (int i = 0; i < parsed.onCalls.size(); i++) {
            OnCall onCall = parsed.onCalls.get(i);
            onCall.setSourcePath(source);
            if (StringUtils.isBlank(onCall.getId())) {
                onCall.setId(fileName + "#oncall-" + i);
            }
        }
        parsed.groups.forEach(group -> group.setSourcePath(source));
        parsed.channels.forEach(channel -> channel.setSourcePath(source));

        parsed.notificationRules.forEach(validator::validate);
        parsed.escalationRules.forEach(validator::validate);
        parsed.blackouts.forEach(validator::validate);
        parsed.onCalls.forEach(validator::validate);
        parsed.channels.forEach(validator::validate);

        configStore.deleteBySource(source);
        parsed.groups.forEach(configStore::saveGroup);
        parsed.channels.forEach(configStore::saveChannel);
        parsed.notificationRules.forEach(configStore::saveRule);
        parsed.escalationRules.forEach(configStore::saveRule);
        parsed.blackouts.forEach(configStore::saveBlackout);
        parsed.onCalls.forEach(configStore::saveOnCall);

        logger.info("规则文件加载成功: {}, 通知规则 {} 条, 升级规则 {} 条, 屏蔽窗口 {} 条, 值班 {} 条",
                path, parsed.notificationRules.size(), parsed.escalationRules.size(),
                parsed.blackouts.size(), parsed.onCalls.size());
    }

    private static int schemaVersion(Map<String, Object> document, String source) {
        Object value = document.getOrDefault("schemaVersion", CURRENT_SCHEMA_VERSION);
        if (!(value instanceof Number)) {
            throw new ValidationException("schemaVersion 必须为数字: " + source);
        }
        int version = ((Number) value).intValue();
        if (version < 1 || version > CURRENT_SCHEMA_VERSION) {
            throw new ValidationException("不支持的 schemaVersion " + version + ": " + source);
        }
        return version;
    }

    @SuppressWarnings("unchecked")
    private <T> List<T> convertList(Map<String, Object> document, String field, Class<T> type,
                                    int schemaVersion, String source) {
        Object value = document.get(field);
        if (value == null) {
            return new ArrayList<>();
        }
        if (!(value instanceof List)) {
            throw new ValidationException(field + " 必须为列表: " + source);
        }
        List<T> result = new ArrayList<>();
        for (Object item : (List<Object>) value) {
            if (!(item instanceof Map)) {
                throw new ValidationException(field + " 中的条目必须为对象: " + source);
            }
            Map<String, Object> normalized = normalize((Map<String, Object>) item, schemaVersion);
            try {
                result.add(yamlMapper.convertValue(normalized, type));
            } catch (IllegalArgumentException e) {
                throw new ValidationException(field + " 格式不合法: " + source, e);
            }
        }
        return result;
    }

    /**
     * 归一化为当前结构: 时间周期统一转 ISO-8601;
     * schemaVersion 1 的 severity 列表转为触发条件,字符串标签列表转为高级标签
     */
    static Map<String, Object> normalize(Map<String, Object> item, int schemaVersion) {
        Map<String, Object> normalized = new LinkedHashMap<>(item);

        for (String field : DURATION_FIELDS) {
            if (normalized.containsKey(field)) {
                Duration duration = Durations.parse(normalized.get(field));
                normalized.put(field, duration == null ? null : duration.toString());
            }
        }

        if (schemaVersion == 1) {
            Object severity = normalized.remove("severity");
            if (severity instanceof List && !((List<?>) severity).isEmpty() && !normalized.containsKey("triggers")) {
                Map<String, Object> trigger = new LinkedHashMap<>();
                trigger.put("to_severity", severity);
                normalized.put("triggers", Collections.singletonList(trigger));
            }
            normalized.computeIfPresent("tags", (key, tags) -> legacyTags(tags));
            normalized.computeIfPresent("excludedTags", (key, tags) -> legacyTags(tags));
        }
        return normalized;
    }

    private static Object legacyTags(Object tags) {
        if (tags instanceof List && !((List<?>) tags).isEmpty()
                && ((List<?>) tags).stream().allMatch(tag -> tag instanceof String)) {
            Map<String, Object> advanced = new LinkedHashMap<>();
            advanced.put("all", tags);
            advanced.put("any", Collections.emptyList());
            return Collections.singletonList(advanced);
        }
        return tags;
    }

    private static void assignRuleIds(List<? extends AlertRule> rules, String fileName, String prefix, String source) {
        for (int i = 0; i < rules.size(); i++) {
            AlertRule rule = rules.get(i);
            rule.setSourcePath(source);
            if (StringUtils.isBlank(rule.getId())) {
                rule.setId(fileName + "#" + prefix + "-" + i);
            }
        }
    }

    /**
     * 计算文件hash
     */
    private String calculateFileHash(Path path) throws IOException {
        byte[] content = Files.readAllBytes(path);
        return DigestUtils.md5Hex(content);
    }

    private static class RuleDocument {
        private List<NotificationGroup> groups;
        private List<NotificationChannel> channels;
        private List<NotificationRule> notificationRules;
        private List<EscalationRule> escalationRules;
        private List<Blackout> blackouts;
        private List<OnCall> onCalls;
    }
}

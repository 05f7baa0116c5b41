package alertflow.dispatch;

import alertflow.alert.Alert;
import org.apache.commons.lang3.StringUtils;

import java.util.Collection;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 渲染通知消息,{field} 占位符取告警字段,attributes.x 取自定义属性,未知占位符保持原样
 */
public class MessageRenderer {
    static final String STANDARD_MESSAGE = "{environment}: {severity} alert for {service} - {resource} is {event}";
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z_][A-Za-z0-9_.]*)}");

    public String render(String template, Alert alert) {
        String source = StringUtils.isEmpty(template) ? STANDARD_MESSAGE : template;
        Matcher matcher = PLACEHOLDER.matcher(source);
        StringBuffer result = new StringBuffer();
        while (matcher.find()) {
            Object value = lookup(matcher.group(1), alert);
            String replacement = value == null ? matcher.group(0) : format(value);
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private static Object lookup(String field, Alert alert) {
        if (field.startsWith("attributes.")) {
            Map<String, Object> attributes = alert.getAttributes();
            return attributes == null ? null : attributes.get(field.substring("attributes.".length()));
        }
        switch (field) {
            case "id":
                return alert.getId();
            case "environment":
                return alert.getEnvironment();
            case "resource":
                return alert.getResource();
            case "event":
                return alert.getEvent();
            case "customer":
                return StringUtils.defaultString(alert.getCustomer());
            case "severity":
                return StringUtils.capitalize(alert.getSeverity());
            case "previousSeverity":
                return StringUtils.capitalize(alert.getPreviousSeverity());
            case "trendIndication":
                return alert.getTrendIndication() == null ? null : alert.getTrendIndication().getValue();
            case "status":
                return alert.getStatus();
            case "service":
                return alert.getService();
            case "tags":
                return alert.getTags();
            case "group":
                return StringUtils.defaultString(alert.getGroup());
            case "value":
                return StringUtils.defaultString(alert.getValue());
            case "text":
                return StringUtils.defaultString(alert.getText());
            case "origin":
                return StringUtils.defaultString(alert.getOrigin());
            case "type":
                return StringUtils.defaultString(alert.getType());
            case "duplicateCount":
                return alert.getDuplicateCount();
            default:
                return null;
        }
    }

    private static String format(Object value) {
        if (value instanceof Collection) {
            return StringUtils.join((Collection<?>) value, ", ");
        }
        return String.valueOf(value);
    }
}

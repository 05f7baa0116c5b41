package alertflow.alert;

import lombok.Data;

/**
 * 告警唯一标识 (environment, resource, event, customer)
 */
@Data
public class AlertKey {
    private final String environment;
    private final String resource;
    private final String event;
    private final String customer;

    /**
     * 关联查找用的键,不区分事件名
     */
    public AlertKey withEvent(String otherEvent) {
        return new AlertKey(environment, resource, otherEvent, customer);
    }

    public boolean sameScope(AlertKey other) {
        return other != null
                && environment.equals(other.environment)
                && resource.equals(other.resource)
                && java.util.Objects.equals(customer, other.customer);
    }
}

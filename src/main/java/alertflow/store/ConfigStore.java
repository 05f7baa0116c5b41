package alertflow.store;

import alertflow.blackout.Blackout;
import alertflow.dispatch.NotificationChannel;
import alertflow.oncall.NotificationGroup;
import alertflow.oncall.OnCall;
import alertflow.rule.AlertRule;
import alertflow.rule.RuleKind;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 规则、屏蔽窗口、值班、分组、渠道的配置存储。保存时校验,每次变更递增 version
 */
public interface ConfigStore {

    List<AlertRule> listRules(RuleKind kind, String environment);

    List<AlertRule> listAllRules();

    Optional<AlertRule> getRule(String id);

    AlertRule saveRule(AlertRule rule);

    boolean deleteRule(String id);

    List<Blackout> listBlackouts(String environment);

    Blackout saveBlackout(Blackout blackout);

    boolean deleteBlackout(String id);

    /**
     * 返回该客户的值班安排以及未指定客户的公共值班安排
     */
    List<OnCall> listOnCalls(String customer);

    OnCall saveOnCall(OnCall onCall);

    boolean deleteOnCall(String id);

    Optional<NotificationGroup> getGroup(String id);

    NotificationGroup saveGroup(NotificationGroup group);

    Optional<NotificationChannel> getChannel(String id);

    NotificationChannel saveChannel(NotificationChannel channel);

    /**
     * 删除某个规则文件加载的全部配置,返回删除数量
     */
    int deleteBySource(String sourcePath);

    /**
     * 恢复 reactivate 已到期的停用规则
     */
    List<AlertRule> reactivateRules(Instant now);

    long version();
}

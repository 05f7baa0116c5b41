package alertflow.config;

import alertflow.AlertPipeline;
import alertflow.alert.AlertKeyResolver;
import alertflow.alert.AlertService;
import alertflow.alert.AlertStateMachine;
import alertflow.alert.SeverityRanking;
import alertflow.blackout.SuppressionGate;
import alertflow.dispatch.ChannelInvoker;
import alertflow.dispatch.ChannelSenderRegistry;
import alertflow.dispatch.DingdingChannelSender;
import alertflow.dispatch.DispatchDedupCache;
import alertflow.dispatch.DispatchScheduler;
import alertflow.dispatch.EscalationSweeper;
import alertflow.dispatch.LocalDispatchDedupCache;
import alertflow.dispatch.LogChannelSender;
import alertflow.dispatch.MessageRenderer;
import alertflow.dispatch.NotificationEngine;
import alertflow.dispatch.WebhookChannelSender;
import alertflow.oncall.OnCallResolver;
import alertflow.rule.RuleCache;
import alertflow.rule.RuleFileLoader;
import alertflow.rule.RuleMatcher;
import alertflow.rule.RuleValidator;
import alertflow.rule.TriggerEvaluator;
import alertflow.store.AlertStore;
import alertflow.store.ConfigStore;
import alertflow.store.InMemoryAlertStore;
import alertflow.store.InMemoryConfigStore;
import alertflow.store.InMemoryNotificationStore;
import alertflow.store.NotificationStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;

@Slf4j
@Configuration
public class AlertFlowConfiguration {

    @Autowired
    private ConfigFilePathManage configFilePathManage;

    @Bean
    public AlertFlowConfig alertFlowConfig() {
        AlertFlowConfig config = AlertFlowConfig.load(configFilePathManage.alertFlowConfigPath);
        config.validate();
        log.info("加载配置文件: {}", configFilePathManage.alertFlowConfigPath);
        return config;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SeverityRanking severityRanking(AlertFlowConfig config) {
        return SeverityRanking.fromConfig(config);
    }

    @Bean
    public RuleValidator ruleValidator(SeverityRanking severityRanking) {
        return new RuleValidator(severityRanking);
    }

    @Bean
    public AlertStore alertStore() {
        return new InMemoryAlertStore();
    }

    @Bean
    public ConfigStore configStore(RuleValidator ruleValidator, Clock clock) {
        return new InMemoryConfigStore(ruleValidator, clock);
    }

    @Bean
    public NotificationStore notificationStore() {
        return new InMemoryNotificationStore();
    }

    @Bean
    public AlertStateMachine alertStateMachine(AlertFlowConfig config, SeverityRanking severityRanking, Clock clock) {
        return new AlertStateMachine(config, severityRanking, clock);
    }

    @Bean
    public AlertService alertService(AlertStore alertStore, AlertStateMachine alertStateMachine, AlertFlowConfig config) {
        return new AlertService(alertStore, new AlertKeyResolver(alertStore), alertStateMachine,
                config.getInt("ingest.max-retries", 5));
    }

    @Bean
    public RuleCache ruleCache(ConfigStore configStore) {
        return new RuleCache(configStore);
    }

    @Bean
    public RuleMatcher ruleMatcher(AlertFlowConfig config) {
        return new RuleMatcher(config.getZone());
    }

    @Bean
    public TriggerEvaluator triggerEvaluator() {
        return new TriggerEvaluator();
    }

    @Bean
    public SuppressionGate suppressionGate() {
        return new SuppressionGate();
    }

    @Bean
    public OnCallResolver onCallResolver(ConfigStore configStore, AlertFlowConfig config) {
        return new OnCallResolver(configStore, config.getZone());
    }

    @Bean(destroyMethod = "close")
    public ChannelInvoker channelInvoker(AlertFlowConfig config, Clock clock) {
        ChannelSenderRegistry registry = new ChannelSenderRegistry(Arrays.asList(
                new WebhookChannelSender(clock),
                new DingdingChannelSender(clock, config.getZone()),
                new LogChannelSender()));
        return new ChannelInvoker(registry,
                config.getInt("dispatch.threadpool.core-size", 5),
                config.getInt("dispatch.threadpool.max-size", 10),
                config.getInt("dispatch.send-timeout-seconds", 10),
                config.getInt("dispatch.max-attempts", 3));
    }

    @Bean
    public DispatchDedupCache dispatchDedupCache(AlertFlowConfig config) {
        return new LocalDispatchDedupCache(Duration.ofHours(config.getInt("dispatch.dedup-ttl-hours", 24)));
    }

    @Bean
    public DispatchScheduler dispatchScheduler(AlertStore alertStore, ConfigStore configStore,
                                               NotificationStore notificationStore, OnCallResolver onCallResolver,
                                               SuppressionGate suppressionGate, ChannelInvoker channelInvoker,
                                               DispatchDedupCache dispatchDedupCache,
                                               AlertStateMachine alertStateMachine,
                                               AlertFlowConfig config, Clock clock) {
        return new DispatchScheduler(alertStore, configStore, notificationStore, onCallResolver, suppressionGate,
                new MessageRenderer(), channelInvoker, dispatchDedupCache, alertStateMachine, clock,
                config.getInt("oncall.lookahead-days", 14));
    }

    @Bean
    public NotificationEngine notificationEngine(RuleCache ruleCache, RuleMatcher ruleMatcher,
                                                 TriggerEvaluator triggerEvaluator, ConfigStore configStore,
                                                 SuppressionGate suppressionGate, DispatchScheduler dispatchScheduler,
                                                 Clock clock) {
        return new NotificationEngine(ruleCache, ruleMatcher, triggerEvaluator, configStore, suppressionGate,
                dispatchScheduler, clock);
    }

    @Bean
    public EscalationSweeper escalationSweeper(AlertStore alertStore, NotificationStore notificationStore,
                                               RuleCache ruleCache, RuleMatcher ruleMatcher,
                                               TriggerEvaluator triggerEvaluator, NotificationEngine notificationEngine,
                                               AlertStateMachine alertStateMachine) {
        return new EscalationSweeper(alertStore, notificationStore, ruleCache, ruleMatcher, triggerEvaluator,
                notificationEngine, alertStateMachine);
    }

    @Bean
    public AlertPipeline alertPipeline(AlertService alertService, NotificationEngine notificationEngine,
                                       DispatchScheduler dispatchScheduler) {
        return new AlertPipeline(alertService, notificationEngine, dispatchScheduler);
    }

    @Bean
    public RuleFileLoader ruleFileLoader(ConfigStore configStore, RuleValidator ruleValidator) {
        RuleFileLoader loader = new RuleFileLoader(Paths.get(configFilePathManage.rulesPath), configStore, ruleValidator);
        int loaded = loader.loadAll();
        log.info("规则目录加载完成: {}, 文件数 {}", configFilePathManage.rulesPath, loaded);
        return loader;
    }
}

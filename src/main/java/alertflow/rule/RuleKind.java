package alertflow.rule;

public enum RuleKind {
    NOTIFICATION,
    ESCALATION
}

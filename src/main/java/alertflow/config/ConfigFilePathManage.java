package alertflow.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class ConfigFilePathManage {

    @Value("${alertflow.config.path}")
    public String alertFlowConfigPath;

    @Value("${alertflow.rules.path}")
    public String rulesPath;
}
